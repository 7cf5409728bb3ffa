package com.sdlcimport.core.validator;

import com.sdlcimport.core.analyzer.AnalyzerResult;
import com.sdlcimport.core.model.Correction;
import com.sdlcimport.core.model.QualityIssue;
import com.sdlcimport.core.validator.checker.ArtifactPresenceChecker;
import com.sdlcimport.core.validator.checker.CompletenessChecker;
import com.sdlcimport.core.validator.checker.DiagramSpecificityChecker;
import com.sdlcimport.core.validator.checker.EvidencePollutionChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs the checkers over the generated artifacts in a fixed order.
 *
 * <p>Failed analyzers are reported first as upstream ERROR issues. Then each checker runs
 * with the removals and re-rendered artifacts of the checkers before it.
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * ValidationOutcome outcome = new PostGenerationValidator().validate(context);
 * QualityReport report = new QualityGate(config.validation()).evaluate(outcome);
 * }</pre>
 */
public class PostGenerationValidator {

    private static final Logger log = LoggerFactory.getLogger(PostGenerationValidator.class);

    /** Checker id of upstream contributions. */
    public static final String UPSTREAM_CHECKER_ID = "analyzer-runner";

    private final List<QualityChecker> checkers;

    public PostGenerationValidator() {
        this(List.of(
            new EvidencePollutionChecker(),
            new CompletenessChecker(),
            new DiagramSpecificityChecker(),
            new ArtifactPresenceChecker()
        ));
    }

    public PostGenerationValidator(List<QualityChecker> checkers) {
        this.checkers = List.copyOf(checkers);
    }

    /**
     * Validates the generated artifacts.
     *
     * @param context validation context
     * @return combined outcome
     */
    public ValidationOutcome validate(ValidationContext context) {
        List<QualityIssue> issues = new ArrayList<>(upstreamIssues(context));
        List<Correction> corrections = new ArrayList<>();
        Set<String> removed = new LinkedHashSet<>();

        ValidationContext current = context;
        for (QualityChecker checker : checkers) {
            CheckResult result = checker.check(current);
            log.debug("Checker {}: {} issue(s), {} correction(s)", checker.getId(),
                result.issues().size(), result.corrections().size());
            issues.addAll(result.issues());
            corrections.addAll(result.corrections());
            removed.addAll(result.removedDecisionKeys());
            current = current.withRemoved(result.removedDecisionKeys()).withRendered(result.rerendered());
        }

        log.info("Validation finished: {} issue(s), {} correction(s), {} decision(s) removed",
            issues.size(), corrections.size(), removed.size());
        return new ValidationOutcome(issues, corrections, removed);
    }

    private static List<QualityIssue> upstreamIssues(ValidationContext context) {
        double penalty = context.config().penalties().failedAnalyzer();
        List<QualityIssue> issues = new ArrayList<>();
        for (AnalyzerResult result : context.analyzerResults()) {
            if (result.isFailed()) {
                issues.add(QualityIssue.error(UPSTREAM_CHECKER_ID,
                    "Analyzer " + result.analyzerId() + " failed: " + result.error(), null, penalty));
            }
        }
        return issues;
    }
}
