package com.sdlcimport.core.validator.checker;

import com.fasterxml.jackson.databind.JsonNode;
import com.sdlcimport.core.analyzer.AnalyzerResult;
import com.sdlcimport.core.analyzer.ArtifactKind;
import com.sdlcimport.core.model.Correction;
import com.sdlcimport.core.model.QualityIssue;
import com.sdlcimport.core.renderer.OutputLayout;
import com.sdlcimport.core.renderer.RenderReport;
import com.sdlcimport.core.validator.CheckResult;
import com.sdlcimport.core.validator.QualityChecker;
import com.sdlcimport.core.validator.ValidationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Verifies that the threat model and debt report contain every computed item.
 *
 * <p>A rendered report listing fewer items than its analyzer computed is regenerated in full.
 * Reports that do not exist are left to {@link ArtifactPresenceChecker}.
 */
public class CompletenessChecker implements QualityChecker {

    private static final Logger log = LoggerFactory.getLogger(CompletenessChecker.class);

    @Override
    public String getId() {
        return "completeness";
    }

    @Override
    public CheckResult check(ValidationContext context) {
        List<QualityIssue> issues = new ArrayList<>();
        List<Correction> corrections = new ArrayList<>();
        RenderReport rerendered = RenderReport.empty();

        rerendered = rerendered.merge(checkReport(context, ArtifactKind.THREAT_MODEL, OutputLayout.THREAT_MODEL,
            "findings", issues, corrections));
        rerendered = rerendered.merge(checkReport(context, ArtifactKind.DEBT_REPORT, OutputLayout.TECH_DEBT,
            "items", issues, corrections));

        return new CheckResult(issues, corrections, null, rerendered);
    }

    private RenderReport checkReport(ValidationContext context, ArtifactKind kind, String artifact, String listField,
                                     List<QualityIssue> issues, List<Correction> corrections) {
        Optional<AnalyzerResult> result = context.resultFor(kind);
        if (result.isEmpty() || !context.renderer().exists(artifact)) {
            return RenderReport.empty();
        }

        int expected = result.get().itemCount();
        int rendered = renderedCount(context, artifact, listField);
        if (rendered >= expected) {
            return RenderReport.empty();
        }

        log.warn("{} lists {} of {} item(s); regenerating", artifact, rendered, expected);
        RenderReport report = context.renderer().renderAnalyzerResult(context.projectName(), result.get());
        issues.add(QualityIssue.warning(getId(),
            String.format("%s listed %d of %d item(s) and was regenerated", artifact, rendered, expected),
            artifact, context.config().penalties().incompleteReport()));
        corrections.add(new Correction(getId(), "Regenerated " + artifact, artifact));
        return report;
    }

    private int renderedCount(ValidationContext context, String artifact, String listField) {
        try {
            JsonNode tree = context.renderer().readArtifact(artifact);
            JsonNode list = tree == null ? null : tree.get(listField);
            return list != null && list.isArray() ? list.size() : 0;
        } catch (IOException e) {
            log.warn("Cannot parse {}: {}", artifact, e.getMessage());
            return 0;
        }
    }
}
