package com.sdlcimport.core.validator.checker;

import com.sdlcimport.core.model.Correction;
import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.model.EvidenceRef;
import com.sdlcimport.core.model.QualityIssue;
import com.sdlcimport.core.renderer.OutputLayout;
import com.sdlcimport.core.renderer.RenderReport;
import com.sdlcimport.core.util.GlobMatcher;
import com.sdlcimport.core.validator.CheckResult;
import com.sdlcimport.core.validator.QualityChecker;
import com.sdlcimport.core.validator.ValidationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes decisions whose evidence comes mostly from non-production paths.
 *
 * <p>A decision is removed when the share of its evidence files matching
 * {@code validation.nonProductionPatterns} exceeds {@code validation.pollutionThreshold}.
 * Its artifact is deleted and it is excluded from the store commit. Categories listed in
 * {@code validation.pollutionExemptCategories} are never removed.
 */
public class EvidencePollutionChecker implements QualityChecker {

    private static final Logger log = LoggerFactory.getLogger(EvidencePollutionChecker.class);

    @Override
    public String getId() {
        return "evidence-pollution";
    }

    @Override
    public CheckResult check(ValidationContext context) {
        GlobMatcher nonProduction = GlobMatcher.of(context.config().nonProductionPatterns());
        double threshold = context.config().pollutionThreshold();
        double penalty = context.config().penalties().removedDecision();

        List<QualityIssue> issues = new ArrayList<>();
        List<Correction> corrections = new ArrayList<>();
        Set<String> removed = new LinkedHashSet<>();

        for (DecisionRecord decision : context.renderedDecisions()) {
            if (context.config().pollutionExemptCategories().contains(decision.category())) {
                continue;
            }
            double share = nonProductionShare(decision.evidenceRefs(), nonProduction);
            if (share <= threshold) {
                continue;
            }

            String artifact = OutputLayout.decisionPath(decision);
            log.warn("Removing decision {} ({}): {}% of its evidence is non-production",
                decision.id(), decision.technologyId(), Math.round(share * 100));
            try {
                context.renderer().remove(artifact);
            } catch (IllegalStateException e) {
                log.error("Cannot delete {}: {}", artifact, e.getMessage(), e);
            }
            removed.add(decision.identityKey());
            issues.add(QualityIssue.warning(getId(),
                String.format("Decision %s (%s) removed: %.0f%% of its evidence is in non-production paths",
                    decision.id(), decision.technologyName(), share * 100),
                artifact, penalty));
            corrections.add(new Correction(getId(), "Removed decision " + decision.id(), artifact));
        }
        return new CheckResult(issues, corrections, removed, RenderReport.empty());
    }

    /**
     * Returns the share of evidence files in non-production paths.
     *
     * @param refs evidence references
     * @param nonProduction non-production path matcher
     * @return share in [0,1], 0 without evidence
     */
    static double nonProductionShare(List<EvidenceRef> refs, GlobMatcher nonProduction) {
        Set<String> paths = new LinkedHashSet<>();
        refs.forEach(ref -> paths.add(ref.filePath()));
        if (paths.isEmpty()) {
            return 0.0;
        }
        long polluted = paths.stream().filter(nonProduction::matches).count();
        return (double) polluted / paths.size();
    }
}
