package com.sdlcimport.core.validator;

import com.sdlcimport.core.model.Correction;
import com.sdlcimport.core.model.QualityIssue;
import com.sdlcimport.core.renderer.RenderReport;

import java.util.List;
import java.util.Set;

/**
 * Outcome of one checker.
 *
 * @param issues issues raised, with their penalties
 * @param corrections corrections applied
 * @param removedDecisionKeys identity keys of decisions removed
 * @param rerendered artifacts written while correcting
 */
public record CheckResult(
    List<QualityIssue> issues,
    List<Correction> corrections,
    Set<String> removedDecisionKeys,
    RenderReport rerendered
) {
    public CheckResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
        corrections = corrections == null ? List.of() : List.copyOf(corrections);
        removedDecisionKeys = removedDecisionKeys == null ? Set.of() : Set.copyOf(removedDecisionKeys);
        rerendered = rerendered == null ? RenderReport.empty() : rerendered;
    }

    /**
     * Creates a result without findings.
     *
     * @return clean result
     */
    public static CheckResult clean() {
        return new CheckResult(List.of(), List.of(), Set.of(), RenderReport.empty());
    }

    /**
     * Creates a result with issues only.
     *
     * @param issues issues
     * @return result
     */
    public static CheckResult of(List<QualityIssue> issues) {
        return new CheckResult(issues, List.of(), Set.of(), RenderReport.empty());
    }

    public boolean isClean() {
        return issues.isEmpty() && corrections.isEmpty();
    }
}
