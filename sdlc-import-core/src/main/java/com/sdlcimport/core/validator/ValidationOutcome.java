package com.sdlcimport.core.validator;

import com.sdlcimport.core.model.Correction;
import com.sdlcimport.core.model.QualityIssue;

import java.util.List;
import java.util.Set;

/**
 * Combined outcome of all checkers.
 *
 * @param issues every issue, upstream contributions first
 * @param corrections every correction applied
 * @param removedDecisionKeys identity keys of decisions removed for evidence pollution
 */
public record ValidationOutcome(
    List<QualityIssue> issues,
    List<Correction> corrections,
    Set<String> removedDecisionKeys
) {
    public ValidationOutcome {
        issues = issues == null ? List.of() : List.copyOf(issues);
        corrections = corrections == null ? List.of() : List.copyOf(corrections);
        removedDecisionKeys = removedDecisionKeys == null ? Set.of() : Set.copyOf(removedDecisionKeys);
    }
}
