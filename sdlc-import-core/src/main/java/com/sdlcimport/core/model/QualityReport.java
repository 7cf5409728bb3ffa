package com.sdlcimport.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate result of post-generation validation.
 *
 * <p>Built once per run after every checker has finished and never modified afterwards.
 *
 * @param score quality score in [0.0, 1.0]
 * @param issues issues that lowered the score, in detection order
 * @param correctionsApplied automatic corrections, in application order
 * @param recommendation quality gate verdict
 */
public record QualityReport(
    double score,
    List<QualityIssue> issues,
    List<Correction> correctionsApplied,
    Recommendation recommendation
) {
    /**
     * Compact constructor with validation.
     */
    public QualityReport {
        if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("score must be within [0,1]: " + score);
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
        correctionsApplied = correctionsApplied == null ? List.of() : List.copyOf(correctionsApplied);
        Objects.requireNonNull(recommendation, "recommendation must not be null");
    }

    /**
     * Returns true if any issue is critical.
     *
     * @return true when a CRITICAL issue was raised
     */
    public boolean hasCriticalIssue() {
        return issues.stream().anyMatch(QualityIssue::isCritical);
    }

    /**
     * Returns the issues that carried a score penalty.
     *
     * @return penalized issues
     */
    public List<QualityIssue> penalizedIssues() {
        return issues.stream().filter(issue -> issue.penalty() > 0).toList();
    }
}
