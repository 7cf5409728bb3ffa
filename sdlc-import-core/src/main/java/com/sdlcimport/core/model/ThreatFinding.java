package com.sdlcimport.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A security finding classified by STRIDE category.
 *
 * @param id finding identifier (e.g. {@code TM-001})
 * @param ruleId threat rule that produced the finding
 * @param title short description
 * @param strideCategory STRIDE category
 * @param severity CVSS-like severity in [0.0, 10.0]
 * @param evidenceRefs files that triggered the finding
 * @param escalate whether the finding needs immediate human attention
 */
public record ThreatFinding(
    String id,
    String ruleId,
    String title,
    StrideCategory strideCategory,
    double severity,
    List<EvidenceRef> evidenceRefs,
    boolean escalate
) {
    /** Severity at or above which a finding is critical. */
    public static final double CRITICAL_SEVERITY = 9.0;

    /**
     * Compact constructor with validation.
     */
    public ThreatFinding {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(strideCategory, "strideCategory must not be null");
        if (severity < 0.0 || severity > 10.0) {
            throw new IllegalArgumentException("severity must be within [0,10]: " + severity);
        }
        evidenceRefs = evidenceRefs == null ? List.of() : List.copyOf(evidenceRefs);
    }

    /**
     * Returns true if the severity is critical.
     *
     * @return true when severity is at least {@link #CRITICAL_SEVERITY}
     */
    public boolean isCritical() {
        return severity >= CRITICAL_SEVERITY;
    }
}
