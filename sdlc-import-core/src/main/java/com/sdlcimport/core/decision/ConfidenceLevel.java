package com.sdlcimport.core.decision;

import com.sdlcimport.core.config.ImportConfig;

/**
 * Confidence level of a decision, derived from its composite confidence score.
 *
 * <p><b>Levels:</b></p>
 * <ul>
 *   <li><b>HIGH:</b> auto-accepted, no review needed</li>
 *   <li><b>MEDIUM:</b> flagged for human validation</li>
 *   <li><b>LOW:</b> mandatory manual review, eligible for a ticket</li>
 * </ul>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ConfidenceLevel level = ConfidenceLevel.fromScore(0.72, config.scoring());
 * if (level == ConfidenceLevel.LOW) {
 *     tickets.fileTicket(...);
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public enum ConfidenceLevel {
    /**
     * High confidence - strong content evidence across several files.
     */
    HIGH("Auto-accept"),

    /**
     * Medium confidence - plausible but needs human validation.
     */
    MEDIUM("Human validation"),

    /**
     * Low confidence - thin or path-only evidence.
     */
    LOW("Manual review");

    private final String description;

    ConfidenceLevel(String description) {
        this.description = description;
    }

    /**
     * Returns a human-readable description of the handling this level implies.
     *
     * @return description string
     */
    public String getDescription() {
        return description;
    }

    /**
     * Returns true if this confidence level is at least the specified level.
     *
     * @param minimum minimum acceptable confidence level
     * @return true if this level >= minimum level
     */
    public boolean isAtLeast(ConfidenceLevel minimum) {
        return this.ordinal() <= minimum.ordinal();
    }

    /**
     * Maps a score to a level using the configured thresholds (lower bounds inclusive).
     *
     * @param score confidence score in [0,1]
     * @param scoring scoring thresholds
     * @return confidence level
     */
    public static ConfidenceLevel fromScore(double score, ImportConfig.ScoringConfig scoring) {
        if (score >= scoring.highThreshold()) {
            return HIGH;
        }
        if (score >= scoring.mediumThreshold()) {
            return MEDIUM;
        }
        return LOW;
    }
}
