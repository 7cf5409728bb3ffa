package com.sdlcimport.core.model;

/**
 * Strength of a single evidence match.
 *
 * <p>A content match (a signature's content pattern was found inside the file) is a stronger
 * indication of adoption than a path match (only the file name or location matched).
 *
 * @since 1.0.0
 */
public enum MatchStrength {
    /** A content pattern matched inside the file. */
    CONTENT(1.0),

    /** Only the file path matched. */
    PATH(0.5);

    private final double weight;

    MatchStrength(double weight) {
        this.weight = weight;
    }

    /**
     * Returns the numeric weight of this strength (0.0 to 1.0).
     *
     * @return weight used by confidence scoring
     */
    public double getWeight() {
        return weight;
    }

    /**
     * Returns the stronger of two strengths.
     *
     * @param other strength to compare with
     * @return the strength with the higher weight
     */
    public MatchStrength strongest(MatchStrength other) {
        return other != null && other.weight > this.weight ? other : this;
    }
}
