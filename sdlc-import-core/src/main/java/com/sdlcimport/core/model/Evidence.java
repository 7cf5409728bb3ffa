package com.sdlcimport.core.model;

import java.util.Objects;

/**
 * A single observed fact supporting a technology's presence.
 *
 * <p>Evidence is immutable once produced by the technology detector. Many evidence records
 * feed one {@link DecisionRecord}.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Evidence evidence = new Evidence(
 *     "postgresql",
 *     "database",
 *     "src/main/resources/application.yml",
 *     4,
 *     MatchStrength.CONTENT
 * );
 * }</pre>
 *
 * @param technologyId technology identifier from the signature registry
 * @param category decision category the signature belongs to
 * @param filePath file path relative to the scanned root, {@code /}-separated
 * @param lineRef 1-based line of the first content match, or null for path matches
 * @param matchStrength strength of the match
 */
public record Evidence(
    String technologyId,
    String category,
    String filePath,
    Integer lineRef,
    MatchStrength matchStrength
) {
    /**
     * Compact constructor with validation.
     */
    public Evidence {
        Objects.requireNonNull(technologyId, "technologyId must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(matchStrength, "matchStrength must not be null");
    }

    /**
     * Projects this evidence onto a reference usable inside a decision record.
     *
     * @return evidence reference
     */
    public EvidenceRef toRef() {
        return new EvidenceRef(filePath, lineRef, matchStrength);
    }
}
