package com.sdlcimport.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Reference from a decision, threat or debt item to the file that supports it.
 *
 * <p>Inside one decision the identity of a reference is its {@code filePath}.
 *
 * @param filePath file path relative to the scanned root
 * @param lineRef 1-based line number, or null
 * @param matchStrength strength of the underlying match
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvidenceRef(
    @JsonProperty("file") String filePath,
    @JsonProperty("line") Integer lineRef,
    @JsonProperty("strength") MatchStrength matchStrength
) {
    /**
     * Compact constructor with validation.
     */
    public EvidenceRef {
        Objects.requireNonNull(filePath, "filePath must not be null");
        if (matchStrength == null) {
            matchStrength = MatchStrength.PATH;
        }
    }
}
