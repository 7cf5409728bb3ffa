package com.sdlcimport.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Extra condition a signature match must satisfy.
 *
 * <p>Resolves ambiguous matches, e.g. two technologies sharing a configuration file name.
 * Both parts are optional; a part that is set must hold.
 *
 * <p><b>Example YAML:</b></p>
 * <pre>{@code
 * disambiguators:
 *   - requiresFile: "tsconfig.json"
 *   - requiresContent: "apiVersion:"
 * }</pre>
 *
 * @param requiresFile glob that must match at least one file of the inventory
 * @param requiresContent regex that must occur in the matched file
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Disambiguator(
    @JsonProperty("requiresFile") String requiresFile,
    @JsonProperty("requiresContent") String requiresContent
) {
    /**
     * Compact constructor with validation.
     */
    public Disambiguator {
        if (isBlank(requiresFile) && isBlank(requiresContent)) {
            throw new IllegalArgumentException("disambiguator needs requiresFile or requiresContent");
        }
    }

    /**
     * Returns true if this disambiguator needs the file content.
     *
     * @return true when {@code requiresContent} is set
     */
    public boolean needsContent() {
        return !isBlank(requiresContent);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
