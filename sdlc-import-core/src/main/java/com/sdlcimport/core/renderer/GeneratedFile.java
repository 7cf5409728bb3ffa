package com.sdlcimport.core.renderer;

import java.util.Objects;

/**
 * Represents a generated file to be rendered.
 *
 * @param relativePath relative path for the file (e.g., "security/threat-model.yml")
 * @param content file content
 * @param contentType content type (e.g., {@code application/yaml})
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /** YAML artifacts. */
    public static final String YAML = "application/yaml";

    /** Markdown summaries. */
    public static final String MARKDOWN = "text/markdown";

    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }
}
