package com.sdlcimport.core.renderer;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Context provided to renderers during execution.
 *
 * @param outputDirectory target output directory
 * @param settings renderer-specific settings
 */
public record RenderContext(
    Path outputDirectory,
    Map<String, String> settings
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    /**
     * Creates a context without settings.
     *
     * @param outputDirectory target output directory
     * @return context
     */
    public static RenderContext of(Path outputDirectory) {
        return new RenderContext(outputDirectory, Map.of());
    }

    /**
     * Resolves a path relative to the output directory.
     *
     * @param relativePath relative path
     * @return absolute path
     */
    public Path resolve(String relativePath) {
        return outputDirectory.resolve(relativePath);
    }
}
