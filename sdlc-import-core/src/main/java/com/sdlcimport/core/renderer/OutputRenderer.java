package com.sdlcimport.core.renderer;

/**
 * Interface for output renderers that write generated artifacts to a destination.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI). The import pipeline
 * writes every artifact through one renderer, one {@link GeneratedOutput} per artifact, so a
 * failed write affects only that artifact.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class FileSystemRenderer implements OutputRenderer {
 *     @Override
 *     public String getId() {
 *         return "filesystem";
 *     }
 *
 *     @Override
 *     public void render(GeneratedOutput output, RenderContext context) {
 *         for (GeneratedFile file : output.files()) {
 *             Path target = context.outputDirectory().resolve(file.relativePath());
 *             Files.createDirectories(target.getParent());
 *             Files.writeString(target, file.content());
 *         }
 *     }
 *     ...
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.sdlcimport.core.renderer.OutputRenderer}
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Should be lowercase (e.g., "filesystem").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the generated output to the target destination, replacing existing files.
     *
     * @param output the generated files to render
     * @param context rendering context with the output directory and settings
     * @throws IllegalStateException if a file cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);

    /**
     * Removes a previously rendered file; a missing file is not an error.
     *
     * @param relativePath path relative to the output directory
     * @param context rendering context
     * @throws IllegalStateException if the file exists but cannot be removed
     */
    void remove(String relativePath, RenderContext context);
}
