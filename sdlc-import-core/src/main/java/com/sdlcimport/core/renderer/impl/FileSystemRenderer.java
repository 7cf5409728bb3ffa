package com.sdlcimport.core.renderer.impl;

import com.sdlcimport.core.renderer.GeneratedFile;
import com.sdlcimport.core.renderer.GeneratedOutput;
import com.sdlcimport.core.renderer.OutputRenderer;
import com.sdlcimport.core.renderer.RenderContext;
import com.sdlcimport.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Renderer that writes generated files to the filesystem.
 *
 * <p>Creates the directory structure automatically and preserves relative paths. Each file
 * is written to a sibling temporary file and moved into place, so readers never observe a
 * half-written artifact.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext context = RenderContext.of(Path.of("sdlc-import"));
 *
 * GeneratedOutput output = GeneratedOutput.of(
 *     new GeneratedFile("reports/tech-debt.yml", "kind: tech-debt\n", GeneratedFile.YAML));
 *
 * new FileSystemRenderer().render(output, context);
 * // Creates: sdlc-import/reports/tech-debt.yml
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = context.outputDirectory();
        logger.debug("Rendering {} file(s) to filesystem at: {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }
    }

    @Override
    public void remove(String relativePath, RenderContext context) {
        Path target = context.resolve(relativePath);
        try {
            if (Files.deleteIfExists(target)) {
                logger.info("Removed file: {}", relativePath);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to remove file: " + relativePath, e);
        }
    }

    /**
     * Writes a single file to the filesystem.
     *
     * @param outputDir base output directory
     * @param file file to write
     */
    private void writeFile(Path outputDir, GeneratedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath()).normalize();
        if (!FileUtils.isWithin(outputDir, targetPath)) {
            throw new IllegalStateException("File escapes output directory: " + file.relativePath());
        }
        logger.debug("Writing file: {}", targetPath);

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }

            Path temp = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
            Files.writeString(temp, file.content(), StandardCharsets.UTF_8);
            try {
                Files.move(temp, targetPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.info("Wrote file: {} ({} bytes)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
