package com.sdlcimport.core.scanner;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One file of the inventory.
 *
 * @param relativePath path relative to the scanned root, {@code /}-separated
 * @param absolutePath absolute path on disk
 * @param kind file classification
 * @param sizeBytes file size in bytes
 */
public record ScannedFile(
    String relativePath,
    Path absolutePath,
    FileKind kind,
    long sizeBytes
) {
    public ScannedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(absolutePath, "absolutePath must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Returns true if the file may be read as text.
     *
     * @return false for binary files
     */
    public boolean isText() {
        return kind != FileKind.BINARY;
    }
}
