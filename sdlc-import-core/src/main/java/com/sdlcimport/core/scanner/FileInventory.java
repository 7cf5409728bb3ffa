package com.sdlcimport.core.scanner;

import com.sdlcimport.core.util.GlobMatcher;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded, classified list of the files of one input tree.
 *
 * <p>Files are sorted by relative path so that every later stage iterates them in a
 * deterministic order.
 *
 * @param root scanned root directory (absolute, normalized)
 * @param files included files sorted by relative path
 * @param statistics scan statistics
 */
public record FileInventory(
    Path root,
    List<ScannedFile> files,
    ScanStatistics statistics
) {
    public FileInventory {
        Objects.requireNonNull(root, "root must not be null");
        files = files == null ? List.of() : List.copyOf(files);
        statistics = statistics == null ? ScanStatistics.empty() : statistics;
    }

    /**
     * Returns the files that may be read as text.
     *
     * @return non-binary files
     */
    public List<ScannedFile> textFiles() {
        return files.stream().filter(ScannedFile::isText).toList();
    }

    /**
     * Returns the files of one kind.
     *
     * @param kind file kind
     * @return matching files
     */
    public List<ScannedFile> filesOfKind(FileKind kind) {
        return files.stream().filter(file -> file.kind() == kind).toList();
    }

    /**
     * Returns true if any file matches the glob pattern.
     *
     * @param globPattern glob pattern
     * @return true if some file matches
     */
    public boolean containsMatching(String globPattern) {
        return files.stream().anyMatch(file -> GlobMatcher.matches(globPattern, file.relativePath()));
    }

    /**
     * Looks up a file by relative path.
     *
     * @param relativePath relative path
     * @return the file, if present
     */
    public Optional<ScannedFile> find(String relativePath) {
        return files.stream().filter(file -> file.relativePath().equals(relativePath)).findFirst();
    }

    /**
     * Returns the number of included files.
     *
     * @return file count
     */
    public int size() {
        return files.size();
    }
}
