package com.sdlcimport.core.scanner;

import com.sdlcimport.core.config.ImportConfig;
import com.sdlcimport.core.util.FileUtils;
import com.sdlcimport.core.util.GlobMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Walks an input tree and produces a bounded, classified {@link FileInventory}.
 *
 * <p>Excluded directories (VCS metadata, build output, vendored dependencies) are pruned
 * without being entered; the output directory is always pruned so that a run never scans
 * its own artifacts. Files matching an exclusion pattern (generated or minified code) are
 * counted but not inventoried.
 *
 * <p>Exceeding {@code scan.maxFiles} or {@code scan.maxTotalBytes} aborts the walk with an
 * {@link InputException}; the inventory is never silently truncated.
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * TreeScanner scanner = new TreeScanner(config.scan());
 * FileInventory inventory = scanner.scan(Paths.get("/repos/billing"), outputDirectory);
 * }</pre>
 */
public class TreeScanner {

    private static final Logger log = LoggerFactory.getLogger(TreeScanner.class);

    private final ImportConfig.ScanConfig config;
    private final Set<String> excludedDirectories;
    private final GlobMatcher excludedFiles;

    public TreeScanner(ImportConfig.ScanConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.excludedDirectories = new HashSet<>(config.excludeDirectories());
        this.excludedFiles = GlobMatcher.of(config.excludePatterns());
    }

    /**
     * Scans a directory tree.
     *
     * @param root directory to scan
     * @param outputDirectory output directory to exclude, may be null
     * @return classified inventory
     * @throws InputException if the root is missing, not a directory, unreadable or too large
     */
    public FileInventory scan(Path root, Path outputDirectory) throws InputException {
        if (root == null || !Files.exists(root)) {
            throw new InputException("Input path does not exist: " + root);
        }
        if (!Files.isDirectory(root)) {
            throw new InputException("Input path is not a directory: " + root);
        }
        if (!Files.isReadable(root)) {
            throw new InputException("Input path is not readable: " + root);
        }

        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path normalizedOutput = outputDirectory == null ? null : outputDirectory.toAbsolutePath().normalize();
        CollectingVisitor visitor = new CollectingVisitor(normalizedRoot, normalizedOutput);

        log.info("Scanning {}", normalizedRoot);
        try {
            Files.walkFileTree(normalizedRoot, visitor);
        } catch (IOException e) {
            throw new InputException("Failed to walk input tree " + normalizedRoot + ": " + e.getMessage(), e);
        }
        if (visitor.rootFailure != null) {
            throw new InputException("Input path is not readable: " + normalizedRoot + ": "
                + visitor.rootFailure.getMessage(), visitor.rootFailure);
        }
        if (visitor.ceilingViolation != null) {
            throw new InputException(visitor.ceilingViolation);
        }

        List<ScannedFile> files = visitor.files;
        files.sort(Comparator.comparing(ScannedFile::relativePath));
        ScanStatistics statistics = visitor.statistics.build();
        log.info("Scan complete: {}", statistics.getSummary());
        return new FileInventory(normalizedRoot, files, statistics);
    }

    private final class CollectingVisitor extends SimpleFileVisitor<Path> {

        private final Path root;
        private final Path outputDirectory;
        private final List<ScannedFile> files = new ArrayList<>();
        private final ScanStatistics.Builder statistics = new ScanStatistics.Builder();
        private String ceilingViolation;
        private IOException rootFailure;

        private CollectingVisitor(Path root, Path outputDirectory) {
            this.root = root;
            this.outputDirectory = outputDirectory;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (dir.equals(root)) {
                return FileVisitResult.CONTINUE;
            }
            Path name = dir.getFileName();
            if (name != null && excludedDirectories.contains(name.toString())) {
                log.debug("Skipping excluded directory: {}", dir);
                statistics.incrementDirectoriesSkipped();
                return FileVisitResult.SKIP_SUBTREE;
            }
            if (outputDirectory != null && dir.equals(outputDirectory)) {
                log.debug("Skipping output directory: {}", dir);
                statistics.incrementDirectoriesSkipped();
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (!attrs.isRegularFile()) {
                return FileVisitResult.CONTINUE;
            }
            statistics.incrementFilesDiscovered();
            String relativePath = FileUtils.toRelativePath(root, file);
            if (excludedFiles.matches(relativePath)) {
                statistics.incrementFilesExcluded();
                return FileVisitResult.CONTINUE;
            }

            FileKind kind = FileKind.classify(relativePath);
            files.add(new ScannedFile(relativePath, file, kind, attrs.size()));
            statistics.incrementFilesIncluded(kind, attrs.size());

            if (statistics.filesIncluded() > config.maxFiles()) {
                ceilingViolation = String.format(
                    "Input tree exceeds the file ceiling of %d files (scan.maxFiles)", config.maxFiles());
                return FileVisitResult.TERMINATE;
            }
            if (statistics.totalBytes() > config.maxTotalBytes()) {
                ceilingViolation = String.format(
                    "Input tree exceeds the size ceiling of %d bytes (scan.maxTotalBytes)", config.maxTotalBytes());
                return FileVisitResult.TERMINATE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            if (file.equals(root)) {
                rootFailure = exc;
                return FileVisitResult.TERMINATE;
            }
            log.warn("Cannot access {}: {}", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
        }
    }
}
