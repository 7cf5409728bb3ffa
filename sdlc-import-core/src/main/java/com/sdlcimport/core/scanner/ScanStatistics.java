package com.sdlcimport.core.scanner;

import java.util.EnumMap;
import java.util.Map;

/**
 * Statistics collected while walking the input tree.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ScanStatistics stats = new ScanStatistics.Builder()
 *     .incrementFilesDiscovered()
 *     .incrementFilesIncluded(FileKind.SOURCE, 2048)
 *     .incrementFilesExcluded()
 *     .build();
 * log.info(stats.getSummary());
 * }</pre>
 *
 * @param filesDiscovered regular files visited (excluded directories are never entered)
 * @param filesIncluded files added to the inventory
 * @param filesExcluded files skipped by exclusion patterns
 * @param directoriesSkipped directories pruned by exclusion rules
 * @param totalBytes combined size of the included files
 * @param filesByKind included file count per kind
 *
 * @since 1.0.0
 */
public record ScanStatistics(
    int filesDiscovered,
    int filesIncluded,
    int filesExcluded,
    int directoriesSkipped,
    long totalBytes,
    Map<FileKind, Integer> filesByKind
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public ScanStatistics {
        if (filesDiscovered < 0) {
            filesDiscovered = 0;
        }
        if (filesIncluded < 0) {
            filesIncluded = 0;
        }
        if (filesExcluded < 0) {
            filesExcluded = 0;
        }
        if (directoriesSkipped < 0) {
            directoriesSkipped = 0;
        }
        if (totalBytes < 0) {
            totalBytes = 0;
        }
        filesByKind = filesByKind == null ? Map.of() : Map.copyOf(filesByKind);
    }

    /**
     * Creates an empty statistics instance (no files processed).
     *
     * @return empty statistics
     */
    public static ScanStatistics empty() {
        return new ScanStatistics(0, 0, 0, 0, 0, Map.of());
    }

    /**
     * Returns the number of included files of one kind.
     *
     * @param kind file kind
     * @return count, 0 when none
     */
    public int count(FileKind kind) {
        return filesByKind.getOrDefault(kind, 0);
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format(
            "Discovered: %d, Included: %d, Excluded: %d, Skipped dirs: %d, Bytes: %d",
            filesDiscovered, filesIncluded, filesExcluded, directoriesSkipped, totalBytes
        );
    }

    /**
     * Builder for constructing ScanStatistics incrementally.
     */
    public static class Builder {
        private int filesDiscovered = 0;
        private int filesIncluded = 0;
        private int filesExcluded = 0;
        private int directoriesSkipped = 0;
        private long totalBytes = 0;
        private final Map<FileKind, Integer> filesByKind = new EnumMap<>(FileKind.class);

        public Builder incrementFilesDiscovered() {
            this.filesDiscovered++;
            return this;
        }

        public Builder incrementFilesIncluded(FileKind kind, long sizeBytes) {
            this.filesIncluded++;
            this.totalBytes += sizeBytes;
            filesByKind.merge(kind, 1, Integer::sum);
            return this;
        }

        public Builder incrementFilesExcluded() {
            this.filesExcluded++;
            return this;
        }

        public Builder incrementDirectoriesSkipped() {
            this.directoriesSkipped++;
            return this;
        }

        public int filesIncluded() {
            return filesIncluded;
        }

        public long totalBytes() {
            return totalBytes;
        }

        public ScanStatistics build() {
            return new ScanStatistics(
                filesDiscovered,
                filesIncluded,
                filesExcluded,
                directoriesSkipped,
                totalBytes,
                filesByKind
            );
        }
    }
}
