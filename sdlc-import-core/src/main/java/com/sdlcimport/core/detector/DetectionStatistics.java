package com.sdlcimport.core.detector;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics collected during technology detection.
 *
 * @param filesExamined text files checked against the registry
 * @param filesRead files whose content was read
 * @param filesFailed files that could not be read and were skipped
 * @param rejectedByDisambiguator signature matches dropped by a failing disambiguator
 * @param evidenceCount evidence records emitted after deduplication
 * @param errorCounts error types mapped to their occurrence counts
 * @param topErrors first error messages (max 10)
 */
public record DetectionStatistics(
    int filesExamined,
    int filesRead,
    int filesFailed,
    int rejectedByDisambiguator,
    int evidenceCount,
    Map<String, Integer> errorCounts,
    List<String> topErrors
) {
    public DetectionStatistics {
        errorCounts = errorCounts == null ? Map.of() : Map.copyOf(errorCounts);
        topErrors = topErrors == null ? List.of() : List.copyOf(topErrors);
    }

    /**
     * Returns true if any file failed to read.
     *
     * @return true if at least one file was skipped
     */
    public boolean hasFailures() {
        return filesFailed > 0;
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format("Examined: %d, Read: %d, Failed: %d, Disambiguated away: %d, Evidence: %d",
            filesExamined, filesRead, filesFailed, rejectedByDisambiguator, evidenceCount);
    }

    /**
     * Builder for constructing DetectionStatistics incrementally.
     */
    public static class Builder {
        private int filesExamined = 0;
        private int filesRead = 0;
        private int filesFailed = 0;
        private int rejectedByDisambiguator = 0;
        private final Map<String, Integer> errorCounts = new HashMap<>();
        private final List<String> topErrors = new ArrayList<>();

        public Builder incrementFilesExamined() {
            this.filesExamined++;
            return this;
        }

        public Builder incrementFilesRead() {
            this.filesRead++;
            return this;
        }

        public Builder incrementFilesFailed() {
            this.filesFailed++;
            return this;
        }

        public Builder incrementRejectedByDisambiguator() {
            this.rejectedByDisambiguator++;
            return this;
        }

        public Builder addError(String errorType, String errorDetail) {
            errorCounts.merge(errorType, 1, Integer::sum);
            if (topErrors.size() < 10) {
                topErrors.add(errorDetail);
            }
            return this;
        }

        public DetectionStatistics build(int evidenceCount) {
            return new DetectionStatistics(
                filesExamined,
                filesRead,
                filesFailed,
                rejectedByDisambiguator,
                evidenceCount,
                errorCounts,
                topErrors
            );
        }
    }
}
