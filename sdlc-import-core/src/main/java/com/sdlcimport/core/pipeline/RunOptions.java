package com.sdlcimport.core.pipeline;

import java.nio.file.Path;

/**
 * Options of one import run.
 *
 * @param outputDirectory output directory, null for {@code <root>/<output.directory>}
 * @param configFile configuration file, null for {@code <root>/sdlc-import.yaml}
 * @param skipThreatModel skip the threat modeler
 * @param skipTechDebt skip the debt detector
 * @param disableNarrativeSynthesis use template rationales only
 * @param createTicketsForLowConfidence file tickets for LOW-confidence decisions and critical threats
 * @param branchName branch to create before scanning, null for none
 */
public record RunOptions(
    Path outputDirectory,
    Path configFile,
    boolean skipThreatModel,
    boolean skipTechDebt,
    boolean disableNarrativeSynthesis,
    boolean createTicketsForLowConfidence,
    String branchName
) {
    /**
     * Returns options with every switch off.
     *
     * @return default options
     */
    public static RunOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link RunOptions}.
     */
    public static class Builder {
        private Path outputDirectory;
        private Path configFile;
        private boolean skipThreatModel;
        private boolean skipTechDebt;
        private boolean disableNarrativeSynthesis;
        private boolean createTicketsForLowConfidence;
        private String branchName;

        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder configFile(Path configFile) {
            this.configFile = configFile;
            return this;
        }

        public Builder skipThreatModel(boolean skipThreatModel) {
            this.skipThreatModel = skipThreatModel;
            return this;
        }

        public Builder skipTechDebt(boolean skipTechDebt) {
            this.skipTechDebt = skipTechDebt;
            return this;
        }

        public Builder disableNarrativeSynthesis(boolean disableNarrativeSynthesis) {
            this.disableNarrativeSynthesis = disableNarrativeSynthesis;
            return this;
        }

        public Builder createTicketsForLowConfidence(boolean createTicketsForLowConfidence) {
            this.createTicketsForLowConfidence = createTicketsForLowConfidence;
            return this;
        }

        public Builder branchName(String branchName) {
            this.branchName = branchName;
            return this;
        }

        public RunOptions build() {
            return new RunOptions(outputDirectory, configFile, skipThreatModel, skipTechDebt,
                disableNarrativeSynthesis, createTicketsForLowConfidence, branchName);
        }
    }
}
