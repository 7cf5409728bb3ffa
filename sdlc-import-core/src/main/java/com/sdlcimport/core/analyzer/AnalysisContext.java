package com.sdlcimport.core.analyzer;

import com.sdlcimport.core.config.ImportConfig;
import com.sdlcimport.core.detector.FileContentReader;
import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.model.DecisionStatus;
import com.sdlcimport.core.model.Evidence;
import com.sdlcimport.core.scanner.FileInventory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only input shared by all analyzers of a run.
 *
 * <p>Every field is immutable, so analyzers can read it concurrently.
 *
 * @param projectName project name used in artifact headers
 * @param projectRoot scanned root; relative rule files resolve against it
 * @param inventory classified file inventory
 * @param evidence detected evidence
 * @param decisions known decisions (persisted plus this run's new and enriched records)
 * @param config import configuration
 * @param contentReader bounded file reader
 * @param skippedKinds artifact kinds the run skips
 */
public record AnalysisContext(
    String projectName,
    Path projectRoot,
    FileInventory inventory,
    List<Evidence> evidence,
    List<DecisionRecord> decisions,
    ImportConfig config,
    FileContentReader contentReader,
    Set<ArtifactKind> skippedKinds
) {
    public AnalysisContext {
        Objects.requireNonNull(projectName, "projectName must not be null");
        Objects.requireNonNull(projectRoot, "projectRoot must not be null");
        Objects.requireNonNull(inventory, "inventory must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(contentReader, "contentReader must not be null");
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        decisions = decisions == null ? List.of() : decisions.stream()
            .filter(d -> d.status() != DecisionStatus.REMOVED)
            .toList();
        skippedKinds = skippedKinds == null ? Set.of() : Set.copyOf(skippedKinds);
    }

    /**
     * Returns true if an artifact kind is skipped in this run.
     *
     * @param kind artifact kind
     * @return true when skipped
     */
    public boolean isSkipped(ArtifactKind kind) {
        return skippedKinds.contains(kind);
    }

    /**
     * Returns true if a decision of the given category is known.
     *
     * @param category decision category
     * @return true when present
     */
    public boolean hasDecisionIn(String category) {
        return decisions.stream().anyMatch(d -> d.category().equals(category));
    }

    /**
     * Resolves configured file names against the project root.
     *
     * @param files configured paths
     * @return absolute paths
     */
    public List<Path> resolve(List<String> files) {
        return files.stream().map(projectRoot::resolve).toList();
    }
}
