package com.sdlcimport.core.validator;

import com.sdlcimport.core.analyzer.AnalyzerResult;
import com.sdlcimport.core.analyzer.ArtifactKind;
import com.sdlcimport.core.config.ImportConfig;
import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.model.DecisionStatus;
import com.sdlcimport.core.renderer.ArtifactRenderer;
import com.sdlcimport.core.renderer.RenderReport;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Everything the post-generation checkers inspect.
 *
 * @param projectName project name
 * @param decisions reconciled decisions of this run
 * @param analyzerResults analyzer results
 * @param rendered report of every artifact rendered so far
 * @param renderer renderer used for corrections
 * @param detectedTechnologies technology ids found in the evidence
 * @param skippedKinds artifact kinds skipped in this run
 * @param config validation settings
 * @param removedDecisionKeys identity keys of decisions removed by earlier checkers
 */
public record ValidationContext(
    String projectName,
    List<DecisionRecord> decisions,
    List<AnalyzerResult> analyzerResults,
    RenderReport rendered,
    ArtifactRenderer renderer,
    Set<String> detectedTechnologies,
    Set<ArtifactKind> skippedKinds,
    ImportConfig.ValidationConfig config,
    Set<String> removedDecisionKeys
) {
    public ValidationContext {
        Objects.requireNonNull(projectName, "projectName must not be null");
        Objects.requireNonNull(renderer, "renderer must not be null");
        Objects.requireNonNull(config, "config must not be null");
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
        analyzerResults = analyzerResults == null ? List.of() : List.copyOf(analyzerResults);
        rendered = rendered == null ? RenderReport.empty() : rendered;
        detectedTechnologies = detectedTechnologies == null ? Set.of() : Set.copyOf(detectedTechnologies);
        skippedKinds = skippedKinds == null ? Set.of() : Set.copyOf(skippedKinds);
        removedDecisionKeys = removedDecisionKeys == null ? Set.of() : Set.copyOf(removedDecisionKeys);
    }

    /**
     * Returns the decisions rendered in this run (NEW and ENRICHMENT) that were not removed.
     *
     * @return rendered decisions
     */
    public List<DecisionRecord> renderedDecisions() {
        return decisions.stream()
            .filter(d -> d.status() == DecisionStatus.NEW || d.status() == DecisionStatus.ENRICHMENT)
            .filter(d -> !removedDecisionKeys.contains(d.identityKey()))
            .toList();
    }

    /**
     * Returns the result of the analyzer producing an artifact kind.
     *
     * @param kind artifact kind
     * @return result, empty when the analyzer did not run
     */
    public Optional<AnalyzerResult> resultFor(ArtifactKind kind) {
        return analyzerResults.stream().filter(r -> r.kind() == kind).findFirst();
    }

    /**
     * Returns a copy with additional removed decisions.
     *
     * @param removed identity keys
     * @return new context
     */
    public ValidationContext withRemoved(Set<String> removed) {
        if (removed.isEmpty()) {
            return this;
        }
        Set<String> all = new HashSet<>(removedDecisionKeys);
        all.addAll(removed);
        return new ValidationContext(projectName, decisions, analyzerResults, rendered, renderer,
            detectedTechnologies, skippedKinds, config, all);
    }

    /**
     * Returns a copy with additional rendered artifacts.
     *
     * @param more render report of corrections
     * @return new context
     */
    public ValidationContext withRendered(RenderReport more) {
        return new ValidationContext(projectName, decisions, analyzerResults, rendered.merge(more), renderer,
            detectedTechnologies, skippedKinds, config, removedDecisionKeys);
    }
}
