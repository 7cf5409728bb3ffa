package com.sdlcimport.core.decision;

import com.sdlcimport.core.config.ImportConfig;
import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.model.Evidence;
import com.sdlcimport.core.model.EvidenceRef;
import com.sdlcimport.core.model.SynthesisMode;

import java.util.List;
import java.util.Objects;

/**
 * Computes the composite confidence of candidate decisions.
 *
 * <pre>
 * confidence = 0.4 * quality + 0.3 * quantity + 0.2 * consistency + 0.1 * synthesisBonus
 * </pre>
 *
 * <ul>
 *   <li><b>quality</b>: mean match-strength weight (content 1.0, path 0.5)</li>
 *   <li><b>quantity</b>: {@code min(1, ln(1+n) / ln(1+saturation))} over distinct evidence files</li>
 *   <li><b>consistency</b>: share of the technology's evidence (all categories) in this category</li>
 *   <li><b>synthesisBonus</b>: 1 for narrative rationale, else 0</li>
 * </ul>
 *
 * <p>The result is clamped to [0,1].
 */
public class ConfidenceScorer {

    static final double QUALITY_WEIGHT = 0.4;
    static final double QUANTITY_WEIGHT = 0.3;
    static final double CONSISTENCY_WEIGHT = 0.2;
    static final double SYNTHESIS_WEIGHT = 0.1;

    private final ImportConfig.ScoringConfig config;

    public ConfidenceScorer(ImportConfig.ScoringConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Scores every candidate against the full evidence set.
     *
     * @param candidates candidate decisions
     * @param allEvidence every evidence record of the run
     * @return candidates with their confidence set
     */
    public List<DecisionRecord> scoreAll(List<DecisionRecord> candidates, List<Evidence> allEvidence) {
        return candidates.stream()
            .map(candidate -> candidate.withConfidence(score(candidate, allEvidence)))
            .toList();
    }

    /**
     * Computes the confidence of one decision.
     *
     * @param decision decision to score
     * @param allEvidence every evidence record of the run
     * @return confidence in [0,1]
     */
    public double score(DecisionRecord decision, List<Evidence> allEvidence) {
        double score = QUALITY_WEIGHT * quality(decision.evidenceRefs())
            + QUANTITY_WEIGHT * quantity(decision.evidencePaths().size())
            + CONSISTENCY_WEIGHT * consistency(decision, allEvidence)
            + SYNTHESIS_WEIGHT * (decision.synthesisMode() == SynthesisMode.NARRATIVE ? 1.0 : 0.0);
        return clamp(score);
    }

    /**
     * Maps a confidence score to its level.
     *
     * @param confidence confidence score
     * @return confidence level
     */
    public ConfidenceLevel level(double confidence) {
        return ConfidenceLevel.fromScore(confidence, config);
    }

    double quality(List<EvidenceRef> refs) {
        if (refs.isEmpty()) {
            return 0.0;
        }
        return refs.stream().mapToDouble(ref -> ref.matchStrength().getWeight()).average().orElse(0.0);
    }

    double quantity(int evidenceFiles) {
        if (evidenceFiles <= 0) {
            return 0.0;
        }
        double value = Math.log1p(evidenceFiles) / Math.log1p(config.quantitySaturation());
        return Math.min(1.0, value);
    }

    double consistency(DecisionRecord decision, List<Evidence> allEvidence) {
        long technologyTotal = allEvidence.stream()
            .filter(e -> e.technologyId().equals(decision.technologyId()))
            .count();
        if (technologyTotal == 0) {
            return 1.0;
        }
        long inCategory = allEvidence.stream()
            .filter(e -> e.technologyId().equals(decision.technologyId()))
            .filter(e -> e.category().equals(decision.category()))
            .count();
        return (double) inCategory / technologyTotal;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
