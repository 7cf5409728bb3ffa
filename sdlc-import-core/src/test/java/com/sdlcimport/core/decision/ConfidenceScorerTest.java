package com.sdlcimport.core.decision;

import com.sdlcimport.core.config.ImportConfig;
import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.model.DecisionStatus;
import com.sdlcimport.core.model.Evidence;
import com.sdlcimport.core.model.EvidenceRef;
import com.sdlcimport.core.model.MatchStrength;
import com.sdlcimport.core.model.SynthesisMode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link ConfidenceScorer}.
 */
class ConfidenceScorerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer(ImportConfig.defaults().scoring());

    @Test
    void score_singleContentFile_isMedium() {
        // Given
        DecisionRecord decision = decision("database", "postgresql", MatchStrength.CONTENT, SynthesisMode.TEMPLATE,
            "application.properties");
        List<Evidence> evidence = List.of(evidence("database", "postgresql", "application.properties", MatchStrength.CONTENT));

        // When
        double score = scorer.score(decision, evidence);

        // Then
        double expected = 0.4 + 0.3 * Math.log(2) / Math.log(11) + 0.2;
        assertThat(score).isCloseTo(expected, within(1e-9));
        assertThat(scorer.level(score)).isEqualTo(ConfidenceLevel.MEDIUM);
    }

    @Test
    void score_singlePathFile_isLow() {
        DecisionRecord decision = decision("infrastructure", "docker", MatchStrength.PATH, SynthesisMode.TEMPLATE,
            "Dockerfile");
        List<Evidence> evidence = List.of(evidence("infrastructure", "docker", "Dockerfile", MatchStrength.PATH));

        double score = scorer.score(decision, evidence);

        assertThat(scorer.level(score)).isEqualTo(ConfidenceLevel.LOW);
    }

    @Test
    void score_saturatedNarrativeDecision_reachesOne() {
        // Given
        String[] paths = IntStream.rangeClosed(1, 12).mapToObj(i -> "svc" + i + "/application.yml").toArray(String[]::new);
        DecisionRecord decision = decision("messaging", "kafka", MatchStrength.CONTENT, SynthesisMode.NARRATIVE, paths);
        List<Evidence> evidence = new ArrayList<>();
        for (String path : paths) {
            evidence.add(evidence("messaging", "kafka", path, MatchStrength.CONTENT));
        }

        // When
        double score = scorer.score(decision, evidence);

        // Then
        assertThat(score).isCloseTo(1.0, within(1e-9));
        assertThat(scorer.level(score)).isEqualTo(ConfidenceLevel.HIGH);
    }

    @Test
    void consistency_technologySpreadOverCategories_isShared() {
        DecisionRecord decision = decision("database", "redis", MatchStrength.CONTENT, SynthesisMode.TEMPLATE, "a.yml");
        List<Evidence> evidence = List.of(
            evidence("database", "redis", "a.yml", MatchStrength.CONTENT),
            evidence("caching", "redis", "b.yml", MatchStrength.CONTENT),
            evidence("caching", "redis", "c.yml", MatchStrength.CONTENT),
            evidence("caching", "redis", "d.yml", MatchStrength.CONTENT)
        );

        assertThat(scorer.consistency(decision, evidence)).isEqualTo(0.25);
    }

    @Test
    void quantity_growsMonotonicallyAndSaturates() {
        assertThat(scorer.quantity(0)).isZero();
        assertThat(scorer.quantity(2)).isGreaterThan(scorer.quantity(1));
        assertThat(scorer.quantity(10)).isEqualTo(1.0);
        assertThat(scorer.quantity(500)).isEqualTo(1.0);
    }

    @Test
    void quality_mixedStrengths_isMeanWeight() {
        List<EvidenceRef> refs = List.of(
            new EvidenceRef("a", 1, MatchStrength.CONTENT),
            new EvidenceRef("b", null, MatchStrength.PATH)
        );

        assertThat(scorer.quality(refs)).isEqualTo(0.75);
        assertThat(scorer.quality(List.of())).isZero();
    }

    @Test
    void scoreAll_setsConfidenceOnEveryCandidate() {
        DecisionRecord decision = decision("language", "java", MatchStrength.PATH, SynthesisMode.TEMPLATE, "App.java");

        List<DecisionRecord> scored = scorer.scoreAll(List.of(decision),
            List.of(evidence("language", "java", "App.java", MatchStrength.PATH)));

        assertThat(scored).singleElement().satisfies(d -> assertThat(d.confidence()).isBetween(0.0, 1.0).isPositive());
    }

    private static DecisionRecord decision(String category, String technologyId, MatchStrength strength,
                                           SynthesisMode mode, String... paths) {
        List<EvidenceRef> refs = new ArrayList<>();
        for (String path : paths) {
            refs.add(new EvidenceRef(path, strength == MatchStrength.CONTENT ? 1 : null, strength));
        }
        return new DecisionRecord("ADR-IMPORT-001", category, technologyId, null, null, "rationale", null, 0.0,
            refs, DecisionStatus.NEW, mode);
    }

    private static Evidence evidence(String category, String technologyId, String path, MatchStrength strength) {
        return new Evidence(technologyId, category, path, strength == MatchStrength.CONTENT ? 1 : null, strength);
    }
}
