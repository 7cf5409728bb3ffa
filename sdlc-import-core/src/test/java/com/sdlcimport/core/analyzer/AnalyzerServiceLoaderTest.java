package com.sdlcimport.core.analyzer;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration test validating SPI registration for {@link Analyzer} implementations.
 *
 * <p>Catches typos in the META-INF/services file, missing classes and constructor failures
 * before they surface as a silently skipped artifact at runtime.
 *
 * <p>Expected analyzer count: 3 (diagrams, tech-debt, threat-model)
 */
class AnalyzerServiceLoaderTest {

    /**
     * Expected number of analyzer implementations.
     * Update this constant when adding new analyzers.
     */
    private static final int EXPECTED_ANALYZER_COUNT = 3;

    @Test
    void serviceLoader_discoversAllRegisteredAnalyzers() {
        List<Analyzer> analyzers = ServiceLoader.load(Analyzer.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        assertThat(analyzers)
            .as("ServiceLoader should discover all %d registered analyzers", EXPECTED_ANALYZER_COUNT)
            .hasSize(EXPECTED_ANALYZER_COUNT)
            .allMatch(analyzer -> analyzer.getId() != null, "All analyzers should have non-null ID")
            .allMatch(analyzer -> analyzer.getDisplayName() != null, "All analyzers should have a display name");
    }

    @Test
    void serviceLoader_analyzersHaveUniqueIdsAndKinds() {
        List<Analyzer> analyzers = AnalyzerRunner.discover();

        Set<String> ids = analyzers.stream().map(Analyzer::getId).collect(Collectors.toSet());
        Set<ArtifactKind> kinds = analyzers.stream().map(Analyzer::artifactKind).collect(Collectors.toSet());

        assertThat(ids).hasSize(analyzers.size());
        assertThat(kinds).containsExactlyInAnyOrder(ArtifactKind.values());
    }

    @Test
    void discover_sortsById() {
        assertThat(AnalyzerRunner.discover())
            .extracting(Analyzer::getId)
            .containsExactly("diagrams", "tech-debt", "threat-model");
    }
}
