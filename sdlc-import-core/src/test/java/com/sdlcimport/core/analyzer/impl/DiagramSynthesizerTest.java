package com.sdlcimport.core.analyzer.impl;

import com.sdlcimport.core.analyzer.AnalyzerOutput;
import com.sdlcimport.core.config.ImportConfig;
import com.sdlcimport.core.generator.DiagramGenerator;
import com.sdlcimport.core.generator.DiagramType;
import com.sdlcimport.core.generator.GeneratedDiagram;
import com.sdlcimport.core.generator.GeneratorConfig;
import com.sdlcimport.core.generator.TechnologyLandscape;
import com.sdlcimport.core.generator.impl.MermaidGenerator;
import com.sdlcimport.core.scanner.ScannerTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DiagramSynthesizer}.
 */
class DiagramSynthesizerTest extends ScannerTestBase {

    @Test
    void analyze_generatesEveryDiagramType() throws Exception {
        AnalyzerOutput output = new AnalyzerOutput();

        new DiagramSynthesizer().analyze(analysisContext(List.of(
            decision("ADR-IMPORT-001", "database", "postgresql", "application.properties"))), output);

        assertThat(output.diagrams()).extracting(GeneratedDiagram::type)
            .containsExactly(DiagramType.TECHNOLOGY_STACK, DiagramType.C4_CONTAINER, DiagramType.DATA_FLOW);
        assertThat(output.diagramFailures()).isEmpty();
    }

    @Test
    void analyze_configuredDirectionAndNodeCap_areApplied() throws Exception {
        // Given
        ImportConfig custom = new ImportConfig(null, null, null, null, null, null, null, null, null, null,
            new ImportConfig.DiagramConfig("lr", 1));
        AnalyzerOutput output = new AnalyzerOutput();

        // When
        new DiagramSynthesizer().analyze(analysisContext(List.of(
            decision("ADR-IMPORT-001", "database", "postgresql", "application.properties"),
            decision("ADR-IMPORT-002", "database", "mongodb", "application.properties")), custom, Set.of()), output);

        // Then
        assertThat(output.diagrams()).filteredOn(d -> d.type() == DiagramType.TECHNOLOGY_STACK)
            .singleElement()
            .satisfies(d -> assertThat(d.content()).startsWith("graph LR").doesNotContain("mongodb"));
    }

    @Test
    void analyze_failingDiagramType_isRecordedAndOthersStillGenerated() throws Exception {
        // Given
        DiagramGenerator flaky = new DiagramGenerator() {
            private final MermaidGenerator delegate = new MermaidGenerator();

            @Override
            public String getId() {
                return "flaky";
            }

            @Override
            public String getDisplayName() {
                return "Flaky";
            }

            @Override
            public Set<DiagramType> getSupportedDiagramTypes() {
                return delegate.getSupportedDiagramTypes();
            }

            @Override
            public GeneratedDiagram generate(TechnologyLandscape landscape, DiagramType type, GeneratorConfig config) {
                if (type == DiagramType.DATA_FLOW) {
                    throw new IllegalStateException("layout failed");
                }
                return delegate.generate(landscape, type, config);
            }
        };
        AnalyzerOutput output = new AnalyzerOutput();

        // When
        new DiagramSynthesizer(flaky).analyze(analysisContext(List.of()), output);

        // Then
        assertThat(output.diagrams()).hasSize(2).allMatch(GeneratedDiagram::placeholder);
        assertThat(output.diagramFailures())
            .containsEntry(DiagramType.DATA_FLOW, "IllegalStateException: layout failed");
    }
}
