package com.sdlcimport.core.validator.checker;

import com.sdlcimport.core.analyzer.AnalyzerOutput;
import com.sdlcimport.core.analyzer.AnalyzerResult;
import com.sdlcimport.core.analyzer.ArtifactKind;
import com.sdlcimport.core.generator.DiagramType;
import com.sdlcimport.core.generator.GeneratedDiagram;
import com.sdlcimport.core.renderer.ArtifactRenderer;
import com.sdlcimport.core.validator.CheckResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static com.sdlcimport.core.validator.checker.CheckerTestSupport.context;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DiagramSpecificityChecker}.
 */
class DiagramSpecificityCheckerTest {

    @TempDir
    Path tempDir;

    private ArtifactRenderer renderer;
    private AnalyzerResult diagrams;
    private final DiagramSpecificityChecker checker = new DiagramSpecificityChecker();

    @BeforeEach
    void setUp() {
        renderer = ArtifactRenderer.forDirectory(tempDir);
        AnalyzerOutput output = new AnalyzerOutput();
        output.addDiagram(new GeneratedDiagram(DiagramType.TECHNOLOGY_STACK, "Technology Stack", "graph TB\n",
            "mermaid", List.of("postgresql"), false));
        output.addDiagram(new GeneratedDiagram(DiagramType.DATA_FLOW, "Data Flow", "graph LR\n",
            "mermaid", List.of(), false));
        diagrams = AnalyzerResult.succeeded("diagrams", ArtifactKind.DIAGRAMS, output);
    }

    @Test
    void check_genericDiagram_isMarkedForRegeneration() throws Exception {
        // When
        CheckResult result = checker.check(context(renderer, List.of(), List.of(diagrams), null,
            Set.of("postgresql"), Set.of()));

        // Then
        assertThat(result.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.artifact()).isEqualTo("architecture/data-flow.yml");
            assertThat(issue.penalty()).isEqualTo(0.05);
        });
        assertThat(renderer.readArtifact("architecture/data-flow.yml").get("needsRegeneration").asBoolean()).isTrue();
        assertThat(result.rerendered().written()).containsExactly("architecture/data-flow.yml");
    }

    @Test
    void check_nothingDetected_isSkipped() {
        CheckResult result = checker.check(context(renderer, List.of(), List.of(diagrams), null, Set.of(), Set.of()));

        assertThat(result.isClean()).isTrue();
    }
}
