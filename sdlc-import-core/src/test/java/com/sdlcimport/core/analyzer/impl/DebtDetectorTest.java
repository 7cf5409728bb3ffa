package com.sdlcimport.core.analyzer.impl;

import com.sdlcimport.core.analyzer.AnalyzerOutput;
import com.sdlcimport.core.config.ImportConfig;
import com.sdlcimport.core.model.DebtItem;
import com.sdlcimport.core.model.DebtPriority;
import com.sdlcimport.core.scanner.ScannerTestBase;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link DebtDetector}.
 */
class DebtDetectorTest extends ScannerTestBase {

    private final DebtDetector detector = new DebtDetector();

    @Test
    void analyze_ordersByPriorityThenRuleOrder() throws Exception {
        // Given
        createFile("src/App.java", """
            class App {
                // TODO split this class
                void run() { System.out.println("hi"); } // FIXME logging
            }
            """);
        AnalyzerOutput output = new AnalyzerOutput();

        // When
        detector.analyze(analysisContext(List.of()), output);

        // Then
        assertThat(output.debtItems())
            .extracting(DebtItem::id, DebtItem::ruleId, DebtItem::priority, DebtItem::location)
            .containsExactly(
                tuple("TD-001", DebtDetector.MISSING_TESTS_RULE, DebtPriority.P1, "."),
                tuple("TD-002", "todo-marker", DebtPriority.P3, "src/App.java:2"),
                tuple("TD-003", "stdout-debugging", DebtPriority.P3, "src/App.java:3"));
    }

    @Test
    void analyze_perOccurrenceRule_multipliesEffort() throws Exception {
        createFile("src/App.java", "// TODO a\n// TODO b\n// HACK c\n");
        AnalyzerOutput output = new AnalyzerOutput();

        detector.analyze(analysisContext(List.of(decision("ADR-IMPORT-001", "testing", "junit", "pom.xml"))), output);

        assertThat(output.debtItems()).singleElement().satisfies(item -> {
            assertThat(item.ruleId()).isEqualTo("todo-marker");
            assertThat(item.effortEstimateHours()).isEqualTo(1.5);
        });
    }

    @Test
    void analyze_oversizedSourceFile_isReported() throws Exception {
        // Given
        createFile("src/Big.java", "a\nb\nc\nd\ne\nf\ng");
        ImportConfig custom = new ImportConfig(null, null, null, null, null, null, null, null,
            new ImportConfig.DebtConfig(5, null), null, null);
        AnalyzerOutput output = new AnalyzerOutput();

        // When
        detector.analyze(analysisContext(List.of(decision("ADR-IMPORT-001", "testing", "junit", "pom.xml")),
            custom, Set.of()), output);

        // Then
        assertThat(output.debtItems()).singleElement().satisfies(item -> {
            assertThat(item.ruleId()).isEqualTo(DebtDetector.OVERSIZED_FILE_RULE);
            assertThat(item.title()).contains("7 lines");
            assertThat(item.location()).isEqualTo("src/Big.java");
            assertThat(item.effortEstimateHours()).isEqualTo(2.0);
        });
    }

    @Test
    void analyze_noSourceFiles_noMissingTestsItem() throws Exception {
        createFile("README.md", "# Docs\n");
        AnalyzerOutput output = new AnalyzerOutput();

        detector.analyze(analysisContext(List.of()), output);

        assertThat(output.debtItems()).isEmpty();
    }

    @Test
    void analyze_extraRuleFile_overridesBuiltInRule() throws Exception {
        // Given
        createFile("rules/debt.yaml", """
            rules:
              - id: todo-marker
                title: Open TODO
                priority: P0
                filePatterns: ["**/*.java"]
                pattern: "TODO"
                effortHours: 3.0
            """);
        createFile("src/App.java", "// TODO once\n");
        ImportConfig custom = new ImportConfig(null, null, null, null, null, null, null, null,
            new ImportConfig.DebtConfig(null, List.of("rules/debt.yaml")), null, null);
        AnalyzerOutput output = new AnalyzerOutput();

        // When
        detector.analyze(analysisContext(List.of(decision("ADR-IMPORT-001", "testing", "junit", "pom.xml")),
            custom, Set.of()), output);

        // Then
        assertThat(output.debtItems())
            .extracting(DebtItem::title, DebtItem::priority, DebtItem::effortEstimateHours)
            .containsExactly(tuple("Open TODO", DebtPriority.P0, 3.0));
    }

    @Test
    void countLines_countsUnterminatedLastLine() throws Exception {
        Path file = createFile("x.txt", "one\ntwo\nthree");
        Path terminated = createFile("y.txt", "one\ntwo\n");

        assertThat(DebtDetector.countLines(file)).isEqualTo(3);
        assertThat(DebtDetector.countLines(terminated)).isEqualTo(2);
    }
}
