package com.sdlcimport.core.validator;

import com.sdlcimport.core.generator.DiagramType;
import com.sdlcimport.core.renderer.OutputLayout;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OutputLayoutValidator}.
 */
class OutputLayoutValidatorTest {

    @TempDir
    Path tempDir;

    private final OutputLayoutValidator validator = new OutputLayoutValidator();

    @Test
    void validate_completeOutput_hasNoProblems() throws IOException {
        writeCompleteLayout();

        assertThat(validator.validate(tempDir)).isEmpty();
    }

    @Test
    void validate_missingDirectory_reportsIt() throws IOException {
        assertThat(validator.validate(tempDir.resolve("nowhere")))
            .singleElement().asString().startsWith("Output directory does not exist");
    }

    @Test
    void validate_missingAndBrokenArtifacts_areReported() throws IOException {
        // Given
        writeCompleteLayout();
        Files.delete(tempDir.resolve(OutputLayout.SUMMARY));
        write("decisions/ADR-IMPORT-001-java.yml", "id: [unclosed\n");
        write("architecture/data-flow.yml", "kind: diagram\nfailed: true\n");
        write("reports/list.yml", "- a\n- b\n");

        // When
        var problems = validator.validate(tempDir);

        // Then
        assertThat(problems).containsExactlyInAnyOrder(
            "Missing required artifact: " + OutputLayout.SUMMARY,
            "Artifact is flagged as failed: architecture/data-flow.yml",
            "Artifact is not a YAML mapping: reports/list.yml",
            problems.stream().filter(p -> p.startsWith("Artifact does not parse: decisions/ADR-IMPORT-001-java.yml"))
                .findFirst().orElse("expected parse failure"));
    }

    private void writeCompleteLayout() throws IOException {
        write(OutputLayout.QUALITY_REPORT, "kind: quality-report\nscore: 1.0\n");
        write(OutputLayout.SUMMARY, "# Import Summary: demo\n");
        for (DiagramType type : DiagramType.values()) {
            write(OutputLayout.diagramPath(type), "kind: diagram\nfailed: false\n");
        }
    }

    private void write(String relativePath, String content) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
