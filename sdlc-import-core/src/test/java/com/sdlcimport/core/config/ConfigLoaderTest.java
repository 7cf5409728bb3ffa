package com.sdlcimport.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("sdlc-import.yaml");
        Files.writeString(configFile, """
            project:
              name: "billing-service"
              description: "Invoices and payments"

            output:
              directory: "build/sdlc"

            scan:
              maxFiles: 500
              excludeDirectories: [".git", "fixtures"]

            detection:
              signatureFiles: ["extra-signatures.yaml"]
              minEvidence: 2

            validation:
              acceptThreshold: 0.9
              reviewThreshold: 0.6
              penalties:
                missingArtifact: 0.2

            analysis:
              threads: 2
            """);

        ImportConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("billing-service");
        assertThat(config.project().description()).isEqualTo("Invoices and payments");
        assertThat(config.output().directory()).isEqualTo("build/sdlc");
        assertThat(config.scan().maxFiles()).isEqualTo(500);
        assertThat(config.scan().excludeDirectories()).containsExactly(".git", "fixtures");
        assertThat(config.detection().signatureFiles()).containsExactly("extra-signatures.yaml");
        assertThat(config.detection().minEvidence()).isEqualTo(2);
        assertThat(config.validation().acceptThreshold()).isEqualTo(0.9);
        assertThat(config.validation().reviewThreshold()).isEqualTo(0.6);
        assertThat(config.validation().penalties().missingArtifact()).isEqualTo(0.2);
        assertThat(config.validation().penalties().removedDecision()).isEqualTo(0.05);
        assertThat(config.analysis().threads()).isEqualTo(2);
    }

    @Test
    void load_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("sdlc-import.yaml");
        Files.writeString(configFile, """
            project:
              name: "partial"
            """);

        ImportConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("partial");
        assertThat(config.output().directory()).isEqualTo("sdlc-import");
        assertThat(config.scan().excludeDirectories()).contains(".git", "node_modules");
        assertThat(config.reconciliation().storePath()).isEqualTo("corpus/decision-store.yml");
        assertThat(config.validation().acceptThreshold()).isEqualTo(0.85);
        assertThat(config.validation().reviewThreshold()).isEqualTo(0.70);
        assertThat(config.debt().maxLinesPerFile()).isEqualTo(1000);
    }

    @Test
    void load_diagramSection_normalizesDirection() throws IOException {
        // Given
        Path configFile = tempDir.resolve("sdlc-import.yaml");
        Files.writeString(configFile, """
            diagrams:
              direction: lr
              maxNodesPerCategory: 4
            """);

        // When
        ImportConfig config = ConfigLoader.load(configFile);

        // Then
        assertThat(config.diagrams().direction()).isEqualTo("LR");
        assertThat(config.diagrams().maxNodesPerCategory()).isEqualTo(4);
        assertThat(ImportConfig.defaults().diagrams().direction()).isEqualTo("TB");
    }

    @Test
    void load_unknownProperties_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("sdlc-import.yaml");
        Files.writeString(configFile, """
            project:
              name: "future"
              owner: "platform-team"
            plugins:
              - name: "something"
            """);

        ImportConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("future");
    }

    @Test
    void load_missingFile_returnsDefaults() {
        ImportConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(ImportConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("sdlc-import.yaml");
        Files.writeString(configFile, "project: [unclosed");

        ImportConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("project");
    }

    @Test
    void load_inconsistentThresholds_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("sdlc-import.yaml");
        Files.writeString(configFile, """
            validation:
              acceptThreshold: 0.5
              reviewThreshold: 0.8
            """);

        ImportConfig config = ConfigLoader.load(configFile);

        assertThat(config.validation().acceptThreshold()).isEqualTo(0.85);
    }

    @Test
    void loadFromRoot_withoutFile_returnsDefaults() {
        assertThat(ConfigLoader.loadFromRoot(tempDir)).isEqualTo(ImportConfig.defaults());
    }

    @Test
    void loadFromRoot_readsDefaultFileName() throws IOException {
        Files.writeString(tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME), "project:\n  name: rooted\n");

        assertThat(ConfigLoader.loadFromRoot(tempDir).project().name()).isEqualTo("rooted");
    }
}
