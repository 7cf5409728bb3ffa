package com.sdlcimport;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SDLC Import command line")
class SdlcImportCLITest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should import a project and validate its output")
    void analyzeThenValidate() throws IOException {
        // Given
        Path project = Files.createDirectories(tempDir.resolve("shop"));
        Files.writeString(project.resolve("application.properties"),
            "spring.datasource.url=jdbc:postgresql://db:5432/app\nspring.jpa.hibernate.ddl-auto=update\n");
        Path output = tempDir.resolve("out");

        // When
        int analyzeExit = SdlcImportCLI.createCommandLine()
            .execute("-q", "analyze", project.toString(), "-o", output.toString(), "--yes");
        int validateExit = SdlcImportCLI.createCommandLine()
            .execute("-q", "validate", output.toString());

        // Then
        assertThat(analyzeExit).isZero();
        assertThat(output.resolve("reports/import-summary.md")).exists();
        assertThat(output.resolve("corpus/decision-store.yml")).exists();
        assertThat(validateExit).isZero();
    }

    @Test
    @DisplayName("Should exit 1 when the project directory is missing")
    void analyzeMissingProject() {
        int exit = SdlcImportCLI.createCommandLine()
            .execute("-q", "analyze", tempDir.resolve("missing").toString(), "-o", tempDir.resolve("out").toString());

        assertThat(exit).isEqualTo(1);
    }

    @Test
    @DisplayName("Should exit 1 when validating an empty directory")
    void validateEmptyDirectory() {
        int exit = SdlcImportCLI.createCommandLine().execute("-q", "validate", tempDir.toString());

        assertThat(exit).isEqualTo(1);
    }

    @ParameterizedTest
    @CsvSource({
        "signatures, 0",
        "threat-rules, 0",
        "debt, 0",
        "licenses, 1"
    })
    @DisplayName("Should list built-in catalogs")
    void listCatalogs(String type, int expectedExit) {
        int exit = SdlcImportCLI.createCommandLine().execute("-q", "list", type);

        assertThat(exit).isEqualTo(expectedExit);
    }

    @Test
    @DisplayName("Should apply global logging options before subcommands")
    void globalOptions() {
        SdlcImportCLI app = new SdlcImportCLI();
        new CommandLine(app).parseArgs("-v", "list", "signatures");

        assertThat(app.isVerbose()).isTrue();
        assertThat(app.isQuiet()).isFalse();
    }
}
