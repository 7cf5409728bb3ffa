package com.sdlcimport.core.scanner;

import com.sdlcimport.core.config.ImportConfig;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Functional tests for {@link TreeScanner}.
 */
class TreeScannerTest extends ScannerTestBase {

    @Test
    void scan_classifiesFilesAndSortsByPath() throws Exception {
        // Given
        createFile("src/main/java/com/example/App.java", "class App {}");
        createFile("src/test/java/com/example/AppTest.java", "class AppTest {}");
        createFile("pom.xml", "<project/>");
        createFile("src/main/resources/application.yml", "server:\n  port: 8080\n");
        createFile("Dockerfile", "FROM eclipse-temurin:17");
        createFile("README.md", "# App");

        // When
        FileInventory inventory = scan();

        // Then
        assertThat(inventory.files()).extracting(ScannedFile::relativePath).containsExactly(
            "Dockerfile",
            "README.md",
            "pom.xml",
            "src/main/java/com/example/App.java",
            "src/main/resources/application.yml",
            "src/test/java/com/example/AppTest.java"
        );
        assertThat(inventory.find("src/main/java/com/example/App.java")).get()
            .extracting(ScannedFile::kind).isEqualTo(FileKind.SOURCE);
        assertThat(inventory.find("src/test/java/com/example/AppTest.java")).get()
            .extracting(ScannedFile::kind).isEqualTo(FileKind.TEST);
        assertThat(inventory.find("pom.xml")).get().extracting(ScannedFile::kind).isEqualTo(FileKind.BUILD);
        assertThat(inventory.find("Dockerfile")).get().extracting(ScannedFile::kind).isEqualTo(FileKind.INFRASTRUCTURE);
        assertThat(inventory.statistics().filesIncluded()).isEqualTo(6);
    }

    @Test
    void scan_prunesExcludedDirectories() throws Exception {
        // Given
        createFile("src/index.js", "console.log('hi')");
        createFile("node_modules/left-pad/index.js", "module.exports = {}");
        createFile(".git/config", "[core]");
        createFile("target/classes/App.class", "binary");

        // When
        FileInventory inventory = scan();

        // Then
        assertThat(inventory.files()).extracting(ScannedFile::relativePath).containsExactly("src/index.js");
        assertThat(inventory.statistics().directoriesSkipped()).isEqualTo(3);
    }

    @Test
    void scan_countsButSkipsGeneratedFiles() throws Exception {
        // Given
        createFile("web/app.js", "run()");
        createFile("web/app.min.js", "run()");

        // When
        FileInventory inventory = scan();

        // Then
        assertThat(inventory.files()).extracting(ScannedFile::relativePath).containsExactly("web/app.js");
        assertThat(inventory.statistics().filesDiscovered()).isEqualTo(2);
        assertThat(inventory.statistics().filesExcluded()).isEqualTo(1);
    }

    @Test
    void scan_excludesOutputDirectory() throws Exception {
        // Given
        createFile("app.py", "print('x')");
        createFile("sdlc-import/decisions/ADR-IMPORT-001-python.yml", "kind: architecture-decision");
        Path output = tempDir.resolve("sdlc-import");

        // When
        FileInventory inventory = new TreeScanner(config.scan()).scan(tempDir, output);

        // Then
        assertThat(inventory.files()).extracting(ScannedFile::relativePath).containsExactly("app.py");
    }

    @Test
    void scan_exceedingFileCeiling_throwsInputException() throws IOException {
        // Given
        for (int i = 0; i < 4; i++) {
            createFile("src/File" + i + ".java", "class File" + i + " {}");
        }
        ImportConfig.ScanConfig limited = new ImportConfig.ScanConfig(3, null, null, null, null);

        // When / Then
        assertThatThrownBy(() -> new TreeScanner(limited).scan(tempDir, null))
            .isInstanceOf(InputException.class)
            .hasMessageContaining("file ceiling of 3");
    }

    @Test
    void scan_exceedingSizeCeiling_throwsInputException() throws IOException {
        // Given
        createFile("data.json", "x".repeat(200));
        ImportConfig.ScanConfig limited = new ImportConfig.ScanConfig(null, 100L, null, List.of(), List.of());

        // When / Then
        assertThatThrownBy(() -> new TreeScanner(limited).scan(tempDir, null))
            .isInstanceOf(InputException.class)
            .hasMessageContaining("size ceiling");
    }

    @Test
    void scan_missingRoot_throwsInputException() {
        assertThatThrownBy(() -> new TreeScanner(config.scan()).scan(tempDir.resolve("missing"), null))
            .isInstanceOf(InputException.class)
            .hasMessageContaining("does not exist");
    }

    @Test
    void scan_fileAsRoot_throwsInputException() throws IOException {
        Path file = createFile("single.txt", "text");

        assertThatThrownBy(() -> new TreeScanner(config.scan()).scan(file, null))
            .isInstanceOf(InputException.class)
            .hasMessageContaining("not a directory");
    }

    @Test
    void scan_unreadableRoot_throwsInputException() throws IOException {
        // Given
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path locked = createFile("locked/App.java", "class App {}").getParent();
        Set<PosixFilePermission> original = Files.getPosixFilePermissions(locked);
        Files.setPosixFilePermissions(locked, Set.of());
        try {
            assumeFalse(Files.isReadable(locked), "permissions are not enforced for this user");

            // When / Then
            assertThatThrownBy(() -> new TreeScanner(config.scan()).scan(locked, null))
                .isInstanceOf(InputException.class)
                .hasMessageContaining("not readable");
        } finally {
            Files.setPosixFilePermissions(locked, original);
        }
    }

    @Test
    void scan_emptyDirectory_returnsEmptyInventory() throws Exception {
        FileInventory inventory = scan();

        assertThat(inventory.files()).isEmpty();
        assertThat(inventory.statistics().filesDiscovered()).isZero();
    }
}
