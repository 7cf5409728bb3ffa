package com.sdlcimport.core.detector;

import com.sdlcimport.core.model.Disambiguator;
import com.sdlcimport.core.model.Evidence;
import com.sdlcimport.core.model.MatchStrength;
import com.sdlcimport.core.model.SignatureKind;
import com.sdlcimport.core.model.TechnologySignature;
import com.sdlcimport.core.scanner.FileInventory;
import com.sdlcimport.core.scanner.FileKind;
import com.sdlcimport.core.scanner.ScanStatistics;
import com.sdlcimport.core.scanner.ScannedFile;
import com.sdlcimport.core.scanner.ScannerTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Functional tests for {@link TechnologyDetector}.
 */
class TechnologyDetectorTest extends ScannerTestBase {

    private TechnologyDetector detector;

    @BeforeEach
    void setUp() {
        detector = new TechnologyDetector(SignatureRegistry.load(List.of()), reader());
    }

    @Test
    void detect_springDataSource_emitsDatabaseAndDataAccessEvidence() throws Exception {
        // Given
        createFile("src/main/resources/application.properties", """
            server.port=8080
            spring.datasource.url=jdbc:postgresql://db:5432/app
            spring.jpa.hibernate.ddl-auto=update
            """);

        // When
        DetectionResult result = detector.detect(scan());

        // Then
        assertThat(result.evidence())
            .extracting(Evidence::category, Evidence::technologyId, Evidence::lineRef, Evidence::matchStrength)
            .containsExactly(
                tuple("data-access", "hibernate", 3, MatchStrength.CONTENT),
                tuple("database", "postgresql", 2, MatchStrength.CONTENT)
            );
    }

    @Test
    void detect_pathOnlySignature_emitsPathEvidence() throws Exception {
        // Given
        createFile("src/main/java/com/example/App.java", "package com.example;\nclass App {}\n");
        createFile("Dockerfile", "FROM eclipse-temurin:17\n");

        // When
        DetectionResult result = detector.detect(scan());

        // Then
        assertThat(result.evidence())
            .filteredOn(e -> e.technologyId().equals("java") || e.technologyId().equals("docker"))
            .extracting(Evidence::technologyId, Evidence::filePath, Evidence::matchStrength)
            .containsExactlyInAnyOrder(
                tuple("java", "src/main/java/com/example/App.java", MatchStrength.PATH),
                tuple("docker", "Dockerfile", MatchStrength.PATH)
            );
    }

    @Test
    void detect_disambiguatorRequiringMissingFile_rejectsMatch() throws Exception {
        // Given
        createFile("package.json", "{ \"dependencies\": { \"@angular/core\": \"17.0.0\" } }");

        // When
        DetectionResult withoutWorkspace = detector.detect(scan());
        createFile("angular.json", "{ \"projects\": {} }");
        DetectionResult withWorkspace = detector.detect(scan());

        // Then
        assertThat(withoutWorkspace.evidence()).extracting(Evidence::technologyId).doesNotContain("angular");
        assertThat(withoutWorkspace.statistics().rejectedByDisambiguator()).isPositive();
        assertThat(withWorkspace.evidence()).extracting(Evidence::technologyId).contains("angular");
    }

    @Test
    void detect_sameTechnologyTwiceInFile_keepsStrongestMatch() throws Exception {
        // Given
        TechnologySignature byPath = new TechnologySignature("redis", "Redis", "caching", SignatureKind.SERVICE,
            List.of("cache.conf"), List.of(), List.of(), List.of());
        TechnologySignature byContent = new TechnologySignature("redis", "Redis", "database", SignatureKind.SERVICE,
            List.of("cache.conf"), List.of("redis://"), List.of(), List.of());
        createFile("cache.conf", "url=redis://cache:6379\n");
        TechnologyDetector custom = new TechnologyDetector(SignatureRegistry.of(List.of(byPath, byContent)), reader());

        // When
        DetectionResult result = custom.detect(scan());

        // Then
        assertThat(result.evidence()).hasSize(1);
        assertThat(result.evidence().get(0).matchStrength()).isEqualTo(MatchStrength.CONTENT);
        assertThat(result.evidence().get(0).category()).isEqualTo("database");
    }

    @Test
    void detect_equalStrength_firstRegisteredSignatureWins() throws Exception {
        // Given
        TechnologySignature first = new TechnologySignature("nats", "NATS", "messaging", SignatureKind.SERVICE,
            List.of("nats.conf"), List.of(), List.of(), List.of());
        TechnologySignature second = new TechnologySignature("nats", "NATS", "infrastructure", SignatureKind.SERVICE,
            List.of("nats.conf"), List.of(), List.of(), List.of());
        createFile("nats.conf", "port: 4222\n");
        TechnologyDetector custom = new TechnologyDetector(SignatureRegistry.of(List.of(first, second)), reader());

        // When
        DetectionResult result = custom.detect(scan());

        // Then
        assertThat(result.evidence()).singleElement()
            .extracting(Evidence::category).isEqualTo("messaging");
    }

    @Test
    void detect_contentDisambiguator_requiresMatchingContent() throws Exception {
        // Given
        createFile("requirements.txt", "requests==2.31\n");
        createFile("api/requirements-dev.txt", "pytest==8.0\n");

        // When
        DetectionResult result = detector.detect(scan());

        // Then
        assertThat(result.evidence())
            .filteredOn(e -> e.technologyId().equals("pytest"))
            .extracting(Evidence::filePath)
            .containsExactly("api/requirements-dev.txt");
    }

    @Test
    void detect_unreadableFile_isSkippedAndCounted() throws Exception {
        // Given
        createFile("config/application.yml", "url: postgres://db/app\n");
        FileInventory scanned = scan();
        ScannedFile missing = new ScannedFile("config/vanished.yml", tempDir.resolve("config/vanished.yml"),
            FileKind.CONFIG, 10);
        FileInventory inventory = new FileInventory(scanned.root(),
            List.of(scanned.files().get(0), missing), ScanStatistics.empty());

        // When
        DetectionResult result = detector.detect(inventory);

        // Then
        assertThat(result.statistics().filesFailed()).isEqualTo(1);
        assertThat(result.statistics().errorCounts()).containsKey("NoSuchFileException");
        assertThat(result.evidence()).extracting(Evidence::technologyId).contains("postgresql");
    }

    @Test
    void detect_binaryContent_yieldsNoContentEvidence() throws Exception {
        // Given
        createFile("settings.conf", "jdbc:postgresql://db\u0000\u0001");

        // When
        DetectionResult result = detector.detect(scan());

        // Then
        assertThat(result.evidence()).isEmpty();
    }

    @Test
    void countByTechnology_groupsAcrossCategories() throws Exception {
        createFiles(Map.of(
            "a/App.java", "class App {}",
            "b/Other.java", "class Other {}"
        ));

        DetectionResult result = detector.detect(scan());

        assertThat(result.countByTechnology()).containsEntry("java", 2L);
    }

    @Test
    void disambiguator_requiresFileOrContent() {
        assertThatThrownBy(() -> new Disambiguator(" ", null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
