package com.sdlcimport.core.reconcile;

import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.model.DecisionStatus;
import com.sdlcimport.core.model.EvidenceRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static com.sdlcimport.core.reconcile.DecisionReconcilerTest.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileDecisionStore}.
 */
class FileDecisionStoreTest {

    @TempDir
    Path tempDir;

    private FileDecisionStore store;

    @BeforeEach
    void setUp() {
        store = new FileDecisionStore(tempDir.resolve("corpus/decision-store.yml"));
    }

    @Test
    void load_missingStore_isEmpty() throws IOException {
        assertThat(store.load()).isEmpty();
        assertThat(store.maxSequence()).isZero();
    }

    @Test
    void commit_newDecisions_persistedAsAccepted() throws IOException {
        // Given
        DecisionRecord decision = record("ADR-IMPORT-001", "database", "postgresql", "PostgreSQL",
            "application.properties");

        // When
        List<DecisionRecord> written = store.commit(List.of(decision), Set.of());

        // Then
        assertThat(written).singleElement().satisfies(d -> assertThat(d.status()).isEqualTo(DecisionStatus.ACCEPTED));
        List<DecisionRecord> reloaded = new FileDecisionStore(store.getStorePath()).load();
        assertThat(reloaded).containsExactlyElementsOf(written);
        assertThat(Files.readString(store.getStorePath())).contains("technology: postgresql");
        assertThat(store.maxSequence()).isEqualTo(1);
        assertThat(store.getStorePath().resolveSibling("decision-store.yml.lock")).exists();
    }

    @Test
    void commit_existingIdentity_supersedesKeepingIdAndEvidence() throws IOException {
        store.commit(List.of(record("ADR-IMPORT-001", "database", "postgresql", "PostgreSQL", "a.properties")), Set.of());

        store.commit(List.of(record("ADR-IMPORT-009", "database", "postgresql", "PostgreSQL", "b.yml")), Set.of());

        assertThat(store.load()).singleElement().satisfies(d -> {
            assertThat(d.id()).isEqualTo("ADR-IMPORT-001");
            assertThat(d.evidenceRefs()).extracting(EvidenceRef::filePath).containsExactly("a.properties", "b.yml");
            assertThat(d.rationale()).contains("b.yml");
        });
    }

    @Test
    void commit_conflictingId_isReassigned() throws IOException {
        store.commit(List.of(record("ADR-IMPORT-001", "language", "java", "Java", "App.java")), Set.of());

        List<DecisionRecord> written = store.commit(
            List.of(record("ADR-IMPORT-001", "messaging", "kafka", "Apache Kafka", "application.yml")), Set.of());

        assertThat(written).extracting(DecisionRecord::id).containsExactly("ADR-IMPORT-002");
        assertThat(store.load()).extracting(DecisionRecord::id).containsExactly("ADR-IMPORT-001", "ADR-IMPORT-002");
    }

    @Test
    void commit_removals_dropRecordsByIdentityKey() throws IOException {
        store.commit(List.of(
            record("ADR-IMPORT-001", "language", "java", "Java", "App.java"),
            record("ADR-IMPORT-002", "testing", "junit", "JUnit", "src/test/AppTest.java")), Set.of());

        store.commit(List.of(), Set.of("testing::junit", "unknown::key"));

        assertThat(store.load()).extracting(DecisionRecord::identityKey).containsExactly("language::java");
    }

    @Test
    void persistDecision_returnsStoredId() throws IOException {
        String id = store.persistDecision(record("ADR-IMPORT-004", "caching", "redis", "Redis", "cache.yml"));

        assertThat(id).isEqualTo("ADR-IMPORT-004");
        assertThat(store.maxSequence()).isEqualTo(4);
    }

    @Test
    void load_corruptStore_throws() throws IOException {
        Files.createDirectories(store.getStorePath().getParent());
        Files.writeString(store.getStorePath(), "decisions: [ {id: \n  broken");

        assertThatThrownBy(() -> store.load()).isInstanceOf(IOException.class);
    }
}
