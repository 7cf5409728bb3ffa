package com.sdlcimport.core.reconcile;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.model.DecisionStatus;
import com.sdlcimport.core.util.IdFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * YAML-file backed {@link DecisionStore} and {@link KnowledgeIndex}.
 *
 * <p>Commits run under an exclusive lock on a sibling {@code .lock} file. Inside the lock the
 * store is re-read, merged with the upserts and written to a temporary file in the same
 * directory, which is then atomically renamed over the store. A run interrupted mid-write
 * leaves the previous store intact.
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * DecisionStore store = new FileDecisionStore(outputDir.resolve("corpus/decision-store.yml"));
 * List<DecisionRecord> persisted = store.load();
 * store.commit(plan.upserts(), Set.of());
 * }</pre>
 */
public class FileDecisionStore implements DecisionStore, KnowledgeIndex {

    private static final Logger log = LoggerFactory.getLogger(FileDecisionStore.class);

    private final Path storePath;
    private final ObjectMapper mapper;

    public FileDecisionStore(Path storePath) {
        this.storePath = Objects.requireNonNull(storePath, "storePath must not be null").toAbsolutePath().normalize();
        this.mapper = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS))
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Returns the store file path.
     *
     * @return store path
     */
    public Path getStorePath() {
        return storePath;
    }

    @Override
    public List<DecisionRecord> load() throws IOException {
        if (!Files.exists(storePath)) {
            log.debug("No decision store at {}", storePath);
            return List.of();
        }
        StoreDocument document = mapper.readValue(storePath.toFile(), StoreDocument.class);
        if (document == null) {
            return List.of();
        }
        log.debug("Loaded {} decision(s) from {}", document.decisions().size(), storePath);
        return document.decisions();
    }

    @Override
    public int maxSequence() throws IOException {
        return load().stream().mapToInt(d -> IdFormatter.sequenceOf(d.id())).max().orElse(0);
    }

    @Override
    public List<DecisionRecord> commit(Collection<DecisionRecord> upserts, Set<String> removals) throws IOException {
        Files.createDirectories(storePath.getParent());
        Path lockPath = storePath.resolveSibling(storePath.getFileName() + ".lock");

        try (FileChannel channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
             FileLock lock = channel.lock()) {
            List<DecisionRecord> current = load();
            Map<String, DecisionRecord> merged = new LinkedHashMap<>();
            for (DecisionRecord record : current) {
                merged.put(record.identityKey(), record);
            }

            Set<String> usedIds = new HashSet<>();
            current.forEach(record -> usedIds.add(record.id()));
            int nextSequence = current.stream().mapToInt(d -> IdFormatter.sequenceOf(d.id())).max().orElse(0) + 1;

            List<DecisionRecord> written = new ArrayList<>();
            for (DecisionRecord upsert : upserts) {
                DecisionRecord existing = merged.get(upsert.identityKey());
                DecisionRecord accepted;
                if (existing != null) {
                    accepted = supersede(existing, upsert);
                } else {
                    accepted = upsert.withStatus(DecisionStatus.ACCEPTED);
                    if (usedIds.contains(accepted.id())) {
                        String reassigned = IdFormatter.format(IdFormatter.DECISION_PREFIX, nextSequence);
                        log.info("Decision id {} already taken in store, reassigned to {}", accepted.id(), reassigned);
                        accepted = accepted.withId(reassigned);
                    }
                }
                usedIds.add(accepted.id());
                nextSequence = Math.max(nextSequence, IdFormatter.sequenceOf(accepted.id()) + 1);
                merged.put(accepted.identityKey(), accepted);
                written.add(accepted);
            }

            for (String key : removals) {
                if (merged.remove(key) != null) {
                    log.info("Removed polluted decision {} from store", key);
                }
            }

            write(new StoreDocument(StoreDocument.CURRENT_VERSION, new ArrayList<>(merged.values())));
            log.info("Committed {} decision(s) to {} ({} total)", written.size(), storePath, merged.size());
            return written;
        }
    }

    @Override
    public String persistDecision(DecisionRecord record) throws IOException {
        List<DecisionRecord> written = commit(List.of(record), Set.of());
        return written.get(0).id();
    }

    private DecisionRecord supersede(DecisionRecord existing, DecisionRecord upsert) {
        DecisionRecord extended = existing.withAppendedEvidence(upsert.evidenceRefs());
        return new DecisionRecord(
            existing.id(),
            existing.category(),
            existing.technologyId(),
            upsert.technologyName(),
            upsert.title(),
            upsert.rationale(),
            upsert.consequences().isEmpty() ? existing.consequences() : upsert.consequences(),
            Math.max(existing.confidence(), upsert.confidence()),
            extended.evidenceRefs(),
            DecisionStatus.ACCEPTED,
            upsert.synthesisMode()
        );
    }

    private void write(StoreDocument document) throws IOException {
        Path directory = storePath.getParent();
        Path temp = Files.createTempFile(directory, storePath.getFileName().toString(), ".tmp");
        try {
            mapper.writeValue(temp.toFile(), document);
            try {
                Files.move(temp, storePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, falling back to replace", directory);
                Files.move(temp, storePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
