package com.sdlcimport.core.decision;

import com.sdlcimport.core.detector.SignatureRegistry;
import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.model.DecisionStatus;
import com.sdlcimport.core.model.Evidence;
import com.sdlcimport.core.model.EvidenceRef;
import com.sdlcimport.core.util.IdFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Groups evidence into candidate decision records.
 *
 * <p>Evidence is grouped by {@code (category, technologyId)}. Each group backed by at least
 * {@code detection.minEvidence} distinct files becomes one candidate. Groups are processed in
 * category then technology order, so ids are deterministic for a given evidence set.
 *
 * <p>Candidates leave this stage with status NEW and confidence 0; the scorer and the
 * reconciler fill in the rest.
 */
public class DecisionExtractor {

    private static final Logger log = LoggerFactory.getLogger(DecisionExtractor.class);

    private final SignatureRegistry registry;
    private final RationaleSynthesizer synthesizer;
    private final int minEvidence;

    public DecisionExtractor(SignatureRegistry registry, RationaleSynthesizer synthesizer, int minEvidence) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer must not be null");
        this.minEvidence = Math.max(1, minEvidence);
    }

    /**
     * Extracts candidate decisions.
     *
     * @param evidence detected evidence
     * @param firstSequence sequence number of the first candidate id
     * @return candidates ordered by category then technology
     */
    public List<DecisionRecord> extract(List<Evidence> evidence, int firstSequence) {
        Map<String, Map<String, List<Evidence>>> grouped = new TreeMap<>();
        for (Evidence item : evidence) {
            grouped.computeIfAbsent(item.category(), k -> new TreeMap<>())
                .computeIfAbsent(item.technologyId(), k -> new ArrayList<>())
                .add(item);
        }

        List<DecisionRecord> candidates = new ArrayList<>();
        int sequence = Math.max(1, firstSequence);
        for (Map.Entry<String, Map<String, List<Evidence>>> category : grouped.entrySet()) {
            for (Map.Entry<String, List<Evidence>> technology : category.getValue().entrySet()) {
                List<EvidenceRef> refs = distinctRefs(technology.getValue());
                if (refs.size() < minEvidence) {
                    log.debug("Skipping {}:{} with {} evidence file(s) (minimum {})",
                        category.getKey(), technology.getKey(), refs.size(), minEvidence);
                    continue;
                }
                candidates.add(candidate(IdFormatter.format(IdFormatter.DECISION_PREFIX, sequence++),
                    category.getKey(), technology.getKey(), refs));
            }
        }
        log.info("Extracted {} candidate decision(s)", candidates.size());
        return candidates;
    }

    private DecisionRecord candidate(String id, String category, String technologyId, List<EvidenceRef> refs) {
        String name = registry.displayName(category, technologyId);
        List<String> paths = refs.stream().map(EvidenceRef::filePath).toList();
        SynthesizedRationale rationale = synthesizer.synthesize(technologyId, name, category, paths);
        return new DecisionRecord(
            id,
            category,
            technologyId,
            name,
            "Use " + name + " for " + category,
            rationale.text(),
            rationale.consequences(),
            0.0,
            refs,
            DecisionStatus.NEW,
            rationale.mode()
        );
    }

    private static List<EvidenceRef> distinctRefs(List<Evidence> evidence) {
        Map<String, EvidenceRef> byPath = new LinkedHashMap<>();
        evidence.stream()
            .sorted((a, b) -> a.filePath().compareTo(b.filePath()))
            .forEach(item -> byPath.putIfAbsent(item.filePath(), item.toRef()));
        return new ArrayList<>(byPath.values());
    }
}
