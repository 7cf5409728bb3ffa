package com.sdlcimport.core.reconcile;

import com.sdlcimport.core.config.ImportConfig;
import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.model.DecisionStatus;
import com.sdlcimport.core.model.EvidenceRef;
import com.sdlcimport.core.util.IdFormatter;
import com.sdlcimport.core.util.TextSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Classifies candidate decisions against the persisted store.
 *
 * <p>Matching, per candidate:
 * <ol>
 *   <li>exact {@code (category, technologyId)} match</li>
 *   <li>otherwise a persisted record of the same category whose technology id is a declared
 *       alias of the candidate's, is not re-derived in this run, and whose first rationale
 *       paragraph is at least {@code reconciliation.similarityThreshold} similar</li>
 * </ol>
 *
 * <p>Classification:
 * <ul>
 *   <li>no match: NEW, renumbered after the highest persisted sequence</li>
 *   <li>match without new evidence files: DUPLICATE, the persisted record stays untouched</li>
 *   <li>match with new evidence files: ENRICHMENT, a superseding record under the persisted id
 *       whose evidence is the persisted list followed by the new references</li>
 * </ul>
 *
 * <p>Two different technologies configured in the same file produce near-identical rationales,
 * so similarity alone never links ids that the signature catalog does not declare as aliases.
 *
 * <p>Reconciliation is evidence-additive: the merged view always contains every persisted
 * record.
 */
public class DecisionReconciler {

    private static final Logger log = LoggerFactory.getLogger(DecisionReconciler.class);

    private final ImportConfig.ReconciliationConfig config;
    private final Map<String, Set<String>> aliases;

    public DecisionReconciler(ImportConfig.ReconciliationConfig config) {
        this(config, Map.of());
    }

    /**
     * @param config reconciliation thresholds
     * @param aliases declared alias ids keyed by technology id, see
     *                {@link com.sdlcimport.core.detector.SignatureRegistry#aliasIndex()}
     */
    public DecisionReconciler(ImportConfig.ReconciliationConfig config, Map<String, Set<String>> aliases) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.aliases = Map.copyOf(Objects.requireNonNull(aliases, "aliases must not be null"));
    }

    /**
     * Reconciles candidates against persisted records.
     *
     * @param candidates scored candidates
     * @param persisted persisted store contents
     * @return reconciliation plan
     */
    public ReconciliationPlan reconcile(List<DecisionRecord> candidates, List<DecisionRecord> persisted) {
        Map<String, DecisionRecord> persistedByKey = new LinkedHashMap<>();
        for (DecisionRecord record : persisted) {
            persistedByKey.put(record.identityKey(), record);
        }
        Set<String> derivedKeys = new HashSet<>();
        candidates.forEach(candidate -> derivedKeys.add(candidate.identityKey()));

        int nextSequence = persisted.stream().mapToInt(d -> IdFormatter.sequenceOf(d.id())).max().orElse(0) + 1;
        Map<String, DecisionRecord> merged = new LinkedHashMap<>(persistedByKey);
        Set<String> claimedAliases = new HashSet<>();
        List<DecisionRecord> classified = new ArrayList<>();
        int drift = 0;

        for (DecisionRecord candidate : candidates) {
            DecisionRecord match = persistedByKey.get(candidate.identityKey());
            if (match == null) {
                match = aliasMatch(candidate, persisted, derivedKeys, claimedAliases);
            }

            if (match == null) {
                DecisionRecord fresh = candidate
                    .withId(IdFormatter.format(IdFormatter.DECISION_PREFIX, nextSequence++))
                    .withStatus(DecisionStatus.NEW);
                classified.add(fresh);
                merged.put(fresh.identityKey(), fresh);
                continue;
            }

            List<EvidenceRef> newEvidence = newEvidence(candidate, match);
            if (newEvidence.isEmpty()) {
                double similarity = similarity(candidate, match);
                if (similarity < config.duplicateThreshold()) {
                    drift++;
                    log.warn("Rationale drift for {} (similarity {}), keeping persisted record {}",
                        candidate.identityKey(), String.format("%.2f", similarity), match.id());
                }
                classified.add(candidate.withId(match.id()).withStatus(DecisionStatus.DUPLICATE));
                continue;
            }

            DecisionRecord enriched = enrich(match, candidate, newEvidence);
            classified.add(enriched);
            merged.put(match.identityKey(), enriched);
        }

        ReconciliationPlan plan = new ReconciliationPlan(classified, persisted, new ArrayList<>(merged.values()), drift);
        log.info("Reconciliation: {} new, {} duplicate, {} enrichment, {} drift",
            plan.count(DecisionStatus.NEW), plan.count(DecisionStatus.DUPLICATE),
            plan.count(DecisionStatus.ENRICHMENT), drift);
        return plan;
    }

    private DecisionRecord aliasMatch(DecisionRecord candidate, List<DecisionRecord> persisted,
                                      Set<String> derivedKeys, Set<String> claimedAliases) {
        Set<String> declared = aliases.getOrDefault(candidate.technologyId(), Set.of());
        if (declared.isEmpty()) {
            return null;
        }
        DecisionRecord best = null;
        double bestSimilarity = -1;
        for (DecisionRecord record : persisted) {
            if (!record.category().equals(candidate.category())
                || !declared.contains(record.technologyId())
                || derivedKeys.contains(record.identityKey())
                || claimedAliases.contains(record.identityKey())) {
                continue;
            }
            double similarity = similarity(candidate, record);
            if (similarity >= config.similarityThreshold() && similarity > bestSimilarity) {
                best = record;
                bestSimilarity = similarity;
            }
        }
        if (best != null) {
            claimedAliases.add(best.identityKey());
            log.info("Candidate {} matched persisted {} by rationale similarity {}",
                candidate.identityKey(), best.identityKey(), String.format("%.2f", bestSimilarity));
        }
        return best;
    }

    private DecisionRecord enrich(DecisionRecord persisted, DecisionRecord candidate, List<EvidenceRef> newEvidence) {
        DecisionRecord extended = persisted.withAppendedEvidence(newEvidence);
        boolean candidateCoversPersisted = candidate.evidencePaths().containsAll(persisted.evidencePaths());
        DecisionRecord base = candidateCoversPersisted ? candidate : persisted;
        return new DecisionRecord(
            persisted.id(),
            persisted.category(),
            persisted.technologyId(),
            persisted.technologyName(),
            persisted.title(),
            base.rationale(),
            candidate.consequences().isEmpty() ? persisted.consequences() : candidate.consequences(),
            Math.max(persisted.confidence(), candidate.confidence()),
            extended.evidenceRefs(),
            DecisionStatus.ENRICHMENT,
            base.synthesisMode()
        );
    }

    private static List<EvidenceRef> newEvidence(DecisionRecord candidate, DecisionRecord persisted) {
        Set<String> known = persisted.evidencePaths();
        return candidate.evidenceRefs().stream()
            .filter(ref -> !known.contains(ref.filePath()))
            .toList();
    }

    private static double similarity(DecisionRecord left, DecisionRecord right) {
        List<String> stopWords = List.of(
            left.category(), left.technologyId(), left.technologyName(),
            right.technologyId(), right.technologyName());
        return TextSimilarity.similarity(left.rationale(), right.rationale(), stopWords);
    }
}
