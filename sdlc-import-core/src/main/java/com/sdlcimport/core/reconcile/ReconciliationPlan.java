package com.sdlcimport.core.reconcile;

import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.model.DecisionStatus;

import java.util.List;
import java.util.Objects;

/**
 * Result of reconciling candidates against the persisted store. Nothing is written until the
 * plan is committed.
 *
 * @param classified every candidate with its NEW / DUPLICATE / ENRICHMENT status; ENRICHMENT
 *                   entries are the superseding records under the persisted id
 * @param persisted store contents read at reconciliation time
 * @param merged store view after applying the plan (persisted order, new records appended)
 * @param driftCount duplicates whose rationale drifted below the duplicate threshold
 */
public record ReconciliationPlan(
    List<DecisionRecord> classified,
    List<DecisionRecord> persisted,
    List<DecisionRecord> merged,
    int driftCount
) {
    public ReconciliationPlan {
        classified = classified == null ? List.of() : List.copyOf(classified);
        persisted = persisted == null ? List.of() : List.copyOf(persisted);
        merged = merged == null ? List.of() : List.copyOf(merged);
        if (merged.size() < persisted.size()) {
            throw new IllegalStateException("Reconciliation plan holds " + merged.size()
                + " decisions but the store already holds " + persisted.size());
        }
    }

    /**
     * Returns the records that change the store (NEW and ENRICHMENT).
     *
     * @return upserts in classification order
     */
    public List<DecisionRecord> upserts() {
        return classified.stream()
            .filter(d -> d.status() == DecisionStatus.NEW || d.status() == DecisionStatus.ENRICHMENT)
            .toList();
    }

    /**
     * Returns the candidates with a given status.
     *
     * @param status decision status
     * @return matching candidates
     */
    public List<DecisionRecord> withStatus(DecisionStatus status) {
        return classified.stream().filter(d -> d.status() == status).toList();
    }

    /**
     * Counts candidates with a given status.
     *
     * @param status decision status
     * @return count
     */
    public int count(DecisionStatus status) {
        return (int) classified.stream().filter(d -> d.status() == status).count();
    }

    /**
     * Finds a decision of the merged view by its identity key.
     *
     * @param identityKey {@code category::technologyId}
     * @return the record or null
     */
    public DecisionRecord findMerged(String identityKey) {
        Objects.requireNonNull(identityKey, "identityKey must not be null");
        return merged.stream().filter(d -> d.identityKey().equals(identityKey)).findFirst().orElse(null);
    }
}
