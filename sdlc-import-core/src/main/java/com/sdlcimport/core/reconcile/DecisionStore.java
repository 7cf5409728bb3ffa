package com.sdlcimport.core.reconcile;

import com.sdlcimport.core.model.DecisionRecord;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Persisted set of accepted decisions shared between runs.
 *
 * <p>The store is append-preferring: records are superseded, never edited in place, and a
 * commit never replaces the whole set with the records of one run.
 */
public interface DecisionStore {

    /**
     * Loads every persisted record.
     *
     * @return persisted records in store order, empty when no store exists yet
     * @throws IOException if the store exists but cannot be read
     */
    List<DecisionRecord> load() throws IOException;

    /**
     * Commits accepted records.
     *
     * <p>Upserts are merged into the current store contents by {@code (category, technologyId)}
     * with evidence united by file path. Only records whose identity key is listed in
     * {@code removals} are dropped.
     *
     * @param upserts NEW and ENRICHMENT records to persist
     * @param removals identity keys of records removed for evidence pollution
     * @return the records written by this commit, with status ACCEPTED
     * @throws IOException if the store cannot be written
     */
    List<DecisionRecord> commit(Collection<DecisionRecord> upserts, Set<String> removals) throws IOException;

    /**
     * Returns the highest decision sequence in the store.
     *
     * @return highest sequence, 0 when empty
     * @throws IOException if the store cannot be read
     */
    int maxSequence() throws IOException;
}
