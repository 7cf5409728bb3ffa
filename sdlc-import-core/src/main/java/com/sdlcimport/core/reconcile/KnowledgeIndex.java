package com.sdlcimport.core.reconcile;

import com.sdlcimport.core.model.DecisionRecord;

import java.io.IOException;

/**
 * Write side of the decision knowledge index.
 */
public interface KnowledgeIndex {

    /**
     * Persists one decision.
     *
     * @param record decision to persist
     * @return id of the index node holding the decision
     * @throws IOException if the index cannot be written
     */
    String persistDecision(DecisionRecord record) throws IOException;
}
