package com.sdlcimport.core.model;

/**
 * Lifecycle status of a {@link DecisionRecord}.
 */
public enum DecisionStatus {
    /** No persisted record with the same identity exists. */
    NEW,

    /** A persisted record with identical evidence exists; the candidate is discarded. */
    DUPLICATE,

    /** A persisted record exists and this run found additional evidence for it. */
    ENRICHMENT,

    /** The record has been persisted to the decision store. */
    ACCEPTED,

    /** The validator removed the record (evidence pollution). */
    REMOVED
}
