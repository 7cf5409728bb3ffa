package com.sdlcimport.core.pipeline;

import com.sdlcimport.core.model.QualityReport;

/**
 * Approval boundary for REVIEW and REJECT verdicts. Implementations may block indefinitely.
 */
@FunctionalInterface
public interface ApprovalGate {

    /**
     * Waits for a decision on a quality report.
     *
     * @param report quality report of the run
     * @return decision
     */
    ApprovalDecision await(QualityReport report);

    /**
     * Returns a gate that always answers the same.
     *
     * @param decision fixed answer
     * @return gate
     */
    static ApprovalGate always(ApprovalDecision decision) {
        return report -> decision;
    }
}
