package com.sdlcimport.core.pipeline;

/**
 * Answer of a human at the approval boundary.
 */
public enum ApprovalDecision {
    /** Commit the results. Ignored for a REJECT verdict. */
    ACCEPT,

    /** Run the analysis again. */
    RERUN,

    /** Stop without committing. */
    ABORT
}
