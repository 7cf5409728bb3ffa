package com.sdlcimport.core.model;

/**
 * Quality gate verdict for one run.
 */
public enum Recommendation {
    /**
     * Score at or above the accept threshold and no critical issue; committed without a prompt.
     */
    ACCEPT,

    /**
     * Score within the review band; a human chooses accept, re-run or abort.
     */
    REVIEW,

    /**
     * Score below the review band or a critical issue; a human must re-run or abort.
     */
    REJECT
}
