package com.sdlcimport.core.model;

/**
 * Severity level for quality issues raised by the post-generation validator.
 *
 * @since 1.0.0
 */
public enum IssueSeverity {
    /**
     * Informational - no action required, just for awareness.
     */
    INFO,

    /**
     * Warning - potential issue that should be reviewed.
     */
    WARNING,

    /**
     * Error - significant issue that lowers artifact quality.
     */
    ERROR,

    /**
     * Critical - forces a REJECT recommendation regardless of score.
     */
    CRITICAL
}
