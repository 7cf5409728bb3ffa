package com.sdlcimport.core.pipeline;

/**
 * Process exit codes of an import run.
 */
public enum ExitCode {
    /** Accepted automatically, or a REVIEW verdict approved. */
    SUCCESS(0),

    /** Input validation failed, including branch creation errors and invalid catalogs. */
    INPUT_ERROR(1),

    /** Unexpected internal error. */
    INTERNAL_ERROR(2),

    /** Quality gate rejected, or aborted at the approval boundary. */
    REJECTED(3);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
