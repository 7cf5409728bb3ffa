package com.sdlcimport.core.analyzer;

/**
 * Execution state of one analyzer: {@code RUNNING -> SUCCEEDED | FAILED}.
 */
public enum AnalyzerStatus {
    RUNNING,
    SUCCEEDED,
    FAILED;

    /**
     * Returns true for SUCCEEDED and FAILED.
     *
     * @return true if the analyzer has finished
     */
    public boolean isTerminal() {
        return this != RUNNING;
    }
}
