package com.sdlcimport.core.pipeline;

/**
 * Outcome of {@link VersionControl#createBranch(String)}.
 */
public enum BranchResult {
    OK,
    ALREADY_EXISTS,
    ERROR
}
