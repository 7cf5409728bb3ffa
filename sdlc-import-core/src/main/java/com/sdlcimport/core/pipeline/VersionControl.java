package com.sdlcimport.core.pipeline;

/**
 * Creates the working branch of an import run before anything is scanned.
 */
public interface VersionControl {

    /**
     * Creates a branch.
     *
     * @param name branch name
     * @return outcome; ERROR aborts the run
     */
    BranchResult createBranch(String name);

    /**
     * Returns a version control that does nothing and always succeeds.
     *
     * @return no-op implementation
     */
    static VersionControl noOp() {
        return name -> BranchResult.OK;
    }
}
