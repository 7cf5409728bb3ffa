package com.sdlcimport.core.model;

/**
 * How a decision's rationale text was produced.
 */
public enum SynthesisMode {
    /** Deterministic template. */
    TEMPLATE,

    /** Template skeleton elaborated by a narrative model. */
    NARRATIVE
}
