package com.sdlcimport.core.decision;

/**
 * Thrown when narrative synthesis cannot elaborate a rationale.
 *
 * <p>Never fatal: the synthesizer falls back to the template rationale.
 */
public class SynthesisException extends Exception {

    public SynthesisException(String message) {
        super(message);
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
