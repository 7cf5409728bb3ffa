package com.sdlcimport.core.scanner;

/**
 * Thrown when the input tree cannot be analyzed: the path is missing, is not a directory,
 * or exceeds the configured scan ceilings.
 *
 * <p>Fatal for the run; the pipeline maps it to exit code 1 before any analysis cost is spent.
 */
public class InputException extends Exception {

    public InputException(String message) {
        super(message);
    }

    public InputException(String message, Throwable cause) {
        super(message, cause);
    }
}
