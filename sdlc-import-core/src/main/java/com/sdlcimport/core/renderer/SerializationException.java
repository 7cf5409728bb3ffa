package com.sdlcimport.core.renderer;

/**
 * Thrown when an artifact cannot be serialized or does not parse back to the tree it was
 * built from.
 */
public class SerializationException extends Exception {

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
