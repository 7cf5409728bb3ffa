package com.sdlcimport.core.config;

/**
 * Thrown when a YAML catalog (signatures, narratives, threat or debt rules) cannot be loaded
 * or contains an invalid definition.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
