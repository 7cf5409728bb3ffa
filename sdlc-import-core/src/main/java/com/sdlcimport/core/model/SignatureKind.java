package com.sdlcimport.core.model;

/**
 * Kind of technology a signature describes.
 */
public enum SignatureKind {
    LANGUAGE,
    FRAMEWORK,
    LIBRARY,
    INFRASTRUCTURE,
    BUILD_TOOL,
    TEST_FRAMEWORK,
    SERVICE
}
