package com.sdlcimport.core.model;

/**
 * STRIDE threat categories.
 */
public enum StrideCategory {
    SPOOFING("Spoofing"),
    TAMPERING("Tampering"),
    REPUDIATION("Repudiation"),
    INFORMATION_DISCLOSURE("Information Disclosure"),
    DENIAL_OF_SERVICE("Denial of Service"),
    ELEVATION_OF_PRIVILEGE("Elevation of Privilege");

    private final String displayName;

    StrideCategory(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns the human-readable category name.
     *
     * @return display name
     */
    public String getDisplayName() {
        return displayName;
    }
}
