package com.sdlcimport.core.generator;

import java.util.Locale;

/**
 * Types of diagrams synthesized from the decision set.
 */
public enum DiagramType {
    /** Detected technologies grouped by decision category */
    TECHNOLOGY_STACK("Technology Stack"),

    /** Container diagram (C4 Level 2) */
    C4_CONTAINER("C4 Container Diagram"),

    /** Request and data flow between the application and its backing services */
    DATA_FLOW("Data Flow");

    private final String title;

    DiagramType(String title) {
        this.title = title;
    }

    /**
     * Returns the diagram title.
     *
     * @return title
     */
    public String getTitle() {
        return title;
    }

    /**
     * Returns the diagram id used as artifact file name (e.g. {@code c4-container}).
     *
     * @return kebab-case id
     */
    public String getId() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
