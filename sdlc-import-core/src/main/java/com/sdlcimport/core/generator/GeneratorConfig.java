package com.sdlcimport.core.generator;

/**
 * Configuration for diagram generation.
 *
 * @param direction flowchart direction ({@code TB}, {@code BT}, {@code LR} or {@code RL})
 * @param maxNodesPerCategory maximum technologies drawn per category
 */
public record GeneratorConfig(
    String direction,
    int maxNodesPerCategory
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        if (direction == null || direction.isBlank()) {
            direction = "TB";
        }
        if (maxNodesPerCategory <= 0) {
            maxNodesPerCategory = Integer.MAX_VALUE;
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig("TB", Integer.MAX_VALUE);
    }
}
