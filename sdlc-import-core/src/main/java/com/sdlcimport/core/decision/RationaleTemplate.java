package com.sdlcimport.core.decision;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * The deterministic rationale skeleton.
 *
 * <p>Every rationale starts with this paragraph, whatever the synthesis mode, and the
 * reconciler compares rationales on it alone.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * RationaleTemplate.skeleton("PostgreSQL", "database", List.of("docker-compose.yml"));
 * // **PostgreSQL** was detected as the database solution based on evidence in 1 file(s):
 * // docker-compose.yml. 1 reference(s) found, indicating it is the adopted technology for this concern.
 * }</pre>
 */
public final class RationaleTemplate {

    /** Number of paths listed before the remainder is summarized. */
    public static final int LISTED_PATHS = 5;

    private RationaleTemplate() {
        // Utility class
    }

    /**
     * Renders the skeleton paragraph.
     *
     * @param technologyName technology display name
     * @param category decision category
     * @param evidencePaths distinct evidence file paths (sorted on rendering)
     * @return skeleton paragraph
     */
    public static String skeleton(String technologyName, String category, Collection<String> evidencePaths) {
        List<String> sorted = new ArrayList<>(evidencePaths);
        sorted.sort(null);
        int n = sorted.size();
        return "**" + technologyName + "** was detected as the " + category
            + " solution based on evidence in " + n + " file(s): " + pathList(sorted) + ". "
            + n + " reference(s) found, indicating it is the adopted technology for this concern.";
    }

    static String pathList(List<String> sortedPaths) {
        if (sortedPaths.size() <= LISTED_PATHS) {
            return String.join(", ", sortedPaths);
        }
        int remaining = sortedPaths.size() - LISTED_PATHS;
        return String.join(", ", sortedPaths.subList(0, LISTED_PATHS)) + " and " + remaining + " more";
    }
}
