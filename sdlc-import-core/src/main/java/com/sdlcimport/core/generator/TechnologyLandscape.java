package com.sdlcimport.core.generator;

import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.model.DecisionStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Input of diagram generation: the project name and its known decisions.
 *
 * <p>Removed decisions are filtered out on construction.
 *
 * @param projectName project name used in diagram titles
 * @param decisions decisions to visualize
 */
public record TechnologyLandscape(
    String projectName,
    List<DecisionRecord> decisions
) {
    public TechnologyLandscape {
        Objects.requireNonNull(projectName, "projectName must not be null");
        decisions = decisions == null ? List.of() : decisions.stream()
            .filter(d -> d.status() != DecisionStatus.REMOVED)
            .toList();
    }

    /**
     * Returns true if no decision is known.
     *
     * @return true when empty
     */
    public boolean isEmpty() {
        return decisions.isEmpty();
    }

    /**
     * Groups decisions by category, preserving first-seen category order.
     *
     * @return category mapped to its decisions
     */
    public Map<String, List<DecisionRecord>> byCategory() {
        Map<String, List<DecisionRecord>> grouped = new LinkedHashMap<>();
        for (DecisionRecord decision : decisions) {
            grouped.computeIfAbsent(decision.category(), k -> new ArrayList<>()).add(decision);
        }
        return grouped;
    }

    /**
     * Returns the decisions of one category.
     *
     * @param category decision category
     * @return matching decisions
     */
    public List<DecisionRecord> inCategory(String category) {
        return decisions.stream().filter(d -> d.category().equals(category)).toList();
    }
}
