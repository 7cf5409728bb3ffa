package com.sdlcimport.core.decision;

import java.util.List;
import java.util.Objects;

/**
 * What a {@link NarrativeModel} is asked to elaborate.
 *
 * @param technologyId technology id
 * @param technologyName technology display name
 * @param category decision category
 * @param skeleton template skeleton the narrative elaborates
 * @param evidencePaths sorted evidence file paths
 */
public record NarrativeRequest(
    String technologyId,
    String technologyName,
    String category,
    String skeleton,
    List<String> evidencePaths
) {
    public NarrativeRequest {
        Objects.requireNonNull(technologyId, "technologyId must not be null");
        Objects.requireNonNull(technologyName, "technologyName must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(skeleton, "skeleton must not be null");
        evidencePaths = evidencePaths == null ? List.of() : List.copyOf(evidencePaths);
    }
}
