package com.sdlcimport.core.detector;

import com.sdlcimport.core.model.Evidence;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Output of the technology detector.
 *
 * @param evidence deduplicated evidence sorted by category, technology and file
 * @param statistics detection statistics
 */
public record DetectionResult(
    List<Evidence> evidence,
    DetectionStatistics statistics
) {
    public DetectionResult {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    /**
     * Creates an empty result.
     *
     * @return empty result
     */
    public static DetectionResult empty() {
        return new DetectionResult(List.of(), new DetectionStatistics.Builder().build(0));
    }

    /**
     * Counts evidence per technology id over all categories.
     *
     * @return technology id mapped to evidence count
     */
    public Map<String, Long> countByTechnology() {
        return evidence.stream().collect(Collectors.groupingBy(Evidence::technologyId, Collectors.counting()));
    }
}
