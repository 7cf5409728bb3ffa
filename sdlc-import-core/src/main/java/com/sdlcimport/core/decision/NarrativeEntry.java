package com.sdlcimport.core.decision;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sdlcimport.core.model.Consequences;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One category entry of the narrative catalog ({@code narratives.yaml}).
 *
 * @param category decision category
 * @param context elaboration template; {@code {name}} is replaced by the technology name
 * @param positive default positive consequences
 * @param negative default negative consequences
 * @param technologies per-technology consequence overrides
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NarrativeEntry(
    @JsonProperty("category") String category,
    @JsonProperty("context") String context,
    @JsonProperty("positive") List<String> positive,
    @JsonProperty("negative") List<String> negative,
    @JsonProperty("technologies") Map<String, Consequences> technologies
) {
    public NarrativeEntry {
        Objects.requireNonNull(category, "category must not be null");
        positive = positive == null ? List.of() : List.copyOf(positive);
        negative = negative == null ? List.of() : List.copyOf(negative);
        technologies = technologies == null ? Map.of() : Map.copyOf(technologies);
    }

    /**
     * Returns the consequences for a technology, falling back to the category defaults.
     *
     * @param technologyId technology id
     * @return consequences
     */
    public Consequences consequencesFor(String technologyId) {
        Consequences specific = technologies.get(technologyId);
        if (specific != null && !specific.isEmpty()) {
            return specific;
        }
        return new Consequences(positive, negative);
    }
}
