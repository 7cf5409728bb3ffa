package com.sdlcimport.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Positive and negative consequences of an architectural decision.
 *
 * @param positive benefits of the decision
 * @param negative costs and risks of the decision
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Consequences(
    @JsonProperty("positive") List<String> positive,
    @JsonProperty("negative") List<String> negative
) {
    /**
     * Compact constructor with defaults.
     */
    public Consequences {
        positive = positive == null ? List.of() : List.copyOf(positive);
        negative = negative == null ? List.of() : List.copyOf(negative);
    }

    /**
     * Creates an empty instance.
     *
     * @return consequences with no entries
     */
    public static Consequences none() {
        return new Consequences(List.of(), List.of());
    }

    /**
     * Returns true if neither list has entries.
     *
     * @return true when empty
     */
    @JsonIgnore
    public boolean isEmpty() {
        return positive.isEmpty() && negative.isEmpty();
    }
}
