package com.sdlcimport.core.analyzer.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sdlcimport.core.model.DebtPriority;

import java.util.List;
import java.util.Objects;

/**
 * One entry of the debt rule catalog.
 *
 * @param id rule id, unique in the catalog
 * @param title item title
 * @param priority priority tier
 * @param category debt category (e.g. {@code code-smell})
 * @param filePatterns glob patterns of files to inspect (all text files when empty)
 * @param pattern content regex
 * @param effortHours effort per item, or per occurrence
 * @param perOccurrence multiply the effort by the number of matches in the file
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DebtRule(
    @JsonProperty("id") String id,
    @JsonProperty("title") String title,
    @JsonProperty("priority") DebtPriority priority,
    @JsonProperty("category") String category,
    @JsonProperty("filePatterns") List<String> filePatterns,
    @JsonProperty("pattern") String pattern,
    @JsonProperty("effortHours") Double effortHours,
    @JsonProperty("perOccurrence") Boolean perOccurrence
) {
    public DebtRule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
        category = category == null ? "code-smell" : category;
        filePatterns = filePatterns == null ? List.of() : List.copyOf(filePatterns);
        effortHours = effortHours == null ? 1.0 : effortHours;
        if (effortHours < 0) {
            throw new IllegalArgumentException("effortHours of rule " + id + " must be >= 0");
        }
        perOccurrence = perOccurrence != null && perOccurrence;
    }
}
