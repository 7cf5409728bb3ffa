package com.sdlcimport.core.analyzer.impl;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sdlcimport.core.model.StrideCategory;

import java.util.List;
import java.util.Objects;

/**
 * One entry of the threat rule catalog.
 *
 * <p>A content rule matches {@code pattern} against text files selected by
 * {@code filePatterns}. A decision rule has no pattern and fires when a decision of
 * {@code requiresCategory} exists while none of {@code absentCategory} does.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * - id: aws-access-key
 *   title: Cloud access key committed to the repository
 *   stride: INFORMATION_DISCLOSURE
 *   severity: 9.1
 *   credential: true
 *   pattern: "AKIA[0-9A-Z]{16}"
 * }</pre>
 *
 * @param id rule id, unique in the catalog
 * @param title finding title
 * @param stride STRIDE category
 * @param severity severity in [0,10]
 * @param filePatterns glob patterns of files to inspect (all text files when empty)
 * @param pattern content regex
 * @param credential true when a match exposes a credential
 * @param requiresCategory decision category that must exist
 * @param absentCategory decision category that must be missing
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ThreatRule(
    @JsonProperty("id") String id,
    @JsonProperty("title") String title,
    @JsonProperty("stride") StrideCategory stride,
    @JsonProperty("severity") Double severity,
    @JsonProperty("filePatterns") List<String> filePatterns,
    @JsonProperty("pattern") String pattern,
    @JsonProperty("credential") Boolean credential,
    @JsonProperty("requiresCategory") String requiresCategory,
    @JsonProperty("absentCategory") String absentCategory
) {
    public ThreatRule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(stride, "stride must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        if (severity < 0.0 || severity > 10.0) {
            throw new IllegalArgumentException("severity of rule " + id + " must be within [0,10]");
        }
        if ((pattern == null || pattern.isBlank()) && requiresCategory == null) {
            throw new IllegalArgumentException("rule " + id + " needs a pattern or a requiresCategory");
        }
        filePatterns = filePatterns == null ? List.of() : List.copyOf(filePatterns);
        credential = credential != null && credential;
    }

    /**
     * Returns true if the rule is evaluated against decisions instead of file content.
     *
     * @return true for decision rules
     */
    @JsonIgnore
    public boolean isDecisionRule() {
        return pattern == null || pattern.isBlank();
    }
}
