package com.sdlcimport.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An inferred architectural decision with supporting evidence and a confidence score.
 *
 * <p>Created by the decision extractor, scored by the confidence scorer, classified by the
 * reconciler and possibly removed by the validator. The {@code id} is stable and monotonic
 * within a run; identity across runs is {@link #identityKey()}, never the id alone.
 *
 * <p>Records are immutable; the {@code with*} methods return modified copies.
 *
 * @param id decision identifier (e.g. {@code ADR-IMPORT-001})
 * @param category decision category
 * @param technologyId technology identifier
 * @param technologyName technology display name
 * @param title short decision title
 * @param rationale rationale text; its first paragraph is always the template skeleton
 * @param consequences positive/negative consequences
 * @param confidence composite confidence in [0,1]
 * @param evidenceRefs supporting evidence, identity by file path
 * @param status lifecycle status
 * @param synthesisMode how the rationale was produced
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DecisionRecord(
    @JsonProperty("id") String id,
    @JsonProperty("category") String category,
    @JsonProperty("technology") String technologyId,
    @JsonProperty("technologyName") String technologyName,
    @JsonProperty("title") String title,
    @JsonProperty("rationale") String rationale,
    @JsonProperty("consequences") Consequences consequences,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("evidence") List<EvidenceRef> evidenceRefs,
    @JsonProperty("status") DecisionStatus status,
    @JsonProperty("synthesisMode") SynthesisMode synthesisMode
) {
    /**
     * Compact constructor with validation.
     */
    public DecisionRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(technologyId, "technologyId must not be null");
        if (technologyName == null || technologyName.isBlank()) {
            technologyName = technologyId;
        }
        if (title == null) {
            title = "Use " + technologyName + " for " + category;
        }
        if (rationale == null) {
            rationale = "";
        }
        if (consequences == null) {
            consequences = Consequences.none();
        }
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        evidenceRefs = evidenceRefs == null ? List.of() : List.copyOf(evidenceRefs);
        if (status == null) {
            status = DecisionStatus.NEW;
        }
        if (synthesisMode == null) {
            synthesisMode = SynthesisMode.TEMPLATE;
        }
    }

    /**
     * Builds the cross-run identity key.
     *
     * @param category decision category
     * @param technologyId technology identifier
     * @return identity key
     */
    public static String identityKey(String category, String technologyId) {
        return category + "::" + technologyId;
    }

    /**
     * Returns the cross-run identity of this record: {@code (category, technologyId)}.
     *
     * @return identity key
     */
    @JsonIgnore
    public String identityKey() {
        return identityKey(category, technologyId);
    }

    /**
     * Returns the distinct evidence file paths in order.
     *
     * @return evidence file paths
     */
    @JsonIgnore
    public Set<String> evidencePaths() {
        Set<String> paths = new LinkedHashSet<>();
        for (EvidenceRef ref : evidenceRefs) {
            paths.add(ref.filePath());
        }
        return paths;
    }

    /**
     * Returns a copy with a different status.
     *
     * @param newStatus status to apply
     * @return modified copy
     */
    public DecisionRecord withStatus(DecisionStatus newStatus) {
        return new DecisionRecord(id, category, technologyId, technologyName, title, rationale,
            consequences, confidence, evidenceRefs, newStatus, synthesisMode);
    }

    /**
     * Returns a copy with a different id.
     *
     * @param newId id to apply
     * @return modified copy
     */
    public DecisionRecord withId(String newId) {
        return new DecisionRecord(newId, category, technologyId, technologyName, title, rationale,
            consequences, confidence, evidenceRefs, status, synthesisMode);
    }

    /**
     * Returns a copy with a different confidence.
     *
     * @param newConfidence confidence in [0,1]
     * @return modified copy
     */
    public DecisionRecord withConfidence(double newConfidence) {
        return new DecisionRecord(id, category, technologyId, technologyName, title, rationale,
            consequences, newConfidence, evidenceRefs, status, synthesisMode);
    }

    /**
     * Returns a copy whose evidence list is this record's list followed by every reference
     * of {@code additional} whose file is not referenced yet. Existing references are never
     * removed or reordered.
     *
     * @param additional references to append
     * @return modified copy
     */
    public DecisionRecord withAppendedEvidence(List<EvidenceRef> additional) {
        Set<String> known = evidencePaths();
        List<EvidenceRef> merged = new ArrayList<>(evidenceRefs);
        for (EvidenceRef ref : additional) {
            if (known.add(ref.filePath())) {
                merged.add(ref);
            }
        }
        return new DecisionRecord(id, category, technologyId, technologyName, title, rationale,
            consequences, confidence, merged, status, synthesisMode);
    }

    /**
     * Returns a copy with a different rationale and synthesis mode.
     *
     * @param newRationale rationale text
     * @param mode synthesis mode that produced it
     * @return modified copy
     */
    public DecisionRecord withRationale(String newRationale, SynthesisMode mode) {
        return new DecisionRecord(id, category, technologyId, technologyName, title, newRationale,
            consequences, confidence, evidenceRefs, status, mode);
    }
}
