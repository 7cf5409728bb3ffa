package com.sdlcimport.core.reconcile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sdlcimport.core.model.DecisionRecord;

import java.util.List;

/**
 * On-disk shape of the decision store.
 *
 * <p><b>Example YAML:</b></p>
 * <pre>{@code
 * version: 1
 * decisions:
 *   - id: "ADR-IMPORT-001"
 *     category: "database"
 *     technology: "postgresql"
 *     evidence:
 *       - file: "docker-compose.yml"
 *         line: 12
 *         strength: "CONTENT"
 * }</pre>
 *
 * @param version format version
 * @param decisions persisted decisions
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreDocument(
    @JsonProperty("version") Integer version,
    @JsonProperty("decisions") List<DecisionRecord> decisions
) {
    /** Current format version. */
    public static final int CURRENT_VERSION = 1;

    public StoreDocument {
        version = version == null ? CURRENT_VERSION : version;
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
    }
}
