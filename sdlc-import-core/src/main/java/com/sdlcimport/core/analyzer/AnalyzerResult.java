package com.sdlcimport.core.analyzer;

import com.sdlcimport.core.generator.DiagramType;
import com.sdlcimport.core.generator.GeneratedDiagram;
import com.sdlcimport.core.model.DebtItem;
import com.sdlcimport.core.model.ThreatFinding;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Terminal result of one analyzer.
 *
 * <p>A FAILED result still carries whatever partial output the analyzer produced before it
 * failed, and its artifact is still rendered, flagged {@code failed: true}.
 *
 * @param analyzerId analyzer id
 * @param kind artifact kind
 * @param status SUCCEEDED or FAILED
 * @param diagrams generated diagrams
 * @param diagramFailures diagram types that failed individually, with their error
 * @param threats threat findings
 * @param debtItems debt items
 * @param error failure message, null when succeeded
 */
public record AnalyzerResult(
    String analyzerId,
    ArtifactKind kind,
    AnalyzerStatus status,
    List<GeneratedDiagram> diagrams,
    Map<DiagramType, String> diagramFailures,
    List<ThreatFinding> threats,
    List<DebtItem> debtItems,
    String error
) {
    public AnalyzerResult {
        Objects.requireNonNull(analyzerId, "analyzerId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("result status must be terminal: " + status);
        }
        diagrams = diagrams == null ? List.of() : List.copyOf(diagrams);
        diagramFailures = diagramFailures == null ? Map.of() : Map.copyOf(diagramFailures);
        threats = threats == null ? List.of() : List.copyOf(threats);
        debtItems = debtItems == null ? List.of() : List.copyOf(debtItems);
    }

    /**
     * Creates a successful result from a collector.
     *
     * @param analyzerId analyzer id
     * @param kind artifact kind
     * @param output collected output
     * @return succeeded result
     */
    public static AnalyzerResult succeeded(String analyzerId, ArtifactKind kind, AnalyzerOutput output) {
        return new AnalyzerResult(analyzerId, kind, AnalyzerStatus.SUCCEEDED, output.diagrams(),
            output.diagramFailures(), output.threats(), output.debtItems(), null);
    }

    /**
     * Creates a failed result keeping the partial output.
     *
     * @param analyzerId analyzer id
     * @param kind artifact kind
     * @param partial output collected before the failure
     * @param error failure message
     * @return failed result
     */
    public static AnalyzerResult failed(String analyzerId, ArtifactKind kind, AnalyzerOutput partial, String error) {
        return new AnalyzerResult(analyzerId, kind, AnalyzerStatus.FAILED, partial.diagrams(),
            partial.diagramFailures(), partial.threats(), partial.debtItems(),
            error == null ? "unknown error" : error);
    }

    /**
     * Returns true if the analyzer failed.
     *
     * @return true for FAILED
     */
    public boolean isFailed() {
        return status == AnalyzerStatus.FAILED;
    }

    /**
     * Returns the number of items the artifact must contain.
     *
     * @return threats for a threat model, debt items for a debt report, diagrams otherwise
     */
    public int itemCount() {
        return switch (kind) {
            case THREAT_MODEL -> threats.size();
            case DEBT_REPORT -> debtItems.size();
            case DIAGRAMS -> diagrams.size();
        };
    }
}
