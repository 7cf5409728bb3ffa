package com.sdlcimport.core.analyzer;

import com.sdlcimport.core.generator.DiagramType;
import com.sdlcimport.core.generator.GeneratedDiagram;
import com.sdlcimport.core.model.DebtItem;
import com.sdlcimport.core.model.ThreatFinding;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Collector owned by exactly one analyzer invocation.
 *
 * <p>Whatever was added before a failure is kept as partial output. Not thread-safe; each
 * task gets its own instance.
 */
public class AnalyzerOutput {

    private final List<GeneratedDiagram> diagrams = new ArrayList<>();
    private final Map<DiagramType, String> diagramFailures = new EnumMap<>(DiagramType.class);
    private final List<ThreatFinding> threats = new ArrayList<>();
    private final List<DebtItem> debtItems = new ArrayList<>();

    public void addDiagram(GeneratedDiagram diagram) {
        diagrams.add(diagram);
    }

    public void addDiagramFailure(DiagramType type, String message) {
        diagramFailures.put(type, message);
    }

    public void addThreat(ThreatFinding finding) {
        threats.add(finding);
    }

    public void addDebtItem(DebtItem item) {
        debtItems.add(item);
    }

    public List<GeneratedDiagram> diagrams() {
        return List.copyOf(diagrams);
    }

    public Map<DiagramType, String> diagramFailures() {
        return Map.copyOf(diagramFailures);
    }

    public List<ThreatFinding> threats() {
        return List.copyOf(threats);
    }

    public List<DebtItem> debtItems() {
        return List.copyOf(debtItems);
    }
}
