package com.sdlcimport.core.renderer;

import com.sdlcimport.core.generator.DiagramType;
import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.util.FileUtils;

/**
 * Paths of the generated artifacts, relative to the output directory.
 */
public final class OutputLayout {

    public static final String DECISIONS_DIR = "decisions";
    public static final String ARCHITECTURE_DIR = "architecture";
    public static final String THREAT_MODEL = "security/threat-model.yml";
    public static final String TECH_DEBT = "reports/tech-debt.yml";
    public static final String QUALITY_REPORT = "reports/quality-report.yml";
    public static final String SUMMARY = "reports/import-summary.md";

    private OutputLayout() {
        // Utility class
    }

    /**
     * Returns the file of a decision record.
     *
     * @param decision decision
     * @return e.g. {@code decisions/ADR-IMPORT-001-postgresql.yml}
     */
    public static String decisionPath(DecisionRecord decision) {
        return DECISIONS_DIR + "/" + decision.id() + "-" + FileUtils.slug(decision.technologyId()) + ".yml";
    }

    /**
     * Returns the file of a diagram.
     *
     * @param type diagram type
     * @return e.g. {@code architecture/c4-container.yml}
     */
    public static String diagramPath(DiagramType type) {
        return ARCHITECTURE_DIR + "/" + type.getId() + ".yml";
    }
}
