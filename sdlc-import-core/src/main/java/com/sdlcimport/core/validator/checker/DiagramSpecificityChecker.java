package com.sdlcimport.core.validator.checker;

import com.sdlcimport.core.analyzer.AnalyzerResult;
import com.sdlcimport.core.analyzer.ArtifactKind;
import com.sdlcimport.core.generator.GeneratedDiagram;
import com.sdlcimport.core.model.Correction;
import com.sdlcimport.core.model.QualityIssue;
import com.sdlcimport.core.renderer.OutputLayout;
import com.sdlcimport.core.renderer.RenderReport;
import com.sdlcimport.core.validator.CheckResult;
import com.sdlcimport.core.validator.QualityChecker;
import com.sdlcimport.core.validator.ValidationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flags diagrams that reference none of the detected technologies.
 *
 * <p>Such a diagram is rewritten with {@code needsRegeneration: true}. Skipped entirely when
 * nothing was detected, since a placeholder is then the expected result.
 */
public class DiagramSpecificityChecker implements QualityChecker {

    private static final Logger log = LoggerFactory.getLogger(DiagramSpecificityChecker.class);

    @Override
    public String getId() {
        return "diagram-specificity";
    }

    @Override
    public CheckResult check(ValidationContext context) {
        Optional<AnalyzerResult> result = context.resultFor(ArtifactKind.DIAGRAMS);
        if (result.isEmpty() || context.detectedTechnologies().isEmpty()) {
            return CheckResult.clean();
        }

        List<QualityIssue> issues = new ArrayList<>();
        List<Correction> corrections = new ArrayList<>();
        RenderReport rerendered = RenderReport.empty();

        for (GeneratedDiagram diagram : result.get().diagrams()) {
            if (isSpecific(diagram, context)) {
                continue;
            }
            String artifact = OutputLayout.diagramPath(diagram.type());
            log.warn("Diagram {} references no detected technology", diagram.id());
            rerendered = rerendered.merge(context.renderer().renderDiagram(diagram, true));
            issues.add(QualityIssue.warning(getId(),
                "Diagram " + diagram.id() + " references no detected technology", artifact,
                context.config().penalties().regeneratedDiagram()));
            corrections.add(new Correction(getId(), "Marked " + diagram.id() + " for regeneration", artifact));
        }
        return new CheckResult(issues, corrections, null, rerendered);
    }

    private static boolean isSpecific(GeneratedDiagram diagram, ValidationContext context) {
        return diagram.technologies().stream()
            .anyMatch(technology -> context.detectedTechnologies().contains(technology));
    }
}
