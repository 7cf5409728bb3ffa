package com.sdlcimport.core.analyzer.impl;

import com.sdlcimport.core.analyzer.AnalysisContext;
import com.sdlcimport.core.analyzer.Analyzer;
import com.sdlcimport.core.analyzer.AnalyzerOutput;
import com.sdlcimport.core.analyzer.ArtifactKind;
import com.sdlcimport.core.config.ImportConfig;
import com.sdlcimport.core.generator.DiagramGenerator;
import com.sdlcimport.core.generator.DiagramType;
import com.sdlcimport.core.generator.GeneratorConfig;
import com.sdlcimport.core.generator.TechnologyLandscape;
import com.sdlcimport.core.generator.impl.MermaidGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the architecture diagrams from the known decisions.
 *
 * <p>Every supported {@link DiagramType} is generated on its own; a failing type is recorded
 * as a diagram failure and the others are still produced.
 */
public class DiagramSynthesizer implements Analyzer {

    private static final Logger log = LoggerFactory.getLogger(DiagramSynthesizer.class);

    private final DiagramGenerator generator;

    public DiagramSynthesizer() {
        this(new MermaidGenerator());
    }

    public DiagramSynthesizer(DiagramGenerator generator) {
        this.generator = generator;
    }

    @Override
    public String getId() {
        return "diagrams";
    }

    @Override
    public String getDisplayName() {
        return "Diagram Synthesizer";
    }

    @Override
    public ArtifactKind artifactKind() {
        return ArtifactKind.DIAGRAMS;
    }

    @Override
    public void analyze(AnalysisContext context, AnalyzerOutput output) {
        TechnologyLandscape landscape = new TechnologyLandscape(context.projectName(), context.decisions());
        ImportConfig.DiagramConfig diagrams = context.config().diagrams();
        GeneratorConfig config = new GeneratorConfig(diagrams.direction(), diagrams.maxNodesPerCategory());

        for (DiagramType type : DiagramType.values()) {
            if (!generator.getSupportedDiagramTypes().contains(type)) {
                continue;
            }
            try {
                output.addDiagram(generator.generate(landscape, type, config));
            } catch (RuntimeException e) {
                log.error("Failed to generate {} diagram: {}", type.getId(), e.getMessage(), e);
                output.addDiagramFailure(type, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
    }
}
