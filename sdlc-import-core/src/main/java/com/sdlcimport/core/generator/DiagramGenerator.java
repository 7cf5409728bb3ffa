package com.sdlcimport.core.generator;

import java.util.Set;

/**
 * Interface for diagram generators that turn a {@link TechnologyLandscape} into diagram source.
 *
 * <p>Each generator supports one or more {@link DiagramType}s and emits one
 * {@link GeneratedDiagram} per call.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class PlantUmlGenerator implements DiagramGenerator {
 *     public String getId() { return "plantuml"; }
 *     public String getDisplayName() { return "PlantUML Diagram Generator"; }
 *     public Set<DiagramType> getSupportedDiagramTypes() { return Set.of(DiagramType.C4_CONTAINER); }
 *     public GeneratedDiagram generate(TechnologyLandscape landscape, DiagramType type, GeneratorConfig config) {
 *         ...
 *     }
 * }
 * }</pre>
 *
 * @see TechnologyLandscape
 * @see DiagramType
 * @see GeneratorConfig
 * @see GeneratedDiagram
 */
public interface DiagramGenerator {

    /**
     * Returns unique identifier for this generator (e.g. "mermaid").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns set of diagram types this generator can produce.
     *
     * @return supported diagram types
     */
    Set<DiagramType> getSupportedDiagramTypes();

    /**
     * Generates a diagram.
     *
     * <p>With an empty landscape a meaningful placeholder is generated
     * (e.g. "No technologies detected").
     *
     * @param landscape the decisions to visualize
     * @param type the diagram type to generate
     * @param config configuration settings for generation
     * @return generated diagram
     * @throws IllegalArgumentException if diagram type is not supported
     */
    GeneratedDiagram generate(TechnologyLandscape landscape, DiagramType type, GeneratorConfig config);
}
