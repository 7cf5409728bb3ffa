package com.sdlcimport.core.generator.impl;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sdlcimport.core.generator.DiagramGenerator;
import com.sdlcimport.core.generator.DiagramType;
import com.sdlcimport.core.generator.GeneratedDiagram;
import com.sdlcimport.core.generator.GeneratorConfig;
import com.sdlcimport.core.generator.TechnologyLandscape;
import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.util.Categories;

/**
 * Generates Mermaid diagram source from the decisions of an import run.
 *
 * <p>The output is plain Mermaid source. It is stored as a string value of the diagram
 * artifact, so the YAML serializer takes care of escaping.
 *
 * <h2>Supported Diagram Types</h2>
 * <ul>
 *   <li><b>Technology Stack:</b> flowchart with one subgraph per decision category</li>
 *   <li><b>C4 Container:</b> the application container surrounded by its databases, queues
 *       and external services</li>
 *   <li><b>Data Flow:</b> client request path through the API into data stores and brokers</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * MermaidGenerator generator = new MermaidGenerator();
 * TechnologyLandscape landscape = new TechnologyLandscape("billing", decisions);
 * GeneratedDiagram diagram = generator.generate(landscape, DiagramType.C4_CONTAINER, GeneratorConfig.defaults());
 * }</pre>
 *
 * @see <a href="https://mermaid.js.org/">Mermaid Documentation</a>
 * @see <a href="https://c4model.com/">C4 Model</a>
 */
public class MermaidGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Diagram Generator";

    private static final String NEWLINE = "\n";

    // Mermaid diagram keywords
    private static final String C4_CONTAINER = "C4Container";
    private static final String GRAPH = "graph ";

    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";

    // Placeholder nodes for empty landscapes
    private static final String NO_TECHNOLOGIES_NODE = "  A[No technologies detected]\n";
    private static final String NO_CONTAINERS_ELEMENT = "  Container(placeholder, \"No technologies detected\", \"\", \"\")\n";

    // Categories drawn as data stores and brokers in container and flow diagrams
    private static final Set<String> STORAGE_CATEGORIES = Set.of(Categories.DATABASE, Categories.CACHING);
    private static final Set<String> QUEUE_CATEGORIES = Set.of(Categories.MESSAGING);
    private static final Set<String> APPLICATION_CATEGORIES = Set.of(
        Categories.LANGUAGE, Categories.FRAMEWORK, Categories.DATA_ACCESS);
    private static final Set<String> EXTERNAL_CATEGORIES = Set.of(Categories.AUTH, Categories.OBSERVABILITY);

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public Set<DiagramType> getSupportedDiagramTypes() {
        return Set.of(DiagramType.TECHNOLOGY_STACK, DiagramType.C4_CONTAINER, DiagramType.DATA_FLOW);
    }

    @Override
    public GeneratedDiagram generate(TechnologyLandscape landscape, DiagramType type, GeneratorConfig config) {
        Objects.requireNonNull(landscape, "landscape must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (!getSupportedDiagramTypes().contains(type)) {
            throw new IllegalArgumentException("Unsupported diagram type: " + type);
        }

        log.debug("Generating Mermaid diagram for type: {}", type);

        Set<String> referenced = new LinkedHashSet<>();
        String content = switch (type) {
            case TECHNOLOGY_STACK -> generateTechnologyStack(landscape, config, referenced);
            case C4_CONTAINER -> generateC4Container(landscape, referenced);
            case DATA_FLOW -> generateDataFlow(landscape, referenced);
        };

        log.info("Generated Mermaid diagram: {}", type.getId());
        return new GeneratedDiagram(type, type.getTitle(), content, GENERATOR_ID,
            new ArrayList<>(referenced), landscape.isEmpty());
    }

    /**
     * Generates a flowchart with one subgraph per category.
     *
     * @param landscape decisions to draw
     * @param config generator configuration (direction, node cap)
     * @param referenced collects the technology ids drawn
     * @return Mermaid source
     */
    private String generateTechnologyStack(TechnologyLandscape landscape, GeneratorConfig config, Set<String> referenced) {
        StringBuilder sb = new StringBuilder();
        sb.append(GRAPH).append(config.direction()).append(NEWLINE);

        if (landscape.isEmpty()) {
            sb.append(NO_TECHNOLOGIES_NODE);
            return sb.toString();
        }

        for (Map.Entry<String, List<DecisionRecord>> entry : landscape.byCategory().entrySet()) {
            String category = entry.getKey();
            sb.append("  subgraph ").append(sanitizeId("cat_" + category))
                .append("[\"").append(escape(category)).append("\"]").append(NEWLINE);
            entry.getValue().stream()
                .limit(config.maxNodesPerCategory())
                .forEach(decision -> {
                    appendNode(sb, "    ", decision);
                    referenced.add(decision.technologyId());
                });
            sb.append("  end").append(NEWLINE);
        }
        return sb.toString();
    }

    /**
     * Generates a C4 container diagram.
     *
     * @param landscape decisions to draw
     * @param referenced collects the technology ids drawn
     * @return Mermaid source
     */
    private String generateC4Container(TechnologyLandscape landscape, Set<String> referenced) {
        StringBuilder sb = new StringBuilder();
        sb.append(C4_CONTAINER).append(NEWLINE);
        sb.append("  title Container Diagram for ").append(escape(landscape.projectName())).append(NEWLINE.repeat(2));

        if (landscape.isEmpty()) {
            sb.append(NO_CONTAINERS_ELEMENT);
            return sb.toString();
        }

        sb.append("  Person(user, \"User\", \"Consumer of the system\")").append(NEWLINE);
        sb.append("  System_Boundary(system, \"").append(escape(landscape.projectName())).append("\") {").append(NEWLINE);
        String appTechnology = describeApplication(landscape, referenced);
        sb.append("    Container(app, \"Application\", \"").append(escape(appTechnology)).append("\", \"")
            .append("Main application container\")").append(NEWLINE);

        List<String> relations = new ArrayList<>();
        for (DecisionRecord decision : landscape.decisions()) {
            String nodeId = nodeId(decision);
            if (STORAGE_CATEGORIES.contains(decision.category())) {
                appendC4Element(sb, "ContainerDb", nodeId, decision);
                relations.add(rel("app", nodeId, "Reads/writes"));
            } else if (QUEUE_CATEGORIES.contains(decision.category())) {
                appendC4Element(sb, "ContainerQueue", nodeId, decision);
                relations.add(rel("app", nodeId, "Publishes/consumes"));
            } else {
                continue;
            }
            referenced.add(decision.technologyId());
        }
        sb.append("  }").append(NEWLINE);

        for (DecisionRecord decision : landscape.decisions()) {
            if (EXTERNAL_CATEGORIES.contains(decision.category())) {
                String nodeId = nodeId(decision);
                sb.append("  System_Ext(").append(nodeId).append(", \"").append(escape(decision.technologyName()))
                    .append("\", \"").append(escape(decision.category())).append("\")").append(NEWLINE);
                relations.add(rel("app", nodeId, "Uses"));
                referenced.add(decision.technologyId());
            }
        }

        List<DecisionRecord> apis = landscape.inCategory(Categories.API);
        String apiStyle = "HTTPS";
        if (!apis.isEmpty()) {
            apiStyle = apis.get(0).technologyName();
            referenced.add(apis.get(0).technologyId());
        }
        sb.append(NEWLINE);
        sb.append(rel("user", "app", "Uses", apiStyle));
        relations.forEach(sb::append);
        return sb.toString();
    }

    /**
     * Generates a left-to-right flow from the client through the API into backing services.
     *
     * @param landscape decisions to draw
     * @param referenced collects the technology ids drawn
     * @return Mermaid source
     */
    private String generateDataFlow(TechnologyLandscape landscape, Set<String> referenced) {
        StringBuilder sb = new StringBuilder();
        sb.append(GRAPH).append("LR").append(NEWLINE);

        if (landscape.isEmpty()) {
            sb.append(NO_TECHNOLOGIES_NODE);
            return sb.toString();
        }

        sb.append("  client((\"Client\"))").append(NEWLINE);
        String entry = "client";
        List<DecisionRecord> apis = landscape.inCategory(Categories.API);
        List<DecisionRecord> auth = landscape.inCategory(Categories.AUTH);
        for (DecisionRecord decision : auth) {
            appendNode(sb, "  ", decision);
            sb.append("  ").append(entry).append(" --> ").append(nodeId(decision)).append(NEWLINE);
            entry = nodeId(decision);
            referenced.add(decision.technologyId());
        }
        for (DecisionRecord decision : apis) {
            appendNode(sb, "  ", decision);
            sb.append("  ").append(entry).append(" --> ").append(nodeId(decision)).append(NEWLINE);
            referenced.add(decision.technologyId());
        }

        String appLabel = describeApplication(landscape, referenced);
        sb.append("  app[\"").append(escape(appLabel)).append("\"]").append(NEWLINE);
        if (apis.isEmpty()) {
            sb.append("  ").append(entry).append(" --> app").append(NEWLINE);
        } else {
            apis.forEach(api -> sb.append("  ").append(nodeId(api)).append(" --> app").append(NEWLINE));
        }

        for (DecisionRecord decision : landscape.decisions()) {
            if (STORAGE_CATEGORIES.contains(decision.category())) {
                sb.append("  ").append(nodeId(decision)).append("[(\"").append(escape(decision.technologyName()))
                    .append("\")]").append(NEWLINE);
                sb.append("  app -->|\"read/write\"| ").append(nodeId(decision)).append(NEWLINE);
                referenced.add(decision.technologyId());
            } else if (QUEUE_CATEGORIES.contains(decision.category())) {
                sb.append("  ").append(nodeId(decision)).append("{{\"").append(escape(decision.technologyName()))
                    .append("\"}}").append(NEWLINE);
                sb.append("  app -->|\"publish\"| ").append(nodeId(decision)).append(NEWLINE);
                sb.append("  ").append(nodeId(decision)).append(" -.->|\"consume\"| app").append(NEWLINE);
                referenced.add(decision.technologyId());
            }
        }
        return sb.toString();
    }

    /**
     * Describes the application container by its language, framework and data-access stack.
     *
     * @param landscape decisions
     * @param referenced collects the technology ids used in the description
     * @return comma-separated technology names, or "Application" when none is known
     */
    private String describeApplication(TechnologyLandscape landscape, Set<String> referenced) {
        List<String> names = new ArrayList<>();
        for (DecisionRecord decision : landscape.decisions()) {
            if (APPLICATION_CATEGORIES.contains(decision.category())) {
                names.add(decision.technologyName());
                referenced.add(decision.technologyId());
            }
        }
        return names.isEmpty() ? "Application" : String.join(", ", names);
    }

    private void appendNode(StringBuilder sb, String indent, DecisionRecord decision) {
        sb.append(indent).append(nodeId(decision)).append("[\"").append(escape(decision.technologyName()))
            .append("\"]").append(NEWLINE);
    }

    private void appendC4Element(StringBuilder sb, String element, String nodeId, DecisionRecord decision) {
        sb.append("    ").append(element).append("(").append(nodeId).append(", \"")
            .append(escape(decision.technologyName())).append("\", \"")
            .append(escape(decision.category())).append("\", \"")
            .append(escape(decision.title())).append("\")").append(NEWLINE);
    }

    private String rel(String from, String to, String label) {
        return "  Rel(" + from + ", " + to + ", \"" + escape(label) + "\")" + NEWLINE;
    }

    private String rel(String from, String to, String label, String technology) {
        return "  Rel(" + from + ", " + to + ", \"" + escape(label) + "\", \"" + escape(technology) + "\")" + NEWLINE;
    }

    private String nodeId(DecisionRecord decision) {
        return sanitizeId(decision.category() + "_" + decision.technologyId());
    }

    /**
     * Sanitizes an identifier for safe use in Mermaid diagrams.
     *
     * <p>Replaces all non-alphanumeric characters (except underscores) with underscores.
     *
     * @param id the identifier to sanitize (may be null)
     * @return sanitized identifier, or "unknown" if input is null
     */
    private String sanitizeId(String id) {
        if (id == null) {
            return "unknown";
        }
        return id.replaceAll(ID_SANITIZATION_PATTERN, "_");
    }

    /**
     * Escapes special characters in text for safe embedding in Mermaid labels.
     *
     * @param text the text to escape (may be null)
     * @return escaped text, or empty string if input is null
     */
    private String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "'").replace("\n", " ");
    }
}
