package com.sdlcimport.core.renderer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.sdlcimport.core.analyzer.AnalyzerResult;
import com.sdlcimport.core.config.ImportConfig;
import com.sdlcimport.core.decision.ConfidenceLevel;
import com.sdlcimport.core.generator.DiagramType;
import com.sdlcimport.core.generator.GeneratedDiagram;
import com.sdlcimport.core.model.Correction;
import com.sdlcimport.core.model.DebtItem;
import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.model.DecisionStatus;
import com.sdlcimport.core.model.EvidenceRef;
import com.sdlcimport.core.model.QualityIssue;
import com.sdlcimport.core.model.QualityReport;
import com.sdlcimport.core.model.ThreatFinding;
import com.sdlcimport.core.renderer.impl.FileSystemRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.TreeMap;

/**
 * Builds every YAML artifact as a plain {@code Map}/{@code List} tree and writes it through an
 * {@link OutputRenderer}.
 *
 * <p>Text is never assembled by hand. Each serialized document is parsed back and compared
 * with the tree it came from; any difference, like any serializer exception, fails only that
 * artifact and is reported in the returned {@link RenderReport}.
 *
 * <p>Thread-safe: analyzer tasks render their artifacts concurrently through one instance.
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * ArtifactRenderer renderer = ArtifactRenderer.forDirectory(Path.of("sdlc-import"));
 * RenderReport report = renderer.renderDecisions("shop", decisions, config.scoring());
 * }</pre>
 */
public class ArtifactRenderer {

    private static final Logger log = LoggerFactory.getLogger(ArtifactRenderer.class);

    private static final Comparator<JsonNode> NUMERIC_TOLERANT = (left, right) -> {
        if (left.equals(right)) {
            return 0;
        }
        if (left.isNumber() && right.isNumber()) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
        return 1;
    };

    static final String FILESYSTEM_WRITER = "filesystem";

    private final ObjectMapper mapper;
    private final OutputRenderer writer;
    private final RenderContext context;

    public ArtifactRenderer(OutputRenderer writer, RenderContext context) {
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.mapper = createMapper();
    }

    /**
     * Creates a renderer writing to a filesystem directory.
     *
     * @param outputDirectory output directory
     * @return renderer
     */
    public static ArtifactRenderer forDirectory(Path outputDirectory) {
        return new ArtifactRenderer(loadWriter(FILESYSTEM_WRITER), RenderContext.of(outputDirectory));
    }

    /**
     * Looks up a registered {@link OutputRenderer} by id.
     *
     * @param id renderer id
     * @return the registered renderer, or the filesystem renderer when none has this id
     */
    static OutputRenderer loadWriter(String id) {
        return ServiceLoader.load(OutputRenderer.class).stream()
            .map(ServiceLoader.Provider::get)
            .filter(renderer -> renderer.getId().equals(id))
            .findFirst()
            .orElseGet(() -> {
                log.warn("No output renderer registered as '{}', using filesystem", id);
                return new FileSystemRenderer();
            });
    }

    /**
     * Creates the YAML mapper shared by rendering and reading back.
     *
     * @return mapper
     */
    public static ObjectMapper createMapper() {
        return new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .disable(YAMLGenerator.Feature.SPLIT_LINES));
    }

    public RenderContext context() {
        return context;
    }

    // --- decisions -----------------------------------------------------------

    /**
     * Renders one file per NEW or ENRICHMENT decision; other statuses are skipped.
     *
     * @param projectName project name
     * @param decisions reconciled decisions
     * @param scoring thresholds used to label confidence
     * @return render report
     */
    public RenderReport renderDecisions(String projectName, List<DecisionRecord> decisions,
                                        ImportConfig.ScoringConfig scoring) {
        RenderReport report = RenderReport.empty();
        for (DecisionRecord decision : decisions) {
            if (decision.status() != DecisionStatus.NEW && decision.status() != DecisionStatus.ENRICHMENT) {
                continue;
            }
            report = report.merge(write(OutputLayout.decisionPath(decision), decisionTree(projectName, decision, scoring)));
        }
        return report;
    }

    Map<String, Object> decisionTree(String projectName, DecisionRecord decision, ImportConfig.ScoringConfig scoring) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("kind", "architecture-decision");
        tree.put("id", decision.id());
        tree.put("project", projectName);
        tree.put("title", decision.title());
        tree.put("status", decision.status().name());
        tree.put("category", decision.category());
        tree.put("technology", decision.technologyId());
        tree.put("technologyName", decision.technologyName());
        tree.put("confidence", round(decision.confidence()));
        tree.put("confidenceLevel", ConfidenceLevel.fromScore(decision.confidence(), scoring).name());
        tree.put("synthesisMode", decision.synthesisMode().name());
        tree.put("rationale", decision.rationale());
        Map<String, Object> consequences = new LinkedHashMap<>();
        consequences.put("positive", new ArrayList<>(decision.consequences().positive()));
        consequences.put("negative", new ArrayList<>(decision.consequences().negative()));
        tree.put("consequences", consequences);
        tree.put("evidence", evidenceTree(decision.evidenceRefs()));
        return tree;
    }

    // --- analyzer artifacts --------------------------------------------------

    /**
     * Renders the artifact of one analyzer result; a failed result is written with
     * {@code failed: true} and its partial output.
     *
     * @param projectName project name
     * @param result analyzer result
     * @return render report
     */
    public RenderReport renderAnalyzerResult(String projectName, AnalyzerResult result) {
        return switch (result.kind()) {
            case THREAT_MODEL -> write(OutputLayout.THREAT_MODEL, threatModelTree(projectName, result));
            case DEBT_REPORT -> write(OutputLayout.TECH_DEBT, techDebtTree(projectName, result));
            case DIAGRAMS -> renderDiagrams(result);
        };
    }

    private RenderReport renderDiagrams(AnalyzerResult result) {
        Map<DiagramType, GeneratedDiagram> byType = new LinkedHashMap<>();
        for (GeneratedDiagram diagram : result.diagrams()) {
            byType.put(diagram.type(), diagram);
        }

        RenderReport report = RenderReport.empty();
        for (DiagramType type : DiagramType.values()) {
            GeneratedDiagram diagram = byType.get(type);
            if (diagram != null) {
                report = report.merge(renderDiagram(diagram, false));
            } else {
                String error = result.diagramFailures().getOrDefault(type,
                    result.error() != null ? result.error() : "diagram was not generated");
                report = report.merge(write(OutputLayout.diagramPath(type), failedDiagramTree(type, error)));
            }
        }
        return report;
    }

    /**
     * Renders one diagram file.
     *
     * @param diagram generated diagram
     * @param needsRegeneration value of the {@code needsRegeneration} flag
     * @return render report
     */
    public RenderReport renderDiagram(GeneratedDiagram diagram, boolean needsRegeneration) {
        return write(OutputLayout.diagramPath(diagram.type()), diagramTree(diagram, needsRegeneration));
    }

    Map<String, Object> diagramTree(GeneratedDiagram diagram, boolean needsRegeneration) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("kind", "diagram");
        tree.put("id", diagram.id());
        tree.put("title", diagram.title());
        tree.put("type", diagram.type().name());
        tree.put("format", diagram.format());
        tree.put("technologies", new ArrayList<>(diagram.technologies()));
        tree.put("placeholder", diagram.placeholder());
        tree.put("needsRegeneration", needsRegeneration);
        tree.put("failed", false);
        tree.put("source", diagram.content());
        return tree;
    }

    private Map<String, Object> failedDiagramTree(DiagramType type, String error) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("kind", "diagram");
        tree.put("id", type.getId());
        tree.put("title", type.getTitle());
        tree.put("type", type.name());
        tree.put("technologies", new ArrayList<>());
        tree.put("needsRegeneration", true);
        tree.put("failed", true);
        tree.put("error", error);
        tree.put("source", "");
        return tree;
    }

    Map<String, Object> threatModelTree(String projectName, AnalyzerResult result) {
        List<ThreatFinding> findings = result.threats();
        Map<String, Object> tree = header("threat-model", projectName, result);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total", findings.size());
        summary.put("critical", (int) findings.stream().filter(ThreatFinding::isCritical).count());
        summary.put("escalated", (int) findings.stream().filter(ThreatFinding::escalate).count());
        Map<String, Integer> byStride = new LinkedHashMap<>();
        for (ThreatFinding finding : findings) {
            byStride.merge(finding.strideCategory().name(), 1, Integer::sum);
        }
        summary.put("byStride", byStride);
        tree.put("summary", summary);

        List<Object> items = new ArrayList<>();
        for (ThreatFinding finding : findings) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", finding.id());
            item.put("rule", finding.ruleId());
            item.put("title", finding.title());
            item.put("stride", finding.strideCategory().name());
            item.put("severity", finding.severity());
            item.put("critical", finding.isCritical());
            item.put("escalate", finding.escalate());
            item.put("evidence", evidenceTree(finding.evidenceRefs()));
            items.add(item);
        }
        tree.put("findings", items);
        return tree;
    }

    Map<String, Object> techDebtTree(String projectName, AnalyzerResult result) {
        List<DebtItem> debtItems = result.debtItems();
        Map<String, Object> tree = header("tech-debt", projectName, result);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total", debtItems.size());
        Map<String, Integer> byPriority = new TreeMap<>();
        for (DebtItem item : debtItems) {
            byPriority.merge(item.priority().name(), 1, Integer::sum);
        }
        summary.put("byPriority", byPriority);
        summary.put("totalEffortHours", round(debtItems.stream().mapToDouble(DebtItem::effortEstimateHours).sum()));
        tree.put("summary", summary);

        List<Object> items = new ArrayList<>();
        for (DebtItem debt : debtItems) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", debt.id());
            item.put("rule", debt.ruleId());
            item.put("title", debt.title());
            item.put("priority", debt.priority().name());
            item.put("category", debt.category());
            item.put("location", debt.location());
            item.put("effortHours", round(debt.effortEstimateHours()));
            items.add(item);
        }
        tree.put("items", items);
        return tree;
    }

    private static Map<String, Object> header(String kind, String projectName, AnalyzerResult result) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("kind", kind);
        tree.put("project", projectName);
        tree.put("analyzer", result.analyzerId());
        tree.put("failed", result.isFailed());
        if (result.isFailed()) {
            tree.put("error", result.error());
        }
        return tree;
    }

    // --- quality report and summary ------------------------------------------

    /**
     * Renders the quality report.
     *
     * @param projectName project name
     * @param report quality report
     * @return render report
     */
    public RenderReport renderQualityReport(String projectName, QualityReport report) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("kind", "quality-report");
        tree.put("project", projectName);
        tree.put("score", round(report.score()));
        tree.put("recommendation", report.recommendation().name());

        List<Object> issues = new ArrayList<>();
        for (QualityIssue issue : report.issues()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("checker", issue.checkerId());
            item.put("severity", issue.severity().name());
            item.put("message", issue.message());
            if (issue.artifact() != null) {
                item.put("artifact", issue.artifact());
            }
            item.put("penalty", issue.penalty());
            issues.add(item);
        }
        tree.put("issues", issues);

        List<Object> corrections = new ArrayList<>();
        for (Correction correction : report.correctionsApplied()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("checker", correction.checkerId());
            item.put("description", correction.description());
            if (correction.artifact() != null) {
                item.put("artifact", correction.artifact());
            }
            corrections.add(item);
        }
        tree.put("corrections", corrections);
        return write(OutputLayout.QUALITY_REPORT, tree);
    }

    /**
     * Writes a Markdown document as is.
     *
     * @param relativePath target path
     * @param markdown content
     * @return render report
     */
    public RenderReport renderMarkdown(String relativePath, String markdown) {
        try {
            writer.render(GeneratedOutput.of(new GeneratedFile(relativePath, markdown, GeneratedFile.MARKDOWN)), context);
            return RenderReport.written(relativePath);
        } catch (IllegalStateException e) {
            log.error("Failed to write {}: {}", relativePath, e.getMessage(), e);
            return RenderReport.failed(relativePath, e.getMessage());
        }
    }

    // --- file access ---------------------------------------------------------

    /**
     * Removes a rendered artifact.
     *
     * @param relativePath artifact path
     */
    public void remove(String relativePath) {
        writer.remove(relativePath, context);
    }

    /**
     * Returns true if an artifact exists in the output directory.
     *
     * @param relativePath artifact path
     * @return true when present
     */
    public boolean exists(String relativePath) {
        return Files.isRegularFile(context.resolve(relativePath));
    }

    /**
     * Parses a rendered YAML artifact.
     *
     * @param relativePath artifact path
     * @return parsed tree
     * @throws IOException if the file cannot be read or parsed
     */
    public JsonNode readArtifact(String relativePath) throws IOException {
        return mapper.readTree(context.resolve(relativePath).toFile());
    }

    // --- serialization -------------------------------------------------------

    /**
     * Serializes a tree and verifies that the text parses back to the same tree.
     *
     * @param tree artifact tree of maps, lists and scalars
     * @return YAML text
     * @throws SerializationException if serialization fails or does not round-trip
     */
    protected String serialize(Object tree) throws SerializationException {
        String yaml;
        try {
            yaml = mapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Cannot serialize artifact: " + e.getOriginalMessage(), e);
        }
        verifyRoundTrip(tree, yaml);
        return yaml;
    }

    /**
     * Parses serialized text and compares it with the source tree.
     *
     * @param tree source tree
     * @param yaml serialized text
     * @throws SerializationException if the text does not parse back to the tree
     */
    protected void verifyRoundTrip(Object tree, String yaml) throws SerializationException {
        JsonNode parsed;
        try {
            parsed = mapper.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Serialized artifact does not parse: " + e.getOriginalMessage(), e);
        }
        JsonNode expected = mapper.valueToTree(tree);
        if (parsed == null || !expected.equals(NUMERIC_TOLERANT, parsed)) {
            throw new SerializationException("Serialized artifact does not round-trip to its source tree");
        }
    }

    private RenderReport write(String relativePath, Map<String, Object> tree) {
        String yaml;
        try {
            yaml = serialize(tree);
        } catch (SerializationException e) {
            log.error("Serialization of {} failed: {}", relativePath, e.getMessage(), e);
            return RenderReport.failed(relativePath, e.getMessage());
        }
        try {
            writer.render(GeneratedOutput.of(new GeneratedFile(relativePath, yaml, GeneratedFile.YAML)), context);
            return RenderReport.written(relativePath);
        } catch (IllegalStateException e) {
            log.error("Failed to write {}: {}", relativePath, e.getMessage(), e);
            return RenderReport.failed(relativePath, e.getMessage());
        }
    }

    private static List<Object> evidenceTree(List<EvidenceRef> refs) {
        List<Object> evidence = new ArrayList<>();
        for (EvidenceRef ref : refs) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("file", ref.filePath());
            if (ref.lineRef() != null) {
                item.put("line", ref.lineRef());
            }
            item.put("strength", ref.matchStrength().name());
            evidence.add(item);
        }
        return evidence;
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
