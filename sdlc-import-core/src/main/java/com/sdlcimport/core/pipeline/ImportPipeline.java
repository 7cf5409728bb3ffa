package com.sdlcimport.core.pipeline;

import com.sdlcimport.core.analyzer.AnalysisContext;
import com.sdlcimport.core.analyzer.Analyzer;
import com.sdlcimport.core.analyzer.AnalyzerResult;
import com.sdlcimport.core.analyzer.AnalyzerRun;
import com.sdlcimport.core.analyzer.AnalyzerRunner;
import com.sdlcimport.core.analyzer.ArtifactKind;
import com.sdlcimport.core.config.CatalogException;
import com.sdlcimport.core.config.ConfigLoader;
import com.sdlcimport.core.config.ImportConfig;
import com.sdlcimport.core.decision.CatalogNarrativeModel;
import com.sdlcimport.core.decision.ConfidenceLevel;
import com.sdlcimport.core.decision.ConfidenceScorer;
import com.sdlcimport.core.decision.DecisionExtractor;
import com.sdlcimport.core.decision.NarrativeModel;
import com.sdlcimport.core.decision.RationaleSynthesizer;
import com.sdlcimport.core.detector.DetectionResult;
import com.sdlcimport.core.detector.FileContentReader;
import com.sdlcimport.core.detector.SignatureRegistry;
import com.sdlcimport.core.detector.TechnologyDetector;
import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.model.QualityReport;
import com.sdlcimport.core.model.Recommendation;
import com.sdlcimport.core.model.ThreatFinding;
import com.sdlcimport.core.reconcile.DecisionReconciler;
import com.sdlcimport.core.reconcile.FileDecisionStore;
import com.sdlcimport.core.reconcile.ReconciliationPlan;
import com.sdlcimport.core.renderer.ArtifactRenderer;
import com.sdlcimport.core.renderer.OutputLayout;
import com.sdlcimport.core.renderer.RenderReport;
import com.sdlcimport.core.scanner.FileInventory;
import com.sdlcimport.core.scanner.InputException;
import com.sdlcimport.core.scanner.TreeScanner;
import com.sdlcimport.core.validator.PostGenerationValidator;
import com.sdlcimport.core.validator.QualityGate;
import com.sdlcimport.core.validator.ValidationContext;
import com.sdlcimport.core.validator.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Orchestrates an import run: scan, detect, extract, score, reconcile, analyze, render,
 * validate and, once approved, commit to the decision store.
 *
 * <p>An ACCEPT verdict commits immediately. REVIEW and REJECT verdicts go to the
 * {@link ApprovalGate}; a REJECT can only be rerun or aborted. Nothing is written to the store
 * before acceptance.
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * ImportPipeline pipeline = new ImportPipeline(VersionControl.noOp(), new RecordingTicketTracker(),
 *     ApprovalGate.always(ApprovalDecision.ABORT));
 * RunResult result = pipeline.analyze(Path.of("/repos/billing"), RunOptions.defaults());
 * System.exit(result.exitCode().getCode());
 * }</pre>
 */
public class ImportPipeline {

    private static final Logger log = LoggerFactory.getLogger(ImportPipeline.class);

    private final VersionControl versionControl;
    private final TicketTracker ticketTracker;
    private final ApprovalGate approvalGate;
    private final Supplier<List<Analyzer>> analyzers;
    private final Supplier<NarrativeModel> narrativeModel;

    public ImportPipeline(VersionControl versionControl, TicketTracker ticketTracker, ApprovalGate approvalGate) {
        this(versionControl, ticketTracker, approvalGate, AnalyzerRunner::discover, CatalogNarrativeModel::loadDefault);
    }

    public ImportPipeline(VersionControl versionControl, TicketTracker ticketTracker, ApprovalGate approvalGate,
                          Supplier<List<Analyzer>> analyzers, Supplier<NarrativeModel> narrativeModel) {
        this.versionControl = Objects.requireNonNull(versionControl, "versionControl must not be null");
        this.ticketTracker = Objects.requireNonNull(ticketTracker, "ticketTracker must not be null");
        this.approvalGate = Objects.requireNonNull(approvalGate, "approvalGate must not be null");
        this.analyzers = Objects.requireNonNull(analyzers, "analyzers must not be null");
        this.narrativeModel = Objects.requireNonNull(narrativeModel, "narrativeModel must not be null");
    }

    /**
     * Runs the import on a source tree.
     *
     * @param root root of the source tree
     * @param options run options
     * @return run outcome; never throws
     */
    public RunResult analyze(Path root, RunOptions options) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(options, "options must not be null");

        Path projectRoot = root.toAbsolutePath().normalize();
        ImportConfig config = options.configFile() != null
            ? ConfigLoader.load(options.configFile())
            : ConfigLoader.loadFromRoot(projectRoot);
        Path outputDirectory = options.outputDirectory() != null
            ? options.outputDirectory().toAbsolutePath().normalize()
            : projectRoot.resolve(config.output().directory()).normalize();

        RunResult result;
        try {
            result = execute(projectRoot, outputDirectory, config, options);
        } catch (InputException | CatalogException e) {
            log.error("Input validation failed: {}", e.getMessage());
            result = RunResult.failed(ExitCode.INPUT_ERROR, e.getMessage(), outputDirectory);
        } catch (IOException | RuntimeException e) {
            log.error("Import failed with an internal error", e);
            result = RunResult.failed(ExitCode.INTERNAL_ERROR,
                e.getClass().getSimpleName() + ": " + e.getMessage(), outputDirectory);
        }

        writeSummary(result, outputDirectory);
        log.info("Import finished: {} (exit {})", result.message(), result.exitCode().getCode());
        return result;
    }

    private RunResult execute(Path root, Path outputDirectory, ImportConfig config, RunOptions options)
        throws InputException, IOException {
        if (options.branchName() != null && !options.branchName().isBlank()) {
            BranchResult branch = versionControl.createBranch(options.branchName());
            if (branch == BranchResult.ERROR) {
                throw new InputException("Cannot create branch " + options.branchName());
            }
            if (branch == BranchResult.ALREADY_EXISTS) {
                log.warn("Branch {} already exists, continuing on it", options.branchName());
            }
        }

        SignatureRegistry registry = SignatureRegistry.load(resolveAll(root, config.detection().signatureFiles()));
        FileDecisionStore store = new FileDecisionStore(resolveStorePath(outputDirectory, config));

        int attempt = 0;
        while (true) {
            attempt++;
            log.info("Analysis attempt {}", attempt);
            Attempt current = runAttempt(root, outputDirectory, config, options, registry, store);
            QualityReport report = current.quality();
            log.info("Quality score {} -> {}", String.format("%.2f", report.score()), report.recommendation());

            ApprovalDecision decision;
            if (report.recommendation() == Recommendation.ACCEPT) {
                decision = ApprovalDecision.ACCEPT;
            } else {
                decision = approvalGate.await(report);
                if (report.recommendation() == Recommendation.REJECT && decision == ApprovalDecision.ACCEPT) {
                    log.warn("Acceptance of a rejected run is not allowed; aborting");
                    decision = ApprovalDecision.ABORT;
                }
            }

            switch (decision) {
                case RERUN -> {
                    continue;
                }
                case ACCEPT -> {
                    List<String> tickets = commit(current, config, options, store);
                    return current.toResult(ExitCode.SUCCESS,
                        report.recommendation() == Recommendation.ACCEPT ? "Accepted" : "Accepted after review",
                        tickets, attempt, true);
                }
                default -> {
                    return current.toResult(ExitCode.REJECTED,
                        report.recommendation() == Recommendation.REJECT ? "Rejected by quality gate" : "Aborted at review",
                        List.of(), attempt, false);
                }
            }
        }
    }

    private Attempt runAttempt(Path root, Path outputDirectory, ImportConfig config, RunOptions options,
                               SignatureRegistry registry, FileDecisionStore store) throws InputException, IOException {
        String projectName = config.project().name();

        FileInventory inventory = new TreeScanner(config.scan()).scan(root, outputDirectory);
        log.info(inventory.statistics().getSummary());

        FileContentReader reader = new FileContentReader(config.scan().maxContentBytes());
        DetectionResult detection = new TechnologyDetector(registry, reader).detect(inventory);
        log.info(detection.statistics().getSummary());

        List<DecisionRecord> persisted = store.load();
        int firstSequence = store.maxSequence() + 1;
        RationaleSynthesizer synthesizer = new RationaleSynthesizer(narrativeModel.get(),
            !options.disableNarrativeSynthesis());
        List<DecisionRecord> candidates = new DecisionExtractor(registry, synthesizer, config.detection().minEvidence())
            .extract(detection.evidence(), firstSequence);
        List<DecisionRecord> scored = new ConfidenceScorer(config.scoring()).scoreAll(candidates, detection.evidence());

        ReconciliationPlan plan = new DecisionReconciler(config.reconciliation(), registry.aliasIndex())
            .reconcile(scored, persisted);

        ArtifactRenderer renderer = ArtifactRenderer.forDirectory(outputDirectory);
        RenderReport rendered = renderer.renderDecisions(projectName, plan.classified(), config.scoring());

        Set<ArtifactKind> skipped = EnumSet.noneOf(ArtifactKind.class);
        if (options.skipThreatModel()) {
            skipped.add(ArtifactKind.THREAT_MODEL);
        }
        if (options.skipTechDebt()) {
            skipped.add(ArtifactKind.DEBT_REPORT);
        }
        AnalysisContext analysisContext = new AnalysisContext(projectName, root, inventory, detection.evidence(),
            plan.merged(), config, reader, skipped);
        List<AnalyzerRun<RenderReport>> runs = new AnalyzerRunner(config.analysis().threads())
            .run(analyzers.get(), analysisContext, result -> renderer.renderAnalyzerResult(projectName, result));

        List<AnalyzerResult> results = new ArrayList<>();
        for (AnalyzerRun<RenderReport> run : runs) {
            results.add(run.result());
            if (run.rendered() != null) {
                rendered = rendered.merge(run.rendered());
            }
        }

        Set<String> detected = new LinkedHashSet<>();
        detection.evidence().forEach(evidence -> detected.add(evidence.technologyId()));
        ValidationContext validationContext = new ValidationContext(projectName, plan.classified(), results, rendered,
            renderer, detected, skipped, config.validation(), Set.of());
        ValidationOutcome outcome = new PostGenerationValidator().validate(validationContext);
        QualityReport quality = new QualityGate(config.validation()).evaluate(outcome);
        renderer.renderQualityReport(projectName, quality);

        return new Attempt(projectName, outputDirectory, inventory, detection, plan, results, outcome, quality);
    }

    private List<String> commit(Attempt attempt, ImportConfig config, RunOptions options, FileDecisionStore store)
        throws IOException {
        Set<String> removed = attempt.outcome().removedDecisionKeys();
        List<DecisionRecord> upserts = attempt.plan().upserts().stream()
            .filter(d -> !removed.contains(d.identityKey()))
            .toList();
        store.commit(upserts, removed);

        if (!options.createTicketsForLowConfidence()) {
            return List.of();
        }
        List<String> tickets = new ArrayList<>();
        for (DecisionRecord decision : upserts) {
            if (ConfidenceLevel.fromScore(decision.confidence(), config.scoring()) == ConfidenceLevel.LOW) {
                String id = ticketTracker.fileTicket(new TicketRequest("low-confidence-decision", decision.id(),
                    "Review low-confidence decision: " + decision.title(),
                    String.format("Confidence %.2f. Evidence: %s", decision.confidence(), decision.evidencePaths())));
                tickets.add(id + ": " + decision.title());
            }
        }
        for (AnalyzerResult result : attempt.results()) {
            for (ThreatFinding finding : result.threats()) {
                if (finding.isCritical()) {
                    String id = ticketTracker.fileTicket(new TicketRequest("critical-threat", finding.id(),
                        "Critical threat: " + finding.title(),
                        finding.strideCategory().getDisplayName() + ", severity " + finding.severity()));
                    tickets.add(id + ": " + finding.title());
                }
            }
        }
        return tickets;
    }

    private void writeSummary(RunResult result, Path outputDirectory) {
        if (result.qualityReport() == null && result.exitCode() == ExitCode.INPUT_ERROR) {
            return;
        }
        ArtifactRenderer.forDirectory(outputDirectory).renderMarkdown(OutputLayout.SUMMARY, SummaryWriter.toMarkdown(result));
    }

    private static Path resolveStorePath(Path outputDirectory, ImportConfig config) {
        Path configured = Path.of(config.reconciliation().storePath());
        return configured.isAbsolute() ? configured : outputDirectory.resolve(configured);
    }

    private static List<Path> resolveAll(Path root, List<String> files) {
        return files.stream().map(root::resolve).toList();
    }

    /**
     * State of one analysis attempt.
     */
    private record Attempt(
        String projectName,
        Path outputDirectory,
        FileInventory inventory,
        DetectionResult detection,
        ReconciliationPlan plan,
        List<AnalyzerResult> results,
        ValidationOutcome outcome,
        QualityReport quality
    ) {
        RunResult toResult(ExitCode exitCode, String message, List<String> tickets, int attempts, boolean committed) {
            return new RunResult(exitCode, message, projectName, outputDirectory, quality, plan.classified(),
                outcome.removedDecisionKeys(), results, tickets, inventory.statistics(), detection.statistics(),
                plan.driftCount(), attempts, committed);
        }
    }
}
