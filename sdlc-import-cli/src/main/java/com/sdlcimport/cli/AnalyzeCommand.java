package com.sdlcimport.cli;

import com.sdlcimport.core.analyzer.AnalyzerResult;
import com.sdlcimport.core.model.DecisionStatus;
import com.sdlcimport.core.model.QualityIssue;
import com.sdlcimport.core.model.Recommendation;
import com.sdlcimport.core.pipeline.ApprovalDecision;
import com.sdlcimport.core.pipeline.ApprovalGate;
import com.sdlcimport.core.pipeline.ImportPipeline;
import com.sdlcimport.core.pipeline.RecordingTicketTracker;
import com.sdlcimport.core.pipeline.RunOptions;
import com.sdlcimport.core.pipeline.RunResult;
import com.sdlcimport.core.pipeline.VersionControl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to run the import on a source tree.
 *
 * <p>Exit codes: 0 success, 1 input validation failed, 2 internal error, 3 rejected or
 * aborted.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Import the current directory
 * sdlc-import analyze
 *
 * # Import another tree into a custom output directory
 * sdlc-import analyze ../billing -o build/sdlc
 *
 * # Non-interactive run that accepts a REVIEW verdict
 * sdlc-import analyze --yes --create-tickets
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Import architecture decisions, diagrams, threats and debt from a source tree",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: <project>/sdlc-import.yaml)")
    private Path configPath;

    @Option(names = {"-o", "--output"}, description = "Output directory (default: <project>/sdlc-import)")
    private Path outputPath;

    @Option(names = "--skip-threat-model", description = "Do not generate the threat model")
    private boolean skipThreatModel;

    @Option(names = "--skip-tech-debt", description = "Do not generate the technical debt report")
    private boolean skipTechDebt;

    @Option(names = "--no-narrative", description = "Use template rationales only")
    private boolean noNarrative;

    @Option(names = "--create-tickets", description = "File tickets for low-confidence decisions and critical threats")
    private boolean createTickets;

    @Option(names = "--branch", paramLabel = "NAME", description = "Branch to create before the import")
    private String branchName;

    @Option(names = {"-y", "--yes"}, description = "Accept a REVIEW verdict without prompting")
    private boolean assumeYes;

    @Override
    public Integer call() {
        log.info("Starting import of: {}", projectPath.toAbsolutePath());
        System.out.println("Importing project: " + projectPath.toAbsolutePath());
        System.out.println();

        RunOptions options = RunOptions.builder()
            .outputDirectory(outputPath)
            .configFile(configPath)
            .skipThreatModel(skipThreatModel)
            .skipTechDebt(skipTechDebt)
            .disableNarrativeSynthesis(noNarrative)
            .createTicketsForLowConfidence(createTickets)
            .branchName(branchName)
            .build();

        ImportPipeline pipeline = new ImportPipeline(VersionControl.noOp(), new RecordingTicketTracker(), approvalGate());
        RunResult result = pipeline.analyze(projectPath, options);
        printResult(result);
        return result.exitCode().getCode();
    }

    ApprovalGate approvalGate() {
        if (assumeYes) {
            return report -> report.recommendation() == Recommendation.REVIEW
                ? ApprovalDecision.ACCEPT
                : ApprovalDecision.ABORT;
        }
        return new ConsoleApprovalGate(
            new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    private void printResult(RunResult result) {
        if (result.qualityReport() == null) {
            System.err.println("✗ " + result.message());
            return;
        }

        System.out.println("✓ Decisions: " + result.count(DecisionStatus.NEW) + " new, "
            + result.count(DecisionStatus.ENRICHMENT) + " enriched, "
            + result.count(DecisionStatus.DUPLICATE) + " duplicate");
        for (AnalyzerResult analyzer : result.analyzerResults()) {
            String mark = analyzer.isFailed() ? "✗" : "✓";
            System.out.println(mark + " " + analyzer.analyzerId() + ": " + analyzer.itemCount() + " item(s)"
                + (analyzer.isFailed() ? " (" + analyzer.error() + ")" : ""));
        }
        System.out.printf(Locale.ROOT, "%s Quality score %.2f: %s%n",
            result.isSuccess() ? "✓" : "✗", result.qualityReport().score(), result.recommendation());
        if (result.recommendation() != Recommendation.ACCEPT) {
            for (QualityIssue issue : result.qualityReport().issues()) {
                System.out.printf(Locale.ROOT, "  - [%s] %s (-%.2f)%n", issue.severity(), issue.message(), issue.penalty());
            }
        }
        result.tickets().forEach(ticket -> System.out.println("  → " + ticket));

        System.out.println();
        System.out.println((result.isSuccess() ? "✓ " : "✗ ") + result.message()
            + " (output: " + result.outputDirectory() + ")");
    }
}
