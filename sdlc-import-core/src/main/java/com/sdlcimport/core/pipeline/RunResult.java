package com.sdlcimport.core.pipeline;

import com.sdlcimport.core.analyzer.AnalyzerResult;
import com.sdlcimport.core.detector.DetectionStatistics;
import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.model.DecisionStatus;
import com.sdlcimport.core.model.QualityReport;
import com.sdlcimport.core.model.Recommendation;
import com.sdlcimport.core.scanner.ScanStatistics;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of an import run.
 *
 * @param exitCode process exit code
 * @param message one-line outcome description
 * @param projectName project name
 * @param outputDirectory output directory, may be null when the run failed early
 * @param qualityReport quality report of the last attempt, null when the run failed before validation
 * @param decisions reconciled decisions of the last attempt
 * @param removedDecisionKeys identity keys removed by the validator
 * @param analyzerResults analyzer results of the last attempt
 * @param tickets filed ticket ids with their titles
 * @param scanStatistics scan statistics, may be null
 * @param detectionStatistics detection statistics, may be null
 * @param driftCount duplicates whose rationale drifted
 * @param attempts number of analysis attempts (reruns included)
 * @param committed true when the store was updated
 */
public record RunResult(
    ExitCode exitCode,
    String message,
    String projectName,
    Path outputDirectory,
    QualityReport qualityReport,
    List<DecisionRecord> decisions,
    Set<String> removedDecisionKeys,
    List<AnalyzerResult> analyzerResults,
    List<String> tickets,
    ScanStatistics scanStatistics,
    DetectionStatistics detectionStatistics,
    int driftCount,
    int attempts,
    boolean committed
) {
    public RunResult {
        Objects.requireNonNull(exitCode, "exitCode must not be null");
        message = message == null ? "" : message;
        projectName = projectName == null ? "project" : projectName;
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
        removedDecisionKeys = removedDecisionKeys == null ? Set.of() : Set.copyOf(removedDecisionKeys);
        analyzerResults = analyzerResults == null ? List.of() : List.copyOf(analyzerResults);
        tickets = tickets == null ? List.of() : List.copyOf(tickets);
    }

    /**
     * Creates the result of a run that ended before producing a quality report.
     *
     * @param exitCode exit code
     * @param message failure description
     * @param outputDirectory output directory, may be null
     * @return failed result
     */
    public static RunResult failed(ExitCode exitCode, String message, Path outputDirectory) {
        return new RunResult(exitCode, message, null, outputDirectory, null, List.of(), Set.of(), List.of(),
            List.of(), null, null, 0, 0, false);
    }

    public boolean isSuccess() {
        return exitCode == ExitCode.SUCCESS;
    }

    /**
     * Returns the verdict of the quality gate.
     *
     * @return recommendation, null when the run failed before validation
     */
    public Recommendation recommendation() {
        return qualityReport == null ? null : qualityReport.recommendation();
    }

    /**
     * Counts the reconciled decisions with a status, ignoring removed ones.
     *
     * @param status decision status
     * @return count
     */
    public int count(DecisionStatus status) {
        return (int) decisions.stream()
            .filter(d -> d.status() == status)
            .filter(d -> !removedDecisionKeys.contains(d.identityKey()))
            .count();
    }

    /**
     * Returns the decisions that are not duplicates and were not removed.
     *
     * @return NEW and ENRICHMENT decisions
     */
    public List<DecisionRecord> nonDuplicateDecisions() {
        return decisions.stream()
            .filter(d -> d.status() == DecisionStatus.NEW || d.status() == DecisionStatus.ENRICHMENT)
            .filter(d -> !removedDecisionKeys.contains(d.identityKey()))
            .toList();
    }
}
