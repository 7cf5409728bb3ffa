package com.sdlcimport.core.pipeline;

import com.sdlcimport.core.analyzer.AnalyzerResult;
import com.sdlcimport.core.model.Correction;
import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.model.DecisionStatus;
import com.sdlcimport.core.model.QualityIssue;
import com.sdlcimport.core.model.QualityReport;
import com.sdlcimport.core.model.Recommendation;

import java.util.Locale;

/**
 * Renders the Markdown summary that ends every import run.
 *
 * <p>For REVIEW and REJECT verdicts the summary lists the issues and penalties that lowered
 * the score and the corrections that were applied.
 */
public final class SummaryWriter {

    private static final String H1 = "# ";
    private static final String H2 = "## ";
    private static final String PIPE = "|";
    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final String NONE = "None";

    private SummaryWriter() {
        // Utility class
    }

    /**
     * Renders the summary of a run.
     *
     * @param result run result
     * @return Markdown document
     */
    public static String toMarkdown(RunResult result) {
        StringBuilder md = new StringBuilder();
        md.append(H1).append("Import Summary: ").append(result.projectName()).append(DOUBLE_NEWLINE);

        QualityReport report = result.qualityReport();
        md.append("**Outcome:** ").append(result.message())
            .append(" (exit code ").append(result.exitCode().getCode()).append(")").append(NEWLINE);
        if (report != null) {
            md.append(NEWLINE).append("**Verdict:** ").append(report.recommendation()).append(NEWLINE);
            md.append(NEWLINE).append("**Quality score:** ").append(format(report.score())).append(NEWLINE);
        }
        if (result.attempts() > 1) {
            md.append(NEWLINE).append("**Attempts:** ").append(result.attempts()).append(NEWLINE);
        }
        md.append(NEWLINE).append("**Store updated:** ").append(result.committed() ? "yes" : "no").append(NEWLINE);

        appendStatistics(md, result);
        appendDecisions(md, result);
        appendAnalyzers(md, result);

        if (report != null && report.recommendation() != Recommendation.ACCEPT) {
            appendIssues(md, report);
            appendCorrections(md, report);
        }

        if (!result.tickets().isEmpty()) {
            md.append(NEWLINE).append(H2).append("Tickets").append(DOUBLE_NEWLINE);
            result.tickets().forEach(ticket -> md.append("- ").append(ticket).append(NEWLINE));
        }
        return md.toString();
    }

    private static void appendStatistics(StringBuilder md, RunResult result) {
        md.append(NEWLINE).append(H2).append("Statistics").append(DOUBLE_NEWLINE);
        md.append("| Metric | Count |").append(NEWLINE);
        md.append("|--------|-------|").append(NEWLINE);
        if (result.scanStatistics() != null) {
            row(md, "Files scanned", result.scanStatistics().filesIncluded());
            row(md, "Files excluded", result.scanStatistics().filesExcluded());
        }
        if (result.detectionStatistics() != null) {
            row(md, "Evidence items", result.detectionStatistics().evidenceCount());
            row(md, "Unreadable files", result.detectionStatistics().filesFailed());
        }
        row(md, "New decisions", result.count(DecisionStatus.NEW));
        row(md, "Enriched decisions", result.count(DecisionStatus.ENRICHMENT));
        row(md, "Duplicate decisions", result.count(DecisionStatus.DUPLICATE));
        row(md, "Removed decisions", result.removedDecisionKeys().size());
        row(md, "Rationale drift", result.driftCount());
    }

    private static void appendDecisions(StringBuilder md, RunResult result) {
        md.append(NEWLINE).append(H2).append("Decisions").append(DOUBLE_NEWLINE);
        if (result.nonDuplicateDecisions().isEmpty()) {
            md.append(NONE).append(NEWLINE);
            return;
        }
        md.append("| ID | Title | Status | Confidence |").append(NEWLINE);
        md.append("|----|-------|--------|------------|").append(NEWLINE);
        for (DecisionRecord decision : result.nonDuplicateDecisions()) {
            md.append(PIPE).append(' ').append(escape(decision.id()))
                .append(' ').append(PIPE).append(' ').append(escape(decision.title()))
                .append(' ').append(PIPE).append(' ').append(decision.status())
                .append(' ').append(PIPE).append(' ').append(format(decision.confidence()))
                .append(' ').append(PIPE).append(NEWLINE);
        }
    }

    private static void appendAnalyzers(StringBuilder md, RunResult result) {
        if (result.analyzerResults().isEmpty()) {
            return;
        }
        md.append(NEWLINE).append(H2).append("Analyzers").append(DOUBLE_NEWLINE);
        md.append("| Analyzer | Status | Items |").append(NEWLINE);
        md.append("|----------|--------|-------|").append(NEWLINE);
        for (AnalyzerResult analyzer : result.analyzerResults()) {
            md.append(PIPE).append(' ').append(escape(analyzer.analyzerId()))
                .append(' ').append(PIPE).append(' ').append(analyzer.status())
                .append(' ').append(PIPE).append(' ').append(analyzer.itemCount())
                .append(' ').append(PIPE).append(NEWLINE);
        }
    }

    private static void appendIssues(StringBuilder md, QualityReport report) {
        md.append(NEWLINE).append(H2).append("Issues").append(DOUBLE_NEWLINE);
        if (report.issues().isEmpty()) {
            md.append(NONE).append(NEWLINE);
            return;
        }
        md.append("| Severity | Checker | Penalty | Message |").append(NEWLINE);
        md.append("|----------|---------|---------|---------|").append(NEWLINE);
        for (QualityIssue issue : report.issues()) {
            md.append(PIPE).append(' ').append(issue.severity())
                .append(' ').append(PIPE).append(' ').append(escape(issue.checkerId()))
                .append(' ').append(PIPE).append(' ').append(format(issue.penalty()))
                .append(' ').append(PIPE).append(' ').append(escape(issue.message()))
                .append(' ').append(PIPE).append(NEWLINE);
        }
    }

    private static void appendCorrections(StringBuilder md, QualityReport report) {
        md.append(NEWLINE).append(H2).append("Corrections Applied").append(DOUBLE_NEWLINE);
        if (report.correctionsApplied().isEmpty()) {
            md.append(NONE).append(NEWLINE);
            return;
        }
        for (Correction correction : report.correctionsApplied()) {
            md.append("- ").append(escape(correction.description()))
                .append(" (").append(correction.checkerId()).append(")").append(NEWLINE);
        }
    }

    private static void row(StringBuilder md, String metric, int count) {
        md.append(PIPE).append(' ').append(metric).append(' ').append(PIPE).append(' ')
            .append(count).append(' ').append(PIPE).append(NEWLINE);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    /**
     * Escapes table separators and line breaks.
     *
     * @param text text to escape
     * @return escaped text
     */
    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("|", "\\|").replace("\r", " ").replace("\n", " ");
    }
}
