package com.sdlcimport.cli;

import com.sdlcimport.core.model.QualityIssue;
import com.sdlcimport.core.model.QualityReport;
import com.sdlcimport.core.model.Recommendation;
import com.sdlcimport.core.pipeline.ApprovalDecision;
import com.sdlcimport.core.pipeline.ApprovalGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;

/**
 * Console prompt at the approval boundary.
 *
 * <p>Blocks until a valid answer is read. End of input aborts. For a REJECT verdict only
 * rerun and abort are offered.
 */
public class ConsoleApprovalGate implements ApprovalGate {

    private static final Logger log = LoggerFactory.getLogger(ConsoleApprovalGate.class);

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleApprovalGate(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public ApprovalDecision await(QualityReport report) {
        boolean rejected = report.recommendation() == Recommendation.REJECT;

        out.println();
        out.printf(Locale.ROOT, "Quality gate: %s (score %.2f)%n", report.recommendation(), report.score());
        for (QualityIssue issue : report.penalizedIssues()) {
            out.printf(Locale.ROOT, "  - [%s] %s (-%.2f)%n", issue.severity(), issue.message(), issue.penalty());
        }

        while (true) {
            out.print(rejected ? "[r]erun or a[b]ort? " : "[a]ccept, [r]erun or a[b]ort? ");
            out.flush();

            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                log.error("Cannot read answer: {}", e.getMessage());
                return ApprovalDecision.ABORT;
            }
            if (line == null) {
                return ApprovalDecision.ABORT;
            }

            switch (line.trim().toLowerCase(Locale.ROOT)) {
                case "a", "accept" -> {
                    if (!rejected) {
                        return ApprovalDecision.ACCEPT;
                    }
                    out.println("A rejected run cannot be accepted.");
                }
                case "r", "rerun" -> {
                    return ApprovalDecision.RERUN;
                }
                case "b", "abort" -> {
                    return ApprovalDecision.ABORT;
                }
                default -> out.println("Unrecognized answer: " + line);
            }
        }
    }
}
