package com.sdlcimport.cli;

import com.sdlcimport.core.model.QualityIssue;
import com.sdlcimport.core.model.QualityReport;
import com.sdlcimport.core.model.Recommendation;
import com.sdlcimport.core.pipeline.ApprovalDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Approval gates")
class ApprovalGateTest {

    private final ByteArrayOutputStream console = new ByteArrayOutputStream();

    @ParameterizedTest
    @CsvSource({
        "REVIEW, ACCEPT",
        "REJECT, ABORT"
    })
    @DisplayName("--yes accepts a REVIEW verdict and aborts a REJECT verdict")
    void assumeYes(Recommendation recommendation, ApprovalDecision expected) {
        AnalyzeCommand command = new AnalyzeCommand();
        new CommandLine(command).parseArgs("--yes");

        assertThat(command.approvalGate().await(report(recommendation))).isEqualTo(expected);
    }

    @Test
    @DisplayName("Without --yes the console prompt is used")
    void interactiveByDefault() {
        AnalyzeCommand command = new AnalyzeCommand();
        new CommandLine(command).parseArgs();

        assertThat(command.approvalGate()).isInstanceOf(ConsoleApprovalGate.class);
    }

    @Test
    @DisplayName("Console prompt re-asks until the answer is recognized")
    void consoleRetriesUnknownAnswers() {
        ConsoleApprovalGate gate = gate("maybe\nA\n");

        ApprovalDecision decision = gate.await(report(Recommendation.REVIEW));

        assertThat(decision).isEqualTo(ApprovalDecision.ACCEPT);
        String output = console.toString(StandardCharsets.UTF_8);
        assertThat(output).contains("Quality gate: REVIEW (score 0.75)");
        assertThat(output).contains("[WARNING] Diagram is generic (-0.05)");
        assertThat(output).contains("Unrecognized answer: maybe");
    }

    @Test
    @DisplayName("Console prompt refuses to accept a rejected run")
    void consoleRefusesAcceptOnReject() {
        ConsoleApprovalGate gate = gate("accept\nrerun\n");

        ApprovalDecision decision = gate.await(report(Recommendation.REJECT));

        assertThat(decision).isEqualTo(ApprovalDecision.RERUN);
        assertThat(console.toString(StandardCharsets.UTF_8)).contains("A rejected run cannot be accepted.");
    }

    @Test
    @DisplayName("End of input aborts")
    void consoleAbortsOnEndOfInput() {
        assertThat(gate("").await(report(Recommendation.REVIEW))).isEqualTo(ApprovalDecision.ABORT);
    }

    private ConsoleApprovalGate gate(String input) {
        return new ConsoleApprovalGate(new BufferedReader(new StringReader(input)),
            new PrintStream(console, true, StandardCharsets.UTF_8));
    }

    private static QualityReport report(Recommendation recommendation) {
        return new QualityReport(0.75,
            List.of(QualityIssue.warning("diagram-specificity", "Diagram is generic", "architecture/data-flow.yml", 0.05)),
            List.of(), recommendation);
    }
}
