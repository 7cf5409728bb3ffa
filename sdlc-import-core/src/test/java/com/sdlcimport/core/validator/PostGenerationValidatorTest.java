package com.sdlcimport.core.validator;

import com.sdlcimport.core.analyzer.AnalyzerOutput;
import com.sdlcimport.core.analyzer.AnalyzerResult;
import com.sdlcimport.core.analyzer.ArtifactKind;
import com.sdlcimport.core.config.ImportConfig;
import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.model.DecisionStatus;
import com.sdlcimport.core.model.EvidenceRef;
import com.sdlcimport.core.model.IssueSeverity;
import com.sdlcimport.core.model.MatchStrength;
import com.sdlcimport.core.model.QualityIssue;
import com.sdlcimport.core.renderer.ArtifactRenderer;
import com.sdlcimport.core.renderer.OutputLayout;
import com.sdlcimport.core.renderer.RenderReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link PostGenerationValidator}.
 */
class PostGenerationValidatorTest {

    @TempDir
    Path tempDir;

    @Test
    void validate_failedAnalyzerAndPollutedDecision() {
        // Given
        ArtifactRenderer renderer = ArtifactRenderer.forDirectory(tempDir);
        DecisionRecord polluted = new DecisionRecord("ADR-IMPORT-001", "database", "h2", null, null, "rationale",
            null, 0.6, List.of(new EvidenceRef("src/test/resources/app.yml", 1, MatchStrength.CONTENT)),
            DecisionStatus.NEW, null);
        RenderReport rendered = renderer.renderDecisions("shop", List.of(polluted), ImportConfig.defaults().scoring());
        AnalyzerResult failedDebt = AnalyzerResult.failed("tech-debt", ArtifactKind.DEBT_REPORT, new AnalyzerOutput(),
            "IOException: gone");
        rendered = rendered.merge(renderer.renderAnalyzerResult("shop", failedDebt));
        ValidationContext context = new ValidationContext("shop", List.of(polluted), List.of(failedDebt), rendered,
            renderer, Set.of("h2"), Set.of(ArtifactKind.DIAGRAMS, ArtifactKind.THREAT_MODEL),
            ImportConfig.defaults().validation(), Set.of());

        // When
        ValidationOutcome outcome = new PostGenerationValidator().validate(context);

        // Then
        assertThat(outcome.issues())
            .extracting(QualityIssue::checkerId, QualityIssue::severity)
            .containsExactly(
                tuple(PostGenerationValidator.UPSTREAM_CHECKER_ID, IssueSeverity.ERROR),
                tuple("evidence-pollution", IssueSeverity.WARNING));
        assertThat(outcome.removedDecisionKeys()).containsExactly("database::h2");
        assertThat(new QualityGate(ImportConfig.defaults().validation()).evaluate(outcome).score()).isEqualTo(0.85);
        assertThat(renderer.exists(OutputLayout.TECH_DEBT)).isTrue();
    }

    @Test
    void validate_runsCheckersInOrderAndPassesRemovalsForward() {
        // Given
        List<String> seen = new ArrayList<>();
        QualityChecker remover = new QualityChecker() {
            @Override
            public String getId() {
                return "remover";
            }

            @Override
            public CheckResult check(ValidationContext context) {
                seen.add("remover");
                return new CheckResult(List.of(), List.of(), Set.of("database::h2"), null);
            }
        };
        QualityChecker observer = new QualityChecker() {
            @Override
            public String getId() {
                return "observer";
            }

            @Override
            public CheckResult check(ValidationContext context) {
                seen.add("observer:" + context.removedDecisionKeys());
                return CheckResult.clean();
            }
        };
        ValidationContext context = new ValidationContext("shop", List.of(), List.of(), null,
            ArtifactRenderer.forDirectory(tempDir), Set.of(), Set.of(), ImportConfig.defaults().validation(), Set.of());

        // When
        ValidationOutcome outcome = new PostGenerationValidator(List.of(remover, observer)).validate(context);

        // Then
        assertThat(seen).containsExactly("remover", "observer:[database::h2]");
        assertThat(outcome.issues()).isEmpty();
    }
}
