package com.sdlcimport.core.validator;

import com.sdlcimport.core.config.ImportConfig;
import com.sdlcimport.core.model.QualityIssue;
import com.sdlcimport.core.model.QualityReport;
import com.sdlcimport.core.model.Recommendation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link QualityGate}.
 */
class QualityGateTest {

    private final QualityGate gate = new QualityGate(ImportConfig.defaults().validation());

    @Test
    void evaluate_noIssues_acceptsWithFullScore() {
        QualityReport report = gate.evaluate(new ValidationOutcome(List.of(), List.of(), Set.of()));

        assertThat(report.score()).isEqualTo(1.0);
        assertThat(report.recommendation()).isEqualTo(Recommendation.ACCEPT);
    }

    @Test
    void evaluate_threeSmallPenalties_landExactlyOnAcceptThreshold() {
        // Given
        List<QualityIssue> issues = List.of(
            QualityIssue.warning("a", "one", null, 0.05),
            QualityIssue.warning("a", "two", null, 0.05),
            QualityIssue.warning("a", "three", null, 0.05));

        // When
        QualityReport report = gate.evaluate(new ValidationOutcome(issues, List.of(), Set.of()));

        // Then
        assertThat(report.score()).isEqualTo(0.85);
        assertThat(report.recommendation()).isEqualTo(Recommendation.ACCEPT);
        assertThat(report.penalizedIssues()).hasSize(3);
    }

    @Test
    void evaluate_criticalIssue_rejectsRegardlessOfScore() {
        QualityReport report = gate.evaluate(new ValidationOutcome(
            List.of(QualityIssue.critical("artifact-presence", "missing", "reports/tech-debt.yml", 0.0)),
            List.of(), Set.of()));

        assertThat(report.score()).isEqualTo(1.0);
        assertThat(report.hasCriticalIssue()).isTrue();
        assertThat(report.recommendation()).isEqualTo(Recommendation.REJECT);
    }

    @Test
    void evaluate_scoreNeverDropsBelowZero() {
        List<QualityIssue> issues = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            issues.add(QualityIssue.error("x", "issue " + i, null, 0.10));
        }

        QualityReport report = gate.evaluate(new ValidationOutcome(issues, List.of(), Set.of()));

        assertThat(report.score()).isZero();
        assertThat(report.recommendation()).isEqualTo(Recommendation.REJECT);
    }

    @Test
    void score_isMonotonicInIssues() {
        List<QualityIssue> issues = new ArrayList<>();
        double previous = gate.score(new ValidationOutcome(issues, null, null));
        for (int i = 0; i < 5; i++) {
            issues.add(QualityIssue.warning("x", "issue " + i, null, 0.05));
            double current = gate.score(new ValidationOutcome(issues, null, null));
            assertThat(current).isLessThanOrEqualTo(previous);
            previous = current;
        }
    }

    @ParameterizedTest
    @CsvSource({
        "1.0,  ACCEPT",
        "0.85, ACCEPT",
        "0.84, REVIEW",
        "0.70, REVIEW",
        "0.69, REJECT",
        "0.0,  REJECT"
    })
    void recommend_thresholdsAreInclusive(double score, Recommendation expected) {
        assertThat(gate.recommend(score, false)).isEqualTo(expected);
    }
}
