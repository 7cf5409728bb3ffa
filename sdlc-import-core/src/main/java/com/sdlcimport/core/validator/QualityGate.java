package com.sdlcimport.core.validator;

import com.sdlcimport.core.config.ImportConfig;
import com.sdlcimport.core.model.QualityIssue;
import com.sdlcimport.core.model.QualityReport;
import com.sdlcimport.core.model.Recommendation;

import java.math.BigDecimal;

/**
 * Turns validation issues into a score and a verdict.
 *
 * <p>The score starts at 1.0 and every penalty is subtracted in decimal arithmetic, floored
 * at 0.0. A CRITICAL issue always rejects; otherwise the score is compared with the accept and
 * review thresholds, both inclusive.
 */
public class QualityGate {

    private final ImportConfig.ValidationConfig config;

    public QualityGate(ImportConfig.ValidationConfig config) {
        this.config = config;
    }

    /**
     * Evaluates the outcome of validation.
     *
     * @param outcome validation outcome
     * @return quality report
     */
    public QualityReport evaluate(ValidationOutcome outcome) {
        double score = score(outcome);
        boolean critical = outcome.issues().stream().anyMatch(QualityIssue::isCritical);
        return new QualityReport(score, outcome.issues(), outcome.corrections(), recommend(score, critical));
    }

    double score(ValidationOutcome outcome) {
        BigDecimal score = BigDecimal.ONE;
        for (QualityIssue issue : outcome.issues()) {
            score = score.subtract(BigDecimal.valueOf(issue.penalty()));
        }
        return score.max(BigDecimal.ZERO).doubleValue();
    }

    Recommendation recommend(double score, boolean critical) {
        if (critical) {
            return Recommendation.REJECT;
        }
        if (BigDecimal.valueOf(score).compareTo(BigDecimal.valueOf(config.acceptThreshold())) >= 0) {
            return Recommendation.ACCEPT;
        }
        if (BigDecimal.valueOf(score).compareTo(BigDecimal.valueOf(config.reviewThreshold())) >= 0) {
            return Recommendation.REVIEW;
        }
        return Recommendation.REJECT;
    }
}
