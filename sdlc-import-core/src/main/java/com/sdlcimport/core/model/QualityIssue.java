package com.sdlcimport.core.model;

import java.util.Objects;

/**
 * Represents an issue detected while validating generated artifacts.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * QualityIssue issue = QualityIssue.critical(
 *     "artifact-presence",
 *     "Required artifact is missing",
 *     "security/threat-model.yml",
 *     0.05
 * );
 * }</pre>
 *
 * @param checkerId the ID of the checker (or analyzer) that raised the issue
 * @param severity severity level of the issue
 * @param message human-readable description of the issue
 * @param artifact affected artifact path relative to the output directory, may be null
 * @param penalty score penalty applied for this issue (non-negative)
 */
public record QualityIssue(
    String checkerId,
    IssueSeverity severity,
    String message,
    String artifact,
    double penalty
) {
    /**
     * Compact constructor with validation.
     */
    public QualityIssue {
        Objects.requireNonNull(checkerId, "checkerId must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (penalty < 0 || Double.isNaN(penalty)) {
            throw new IllegalArgumentException("penalty must be >= 0: " + penalty);
        }
    }

    /**
     * Create an informational issue without penalty.
     *
     * @param checkerId the checker ID
     * @param message the message
     * @return a new QualityIssue with INFO severity
     */
    public static QualityIssue info(String checkerId, String message) {
        return new QualityIssue(checkerId, IssueSeverity.INFO, message, null, 0.0);
    }

    /**
     * Create a warning issue.
     *
     * @param checkerId the checker ID
     * @param message the message
     * @param artifact affected artifact
     * @param penalty score penalty
     * @return a new QualityIssue with WARNING severity
     */
    public static QualityIssue warning(String checkerId, String message, String artifact, double penalty) {
        return new QualityIssue(checkerId, IssueSeverity.WARNING, message, artifact, penalty);
    }

    /**
     * Create an error issue.
     *
     * @param checkerId the checker ID
     * @param message the message
     * @param artifact affected artifact
     * @param penalty score penalty
     * @return a new QualityIssue with ERROR severity
     */
    public static QualityIssue error(String checkerId, String message, String artifact, double penalty) {
        return new QualityIssue(checkerId, IssueSeverity.ERROR, message, artifact, penalty);
    }

    /**
     * Create a critical issue.
     *
     * @param checkerId the checker ID
     * @param message the message
     * @param artifact affected artifact
     * @param penalty score penalty
     * @return a new QualityIssue with CRITICAL severity
     */
    public static QualityIssue critical(String checkerId, String message, String artifact, double penalty) {
        return new QualityIssue(checkerId, IssueSeverity.CRITICAL, message, artifact, penalty);
    }

    /**
     * Returns true if this issue is critical.
     *
     * @return true for CRITICAL severity
     */
    public boolean isCritical() {
        return severity == IssueSeverity.CRITICAL;
    }
}
