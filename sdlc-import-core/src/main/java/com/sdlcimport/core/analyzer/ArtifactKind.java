package com.sdlcimport.core.analyzer;

/**
 * Kind of artifact an analyzer produces.
 */
public enum ArtifactKind {
    /** One file per diagram under {@code architecture/} */
    DIAGRAMS,

    /** {@code security/threat-model.yml} */
    THREAT_MODEL,

    /** {@code reports/tech-debt.yml} */
    DEBT_REPORT
}
