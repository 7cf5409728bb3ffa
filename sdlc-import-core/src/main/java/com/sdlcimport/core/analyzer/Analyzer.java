package com.sdlcimport.core.analyzer;

/**
 * Service Provider Interface for stage-6 analyzers.
 *
 * <p>Analyzers consume the shared {@link AnalysisContext} and write their findings into their
 * own {@link AnalyzerOutput}. They run in parallel and share no mutable state; an exception
 * escaping {@link #analyze} fails only that analyzer.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class LicenseAnalyzer implements Analyzer {
 *     public String getId() { return "licenses"; }
 *     public String getDisplayName() { return "License Analyzer"; }
 *     public ArtifactKind artifactKind() { return ArtifactKind.DEBT_REPORT; }
 *     public void analyze(AnalysisContext context, AnalyzerOutput output) {
 *         ...
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.sdlcimport.core.analyzer.Analyzer}
 *
 * @see AnalyzerRunner
 */
public interface Analyzer {

    /**
     * Returns unique identifier for this analyzer.
     *
     * @return analyzer id (e.g. "threat-model")
     */
    String getId();

    /**
     * Returns human-readable display name.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the kind of artifact this analyzer produces.
     *
     * @return artifact kind
     */
    ArtifactKind artifactKind();

    /**
     * Returns true if this analyzer runs for the given context.
     *
     * <p>Default: runs unless its artifact kind is skipped.
     *
     * @param context analysis context
     * @return true if applicable
     */
    default boolean appliesTo(AnalysisContext context) {
        return !context.isSkipped(artifactKind());
    }

    /**
     * Analyzes the context.
     *
     * @param context shared read-only input
     * @param output this invocation's collector
     * @throws Exception on failure; partial output is kept
     */
    void analyze(AnalysisContext context, AnalyzerOutput output) throws Exception;
}
