package com.sdlcimport.core.analyzer;

import java.util.Objects;

/**
 * An analyzer result together with whatever its task produced when rendering it.
 *
 * @param result analyzer result
 * @param rendered render outcome, null when rendering itself failed
 * @param <R> render outcome type
 */
public record AnalyzerRun<R>(AnalyzerResult result, R rendered) {

    public AnalyzerRun {
        Objects.requireNonNull(result, "result must not be null");
    }
}
