package com.sdlcimport.core.renderer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of rendering one or more artifacts.
 *
 * @param written paths written successfully
 * @param failures paths that could not be written, with the reason
 */
public record RenderReport(List<String> written, Map<String, String> failures) {

    public RenderReport {
        written = written == null ? List.of() : List.copyOf(written);
        failures = failures == null ? Map.of() : Map.copyOf(failures);
    }

    public static RenderReport empty() {
        return new RenderReport(List.of(), Map.of());
    }

    public static RenderReport written(String path) {
        return new RenderReport(List.of(path), Map.of());
    }

    public static RenderReport failed(String path, String reason) {
        return new RenderReport(List.of(), Map.of(path, reason));
    }

    /**
     * Combines two reports; a later failure of a path supersedes an earlier write and vice versa.
     *
     * @param other report to add
     * @return combined report
     */
    public RenderReport merge(RenderReport other) {
        List<String> paths = new ArrayList<>(written);
        Map<String, String> failed = new LinkedHashMap<>(failures);
        for (String path : other.written) {
            failed.remove(path);
            if (!paths.contains(path)) {
                paths.add(path);
            }
        }
        for (Map.Entry<String, String> failure : other.failures.entrySet()) {
            paths.remove(failure.getKey());
            failed.put(failure.getKey(), failure.getValue());
        }
        return new RenderReport(paths, failed);
    }

    /**
     * Returns every path that should exist: written and failed ones.
     *
     * @return expected paths
     */
    public List<String> expectedPaths() {
        List<String> expected = new ArrayList<>(written);
        expected.addAll(failures.keySet());
        return expected;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
