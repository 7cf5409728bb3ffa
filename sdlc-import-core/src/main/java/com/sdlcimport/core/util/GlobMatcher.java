package com.sdlcimport.core.util;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Glob matching over relative paths with {@code /} separators.
 *
 * <p>Matching rules:
 * <ul>
 *   <li>a pattern without {@code /} matches the file name (e.g. {@code pom.xml})</li>
 *   <li>a pattern starting with {@code **}{@code /} also matches at the root
 *       ({@code **}{@code /Dockerfile} matches {@code Dockerfile})</li>
 *   <li>any other pattern matches the whole relative path</li>
 * </ul>
 *
 * <p>Compiled matchers are cached; instances are safe to share between threads.
 */
public final class GlobMatcher {

    private static final Map<String, PathMatcher> CACHE = new ConcurrentHashMap<>();

    private final List<String> patterns;

    private GlobMatcher(List<String> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    /**
     * Creates a matcher accepting a path when any of the patterns matches.
     *
     * @param patterns glob patterns
     * @return matcher
     */
    public static GlobMatcher of(Collection<String> patterns) {
        return new GlobMatcher(new ArrayList<>(patterns));
    }

    /**
     * Returns true if any pattern matches the relative path.
     *
     * @param relativePath path relative to the scanned root, {@code /}-separated
     * @return true on match
     */
    public boolean matches(String relativePath) {
        for (String pattern : patterns) {
            if (matches(pattern, relativePath)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns true if a single glob pattern matches the relative path.
     *
     * @param pattern glob pattern
     * @param relativePath path relative to the scanned root, {@code /}-separated
     * @return true on match
     */
    public static boolean matches(String pattern, String relativePath) {
        if (pattern == null || pattern.isBlank() || relativePath == null || relativePath.isEmpty()) {
            return false;
        }
        if (!pattern.contains("/")) {
            return compiled(pattern).matches(Path.of(FileUtils.getFileName(relativePath)));
        }
        Path path = Path.of(relativePath);
        if (compiled(pattern).matches(path)) {
            return true;
        }
        return pattern.startsWith("**/") && matches(pattern.substring(3), relativePath);
    }

    /**
     * Returns the patterns of this matcher.
     *
     * @return patterns
     */
    public List<String> patterns() {
        return patterns;
    }

    private static PathMatcher compiled(String pattern) {
        return CACHE.computeIfAbsent(pattern,
            p -> FileSystems.getDefault().getPathMatcher("glob:" + p));
    }
}
