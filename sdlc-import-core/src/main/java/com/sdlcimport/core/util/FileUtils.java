package com.sdlcimport.core.util;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Converts a path below {@code root} into a relative path with {@code /} separators.
     *
     * @param root root directory
     * @param path path inside root
     * @return relative path using forward slashes
     */
    public static String toRelativePath(Path root, Path path) {
        String relative = root.relativize(path).toString();
        return relative.replace('\\', '/');
    }

    /**
     * Gets the file extension.
     *
     * @param fileName file name or relative path
     * @return lower-case file extension without dot, or empty string if no extension
     */
    public static String getExtension(String fileName) {
        int slash = fileName.lastIndexOf('/');
        String name = slash >= 0 ? fileName.substring(slash + 1) : fileName;
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(lastDot + 1).toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Gets the file name part of a relative path.
     *
     * @param relativePath relative path using forward slashes
     * @return the last path segment
     */
    public static String getFileName(String relativePath) {
        int slash = relativePath.lastIndexOf('/');
        return slash >= 0 ? relativePath.substring(slash + 1) : relativePath;
    }

    /**
     * Turns an arbitrary label into a lower-case file-name-safe slug.
     *
     * @param value label (e.g. a technology id)
     * @return slug containing only {@code [a-z0-9-]}
     */
    public static String slug(String value) {
        String slug = value.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? "item" : slug;
    }

    /**
     * Returns true if {@code candidate} lies inside {@code directory} (or is the directory).
     *
     * @param directory directory
     * @param candidate path to test
     * @return true if candidate is below directory
     */
    public static boolean isWithin(Path directory, Path candidate) {
        Path dir = directory.toAbsolutePath().normalize();
        Path path = candidate.toAbsolutePath().normalize();
        return path.startsWith(dir);
    }
}
