package com.sdlcimport.core.analyzer.impl;

import com.sdlcimport.core.config.CatalogException;
import com.sdlcimport.core.detector.FileContentReader;
import com.sdlcimport.core.util.GlobMatcher;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A content rule with its file patterns and regex compiled once.
 *
 * @param rule catalog entry
 * @param files file selector, null when every text file applies
 * @param content compiled content regex
 * @param <T> rule type
 */
record CompiledRule<T>(T rule, GlobMatcher files, Pattern content) {

    static <T> CompiledRule<T> compile(T rule, String id, List<String> filePatterns, String regex) {
        try {
            return new CompiledRule<>(rule,
                filePatterns.isEmpty() ? null : GlobMatcher.of(filePatterns),
                Pattern.compile(regex, Pattern.MULTILINE));
        } catch (PatternSyntaxException e) {
            throw new CatalogException("Invalid pattern in rule " + id + ": " + e.getDescription(), e);
        }
    }

    boolean appliesTo(String relativePath) {
        return files == null || files.matches(relativePath);
    }

    /**
     * Finds the matches of the content regex.
     *
     * @param text file content
     * @return line of the first match and the number of matches, or null when none
     */
    Hit find(String text) {
        Matcher matcher = content.matcher(text);
        int first = -1;
        int count = 0;
        while (matcher.find()) {
            if (first < 0) {
                first = matcher.start();
            }
            count++;
        }
        return count == 0 ? null : new Hit(FileContentReader.lineOf(text, first), count);
    }

    record Hit(int line, int occurrences) {
    }
}
