package com.sdlcimport.core.util;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lexical similarity between rationale texts.
 *
 * <p>Only the first paragraph of a rationale is compared. Tokens are lower-cased words and
 * numbers; the fixed template vocabulary is removed before the Jaccard index is computed so
 * that two rationales sharing only boilerplate do not look similar.
 */
public final class TextSimilarity {

    /** Words of the deterministic rationale template. */
    public static final Set<String> TEMPLATE_VOCABULARY = Set.of(
        "was", "detected", "as", "the", "solution", "based", "on", "evidence", "in",
        "file", "files", "s", "reference", "references", "found", "indicating", "it", "is",
        "adopted", "technology", "for", "this", "concern", "and", "more"
    );

    private TextSimilarity() {
        // Utility class
    }

    /**
     * Returns the first paragraph of a text (up to the first blank line).
     *
     * @param text rationale text
     * @return first paragraph, trimmed
     */
    public static String firstParagraph(String text) {
        if (text == null) {
            return "";
        }
        String normalized = text.replace("\r\n", "\n");
        int split = normalized.indexOf("\n\n");
        return (split >= 0 ? normalized.substring(0, split) : normalized).trim();
    }

    /**
     * Tokenizes a text into lower-case word tokens without template vocabulary.
     *
     * @param text text to tokenize
     * @param extraStopWords additional words to remove (e.g. the category name)
     * @return distinct tokens
     */
    public static Set<String> tokens(String text, Collection<String> extraStopWords) {
        Set<String> tokens = new HashSet<>();
        if (text == null) {
            return tokens;
        }
        Set<String> stop = new HashSet<>();
        for (String word : extraStopWords) {
            for (String part : word.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
                stop.add(part);
            }
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (!token.isEmpty() && !TEMPLATE_VOCABULARY.contains(token) && !stop.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Jaccard similarity of the first paragraphs of two rationales.
     *
     * <p>Two texts that are both empty after normalization are identical (1.0).
     *
     * @param left first rationale
     * @param right second rationale
     * @param extraStopWords additional words removed from both sides
     * @return similarity in [0,1]
     */
    public static double similarity(String left, String right, Collection<String> extraStopWords) {
        Set<String> a = tokens(firstParagraph(left), extraStopWords);
        Set<String> b = tokens(firstParagraph(right), extraStopWords);
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }
}
