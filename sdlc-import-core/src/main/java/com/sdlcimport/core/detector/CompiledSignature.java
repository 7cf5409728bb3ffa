package com.sdlcimport.core.detector;

import com.sdlcimport.core.model.Disambiguator;
import com.sdlcimport.core.model.TechnologySignature;
import com.sdlcimport.core.util.GlobMatcher;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A {@link TechnologySignature} with its globs and regexes compiled.
 *
 * @param signature source signature
 * @param files file pattern matcher
 * @param contentPatterns compiled content regexes
 * @param disambiguators compiled disambiguators
 */
public record CompiledSignature(
    TechnologySignature signature,
    GlobMatcher files,
    List<Pattern> contentPatterns,
    List<CompiledDisambiguator> disambiguators
) {
    /**
     * Compiles a signature.
     *
     * @param signature signature to compile
     * @return compiled signature
     * @throws java.util.regex.PatternSyntaxException if a regex is invalid
     */
    public static CompiledSignature compile(TechnologySignature signature) {
        List<Pattern> content = signature.contentPatterns().stream()
            .map(CompiledSignature::regex)
            .toList();
        List<CompiledDisambiguator> disambiguators = signature.disambiguators().stream()
            .map(d -> new CompiledDisambiguator(d, d.needsContent() ? regex(d.requiresContent()) : null))
            .toList();
        return new CompiledSignature(signature, GlobMatcher.of(signature.filePatterns()), content, disambiguators);
    }

    /**
     * Returns true if the signature's file patterns match a path.
     *
     * @param relativePath relative path
     * @return true on match
     */
    public boolean matchesPath(String relativePath) {
        return files.matches(relativePath);
    }

    /**
     * Finds the earliest content match over all content patterns.
     *
     * @param content file content
     * @return offset of the earliest match, or -1 when nothing matches
     */
    public int firstContentMatch(String content) {
        int earliest = -1;
        for (Pattern pattern : contentPatterns) {
            Matcher matcher = pattern.matcher(content);
            if (matcher.find() && (earliest < 0 || matcher.start() < earliest)) {
                earliest = matcher.start();
            }
        }
        return earliest;
    }

    /**
     * Returns true if any disambiguator inspects file content.
     *
     * @return true when content is needed to evaluate disambiguators
     */
    public boolean disambiguationNeedsContent() {
        return disambiguators.stream().anyMatch(d -> d.content() != null);
    }

    static Pattern regex(String expression) {
        return Pattern.compile(expression, Pattern.MULTILINE);
    }

    /**
     * A disambiguator with its content regex compiled.
     *
     * @param source source disambiguator
     * @param content compiled content regex, null when the disambiguator only requires a file
     */
    public record CompiledDisambiguator(Disambiguator source, Pattern content) {
    }
}
