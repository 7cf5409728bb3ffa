package com.sdlcimport.core.analyzer.impl;

import com.sdlcimport.core.analyzer.AnalysisContext;
import com.sdlcimport.core.analyzer.Analyzer;
import com.sdlcimport.core.analyzer.AnalyzerOutput;
import com.sdlcimport.core.analyzer.ArtifactKind;
import com.sdlcimport.core.config.CatalogLoader;
import com.sdlcimport.core.detector.EvidenceReadException;
import com.sdlcimport.core.model.DebtItem;
import com.sdlcimport.core.model.DebtPriority;
import com.sdlcimport.core.scanner.FileKind;
import com.sdlcimport.core.scanner.ScannedFile;
import com.sdlcimport.core.util.Categories;
import com.sdlcimport.core.util.IdFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Technical debt detector driven by the debt rule catalog.
 *
 * <p>Each content rule yields one item per matching file, located at its first match. Two
 * checks are built in: source files longer than {@code debt.maxLinesPerFile}, and source code
 * without any testing decision. Items are ordered by priority and numbered {@code TD-NNN}.
 */
public class DebtDetector implements Analyzer {

    private static final Logger log = LoggerFactory.getLogger(DebtDetector.class);

    /** Classpath resource with the built-in rules. */
    public static final String BUILT_IN_RESOURCE = "debt-rules.yaml";

    static final String OVERSIZED_FILE_RULE = "oversized-file";
    static final String MISSING_TESTS_RULE = "missing-test-framework";

    private static final int LINES_PER_EFFORT_HOUR = 250;
    private static final double MISSING_TESTS_EFFORT_HOURS = 16.0;

    @Override
    public String getId() {
        return "tech-debt";
    }

    @Override
    public String getDisplayName() {
        return "Technical Debt Detector";
    }

    @Override
    public ArtifactKind artifactKind() {
        return ArtifactKind.DEBT_REPORT;
    }

    /**
     * Loads the built-in rules followed by the given rule files; a later rule replaces an
     * earlier one with the same id.
     *
     * @param extraFiles user rule files
     * @return rules in catalog order
     */
    public static List<DebtRule> loadRules(List<Path> extraFiles) {
        Map<String, DebtRule> byId = new LinkedHashMap<>();
        for (DebtRule rule : CatalogLoader.loadList(BUILT_IN_RESOURCE, extraFiles, "rules", DebtRule.class)) {
            byId.put(rule.id(), rule);
        }
        return List.copyOf(byId.values());
    }

    @Override
    public void analyze(AnalysisContext context, AnalyzerOutput output) {
        List<CompiledRule<DebtRule>> rules = loadRules(context.resolve(context.config().debt().ruleFiles()))
            .stream()
            .map(r -> CompiledRule.compile(r, r.id(), r.filePatterns(), r.pattern()))
            .toList();

        List<Draft> drafts = new ArrayList<>();
        matchContent(context, rules, drafts);
        findOversizedFiles(context, drafts);
        findMissingTests(context, drafts);

        drafts.sort(Comparator.comparing(Draft::priority).thenComparingInt(Draft::order));
        int sequence = 1;
        for (Draft draft : drafts) {
            output.addDebtItem(new DebtItem(
                IdFormatter.format(IdFormatter.DEBT_PREFIX, sequence++),
                draft.ruleId(),
                draft.title(),
                draft.priority(),
                draft.category(),
                draft.location(),
                draft.effortHours()
            ));
        }
        log.debug("Detected {} debt item(s)", drafts.size());
    }

    private void matchContent(AnalysisContext context, List<CompiledRule<DebtRule>> rules, List<Draft> drafts) {
        for (ScannedFile file : context.inventory().textFiles()) {
            List<CompiledRule<DebtRule>> applicable = rules.stream()
                .filter(r -> r.appliesTo(file.relativePath()))
                .toList();
            if (applicable.isEmpty()) {
                continue;
            }

            String content;
            try {
                content = context.contentReader().read(file);
            } catch (EvidenceReadException e) {
                log.warn("Skipping {} for debt rules: {}", e.getFilePath(), e.getMessage());
                continue;
            }
            if (content.isEmpty()) {
                continue;
            }

            for (CompiledRule<DebtRule> compiled : applicable) {
                CompiledRule.Hit hit = compiled.find(content);
                if (hit == null) {
                    continue;
                }
                DebtRule rule = compiled.rule();
                double effort = rule.perOccurrence() ? rule.effortHours() * hit.occurrences() : rule.effortHours();
                drafts.add(new Draft(rules.indexOf(compiled), rule.id(), rule.title(), rule.priority(),
                    rule.category(), file.relativePath() + ":" + hit.line(), effort));
            }
        }
    }

    private void findOversizedFiles(AnalysisContext context, List<Draft> drafts) {
        int maxLines = context.config().debt().maxLinesPerFile();
        for (ScannedFile file : context.inventory().filesOfKind(FileKind.SOURCE)) {
            long lines;
            try {
                lines = countLines(file.absolutePath());
            } catch (IOException e) {
                log.warn("Cannot count lines of {}: {}", file.relativePath(), e.getMessage());
                continue;
            }
            if (lines > maxLines) {
                drafts.add(new Draft(Integer.MAX_VALUE - 1, OVERSIZED_FILE_RULE,
                    "Oversized source file (" + lines + " lines)", DebtPriority.P2, "code-smell",
                    file.relativePath(), Math.max(2.0, (double) lines / LINES_PER_EFFORT_HOUR)));
            }
        }
    }

    private void findMissingTests(AnalysisContext context, List<Draft> drafts) {
        if (context.inventory().filesOfKind(FileKind.SOURCE).isEmpty()
            || context.hasDecisionIn(Categories.TESTING)) {
            return;
        }
        drafts.add(new Draft(Integer.MAX_VALUE, MISSING_TESTS_RULE, "No automated test framework detected",
            DebtPriority.P1, Categories.TESTING, ".", MISSING_TESTS_EFFORT_HOURS));
    }

    /**
     * Counts lines without holding the file in memory.
     *
     * @param path file to count
     * @return number of lines
     * @throws IOException if the file cannot be read
     */
    static long countLines(Path path) throws IOException {
        long lines = 0;
        boolean pending = false;
        byte[] buffer = new byte[8192];
        try (InputStream in = Files.newInputStream(path)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                for (int i = 0; i < read; i++) {
                    if (buffer[i] == '\n') {
                        lines++;
                        pending = false;
                    } else {
                        pending = true;
                    }
                }
            }
        }
        return pending ? lines + 1 : lines;
    }

    /**
     * Item before numbering; {@code order} keeps catalog order inside one priority.
     */
    private record Draft(int order, String ruleId, String title, DebtPriority priority,
                         String category, String location, double effortHours) {
    }
}
