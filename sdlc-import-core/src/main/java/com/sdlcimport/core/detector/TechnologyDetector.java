package com.sdlcimport.core.detector;

import com.sdlcimport.core.detector.CompiledSignature.CompiledDisambiguator;
import com.sdlcimport.core.model.Evidence;
import com.sdlcimport.core.model.MatchStrength;
import com.sdlcimport.core.model.TechnologySignature;
import com.sdlcimport.core.scanner.FileInventory;
import com.sdlcimport.core.scanner.ScannedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Matches inventory files against the signature registry and emits {@link Evidence}.
 *
 * <p>For every text file, each signature whose file patterns match the path is evaluated:
 * <ol>
 *   <li>a signature with content patterns needs a content match and yields {@code CONTENT}
 *       evidence pointing at the first matching line</li>
 *   <li>a path-only signature yields {@code PATH} evidence</li>
 *   <li>every disambiguator must then hold, otherwise the match is dropped</li>
 * </ol>
 *
 * <p>Evidence is deduplicated by {@code (technologyId, filePath)}, keeping the strongest
 * match; on a tie the signature registered first wins. A file that cannot be read is logged,
 * counted and skipped without affecting the rest of the tree.
 */
public class TechnologyDetector {

    private static final Logger log = LoggerFactory.getLogger(TechnologyDetector.class);

    private final SignatureRegistry registry;
    private final FileContentReader reader;

    public TechnologyDetector(SignatureRegistry registry, FileContentReader reader) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
    }

    /**
     * Detects technologies in an inventory.
     *
     * @param inventory classified file inventory
     * @return deduplicated evidence and statistics
     */
    public DetectionResult detect(FileInventory inventory) {
        List<CompiledSignature> signatures = registry.compiled();
        DetectionStatistics.Builder statistics = new DetectionStatistics.Builder();
        Map<String, Evidence> deduplicated = new LinkedHashMap<>();

        for (ScannedFile file : inventory.textFiles()) {
            List<CompiledSignature> candidates = signatures.stream()
                .filter(signature -> signature.matchesPath(file.relativePath()))
                .toList();
            if (candidates.isEmpty()) {
                continue;
            }
            statistics.incrementFilesExamined();

            String content = null;
            boolean needsContent = candidates.stream()
                .anyMatch(s -> !s.signature().isPathOnly() || s.disambiguationNeedsContent());
            if (needsContent) {
                try {
                    content = reader.read(file);
                    statistics.incrementFilesRead();
                } catch (EvidenceReadException e) {
                    log.warn("Skipping unreadable file {}: {}", e.getFilePath(), e.getMessage());
                    statistics.incrementFilesFailed();
                    statistics.addError(e.getCause() == null ? "read" : e.getCause().getClass().getSimpleName(),
                        e.getMessage());
                    continue;
                }
            }

            for (CompiledSignature candidate : candidates) {
                Evidence evidence = evaluate(candidate, file, content);
                if (evidence == null) {
                    continue;
                }
                if (!disambiguatorsHold(candidate, inventory, content)) {
                    log.debug("Signature {} rejected by disambiguator for {}", candidate.signature().key(), file.relativePath());
                    statistics.incrementRejectedByDisambiguator();
                    continue;
                }
                String key = evidence.technologyId() + "|" + evidence.filePath();
                deduplicated.merge(key, evidence, TechnologyDetector::stronger);
            }
        }

        List<Evidence> evidence = new ArrayList<>(deduplicated.values());
        evidence.sort(Comparator.comparing(Evidence::category)
            .thenComparing(Evidence::technologyId)
            .thenComparing(Evidence::filePath));
        DetectionStatistics stats = statistics.build(evidence.size());
        log.info("Detection complete: {}", stats.getSummary());
        return new DetectionResult(evidence, stats);
    }

    private Evidence evaluate(CompiledSignature candidate, ScannedFile file, String content) {
        TechnologySignature signature = candidate.signature();
        if (signature.isPathOnly()) {
            return new Evidence(signature.id(), signature.category(), file.relativePath(), null, MatchStrength.PATH);
        }
        int offset = candidate.firstContentMatch(content);
        if (offset < 0) {
            return null;
        }
        int line = FileContentReader.lineOf(content, offset);
        return new Evidence(signature.id(), signature.category(), file.relativePath(), line, MatchStrength.CONTENT);
    }

    private boolean disambiguatorsHold(CompiledSignature candidate, FileInventory inventory, String content) {
        for (CompiledDisambiguator disambiguator : candidate.disambiguators()) {
            String requiredFile = disambiguator.source().requiresFile();
            if (requiredFile != null && !requiredFile.isBlank() && !inventory.containsMatching(requiredFile)) {
                return false;
            }
            if (disambiguator.content() != null
                && (content == null || !disambiguator.content().matcher(content).find())) {
                return false;
            }
        }
        return true;
    }

    private static Evidence stronger(Evidence existing, Evidence candidate) {
        MatchStrength strongest = existing.matchStrength().strongest(candidate.matchStrength());
        return strongest == existing.matchStrength() ? existing : candidate;
    }
}
