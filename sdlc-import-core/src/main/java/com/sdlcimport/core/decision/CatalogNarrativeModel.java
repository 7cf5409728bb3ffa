package com.sdlcimport.core.decision;

import com.sdlcimport.core.config.CatalogLoader;
import com.sdlcimport.core.model.Consequences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Offline narrative model backed by the {@value #RESOURCE} catalog.
 *
 * <p>The elaboration is the category context with the technology name filled in, followed by
 * the expected trade-offs. Output depends only on the request, so repeated runs produce
 * identical rationales.
 *
 * <p><b>Catalog format:</b></p>
 * <pre>{@code
 * narratives:
 *   - category: database
 *     context: "{name} is the system of record for persistent state."
 *     positive: ["Mature transactional guarantees"]
 *     negative: ["Schema migrations must be managed"]
 * }</pre>
 */
public class CatalogNarrativeModel implements NarrativeModel {

    /** Classpath resource holding the narrative catalog. */
    public static final String RESOURCE = "narratives.yaml";

    private static final Logger log = LoggerFactory.getLogger(CatalogNarrativeModel.class);

    private final Map<String, NarrativeEntry> entries;

    /**
     * Creates a model over explicit catalog entries.
     *
     * @param entries narrative entries; later entries for a category replace earlier ones
     */
    public CatalogNarrativeModel(List<NarrativeEntry> entries) {
        Map<String, NarrativeEntry> byCategory = new LinkedHashMap<>();
        for (NarrativeEntry entry : entries) {
            byCategory.put(entry.category(), entry);
        }
        this.entries = Map.copyOf(byCategory);
    }

    /**
     * Loads the built-in catalog.
     *
     * @return catalog model
     */
    public static CatalogNarrativeModel loadDefault() {
        List<NarrativeEntry> entries = CatalogLoader.loadList(RESOURCE, List.of(), "narratives", NarrativeEntry.class);
        log.debug("Narrative catalog loaded: {} categories", entries.size());
        return new CatalogNarrativeModel(entries);
    }

    @Override
    public String getId() {
        return "catalog";
    }

    @Override
    public String elaborate(NarrativeRequest request) throws SynthesisException {
        NarrativeEntry entry = entries.get(request.category());
        if (entry == null) {
            throw new SynthesisException("No narrative for category '" + request.category() + "'");
        }
        if (entry.context() == null || entry.context().isBlank()) {
            throw new SynthesisException("Narrative for category '" + request.category() + "' has no context");
        }

        StringBuilder sb = new StringBuilder(entry.context().replace("{name}", request.technologyName()).trim());
        Consequences consequences = entry.consequencesFor(request.technologyId());
        if (!consequences.positive().isEmpty()) {
            sb.append(" Expected benefits: ").append(joinSentence(consequences.positive())).append('.');
        }
        if (!consequences.negative().isEmpty()) {
            sb.append(" Trade-offs to manage: ").append(joinSentence(consequences.negative())).append('.');
        }
        return sb.toString();
    }

    @Override
    public Consequences consequences(String category, String technologyId) {
        NarrativeEntry entry = entries.get(category);
        return entry == null ? Consequences.none() : entry.consequencesFor(technologyId);
    }

    private static String joinSentence(List<String> parts) {
        return String.join("; ", parts.stream().map(p -> lowerFirst(stripPeriod(p))).toList());
    }

    private static String stripPeriod(String value) {
        String trimmed = value.trim();
        return trimmed.endsWith(".") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    private static String lowerFirst(String value) {
        if (value.length() < 2 || Character.isUpperCase(value.charAt(1))) {
            return value;
        }
        return Character.toLowerCase(value.charAt(0)) + value.substring(1);
    }
}
