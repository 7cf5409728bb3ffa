package com.sdlcimport.core.analyzer.impl;

import com.sdlcimport.core.analyzer.AnalysisContext;
import com.sdlcimport.core.analyzer.Analyzer;
import com.sdlcimport.core.analyzer.AnalyzerOutput;
import com.sdlcimport.core.analyzer.ArtifactKind;
import com.sdlcimport.core.config.CatalogLoader;
import com.sdlcimport.core.detector.EvidenceReadException;
import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.model.EvidenceRef;
import com.sdlcimport.core.model.MatchStrength;
import com.sdlcimport.core.model.StrideCategory;
import com.sdlcimport.core.model.ThreatFinding;
import com.sdlcimport.core.scanner.ScannedFile;
import com.sdlcimport.core.util.IdFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * STRIDE threat modeler driven by the threat rule catalog.
 *
 * <p>Content rules are matched against the text files of the inventory, each file read at
 * most once. Decision rules are evaluated against the known decisions. Findings are grouped
 * per rule, so one rule yields at most one finding listing every file it matched, and are
 * numbered {@code TM-NNN} in catalog order.
 *
 * <p>A finding is escalated when its severity is critical or when it discloses a credential.
 */
public class ThreatModeler implements Analyzer {

    private static final Logger log = LoggerFactory.getLogger(ThreatModeler.class);

    /** Classpath resource with the built-in rules. */
    public static final String BUILT_IN_RESOURCE = "threat-rules.yaml";

    @Override
    public String getId() {
        return "threat-model";
    }

    @Override
    public String getDisplayName() {
        return "STRIDE Threat Modeler";
    }

    @Override
    public ArtifactKind artifactKind() {
        return ArtifactKind.THREAT_MODEL;
    }

    /**
     * Loads the built-in rules followed by the given rule files; a later rule replaces an
     * earlier one with the same id.
     *
     * @param extraFiles user rule files
     * @return rules in catalog order
     */
    public static List<ThreatRule> loadRules(List<Path> extraFiles) {
        Map<String, ThreatRule> byId = new LinkedHashMap<>();
        for (ThreatRule rule : CatalogLoader.loadList(BUILT_IN_RESOURCE, extraFiles, "rules", ThreatRule.class)) {
            byId.put(rule.id(), rule);
        }
        return List.copyOf(byId.values());
    }

    @Override
    public void analyze(AnalysisContext context, AnalyzerOutput output) {
        List<ThreatRule> rules = loadRules(context.resolve(context.config().threats().ruleFiles()));

        List<CompiledRule<ThreatRule>> contentRules = new ArrayList<>();
        for (ThreatRule rule : rules) {
            if (!rule.isDecisionRule()) {
                contentRules.add(CompiledRule.compile(rule, rule.id(), rule.filePatterns(), rule.pattern()));
            }
        }

        Map<String, List<EvidenceRef>> matches = matchContent(context, contentRules);

        int sequence = 1;
        for (ThreatRule rule : rules) {
            List<EvidenceRef> refs = rule.isDecisionRule()
                ? evaluateDecisionRule(rule, context)
                : matches.getOrDefault(rule.id(), List.of());
            if (refs.isEmpty()) {
                continue;
            }
            ThreatFinding finding = new ThreatFinding(
                IdFormatter.format(IdFormatter.THREAT_PREFIX, sequence++),
                rule.id(),
                rule.title(),
                rule.stride(),
                rule.severity(),
                refs,
                shouldEscalate(rule)
            );
            log.debug("Threat {} ({}) in {} file(s)", finding.id(), rule.id(), refs.size());
            output.addThreat(finding);
        }
    }

    /**
     * Returns true if findings of a rule need immediate attention.
     *
     * @param rule threat rule
     * @return true for critical severity or disclosed credentials
     */
    static boolean shouldEscalate(ThreatRule rule) {
        return rule.severity() >= ThreatFinding.CRITICAL_SEVERITY
            || (rule.stride() == StrideCategory.INFORMATION_DISCLOSURE && rule.credential());
    }

    private Map<String, List<EvidenceRef>> matchContent(AnalysisContext context,
                                                        List<CompiledRule<ThreatRule>> rules) {
        Map<String, List<EvidenceRef>> matches = new LinkedHashMap<>();
        for (ScannedFile file : context.inventory().textFiles()) {
            List<CompiledRule<ThreatRule>> applicable = rules.stream()
                .filter(r -> r.appliesTo(file.relativePath()))
                .toList();
            if (applicable.isEmpty()) {
                continue;
            }

            String content;
            try {
                content = context.contentReader().read(file);
            } catch (EvidenceReadException e) {
                log.warn("Skipping {} for threat rules: {}", e.getFilePath(), e.getMessage());
                continue;
            }
            if (content.isEmpty()) {
                continue;
            }

            for (CompiledRule<ThreatRule> rule : applicable) {
                CompiledRule.Hit hit = rule.find(content);
                if (hit != null) {
                    matches.computeIfAbsent(rule.rule().id(), k -> new ArrayList<>())
                        .add(new EvidenceRef(file.relativePath(), hit.line(), MatchStrength.CONTENT));
                }
            }
        }
        return matches;
    }

    private static List<EvidenceRef> evaluateDecisionRule(ThreatRule rule, AnalysisContext context) {
        if (!context.hasDecisionIn(rule.requiresCategory())) {
            return List.of();
        }
        if (rule.absentCategory() != null && context.hasDecisionIn(rule.absentCategory())) {
            return List.of();
        }
        List<EvidenceRef> refs = new ArrayList<>();
        for (DecisionRecord decision : context.decisions()) {
            if (decision.category().equals(rule.requiresCategory())) {
                refs.addAll(decision.evidenceRefs());
            }
        }
        return refs;
    }
}
