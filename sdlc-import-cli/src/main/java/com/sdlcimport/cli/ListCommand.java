package com.sdlcimport.cli;

import com.sdlcimport.core.analyzer.impl.DebtDetector;
import com.sdlcimport.core.analyzer.impl.DebtRule;
import com.sdlcimport.core.analyzer.impl.ThreatModeler;
import com.sdlcimport.core.analyzer.impl.ThreatRule;
import com.sdlcimport.core.config.CatalogException;
import com.sdlcimport.core.detector.SignatureRegistry;
import com.sdlcimport.core.model.TechnologySignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list the built-in catalogs.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * sdlc-import list signatures
 * sdlc-import list threat-rules
 * sdlc-import list debt-rules
 * }</pre>
 */
@Command(
    name = "list",
    description = "List built-in technology signatures, threat rules or debt rules",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Catalog to list: signatures, threat-rules or debt-rules"
    )
    private String type;

    @Override
    public Integer call() {
        try {
            return switch (type.toLowerCase(Locale.ROOT)) {
                case "signatures", "signature" -> listSignatures();
                case "threat-rules", "threats" -> listThreatRules();
                case "debt-rules", "debt" -> listDebtRules();
                default -> {
                    log.error("Unknown type: {}. Use: signatures, threat-rules or debt-rules", type);
                    yield 1;
                }
            };
        } catch (CatalogException e) {
            log.error("Cannot load catalog: {}", e.getMessage());
            return 1;
        }
    }

    private int listSignatures() {
        SignatureRegistry registry = SignatureRegistry.load(List.of());
        System.out.println("Technology Signatures (" + registry.size() + "):");
        System.out.println();
        String category = null;
        for (TechnologySignature signature : registry.signatures()) {
            if (!signature.category().equals(category)) {
                category = signature.category();
                System.out.println("  " + category);
            }
            System.out.printf("    • %s (ID: %s)%n", signature.name(), signature.id());
        }
        return 0;
    }

    private int listThreatRules() {
        List<ThreatRule> rules = ThreatModeler.loadRules(List.of());
        System.out.println("Threat Rules (" + rules.size() + "):");
        System.out.println();
        for (ThreatRule rule : rules) {
            System.out.printf(Locale.ROOT, "  • %s (ID: %s)%n", rule.title(), rule.id());
            System.out.printf(Locale.ROOT, "    STRIDE: %s, severity %.1f%s%n", rule.stride().getDisplayName(),
                rule.severity(), rule.credential() ? ", credential" : "");
        }
        return 0;
    }

    private int listDebtRules() {
        List<DebtRule> rules = DebtDetector.loadRules(List.of());
        System.out.println("Debt Rules (" + rules.size() + "):");
        System.out.println();
        for (DebtRule rule : rules) {
            System.out.printf(Locale.ROOT, "  • %s (ID: %s)%n", rule.title(), rule.id());
            System.out.printf(Locale.ROOT, "    %s, %s, %.1fh%s%n", rule.priority(), rule.category(),
                rule.effortHours(), rule.perOccurrence() ? " per occurrence" : "");
        }
        return 0;
    }
}
