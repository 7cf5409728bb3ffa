package com.sdlcimport.core.detector;

import com.sdlcimport.core.config.CatalogException;
import com.sdlcimport.core.config.CatalogLoader;
import com.sdlcimport.core.model.TechnologySignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

/**
 * Registry of technology signatures.
 *
 * <p>Signatures are data: the built-in catalog {@value #BUILT_IN_RESOURCE} is loaded first,
 * then each configured signature file. A later definition with the same
 * {@code (category, id)} replaces the earlier one in place, so registration order (and with it
 * detection order) stays stable.
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * SignatureRegistry registry = SignatureRegistry.load(List.of(Path.of("extra-signatures.yaml")));
 * registry.find("database", "postgresql").ifPresent(...);
 * }</pre>
 */
public final class SignatureRegistry {

    /** Classpath resource holding the built-in signatures. */
    public static final String BUILT_IN_RESOURCE = "signatures.yaml";

    private static final Logger log = LoggerFactory.getLogger(SignatureRegistry.class);

    private final Map<String, CompiledSignature> signatures;

    private SignatureRegistry(Map<String, CompiledSignature> signatures) {
        this.signatures = signatures;
    }

    /**
     * Loads the built-in catalog followed by extra signature files.
     *
     * @param extraFiles additional signature YAML files
     * @return registry
     * @throws CatalogException if a file is unreadable or a signature is invalid
     */
    public static SignatureRegistry load(List<Path> extraFiles) {
        List<TechnologySignature> loaded = CatalogLoader.loadList(
            BUILT_IN_RESOURCE, extraFiles, "signatures", TechnologySignature.class);
        SignatureRegistry registry = of(loaded);
        log.info("Signature registry loaded: {} signatures", registry.size());
        return registry;
    }

    /**
     * Builds a registry from signatures in declaration order.
     *
     * @param definitions signatures; later duplicates of {@code (category, id)} override earlier ones
     * @return registry
     * @throws CatalogException if a regex is invalid
     */
    public static SignatureRegistry of(List<TechnologySignature> definitions) {
        Map<String, CompiledSignature> compiled = new LinkedHashMap<>();
        for (TechnologySignature signature : definitions) {
            try {
                CompiledSignature previous = compiled.put(signature.key(), CompiledSignature.compile(signature));
                if (previous != null) {
                    log.debug("Signature {} overridden by later definition", signature.key());
                }
            } catch (PatternSyntaxException e) {
                throw new CatalogException("Signature " + signature.key() + " has an invalid regex: "
                    + e.getDescription() + " in '" + e.getPattern() + "'", e);
            }
        }
        return new SignatureRegistry(compiled);
    }

    /**
     * Returns all compiled signatures in registration order.
     *
     * @return compiled signatures
     */
    public List<CompiledSignature> compiled() {
        return new ArrayList<>(signatures.values());
    }

    /**
     * Returns all signatures in registration order.
     *
     * @return signatures
     */
    public List<TechnologySignature> signatures() {
        return signatures.values().stream().map(CompiledSignature::signature).toList();
    }

    /**
     * Looks up a signature by category and id.
     *
     * @param category decision category
     * @param id technology id
     * @return the signature, if registered
     */
    public Optional<TechnologySignature> find(String category, String id) {
        CompiledSignature compiled = signatures.get(category + ":" + id);
        return Optional.ofNullable(compiled).map(CompiledSignature::signature);
    }

    /**
     * Returns the declared aliases of every technology id, in both directions.
     *
     * <p>A signature {@code postgresql} declaring {@code aliases: [postgres]} yields
     * {@code postgresql -> [postgres]} and {@code postgres -> [postgresql]}.
     *
     * @return alias sets keyed by technology id
     */
    public Map<String, Set<String>> aliasIndex() {
        Map<String, Set<String>> index = new HashMap<>();
        for (CompiledSignature compiled : signatures.values()) {
            TechnologySignature signature = compiled.signature();
            for (String alias : signature.aliases()) {
                if (alias.equals(signature.id())) {
                    continue;
                }
                index.computeIfAbsent(signature.id(), k -> new HashSet<>()).add(alias);
                index.computeIfAbsent(alias, k -> new HashSet<>()).add(signature.id());
            }
        }
        Map<String, Set<String>> frozen = new HashMap<>();
        index.forEach((id, aliases) -> frozen.put(id, Set.copyOf(aliases)));
        return Map.copyOf(frozen);
    }

    /**
     * Returns the display name of a technology, falling back to its id.
     *
     * @param category decision category
     * @param id technology id
     * @return display name
     */
    public String displayName(String category, String id) {
        return find(category, id).map(TechnologySignature::name).orElse(id);
    }

    /**
     * Returns the number of registered signatures.
     *
     * @return signature count
     */
    public int size() {
        return signatures.size();
    }
}
