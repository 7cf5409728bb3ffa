package com.sdlcimport.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Registry entry describing how to recognise one technology.
 *
 * <p>Signatures are data, not code: adding a technology means adding an entry to a signature
 * YAML file. The same technology id may appear under several categories (for example Redis as
 * {@code caching} and as {@code messaging}).
 *
 * <p><b>Example YAML:</b></p>
 * <pre>{@code
 * - id: postgresql
 *   name: PostgreSQL
 *   category: database
 *   kind: SERVICE
 *   filePatterns: ["*.yml", "*.properties", "pom.xml"]
 *   contentPatterns: ["jdbc:postgresql", "org\\.postgresql"]
 *   aliases: ["postgres"]
 * }</pre>
 *
 * <p>{@code aliases} names other ids the same technology has been recorded under. Only a
 * persisted decision whose technology is a declared alias can be reconciled with a candidate of
 * a different id.
 *
 * @param id technology identifier (kebab-case)
 * @param name display name
 * @param category decision category (see {@link com.sdlcimport.core.util.Categories})
 * @param kind technology kind
 * @param filePatterns glob patterns matched against the relative path or file name
 * @param contentPatterns regular expressions, any of which must match the content; empty means path-only
 * @param disambiguators additional conditions, all of which must hold
 * @param aliases other ids of the same technology
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TechnologySignature(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("category") String category,
    @JsonProperty("kind") SignatureKind kind,
    @JsonProperty("filePatterns") List<String> filePatterns,
    @JsonProperty("contentPatterns") List<String> contentPatterns,
    @JsonProperty("disambiguators") List<Disambiguator> disambiguators,
    @JsonProperty("aliases") List<String> aliases
) {
    /**
     * Compact constructor with validation.
     */
    public TechnologySignature {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(category, "category must not be null");
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (kind == null) {
            kind = SignatureKind.LIBRARY;
        }
        filePatterns = filePatterns == null ? List.of() : List.copyOf(filePatterns);
        contentPatterns = contentPatterns == null ? List.of() : List.copyOf(contentPatterns);
        disambiguators = disambiguators == null ? List.of() : List.copyOf(disambiguators);
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        if (filePatterns.isEmpty()) {
            throw new IllegalArgumentException("signature " + id + " has no filePatterns");
        }
    }

    /**
     * Returns the registry key of this signature.
     *
     * @return {@code category:id}
     */
    public String key() {
        return category + ":" + id;
    }

    /**
     * Returns true if a path match alone is enough evidence.
     *
     * @return true when no content patterns are defined
     */
    @JsonIgnore
    public boolean isPathOnly() {
        return contentPatterns.isEmpty();
    }
}
