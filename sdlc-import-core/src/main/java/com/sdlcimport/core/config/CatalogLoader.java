package com.sdlcimport.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads data-driven catalogs from YAML.
 *
 * <p>A catalog is a built-in classpath resource followed by any number of user files. Each
 * document holds a list under a fixed root key:
 * <pre>{@code
 * signatures:
 *   - id: postgresql
 *     category: database
 *     filePatterns: ["*.yml", "*.properties"]
 *     contentPatterns: ["jdbc:postgresql:"]
 * }</pre>
 *
 * <p>Unlike {@link ConfigLoader}, a broken catalog is not replaced by defaults: it fails with a
 * {@link CatalogException} naming the file and entry.
 */
public final class CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private CatalogLoader() {
        // Utility class
    }

    /**
     * Loads the entries of a classpath resource and then of each extra file, in order.
     *
     * @param resource classpath resource name (e.g. {@code signatures.yaml})
     * @param extraFiles user catalog files applied after the resource
     * @param rootKey key holding the entry list
     * @param type entry type
     * @param <T> entry type
     * @return entries in load order
     * @throws CatalogException if a source is missing, unparsable or holds an invalid entry
     */
    public static <T> List<T> loadList(String resource, List<Path> extraFiles, String rootKey, Class<T> type) {
        List<T> entries = new ArrayList<>(convertList(readResource(resource), resource, rootKey, type));
        for (Path file : extraFiles) {
            entries.addAll(convertList(readFile(file), file.toString(), rootKey, type));
        }
        log.debug("Loaded {} {} entries from {} and {} extra file(s)", entries.size(), rootKey, resource, extraFiles.size());
        return entries;
    }

    /**
     * Reads a classpath YAML resource into a tree.
     *
     * @param resource classpath resource name
     * @return parsed tree
     * @throws CatalogException if the resource is missing or unparsable
     */
    public static JsonNode readResource(String resource) {
        try (InputStream in = CatalogLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new CatalogException("Catalog resource not found on classpath: " + resource);
            }
            return YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new CatalogException("Failed to parse catalog resource " + resource + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a YAML file into a tree.
     *
     * @param file catalog file
     * @return parsed tree
     * @throws CatalogException if the file is missing or unparsable
     */
    public static JsonNode readFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new CatalogException("Catalog file not found: " + file);
        }
        try {
            return YAML_MAPPER.readTree(file.toFile());
        } catch (IOException e) {
            throw new CatalogException("Failed to parse catalog file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Converts a tree node into a typed value.
     *
     * @param node source node
     * @param type target type
     * @param source source name used in error messages
     * @param <T> target type
     * @return converted value
     * @throws CatalogException if the node does not describe a valid value
     */
    public static <T> T convert(JsonNode node, Class<T> type, String source) {
        try {
            return YAML_MAPPER.treeToValue(node, type);
        } catch (IOException | IllegalArgumentException e) {
            throw new CatalogException("Invalid " + type.getSimpleName() + " entry in " + source
                + ": " + rootMessage(e), e);
        }
    }

    private static <T> List<T> convertList(JsonNode document, String source, String rootKey, Class<T> type) {
        if (document == null || document.isMissingNode() || document.isNull()) {
            log.warn("Catalog {} is empty", source);
            return List.of();
        }
        JsonNode list = document.get(rootKey);
        if (list == null || list.isNull()) {
            return List.of();
        }
        if (!list.isArray()) {
            throw new CatalogException("Catalog " + source + ": '" + rootKey + "' must be a list");
        }
        List<T> entries = new ArrayList<>();
        for (JsonNode entry : list) {
            entries.add(convert(entry, type, source));
        }
        return entries;
    }

    private static String rootMessage(Throwable e) {
        Throwable current = e;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage();
    }
}
