package com.sdlcimport.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading import configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code sdlc-import.yaml} into {@link ImportConfig} records.
 * If the config file is missing or invalid, returns {@link ImportConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ImportConfig config = ConfigLoader.load(Paths.get("sdlc-import.yaml"));
 * int ceiling = config.scan().maxFiles();
 * }</pre>
 */
public class ConfigLoader {

    /** Default configuration file name, looked up in the scanned root. */
    public static final String DEFAULT_FILE_NAME = "sdlc-import.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link ImportConfig#defaults()}.
     *
     * @param configPath path to {@code sdlc-import.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ImportConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return ImportConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ImportConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ImportConfig config = YAML_MAPPER.readValue(configPath.toFile(), ImportConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ImportConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ImportConfig.defaults();
        }
    }

    /**
     * Loads {@value #DEFAULT_FILE_NAME} from a project root, or returns defaults.
     *
     * @param projectRoot scanned root directory
     * @return loaded configuration or defaults
     */
    public static ImportConfig loadFromRoot(Path projectRoot) {
        Path candidate = projectRoot.resolve(DEFAULT_FILE_NAME);
        if (!Files.exists(candidate)) {
            log.debug("No {} in {}, using defaults", DEFAULT_FILE_NAME, projectRoot);
            return ImportConfig.defaults();
        }
        return load(candidate);
    }
}
