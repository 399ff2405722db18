package com.codeguard.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading CodeGuard configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code codeguard.yaml} into {@link CodeGuardConfig} records.
 * {@link #load(Path)} is lenient: if the config file is missing or invalid it returns
 * {@link CodeGuardConfig#defaults()}. {@link #parse(Path)} is strict and is what the
 * {@code validate} command uses.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CodeGuardConfig config = ConfigLoader.load(Paths.get("codeguard.yaml"));
 * AnalysisConfig analysis = config.toAnalysisConfig();
 * }</pre>
 */
public class ConfigLoader {

    /**
     * Default configuration file name looked up in the analyzed directory.
     */
    public static final String DEFAULT_FILE_NAME = "codeguard.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link CodeGuardConfig#defaults()}.
     *
     * @param configPath path to {@code codeguard.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static CodeGuardConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults (all analyzers enabled).", configPath);
            return CodeGuardConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return CodeGuardConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            CodeGuardConfig config = read(configPath);
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return CodeGuardConfig.defaults();
        }
    }

    /**
     * Parses a configuration file and validates the resulting run settings.
     *
     * @param configPath path to the YAML file
     * @return parsed configuration
     * @throws ConfigurationException if the file is missing, unparseable or holds invalid values
     */
    public static CodeGuardConfig parse(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigurationException("Configuration file not found: " + configPath);
        }
        try {
            CodeGuardConfig config = read(configPath);
            config.toAnalysisConfig();
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse configuration file " + configPath + ": " + e.getMessage(), e);
        }
    }

    private static CodeGuardConfig read(Path configPath) throws IOException {
        CodeGuardConfig config = YAML_MAPPER.readValue(configPath.toFile(), CodeGuardConfig.class);
        // An empty document deserializes to null
        return config == null ? CodeGuardConfig.defaults() : config;
    }
}
