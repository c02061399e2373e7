package com.netmig.pan2tf.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads conversion settings from YAML files
 */
@Slf4j
public class ConfigLoader {

    public static final String DEFAULT_CONFIG = "conversion-config.yaml";
    private final ObjectMapper yamlMapper;

    public ConfigLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * Load configuration from the default classpath resource
     */
    public ConversionConfig loadDefault() {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG)) {
            if (is == null) {
                log.warn("Default config file '{}' not found, using built-in defaults", DEFAULT_CONFIG);
                return new ConversionConfig();
            }

            ConversionConfig config = yamlMapper.readValue(is, ConversionConfig.class);
            log.info("Loaded default conversion config (namespace mode {})", config.getNamespaceMode());
            return config;

        } catch (IOException e) {
            log.error("Failed to load default config, using built-in defaults", e);
            return new ConversionConfig();
        }
    }

    /**
     * Load configuration from a specific file. A file given explicitly must
     * exist and be valid.
     */
    public ConversionConfig loadFromFile(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Config file not found: " + path);
        }
        ConversionConfig config = Files.size(path) == 0 ? null
                : yamlMapper.readValue(path.toFile(), ConversionConfig.class);
        if (config == null) {
            log.warn("Config file '{}' is empty, using built-in defaults", path);
            return new ConversionConfig();
        }
        log.info("Loaded conversion config from '{}'", path);
        return config;
    }

    /**
     * Load configuration from file path, or use default file in current directory,
     * or the classpath default
     */
    public ConversionConfig load(String filePath) throws IOException {
        if (filePath == null || filePath.isEmpty()) {
            // Try to load from current directory first
            Path local = Paths.get(DEFAULT_CONFIG);
            if (Files.exists(local)) {
                log.info("Loading config from current directory: {}", local);
                return loadFromFile(local);
            }
            // Fall back to classpath
            log.info("No config file in current directory, using default from classpath");
            return loadDefault();
        }

        return loadFromFile(Paths.get(filePath));
    }
}
