package io.surfworks.tirnarrow.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Loads and saves {@link NarrowingConfig}.
 *
 * <p>Configuration sources (in order of precedence):
 * <ol>
 *   <li>System property {@value #TARGET_BITS_PROPERTY}</li>
 *   <li>Config file ({@code ~/.config/tirnarrow/narrowing.json})</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <p>Keys missing from the file keep their default. A file that cannot be
 * read or parsed is ignored with a warning.
 */
public final class NarrowingConfigLoader {

    private static final Logger LOG = Logger.getLogger(NarrowingConfigLoader.class.getName());

    /** System property overriding the configured target width */
    public static final String TARGET_BITS_PROPERTY = "tirnarrow.targetBits";

    private static final ObjectMapper JSON = new ObjectMapper();

    private NarrowingConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     */
    public static NarrowingConfig load() {
        return load(NarrowingConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     */
    public static NarrowingConfig load(Path configFile) {
        NarrowingConfig config = NarrowingConfig.defaults();

        if (Files.exists(configFile)) {
            config = loadFromFile(configFile, config);
        }

        return applySystemProperties(config);
    }

    /**
     * Saves configuration to a specific file.
     *
     * @param config     the configuration to save
     * @param configFile path to write the config
     * @throws IOException if saving fails
     */
    public static void save(NarrowingConfig config, Path configFile) throws IOException {
        if (configFile.getParent() != null) {
            Files.createDirectories(configFile.getParent());
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("targetBits", config.targetBits());
        root.put("validateOutput", config.validateOutput());
        root.put("logSummary", config.logSummary());
        root.put("parallelism", config.parallelism());

        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    private static NarrowingConfig loadFromFile(Path configFile, NarrowingConfig base) {
        try {
            JsonNode root = JSON.readTree(configFile.toFile());
            if (root == null || !root.isObject()) {
                LOG.warning("Ignoring config " + configFile + ": not a JSON object");
                return base;
            }

            return new NarrowingConfig(
                    root.path("targetBits").asInt(base.targetBits()),
                    root.path("validateOutput").asBoolean(base.validateOutput()),
                    root.path("logSummary").asBoolean(base.logSummary()),
                    root.path("parallelism").asInt(base.parallelism()));

        } catch (IOException | IllegalArgumentException e) {
            LOG.warning("Ignoring config " + configFile + ": " + e.getMessage());
            return base;
        }
    }

    private static NarrowingConfig applySystemProperties(NarrowingConfig config) {
        String bits = System.getProperty(TARGET_BITS_PROPERTY);
        if (bits == null || bits.isBlank()) {
            return config;
        }
        try {
            return config.withTargetBits(Integer.parseInt(bits.trim()));
        } catch (IllegalArgumentException e) {
            LOG.warning("Ignoring " + TARGET_BITS_PROPERTY + "=" + bits + ": " + e.getMessage());
            return config;
        }
    }
}
