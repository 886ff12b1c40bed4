package de.mirkosertic.sessionmemory.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.function.Function;

/**
 * Configuration of the session memory engine.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. System properties
 * 2. Environment variables
 * 3. User config file (~/.session-memory/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 * <p>
 * Negative counts and scores are rejected with a warning; the previous value stays in effect.
 * <p>
 * The ranking weights are fixed and deliberately not part of the configuration.
 */
public class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    private static final String ENV_DATA_DIR = "SESSION_MEMORY_DATA_DIR";
    private static final String ENV_API_KEY = "ANTHROPIC_API_KEY";
    private static final String PROP_DATA_DIR = "session.memory.data.dir";
    private static final String CONFIG_DIR = ".session-memory";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Storage root handed to the persistence layer
    private String dataDir;

    // Selection of ranked sessions
    private double minScore = 0.1;
    private int maxSessions = 5;
    private int fallbackCount = 3;

    // Summaries
    private int maxKeywords = 50;
    @Nullable
    private String apiKey;

    private EngineConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static EngineConfig load() {
        return load(getUserConfigPath(), System::getenv);
    }

    /**
     * Load configuration from the given user file and environment lookup.
     */
    public static EngineConfig load(final Path userConfigPath, final Function<String, String> environment) {
        final EngineConfig config = new EngineConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromFile(userConfigPath);

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides(environment);

        logger.info("Configuration loaded: dataDir={}, minScore={}, maxSessions={}, fallbackCount={}, summarizationService={}",
                config.dataDir, config.minScore, config.maxSessions, config.fallbackCount, config.hasApiKey());

        return config;
    }

    /**
     * Configuration with built-in defaults only, ignoring files and environment.
     */
    public static EngineConfig defaults() {
        final EngineConfig config = new EngineConfig();
        config.dataDir = getConfigDirectory().toString();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                applyYaml(is);
                logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
            }
        } catch (final IOException | RuntimeException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromFile(final Path configPath) {
        if (Files.exists(configPath)) {
            try (final InputStream is = Files.newInputStream(configPath)) {
                applyYaml(is);
                logger.debug("Loaded user config from: {}", configPath);
            } catch (final IOException | RuntimeException e) {
                logger.warn("Failed to load user config from: {}", configPath, e);
            }
        }
    }

    private void applyYaml(final InputStream is) {
        final Yaml yaml = new Yaml();
        final Map<String, Object> config = yaml.load(is);
        if (config != null) {
            applyYamlConfig(config);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        // Navigate to memory section
        final Map<String, Object> memoryConfig = (Map<String, Object>) config.get("memory");
        if (memoryConfig == null) {
            return;
        }

        final Object dir = memoryConfig.get("data-dir");
        if (dir != null) {
            this.dataDir = resolveVariables(dir.toString());
        }

        final Map<String, Object> selectionConfig = (Map<String, Object>) memoryConfig.get("selection");
        if (selectionConfig != null) {
            this.minScore = readDouble(selectionConfig, "selection.min-score", "min-score", this.minScore);
            this.maxSessions = readCount(selectionConfig, "selection.max-sessions", "max-sessions", this.maxSessions);
            this.fallbackCount = readCount(selectionConfig, "selection.fallback-count", "fallback-count", this.fallbackCount);
        }

        final Map<String, Object> summaryConfig = (Map<String, Object>) memoryConfig.get("summary");
        if (summaryConfig != null) {
            this.maxKeywords = readCount(summaryConfig, "summary.max-keywords", "max-keywords", this.maxKeywords);
        }
    }

    /**
     * Reads a non-negative score. Invalid values are logged and the current value is kept.
     */
    private static double readDouble(final Map<String, Object> section, final String name, final String key,
                                     final double current) {
        final Object value = section.get(key);
        if (value == null) {
            return current;
        }
        if (value instanceof Number number && number.doubleValue() >= 0.0 && !Double.isNaN(number.doubleValue())) {
            return number.doubleValue();
        }
        logger.warn("Ignoring invalid value for {}: '{}', keeping {}", name, value, current);
        return current;
    }

    /**
     * Reads a non-negative integer. Invalid values are logged and the current value is kept.
     */
    private static int readCount(final Map<String, Object> section, final String name, final String key,
                                 final int current) {
        final Object value = section.get(key);
        if (value == null) {
            return current;
        }
        if (value instanceof Integer number && number >= 0) {
            return number;
        }
        logger.warn("Ignoring invalid value for {}: '{}', keeping {}", name, value, current);
        return current;
    }

    private void applyEnvironmentOverrides(final Function<String, String> environment) {
        // Data directory from environment
        final String envDataDir = environment.apply(ENV_DATA_DIR);
        if (envDataDir != null && !envDataDir.trim().isEmpty()) {
            this.dataDir = envDataDir.trim();
            logger.info("Data directory from environment: {}", this.dataDir);
        }

        // System property for data directory
        final String propDataDir = System.getProperty(PROP_DATA_DIR);
        if (propDataDir != null && !propDataDir.isEmpty()) {
            this.dataDir = propDataDir;
        }

        // Default data directory if not set
        if (this.dataDir == null || this.dataDir.isEmpty()) {
            this.dataDir = getConfigDirectory().toString();
        }

        final String envApiKey = environment.apply(ENV_API_KEY);
        if (envApiKey != null && !envApiKey.isBlank()) {
            this.apiKey = envApiKey.trim();
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return getConfigDirectory().resolve(USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public String getDataDir() {
        return dataDir;
    }

    public double getMinScore() {
        return minScore;
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    public int getFallbackCount() {
        return fallbackCount;
    }

    public int getMaxKeywords() {
        return maxKeywords;
    }

    @Nullable
    public String getApiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null;
    }
}
