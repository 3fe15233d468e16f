package com.hsformatter.config;

import com.hsformatter.util.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads YAML configuration, fills in defaults and replaces out-of-range values.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class.getName());
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";
    private static final String HASKELL = HaskellStyleConfig.PLUGIN_NAME;

    private static FormatterConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file with fallback to defaults.
     */
    public static FormatterConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.fine("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.fine("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.info("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);
            if (config == null) {
                config = new HashMap<>();
            }

            FormatterConfig formatterConfig = _createConfigFromMap(config);
            logger.info("Configuration loaded successfully with " +
                    formatterConfig.getPluginConfigsMap().size() + " plugin configurations");

            return formatterConfig;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the embedded default configuration with caching.
     */
    public static synchronized FormatterConfig loadDefaultConfig() {
        if (_cachedDefaultConfig != null) {
            return _cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return _createEmptyConfig();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = _createConfigFromMap(config);
            logger.fine("Default configuration loaded successfully");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    /**
     * Creates a configuration from a parsed Map, with validation.
     */
    @SuppressWarnings("unchecked")
    private static FormatterConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get("general") instanceof Map) {
            generalConfig = new HashMap<>((Map<String, Object>) config.get("general"));
        } else {
            logger.warning("Missing or invalid 'general' section in config, using defaults");
        }

        Map<String, Map<String, Object>> pluginConfigs = new HashMap<>();
        if (config.get("plugins") instanceof Map) {
            Map<String, Object> pluginsMap = (Map<String, Object>) config.get("plugins");

            for (Map.Entry<String, Object> entry : pluginsMap.entrySet()) {
                if (entry.getValue() instanceof Map) {
                    pluginConfigs.put(entry.getKey(), new HashMap<>((Map<String, Object>) entry.getValue()));
                } else {
                    logger.warning("Invalid configuration for plugin '" + entry.getKey() + "', using defaults");
                    pluginConfigs.put(entry.getKey(), new HashMap<>());
                }
            }
        } else {
            logger.warning("Missing or invalid 'plugins' section in config, using defaults");
        }

        _validateConfigurationValues(generalConfig, pluginConfigs);

        _ensureDefaultGeneralConfig(generalConfig);
        _ensureDefaultPluginConfigs(pluginConfigs);

        return new FormatterConfig(generalConfig, pluginConfigs);
    }

    /**
     * Drops values outside their acceptable ranges so the defaults take over.
     */
    private static void _validateConfigurationValues(Map<String, Object> generalConfig,
                                                     Map<String, Map<String, Object>> pluginConfigs) {
        _validateIntRange(generalConfig, "indentWidth", 1, 8);
        _validateIntRange(generalConfig, "maxLineLength", 40, 200);

        if (pluginConfigs.containsKey(HASKELL)) {
            Map<String, Object> haskellConfig = pluginConfigs.get(HASKELL);
            _validateIntRange(haskellConfig, "qualifyImportThreshold", 1, 1000);
            _validateIntRange(haskellConfig, "maxCompositionChain", 1, 50);
            _validateNamingRules(haskellConfig);
            _validateLayoutPolicies(haskellConfig);
        }
    }

    /**
     * Validates that an integer configuration value is within the specified range.
     */
    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (!config.containsKey(key)) {
            return;
        }
        if (!(config.get(key) instanceof Number)) {
            logger.warning("Configuration value '" + key + "' is not a number. Using default value.");
            config.remove(key);
            return;
        }
        int value = ((Number) config.get(key)).intValue();
        if (value < min || value > max) {
            logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                    "(" + min + "-" + max + "). Using default value.");
            config.remove(key);
        }
    }

    private static void _validateNamingRules(Map<String, Object> haskellConfig) {
        if (!(haskellConfig.get("namingCaseRules") instanceof Map)) {
            haskellConfig.remove("namingCaseRules");
            return;
        }
        Map<String, Object> rules = new HashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) haskellConfig.get("namingCaseRules")).entrySet()) {
            String key = String.valueOf(entry.getKey());
            String regex = String.valueOf(entry.getValue());
            try {
                Pattern.compile(regex);
                rules.put(key, regex);
            } catch (PatternSyntaxException e) {
                logger.warning("Invalid naming rule '" + key + "': " + e.getDescription() + ". Using default value.");
            }
        }
        haskellConfig.put("namingCaseRules", rules);
    }

    private static void _validateLayoutPolicies(Map<String, Object> haskellConfig) {
        if (!(haskellConfig.get("layoutPolicies") instanceof Map)) {
            haskellConfig.remove("layoutPolicies");
            return;
        }
        Map<String, Object> policies = new HashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) haskellConfig.get("layoutPolicies")).entrySet()) {
            String key = String.valueOf(entry.getKey());
            LayoutPolicy policy = LayoutPolicy.parse(String.valueOf(entry.getValue()), null);
            if (policy == null) {
                logger.warning("Invalid layout policy for '" + key + "': " + entry.getValue() + ". Using AUTO.");
                policy = LayoutPolicy.AUTO;
            }
            policies.put(key, policy.name());
        }
        haskellConfig.put("layoutPolicies", policies);
    }

    /**
     * Creates an empty configuration with minimum defaults.
     */
    private static FormatterConfig _createEmptyConfig() {
        Map<String, Object> generalConfig = new HashMap<>();
        _ensureDefaultGeneralConfig(generalConfig);

        Map<String, Map<String, Object>> pluginConfigs = new HashMap<>();
        _ensureDefaultPluginConfigs(pluginConfigs);

        return new FormatterConfig(generalConfig, pluginConfigs);
    }

    /**
     * Ensures that general configuration has all required default values.
     */
    private static void _ensureDefaultGeneralConfig(Map<String, Object> generalConfig) {
        if (!(generalConfig.get("indentWidth") instanceof Number)) {
            generalConfig.put("indentWidth", 2);
        }
        if (!(generalConfig.get("maxLineLength") instanceof Number)) {
            generalConfig.put("maxLineLength", 80);
        }
        if (!(generalConfig.get("ignoreFiles") instanceof List)) {
            generalConfig.put("ignoreFiles", new ArrayList<String>());
        }
    }

    /**
     * Ensures that the Haskell plugin section has all required default values.
     */
    private static void _ensureDefaultPluginConfigs(Map<String, Map<String, Object>> pluginConfigs) {
        Map<String, Object> haskellConfig = pluginConfigs.computeIfAbsent(HASKELL, k -> new HashMap<>());
        if (!(haskellConfig.get("importGroupOrder") instanceof List)) {
            haskellConfig.put("importGroupOrder", new ArrayList<>(List.of("external", "local")));
        }
        if (!(haskellConfig.get("localModulePrefixes") instanceof List)) {
            haskellConfig.put("localModulePrefixes", new ArrayList<String>());
        }
        if (!(haskellConfig.get("qualifyImportThreshold") instanceof Number)) {
            haskellConfig.put("qualifyImportThreshold", 15);
        }
        if (!(haskellConfig.get("enabledLintChecks") instanceof List)) {
            haskellConfig.put("enabledLintChecks", new ArrayList<String>());
        }
        if (!(haskellConfig.get("alignRecordFields") instanceof Boolean)) {
            haskellConfig.put("alignRecordFields", true);
        }
        if (!(haskellConfig.get("maxCompositionChain") instanceof Number)) {
            haskellConfig.put("maxCompositionChain", 4);
        }
        if (!(haskellConfig.get("verifyIdempotence") instanceof Boolean)) {
            haskellConfig.put("verifyIdempotence", false);
        }

        Map<String, Object> naming = new HashMap<>();
        if (haskellConfig.get("namingCaseRules") instanceof Map) {
            ((Map<?, ?>) haskellConfig.get("namingCaseRules")).forEach((k, v) -> naming.put(String.valueOf(k), v));
        }
        naming.putIfAbsent("function", HaskellStyleConfig.DEFAULT_FUNCTION_PATTERN);
        naming.putIfAbsent("type", HaskellStyleConfig.DEFAULT_TYPE_PATTERN);
        haskellConfig.put("namingCaseRules", naming);

        Map<String, Object> policies = new HashMap<>();
        if (haskellConfig.get("layoutPolicies") instanceof Map) {
            ((Map<?, ?>) haskellConfig.get("layoutPolicies")).forEach((k, v) -> policies.put(String.valueOf(k), v));
        }
        for (LayoutTarget target : LayoutTarget.values()) {
            policies.putIfAbsent(target.getConfigKey(), LayoutPolicy.AUTO.name());
        }
        haskellConfig.put("layoutPolicies", policies);
    }

    /**
     * Saves configuration to a file.
     */
    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put("general", new TreeMap<>(config.getGeneralConfigMap()));
            configMap.put("plugins", new TreeMap<>(config.getPluginConfigsMap()));

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved successfully to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
