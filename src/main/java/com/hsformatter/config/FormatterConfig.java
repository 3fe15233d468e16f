package com.hsformatter.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw configuration as read from YAML: a {@code general} section and one
 * section per plugin.
 */
public class FormatterConfig {
    private final Map<String, Object> generalConfig;
    private final Map<String, Map<String, Object>> pluginConfigs;

    public FormatterConfig(Map<String, Object> generalConfig,
                           Map<String, Map<String, Object>> pluginConfigs) {
        this.generalConfig = generalConfig;
        this.pluginConfigs = pluginConfigs;
    }

    /**
     * Gets a copy of the general config map.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    /**
     * Gets a copy of the plugin configs map.
     */
    public Map<String, Map<String, Object>> getPluginConfigsMap() {
        Map<String, Map<String, Object>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : pluginConfigs.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }

    public <T> T getGeneralConfig(String key, T defaultValue) {
        return _convert(generalConfig.get(key), defaultValue);
    }

    public <T> T getPluginConfig(String plugin, String key, T defaultValue) {
        Map<String, Object> pluginConfig = pluginConfigs.get(plugin);
        if (pluginConfig == null) {
            return defaultValue;
        }
        return _convert(pluginConfig.get(key), defaultValue);
    }

    /**
     * Reads a list of strings from a plugin section; scalars become singleton lists.
     */
    public List<String> getPluginStringList(String plugin, String key, List<String> defaultValue) {
        Map<String, Object> pluginConfig = pluginConfigs.get(plugin);
        Object value = pluginConfig == null ? null : pluginConfig.get(key);
        if (value == null) {
            return defaultValue;
        }
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object element : (List<?>) value) {
                if (element != null) {
                    result.add(element.toString());
                }
            }
        } else {
            result.add(value.toString());
        }
        return result;
    }

    /**
     * Reads a nested string map from a plugin section, e.g. {@code namingCaseRules}.
     */
    public Map<String, String> getPluginStringMap(String plugin, String key) {
        Map<String, Object> pluginConfig = pluginConfigs.get(plugin);
        Object value = pluginConfig == null ? null : pluginConfig.get(key);
        Map<String, String> result = new HashMap<>();
        if (value instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    result.put(entry.getKey().toString(), entry.getValue().toString());
                }
            }
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static <T> T _convert(Object value, T defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (defaultValue == null || defaultValue.getClass().isInstance(value)) {
            return (T) value;
        }
        if (defaultValue instanceof Integer && value instanceof Number) {
            return (T) Integer.valueOf(((Number) value).intValue());
        }
        if (defaultValue instanceof Integer && value instanceof String) {
            try {
                return (T) Integer.valueOf(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        if (defaultValue instanceof Boolean && value instanceof String) {
            return (T) Boolean.valueOf(value.toString());
        }
        if (defaultValue instanceof String) {
            return (T) value.toString();
        }
        return defaultValue;
    }
}
