package com.hsformatter.config;

/**
 * Constructs whose layout is governed by a {@link LayoutPolicy}.
 */
public enum LayoutTarget {
    EXPORTS("exports"),
    IMPORTS("imports"),
    RECORDS("records"),
    CONSTRUCTORS("constructors"),
    SIGNATURES("signatures");

    private final String configKey;

    LayoutTarget(String configKey) {
        this.configKey = configKey;
    }

    public String getConfigKey() {
        return configKey;
    }
}
