package com.hsformatter.config;

/**
 * Import groups, ordered by {@code importGroupOrder}.
 */
public enum ImportCategory {
    EXTERNAL,
    LOCAL;

    public static ImportCategory parse(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase()) {
            case "external", "third-party", "thirdparty" -> EXTERNAL;
            case "local", "project", "internal" -> LOCAL;
            default -> null;
        };
    }
}
