package com.hsformatter.config;

/**
 * How a list-shaped construct is laid out.
 */
public enum LayoutPolicy {
    /** One line when it fits and the source was not already broken over lines. */
    AUTO,
    /** Always one item per line. */
    ALWAYS_MULTILINE;

    public static LayoutPolicy parse(String value, LayoutPolicy defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        String normalized = value.trim().toUpperCase().replace('-', '_');
        return switch (normalized) {
            case "AUTO" -> AUTO;
            case "ALWAYS_MULTILINE", "MULTILINE", "MULTI_LINE" -> ALWAYS_MULTILINE;
            default -> defaultValue;
        };
    }
}
