package com.hsformatter.plugins.haskell.cst;

import java.util.Locale;

public enum PragmaKind {
    LANGUAGE,
    OPTIONS,
    INLINE,
    OTHER;

    /**
     * Classifies a pragma by its directive word, e.g. {@code LANGUAGE} or {@code OPTIONS_GHC}.
     */
    public static PragmaKind forDirective(String directive) {
        String upper = directive.toUpperCase(Locale.ROOT);
        if (upper.equals("LANGUAGE")) {
            return LANGUAGE;
        }
        if (upper.equals("OPTIONS") || upper.startsWith("OPTIONS_")) {
            return OPTIONS;
        }
        return switch (upper) {
            case "INLINE", "NOINLINE", "INLINABLE", "INLINEABLE", "NOTINLINE",
                 "SPECIALIZE", "SPECIALISE", "OPAQUE" -> INLINE;
            default -> OTHER;
        };
    }
}
