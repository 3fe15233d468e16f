package com.hsformatter.plugins.haskell.lint;

import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.plugins.haskell.lexer.Token;

/**
 * Builds diagnostics located on token ranges.
 */
public final class Findings {

    private Findings() {
    }

    public static Diagnostic at(DiagnosticKind kind, String message, Token first, Token last, String suggestion) {
        return new Diagnostic(kind, message, first.getLine(), first.getColumn(),
                first.getStartOffset(), last.getEndOffset(), suggestion);
    }

    public static Diagnostic at(DiagnosticKind kind, String message, Token token) {
        return at(kind, message, token, token, null);
    }
}
