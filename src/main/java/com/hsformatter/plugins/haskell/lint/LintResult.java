package com.hsformatter.plugins.haskell.lint;

import java.util.List;

import com.hsformatter.api.error.Diagnostic;

/**
 * Result of one {@link LintCheck}.
 */
public class LintResult {
    private final List<Diagnostic> diagnostics;

    public LintResult(List<Diagnostic> diagnostics) {
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
