package com.hsformatter.plugins.haskell.rules;

import java.util.List;

import com.hsformatter.api.Refactoring;
import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.plugins.haskell.cst.Module;

/**
 * Output of one {@link FormattingPass}.
 */
public class PassResult {
    private final Module module;
    private final List<Diagnostic> diagnostics;
    private final List<Refactoring> refactorings;

    public PassResult(Module module, List<Diagnostic> diagnostics, List<Refactoring> refactorings) {
        this.module = module;
        this.diagnostics = List.copyOf(diagnostics);
        this.refactorings = List.copyOf(refactorings);
    }

    public PassResult(Module module, List<Diagnostic> diagnostics) {
        this(module, diagnostics, List.of());
    }

    public static PassResult unchanged(Module module) {
        return new PassResult(module, List.of());
    }

    public Module getModule() {
        return module;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<Refactoring> getRefactorings() {
        return refactorings;
    }
}
