package com.hsformatter.plugins.haskell.rules;

import java.util.List;

import com.hsformatter.api.Refactoring;
import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.plugins.haskell.cst.Module;

/**
 * The tree after every pass has run, with everything the passes reported.
 */
public final class PassOutcome {
    private final Module module;
    private final List<Diagnostic> diagnostics;
    private final List<Refactoring> refactorings;

    public PassOutcome(Module module, List<Diagnostic> diagnostics, List<Refactoring> refactorings) {
        this.module = module;
        this.diagnostics = List.copyOf(diagnostics);
        this.refactorings = List.copyOf(refactorings);
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
