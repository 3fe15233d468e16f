package com.hsformatter.plugins.haskell.render;

import java.util.List;

import com.hsformatter.api.Refactoring;
import com.hsformatter.api.error.Diagnostic;

/**
 * Output of {@link Renderer#render}.
 */
public final class RenderResult {
    private final String text;
    private final List<Diagnostic> diagnostics;
    private final List<Refactoring> refactorings;
    private final List<RenderedUnit> units;

    public RenderResult(String text, List<Diagnostic> diagnostics, List<Refactoring> refactorings,
                        List<RenderedUnit> units) {
        this.text = text;
        this.diagnostics = List.copyOf(diagnostics);
        this.refactorings = List.copyOf(refactorings);
        this.units = List.copyOf(units);
    }

    public String getText() {
        return text;
    }

    /**
     * Diagnostics of the passes and of rendering, ordered by position.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<Refactoring> getRefactorings() {
        return refactorings;
    }

    public List<RenderedUnit> getUnits() {
        return units;
    }
}
