package com.hsformatter.plugins.haskell.cst;

import java.util.List;

/**
 * A {@code {-# ... #-}} pragma, either in the file header or between
 * declarations.
 */
public final class Pragma extends Declaration {
    private final PragmaKind pragmaKind;
    private final String directive;
    private final List<String> extensions;
    private final String target;
    private final String renderedText;
    private final boolean primary;

    public Pragma(int token, PragmaKind pragmaKind, String directive, List<String> extensions, String target) {
        this(token, pragmaKind, directive, extensions, target, null, true, IndentPlan.EMPTY);
    }

    private Pragma(int token, PragmaKind pragmaKind, String directive, List<String> extensions,
                   String target, String renderedText, boolean primary, IndentPlan plan) {
        super(token, token, List.of(), plan);
        this.pragmaKind = pragmaKind;
        this.directive = directive;
        this.extensions = List.copyOf(extensions);
        this.target = target;
        this.renderedText = renderedText;
        this.primary = primary;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PRAGMA;
    }

    public int getToken() {
        return getFirstToken();
    }

    public PragmaKind getPragmaKind() {
        return pragmaKind;
    }

    /**
     * The directive word as written, e.g. {@code OPTIONS_GHC}.
     */
    public String getDirective() {
        return directive;
    }

    /**
     * Extension names of a {@code LANGUAGE} pragma, in source order.
     */
    public List<String> getExtensions() {
        return extensions;
    }

    /**
     * The name an {@code INLINE}-family pragma annotates.
     */
    public String getTarget() {
        return target;
    }

    /**
     * Replacement text when the pragma was rewritten (one extension split off
     * a multi-extension {@code LANGUAGE} pragma), otherwise null.
     */
    public String getRenderedText() {
        return renderedText;
    }

    /**
     * Whether comments attached to the source token print with this pragma.
     * Only one piece of a split pragma is primary.
     */
    public boolean isPrimary() {
        return primary;
    }

    public Pragma withRenderedText(String text, List<String> newExtensions, boolean isPrimary) {
        return new Pragma(getToken(), pragmaKind, directive, newExtensions, target, text, isPrimary,
                getIndentPlan());
    }

    @Override
    public String getName() {
        return target;
    }

    @Override
    protected Declaration copyWith(IndentPlan plan) {
        return new Pragma(getToken(), pragmaKind, directive, extensions, target, renderedText, primary, plan);
    }
}
