package com.hsformatter.plugins.haskell.render;

/**
 * One top-level unit of the output (the header pragmas, the module header,
 * an import or a declaration) and whether it differs from its source text.
 */
public final class RenderedUnit {
    private final String label;
    private final int firstToken;
    private final int lastToken;
    private final String text;
    private final boolean changed;

    public RenderedUnit(String label, int firstToken, int lastToken, String text, boolean changed) {
        this.label = label;
        this.firstToken = firstToken;
        this.lastToken = lastToken;
        this.text = text;
        this.changed = changed;
    }

    public String getLabel() { return label; }
    public int getFirstToken() { return firstToken; }
    public int getLastToken() { return lastToken; }
    public String getText() { return text; }
    public boolean isChanged() { return changed; }

    @Override
    public String toString() {
        return label + (changed ? " (changed)" : "");
    }
}
