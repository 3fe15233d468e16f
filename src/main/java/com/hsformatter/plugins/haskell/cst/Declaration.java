package com.hsformatter.plugins.haskell.cst;

import java.util.List;

/**
 * A top-level item of the module body, or a binding inside a {@code where}
 * or {@code let} block.
 */
public abstract class Declaration implements Node {
    private final int firstToken;
    private final int lastToken;
    private final List<LayoutBlock> blocks;
    private final IndentPlan indentPlan;
    private Declaration enclosing;

    protected Declaration(int firstToken, int lastToken, List<LayoutBlock> blocks, IndentPlan indentPlan) {
        this.firstToken = firstToken;
        this.lastToken = lastToken;
        this.blocks = List.copyOf(blocks);
        this.indentPlan = indentPlan == null ? IndentPlan.EMPTY : indentPlan;
    }

    @Override
    public int getFirstToken() {
        return firstToken;
    }

    @Override
    public int getLastToken() {
        return lastToken;
    }

    /**
     * Layout blocks opened directly by this declaration, in source order.
     */
    public List<LayoutBlock> getBlocks() {
        return blocks;
    }

    public IndentPlan getIndentPlan() {
        return indentPlan;
    }

    /**
     * The declaration whose {@code where} or {@code let} block holds this one,
     * or null at top level. Not owned.
     */
    public Declaration getEnclosing() {
        return enclosing;
    }

    public boolean isTopLevel() {
        return enclosing == null;
    }

    /**
     * Name of the bound or declared entity, or null when there is none.
     */
    public abstract String getName();

    public Declaration withIndentPlan(IndentPlan plan) {
        if (plan == indentPlan) {
            return this;
        }
        Declaration copy = copyWith(plan);
        copy.enclosing = enclosing;
        return copy;
    }

    protected abstract Declaration copyWith(IndentPlan plan);

    /**
     * Links a local binding to its enclosing declaration. Called once while
     * the tree is built.
     */
    void attachTo(Declaration enclosingDeclaration) {
        this.enclosing = enclosingDeclaration;
    }

    @Override
    public List<? extends Node> getChildren() {
        return blocks;
    }

    @Override
    public String toString() {
        return getKind() + "[" + firstToken + ".." + lastToken + "]"
                + (getName() == null ? "" : " " + getName());
    }
}
