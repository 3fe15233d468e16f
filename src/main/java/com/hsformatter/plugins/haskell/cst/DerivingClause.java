package com.hsformatter.plugins.haskell.cst;

import java.util.List;

/**
 * {@code deriving [strategy] classes [via type]}.
 */
public final class DerivingClause implements Node {
    private final int firstToken;
    private final int lastToken;
    private final int strategyToken;
    private final String strategy;
    private final int classesFirst;
    private final int classesLast;
    private final boolean parenthesized;
    private final int viaToken;
    private final List<String> classNames;

    public DerivingClause(int firstToken, int lastToken, int strategyToken, String strategy,
                          int classesFirst, int classesLast, boolean parenthesized, int viaToken,
                          List<String> classNames) {
        this.firstToken = firstToken;
        this.lastToken = lastToken;
        this.strategyToken = strategyToken;
        this.strategy = strategy;
        this.classesFirst = classesFirst;
        this.classesLast = classesLast;
        this.parenthesized = parenthesized;
        this.viaToken = viaToken;
        this.classNames = List.copyOf(classNames);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.DERIVING_CLAUSE;
    }

    @Override
    public int getFirstToken() { return firstToken; }
    @Override
    public int getLastToken() { return lastToken; }
    public int getStrategyToken() { return strategyToken; }
    public int getClassesFirst() { return classesFirst; }
    public int getClassesLast() { return classesLast; }
    public boolean isParenthesized() { return parenthesized; }
    public int getViaToken() { return viaToken; }
    public List<String> getClassNames() { return classNames; }

    /**
     * {@code stock}, {@code newtype}, {@code anyclass}, {@code via}, or null.
     */
    public String getStrategy() {
        return strategy;
    }

    public boolean hasStrategy() {
        return strategy != null;
    }

    /**
     * A single bare class name, as in {@code deriving Show}.
     */
    public boolean isBareClass() {
        return !parenthesized && classesFirst >= 0 && classesFirst == classesLast;
    }

    @Override
    public List<Node> getChildren() {
        return List.of();
    }
}
