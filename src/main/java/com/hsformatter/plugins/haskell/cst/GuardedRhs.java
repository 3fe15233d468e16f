package com.hsformatter.plugins.haskell.cst;

import java.util.List;

/**
 * {@code | guard = body}
 */
public final class GuardedRhs implements Node {
    private final int barToken;
    private final int equalsToken;
    private final Expr body;

    public GuardedRhs(int barToken, int equalsToken, Expr body) {
        this.barToken = barToken;
        this.equalsToken = equalsToken;
        this.body = body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.GUARDED_RHS;
    }

    @Override
    public int getFirstToken() {
        return barToken;
    }

    @Override
    public int getLastToken() {
        return body.getLastToken();
    }

    public int getBarToken() { return barToken; }
    public int getEqualsToken() { return equalsToken; }
    public Expr getBody() { return body; }

    @Override
    public List<Expr> getChildren() {
        return List.of(body);
    }
}
