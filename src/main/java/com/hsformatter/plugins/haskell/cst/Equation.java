package com.hsformatter.plugins.haskell.cst;

import java.util.ArrayList;
import java.util.List;

/**
 * Left-hand side and right-hand side of a function clause, without its
 * {@code where} block. The right-hand side is either one expression after
 * {@code =} or a list of guarded alternatives.
 */
public final class Equation implements Node {
    private final int lhsFirst;
    private final int lhsLast;
    private final int equalsToken;
    private final Expr rhs;
    private final List<GuardedRhs> guards;

    public Equation(int lhsFirst, int lhsLast, int equalsToken, Expr rhs, List<GuardedRhs> guards) {
        this.lhsFirst = lhsFirst;
        this.lhsLast = lhsLast;
        this.equalsToken = equalsToken;
        this.rhs = rhs;
        this.guards = List.copyOf(guards);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.EQUATION;
    }

    @Override
    public int getFirstToken() {
        return lhsFirst;
    }

    @Override
    public int getLastToken() {
        if (rhs != null) {
            return rhs.getLastToken();
        }
        return guards.isEmpty() ? lhsLast : guards.get(guards.size() - 1).getLastToken();
    }

    public int getLhsFirst() { return lhsFirst; }
    public int getLhsLast() { return lhsLast; }

    /**
     * The {@code =} of an unguarded equation, -1 when guarded.
     */
    public int getEqualsToken() { return equalsToken; }
    public Expr getRhs() { return rhs; }
    public List<GuardedRhs> getGuards() { return guards; }

    public boolean isGuarded() {
        return !guards.isEmpty();
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>();
        if (rhs != null) {
            children.add(rhs);
        }
        children.addAll(guards);
        return children;
    }
}
