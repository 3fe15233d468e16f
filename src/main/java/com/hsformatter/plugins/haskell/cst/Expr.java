package com.hsformatter.plugins.haskell.cst;

import java.util.List;

/**
 * An expression or statement kept as a token range with its nested blocks.
 */
public final class Expr extends BlockItem {
    public Expr(int firstToken, int lastToken, List<LayoutBlock> blocks) {
        super(firstToken, lastToken, blocks);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.EXPR;
    }

    public boolean isSingleToken() {
        return getFirstToken() == getLastToken();
    }
}
