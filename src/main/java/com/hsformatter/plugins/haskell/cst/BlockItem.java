package com.hsformatter.plugins.haskell.cst;

import java.util.List;

/**
 * One item of a layout block: a statement, a binding or a case alternative,
 * together with the blocks nested directly inside it.
 */
public abstract class BlockItem implements Node {
    private final int firstToken;
    private final int lastToken;
    private final List<LayoutBlock> blocks;

    protected BlockItem(int firstToken, int lastToken, List<LayoutBlock> blocks) {
        this.firstToken = firstToken;
        this.lastToken = lastToken;
        this.blocks = List.copyOf(blocks);
    }

    @Override
    public int getFirstToken() {
        return firstToken;
    }

    @Override
    public int getLastToken() {
        return lastToken;
    }

    public List<LayoutBlock> getBlocks() {
        return blocks;
    }

    @Override
    public List<? extends Node> getChildren() {
        return blocks;
    }
}
