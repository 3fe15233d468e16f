package com.hsformatter.plugins.haskell.parser;

import java.util.List;

import com.hsformatter.plugins.haskell.cst.LayoutBlock;

/**
 * Token range of one top-level item with the layout blocks found inside it.
 */
public final class ItemSpan {
    private final int firstToken;
    private final int lastToken;
    private final List<LayoutBlock> blocks;

    public ItemSpan(int firstToken, int lastToken, List<LayoutBlock> blocks) {
        this.firstToken = firstToken;
        this.lastToken = lastToken;
        this.blocks = List.copyOf(blocks);
    }

    public int getFirstToken() {
        return firstToken;
    }

    public int getLastToken() {
        return lastToken;
    }

    public List<LayoutBlock> getBlocks() {
        return blocks;
    }

    @Override
    public String toString() {
        return "ItemSpan[" + firstToken + ".." + lastToken + ", blocks=" + blocks.size() + "]";
    }
}
