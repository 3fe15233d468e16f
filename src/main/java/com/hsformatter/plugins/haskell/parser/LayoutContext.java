package com.hsformatter.plugins.haskell.parser;

import com.hsformatter.plugins.haskell.cst.BlockKind;

/**
 * The layout context an item is read in: the column of the enclosing block,
 * the keyword that opened it and the contexts around it. Immutable; a nested
 * block gets a fresh context through {@link #enter}.
 */
public final class LayoutContext {
    private final int column;
    private final BlockKind blockKind;
    private final LayoutContext parent;
    private final boolean closesOnComma;

    private LayoutContext(int column, BlockKind blockKind, LayoutContext parent, boolean closesOnComma) {
        this.column = column;
        this.blockKind = blockKind;
        this.parent = parent;
        this.closesOnComma = closesOnComma;
    }

    /**
     * The module body, whose items start at {@code column}.
     */
    public static LayoutContext top(int column) {
        return new LayoutContext(column, null, null, false);
    }

    /**
     * Context of a block opened by {@code kind} whose items start at {@code blockColumn}.
     *
     * @param insideBracket the opener sits inside a bracket opened by the current item
     */
    public LayoutContext enter(BlockKind kind, int blockColumn, boolean insideBracket) {
        return new LayoutContext(blockColumn, kind, this, insideBracket || closesOnComma);
    }

    public int getColumn() {
        return column;
    }

    /**
     * Null for the module body.
     */
    public BlockKind getBlockKind() {
        return blockKind;
    }

    public LayoutContext getParent() {
        return parent;
    }

    public boolean isTop() {
        return parent == null;
    }

    /**
     * A comma outside any bracket of the current item belongs to an
     * enclosing bracket and therefore ends the block.
     */
    public boolean isClosesOnComma() {
        return closesOnComma;
    }

    public int getDepth() {
        return parent == null ? 0 : parent.getDepth() + 1;
    }

    @Override
    public String toString() {
        return (blockKind == null ? "top" : blockKind.getKeyword()) + "@" + column;
    }
}
