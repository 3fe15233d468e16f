package com.hsformatter.plugins.haskell.cst;

import java.util.List;

/**
 * An implicit layout block: the items that follow a layout keyword and line up
 * on one column. An empty block ({@code do} followed by nothing indented
 * deeper) has no items and no column.
 */
public final class LayoutBlock implements Node {
    private final BlockKind blockKind;
    private final int openerToken;
    private final int firstToken;
    private final int lastToken;
    private final int column;
    private final List<BlockItem> items;

    public LayoutBlock(BlockKind blockKind, int openerToken, int firstToken, int lastToken,
                       int column, List<BlockItem> items) {
        this.blockKind = blockKind;
        this.openerToken = openerToken;
        this.firstToken = firstToken;
        this.lastToken = lastToken;
        this.column = column;
        this.items = List.copyOf(items);
    }

    public static LayoutBlock empty(BlockKind blockKind, int openerToken) {
        return new LayoutBlock(blockKind, openerToken, -1, -1, -1, List.of());
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LAYOUT_BLOCK;
    }

    public BlockKind getBlockKind() { return blockKind; }
    public int getOpenerToken() { return openerToken; }
    @Override
    public int getFirstToken() { return firstToken; }
    @Override
    public int getLastToken() { return lastToken; }
    public int getColumn() { return column; }
    public List<BlockItem> getItems() { return items; }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public boolean contains(int tokenIndex) {
        return !isEmpty() && tokenIndex >= firstToken && tokenIndex <= lastToken;
    }

    @Override
    public List<BlockItem> getChildren() {
        return items;
    }
}
