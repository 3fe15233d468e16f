package com.hsformatter.plugins.haskell.cst;

import java.util.List;

/**
 * A parenthesized, comma-separated list of names. Items may be empty between
 * two commas; such positions hold no {@link ListItem}.
 */
public abstract class BracketList<T extends ListItem> implements Node {
    private final int openToken;
    private final int closeToken;
    private final List<T> items;
    private final List<Integer> commas;
    private final LayoutChoice layout;

    protected BracketList(int openToken, int closeToken, List<T> items, List<Integer> commas, LayoutChoice layout) {
        this.openToken = openToken;
        this.closeToken = closeToken;
        this.items = List.copyOf(items);
        this.commas = List.copyOf(commas);
        this.layout = layout;
    }

    @Override
    public int getFirstToken() {
        return openToken;
    }

    @Override
    public int getLastToken() {
        return closeToken;
    }

    public int getOpenToken() { return openToken; }
    public int getCloseToken() { return closeToken; }
    public List<T> getItems() { return items; }
    public List<Integer> getCommas() { return commas; }
    public LayoutChoice getLayout() { return layout; }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public abstract BracketList<T> withLayout(LayoutChoice newLayout);

    @Override
    public List<T> getChildren() {
        return items;
    }
}
