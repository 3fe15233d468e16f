package com.hsformatter.plugins.haskell.cst;

import java.util.List;

/**
 * One comma-separated entry of an export or import list.
 */
public abstract class ListItem implements Node {
    private final int firstToken;
    private final int lastToken;
    private final String text;

    protected ListItem(int firstToken, int lastToken, String text) {
        this.firstToken = firstToken;
        this.lastToken = lastToken;
        this.text = text;
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
     * Token texts of the item, one space wherever the source separated two
     * tokens.
     */
    public String getText() {
        return text;
    }

    @Override
    public List<Node> getChildren() {
        return List.of();
    }
}
