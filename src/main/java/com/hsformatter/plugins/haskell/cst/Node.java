package com.hsformatter.plugins.haskell.cst;

import java.util.List;

/**
 * A node of the concrete syntax tree. Nodes refer to the token list of their
 * {@link Module} by index; the range is inclusive on both ends.
 */
public interface Node {
    NodeKind getKind();

    int getFirstToken();

    int getLastToken();

    /**
     * Owned children in source order.
     */
    List<? extends Node> getChildren();
}
