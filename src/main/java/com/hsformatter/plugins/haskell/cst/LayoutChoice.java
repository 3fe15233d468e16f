package com.hsformatter.plugins.haskell.cst;

/**
 * Layout decided for a list-shaped construct.
 */
public enum LayoutChoice {
    UNDECIDED,
    SINGLE_LINE,
    MULTI_LINE
}
