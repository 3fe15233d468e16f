package com.hsformatter.plugins.haskell.cst;

import java.util.List;

public final class CaseAlt extends BlockItem {
    public CaseAlt(int firstToken, int lastToken, List<LayoutBlock> blocks) {
        super(firstToken, lastToken, blocks);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CASE_ALT;
    }
}
