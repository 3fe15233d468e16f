package com.hsformatter.plugins.haskell.cst;

import java.util.List;

public final class ExportList extends BracketList<ExportItem> {
    public ExportList(int openToken, int closeToken, List<ExportItem> items, List<Integer> commas) {
        this(openToken, closeToken, items, commas, LayoutChoice.UNDECIDED);
    }

    private ExportList(int openToken, int closeToken, List<ExportItem> items, List<Integer> commas,
                       LayoutChoice layout) {
        super(openToken, closeToken, items, commas, layout);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.EXPORT_LIST;
    }

    @Override
    public ExportList withLayout(LayoutChoice newLayout) {
        return new ExportList(getOpenToken(), getCloseToken(), getItems(), getCommas(), newLayout);
    }
}
