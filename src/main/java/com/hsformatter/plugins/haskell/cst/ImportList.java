package com.hsformatter.plugins.haskell.cst;

import java.util.List;

public final class ImportList extends BracketList<ImportItem> {
    public ImportList(int openToken, int closeToken, List<ImportItem> items, List<Integer> commas) {
        this(openToken, closeToken, items, commas, LayoutChoice.UNDECIDED);
    }

    private ImportList(int openToken, int closeToken, List<ImportItem> items, List<Integer> commas,
                       LayoutChoice layout) {
        super(openToken, closeToken, items, commas, layout);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IMPORT_LIST;
    }

    @Override
    public ImportList withLayout(LayoutChoice newLayout) {
        return new ImportList(getOpenToken(), getCloseToken(), getItems(), getCommas(), newLayout);
    }
}
