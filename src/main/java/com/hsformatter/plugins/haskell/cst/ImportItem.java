package com.hsformatter.plugins.haskell.cst;

public final class ImportItem extends ListItem {
    public ImportItem(int firstToken, int lastToken, String text) {
        super(firstToken, lastToken, text);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IMPORT_ITEM;
    }
}
