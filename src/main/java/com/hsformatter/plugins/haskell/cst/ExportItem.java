package com.hsformatter.plugins.haskell.cst;

public final class ExportItem extends ListItem {
    private final boolean moduleReexport;

    public ExportItem(int firstToken, int lastToken, String text, boolean moduleReexport) {
        super(firstToken, lastToken, text);
        this.moduleReexport = moduleReexport;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.EXPORT_ITEM;
    }

    /**
     * {@code module M} entries, which re-export an imported module.
     */
    public boolean isModuleReexport() {
        return moduleReexport;
    }

    /**
     * Module name of a {@code module M} entry, otherwise null.
     */
    public String getReexportedModule() {
        return moduleReexport ? getText().substring("module ".length()).trim() : null;
    }
}
