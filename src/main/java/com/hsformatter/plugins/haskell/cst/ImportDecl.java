package com.hsformatter.plugins.haskell.cst;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code import [{-# SOURCE #-}] [safe] [qualified] ["pkg"] M [qualified] [as N] [hiding] [(items)]}
 */
public final class ImportDecl implements Node {
    private final int firstToken;
    private final int lastToken;
    private final int moduleNameToken;
    private final String moduleName;
    private final boolean qualified;
    private final String alias;
    private final boolean hiding;
    private final ImportList importList;
    private final int sourceIndex;

    public ImportDecl(int firstToken, int lastToken, int moduleNameToken, String moduleName, boolean qualified,
                      String alias, boolean hiding, ImportList importList, int sourceIndex) {
        this.firstToken = firstToken;
        this.lastToken = lastToken;
        this.moduleNameToken = moduleNameToken;
        this.moduleName = moduleName;
        this.qualified = qualified;
        this.alias = alias;
        this.hiding = hiding;
        this.importList = importList;
        this.sourceIndex = sourceIndex;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IMPORT_DECL;
    }

    @Override
    public int getFirstToken() { return firstToken; }
    @Override
    public int getLastToken() { return lastToken; }
    public int getModuleNameToken() { return moduleNameToken; }
    public String getModuleName() { return moduleName; }
    public boolean isQualified() { return qualified; }

    /**
     * Name after {@code as}, or null.
     */
    public String getAlias() { return alias; }
    public boolean isHiding() { return hiding; }

    /**
     * Explicit item list (the hidden names when {@link #isHiding()}), or null.
     */
    public ImportList getImportList() { return importList; }

    /**
     * Position among the imports of the source file, starting at 0.
     */
    public int getSourceIndex() { return sourceIndex; }

    public ImportDecl withImportList(ImportList newList) {
        return new ImportDecl(firstToken, lastToken, moduleNameToken, moduleName, qualified, alias, hiding,
                newList, sourceIndex);
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>();
        if (importList != null) {
            children.add(importList);
        }
        return children;
    }
}
