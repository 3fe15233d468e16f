package com.hsformatter.plugins.haskell.cst;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code module Name [(exports)] where}
 */
public final class ModuleHeader implements Node {
    private final int moduleToken;
    private final int lastToken;
    private final int nameToken;
    private final String name;
    private final ExportList exports;
    private final int whereToken;

    public ModuleHeader(int moduleToken, int lastToken, int nameToken, String name, ExportList exports,
                        int whereToken) {
        this.moduleToken = moduleToken;
        this.lastToken = lastToken;
        this.nameToken = nameToken;
        this.name = name;
        this.exports = exports;
        this.whereToken = whereToken;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MODULE_HEADER;
    }

    @Override
    public int getFirstToken() {
        return moduleToken;
    }

    @Override
    public int getLastToken() {
        return lastToken;
    }

    public int getNameToken() { return nameToken; }
    public String getName() { return name; }

    /**
     * The export list, or null when the module exports everything.
     */
    public ExportList getExports() { return exports; }

    /**
     * Index of the {@code where} keyword, -1 when missing.
     */
    public int getWhereToken() { return whereToken; }

    public ModuleHeader withExports(ExportList newExports) {
        return new ModuleHeader(moduleToken, lastToken, nameToken, name, newExports, whereToken);
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>();
        if (exports != null) {
            children.add(exports);
        }
        return children;
    }
}
