package com.hsformatter.plugins.haskell.cst;

import java.util.List;

import com.hsformatter.config.ImportCategory;

/**
 * A run of imports. Groups read from the source are separated by blank lines
 * and have no category; groups built by the ordering pass carry one.
 */
public final class ImportGroup implements Node {
    private final List<ImportDecl> imports;
    private final ImportCategory category;

    public ImportGroup(List<ImportDecl> imports, ImportCategory category) {
        this.imports = List.copyOf(imports);
        this.category = category;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IMPORT_GROUP;
    }

    @Override
    public int getFirstToken() {
        return imports.get(0).getFirstToken();
    }

    @Override
    public int getLastToken() {
        return imports.get(imports.size() - 1).getLastToken();
    }

    public List<ImportDecl> getImports() {
        return imports;
    }

    public ImportCategory getCategory() {
        return category;
    }

    public boolean isOrdered() {
        return category != null;
    }

    @Override
    public List<ImportDecl> getChildren() {
        return imports;
    }
}
