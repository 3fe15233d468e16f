package com.hsformatter.plugins.haskell.cst;

import java.util.List;

/**
 * A binding of a {@code let} or {@code where} block. When the binding reads as a
 * signature or a function clause the parsed declaration is attached.
 */
public final class LetBinding extends BlockItem {
    private final Declaration declaration;

    public LetBinding(int firstToken, int lastToken, List<LayoutBlock> blocks, Declaration declaration) {
        super(firstToken, lastToken, blocks);
        this.declaration = declaration;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LET_BINDING;
    }

    public Declaration getDeclaration() {
        return declaration;
    }

    public LetBinding withDeclaration(Declaration newDeclaration) {
        return new LetBinding(getFirstToken(), getLastToken(), getBlocks(), newDeclaration);
    }
}
