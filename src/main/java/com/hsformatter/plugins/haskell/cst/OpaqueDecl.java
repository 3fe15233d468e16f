package com.hsformatter.plugins.haskell.cst;

import java.util.List;

/**
 * A declaration kept as a token range. Only its indentation may change.
 */
public final class OpaqueDecl extends Declaration {
    private final OpaqueKind opaqueKind;
    private final String name;

    public OpaqueDecl(int firstToken, int lastToken, List<LayoutBlock> blocks,
                      OpaqueKind opaqueKind, String name) {
        this(firstToken, lastToken, blocks, opaqueKind, name, IndentPlan.EMPTY);
    }

    private OpaqueDecl(int firstToken, int lastToken, List<LayoutBlock> blocks,
                       OpaqueKind opaqueKind, String name, IndentPlan plan) {
        super(firstToken, lastToken, blocks, plan);
        this.opaqueKind = opaqueKind;
        this.name = name;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.OPAQUE_DECL;
    }

    public OpaqueKind getOpaqueKind() {
        return opaqueKind;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    protected Declaration copyWith(IndentPlan plan) {
        return new OpaqueDecl(getFirstToken(), getLastToken(), getBlocks(), opaqueKind, name, plan);
    }
}
