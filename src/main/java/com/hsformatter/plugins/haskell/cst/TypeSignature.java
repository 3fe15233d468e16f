package com.hsformatter.plugins.haskell.cst;

import java.util.List;

import com.hsformatter.plugins.haskell.rules.AlignmentGroup;

/**
 * {@code name1, name2 :: type}. The type is split into segments at the
 * {@code =>} and {@code ->} separators outside brackets.
 */
public final class TypeSignature extends Declaration {
    private final List<Integer> nameTokens;
    private final List<String> names;
    private final int doubleColon;
    private final List<Integer> separators;
    private final LayoutChoice layout;
    private final AlignmentGroup alignment;

    public TypeSignature(int firstToken, int lastToken, List<LayoutBlock> blocks, List<Integer> nameTokens,
                         List<String> names, int doubleColon, List<Integer> separators) {
        this(firstToken, lastToken, blocks, nameTokens, names, doubleColon, separators,
                LayoutChoice.UNDECIDED, null, IndentPlan.EMPTY);
    }

    private TypeSignature(int firstToken, int lastToken, List<LayoutBlock> blocks, List<Integer> nameTokens,
                          List<String> names, int doubleColon, List<Integer> separators,
                          LayoutChoice layout, AlignmentGroup alignment, IndentPlan plan) {
        super(firstToken, lastToken, blocks, plan);
        this.nameTokens = List.copyOf(nameTokens);
        this.names = List.copyOf(names);
        this.doubleColon = doubleColon;
        this.separators = List.copyOf(separators);
        this.layout = layout;
        this.alignment = alignment;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TYPE_SIGNATURE;
    }

    @Override
    public String getName() {
        return names.isEmpty() ? null : names.get(0);
    }

    public List<String> getNames() {
        return names;
    }

    public List<Integer> getNameTokens() {
        return nameTokens;
    }

    public int getDoubleColon() {
        return doubleColon;
    }

    /**
     * Indices of the top-level {@code =>} and {@code ->} tokens of the type.
     */
    public List<Integer> getSeparators() {
        return separators;
    }

    public int getSegmentCount() {
        return separators.size() + 1;
    }

    public LayoutChoice getLayout() {
        return layout;
    }

    public AlignmentGroup getAlignment() {
        return alignment;
    }

    public TypeSignature withLayout(LayoutChoice newLayout, AlignmentGroup newAlignment) {
        TypeSignature copy = new TypeSignature(getFirstToken(), getLastToken(), getBlocks(), nameTokens, names,
                doubleColon, separators, newLayout, newAlignment, getIndentPlan());
        copy.attachTo(getEnclosing());
        return copy;
    }

    @Override
    protected Declaration copyWith(IndentPlan plan) {
        return new TypeSignature(getFirstToken(), getLastToken(), getBlocks(), nameTokens, names,
                doubleColon, separators, layout, alignment, plan);
    }
}
