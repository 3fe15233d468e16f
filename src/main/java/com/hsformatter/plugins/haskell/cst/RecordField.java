package com.hsformatter.plugins.haskell.cst;

import java.util.List;

public final class RecordField implements Node {
    private final int firstToken;
    private final int lastToken;
    private final List<Integer> nameTokens;
    private final List<String> names;
    private final int doubleColon;
    private final boolean strict;

    public RecordField(int firstToken, int lastToken, List<Integer> nameTokens, List<String> names,
                       int doubleColon, boolean strict) {
        this.firstToken = firstToken;
        this.lastToken = lastToken;
        this.nameTokens = List.copyOf(nameTokens);
        this.names = List.copyOf(names);
        this.doubleColon = doubleColon;
        this.strict = strict;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.RECORD_FIELD;
    }

    @Override
    public int getFirstToken() { return firstToken; }
    @Override
    public int getLastToken() { return lastToken; }
    public List<Integer> getNameTokens() { return nameTokens; }
    public List<String> getNames() { return names; }
    public int getDoubleColon() { return doubleColon; }

    /**
     * True when the field type carries an explicit {@code !} or {@code ~}.
     */
    public boolean isStrict() {
        return strict;
    }

    @Override
    public List<Node> getChildren() {
        return List.of();
    }
}
