package com.hsformatter.plugins.haskell.cst;

import java.util.List;

/**
 * One data constructor. Record constructors carry their brace tokens and fields.
 */
public final class Constructor implements Node {
    private final int firstToken;
    private final int lastToken;
    private final int nameToken;
    private final String name;
    private final int openBrace;
    private final int closeBrace;
    private final List<RecordField> fields;
    private final List<Integer> commas;

    public Constructor(int firstToken, int lastToken, int nameToken, String name) {
        this(firstToken, lastToken, nameToken, name, -1, -1, List.of(), List.of());
    }

    public Constructor(int firstToken, int lastToken, int nameToken, String name, int openBrace,
                       int closeBrace, List<RecordField> fields, List<Integer> commas) {
        this.firstToken = firstToken;
        this.lastToken = lastToken;
        this.nameToken = nameToken;
        this.name = name;
        this.openBrace = openBrace;
        this.closeBrace = closeBrace;
        this.fields = List.copyOf(fields);
        this.commas = List.copyOf(commas);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CONSTRUCTOR;
    }

    @Override
    public int getFirstToken() { return firstToken; }
    @Override
    public int getLastToken() { return lastToken; }
    public int getNameToken() { return nameToken; }
    public String getName() { return name; }
    public int getOpenBrace() { return openBrace; }
    public int getCloseBrace() { return closeBrace; }
    public List<RecordField> getFields() { return fields; }
    public List<Integer> getCommas() { return commas; }

    public boolean isRecord() {
        return openBrace >= 0;
    }

    @Override
    public List<RecordField> getChildren() {
        return fields;
    }
}
