package com.hsformatter.plugins.haskell.lexer;

/**
 * One run of whitespace, one line break, or one comment.
 */
public final class TriviaPiece {
    public enum Kind {
        WHITESPACE,
        NEWLINE,
        LINE_COMMENT,
        BLOCK_COMMENT
    }

    private final Kind kind;
    private final String text;
    private final int startOffset;
    private final int endOffset;
    private final int line;
    private final int column;
    private final boolean terminated;

    public TriviaPiece(Kind kind, String text, int startOffset, int endOffset, int line, int column,
                       boolean terminated) {
        this.kind = kind;
        this.text = text;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.line = line;
        this.column = column;
        this.terminated = terminated;
    }

    public Kind getKind() { return kind; }
    public String getText() { return text; }
    public int getStartOffset() { return startOffset; }
    public int getEndOffset() { return endOffset; }
    public int getLine() { return line; }
    public int getColumn() { return column; }

    /**
     * False only for a block comment that runs to the end of input.
     */
    public boolean isTerminated() {
        return terminated;
    }

    public boolean isComment() {
        return kind == Kind.LINE_COMMENT || kind == Kind.BLOCK_COMMENT;
    }

    public boolean isNewline() {
        return kind == Kind.NEWLINE;
    }

    @Override
    public String toString() {
        return kind + "(" + text.replace("\n", "\\n") + ")";
    }
}
