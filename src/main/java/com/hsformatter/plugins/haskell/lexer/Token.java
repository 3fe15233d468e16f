package com.hsformatter.plugins.haskell.lexer;

/**
 * A lexical token with the trivia that precedes it. Immutable.
 */
public final class Token {
    private final TokenKind kind;
    private final String text;
    private final int startOffset;
    private final int endOffset;
    private final int line;
    private final int column;
    private final int endLine;
    private final boolean firstOnLine;
    private final Trivia trivia;

    public Token(TokenKind kind, String text, int startOffset, int endOffset, int line, int column,
                 int endLine, boolean firstOnLine, Trivia trivia) {
        this.kind = kind;
        this.text = text;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.line = line;
        this.column = column;
        this.endLine = endLine;
        this.firstOnLine = firstOnLine;
        this.trivia = trivia;
    }

    public TokenKind getKind() { return kind; }
    public String getText() { return text; }
    /**
     * UTF-8 byte offset of the first character.
     */
    public int getStartOffset() { return startOffset; }
    public int getEndOffset() { return endOffset; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getEndLine() { return endLine; }
    public Trivia getTrivia() { return trivia; }

    /**
     * True when no other token precedes this one on its line. Comments do not count.
     */
    public boolean isFirstOnLine() {
        return firstOnLine;
    }

    public boolean isMultiLine() {
        return endLine != line;
    }

    public boolean is(String value) {
        return text.equals(value) && kind != TokenKind.LITERAL
                && kind != TokenKind.QUASI_QUOTE && kind != TokenKind.PRAGMA;
    }

    public boolean isKeyword(String keyword) {
        return kind == TokenKind.KEYWORD && text.equals(keyword);
    }

    public boolean isOperator(String operator) {
        return kind == TokenKind.OPERATOR && text.equals(operator);
    }

    public boolean isPunctuation(String punctuation) {
        return kind == TokenKind.PUNCTUATION && text.equals(punctuation);
    }

    public boolean isOpenBracket() {
        return kind == TokenKind.PUNCTUATION
                && (text.equals("(") || text.equals("[") || text.equals("{"));
    }

    public boolean isCloseBracket() {
        return kind == TokenKind.PUNCTUATION
                && (text.equals(")") || text.equals("]") || text.equals("}"));
    }

    public boolean isEof() {
        return kind == TokenKind.EOF;
    }

    /**
     * Variable identifier: lower case or underscore start, possibly qualified.
     */
    public boolean isVarId() {
        if (kind != TokenKind.IDENTIFIER) {
            return false;
        }
        String base = getUnqualifiedText();
        char first = base.charAt(0);
        return first == '_' || Character.isLowerCase(first)
                || (Character.isLetter(first) && !Character.isUpperCase(first) && !Character.isTitleCase(first));
    }

    /**
     * Constructor identifier: upper case start, possibly qualified.
     */
    public boolean isConId() {
        if (kind != TokenKind.IDENTIFIER) {
            return false;
        }
        char first = getUnqualifiedText().charAt(0);
        return Character.isUpperCase(first) || Character.isTitleCase(first);
    }

    /**
     * The name with any module qualifier removed.
     */
    public String getUnqualifiedText() {
        if (kind != TokenKind.IDENTIFIER && kind != TokenKind.OPERATOR) {
            return text;
        }
        int index = 0;
        while (index < text.length() && Character.isUpperCase(text.charAt(index))) {
            int dot = _qualifierEnd(index);
            if (dot < 0) {
                break;
            }
            index = dot + 1;
        }
        return index == 0 || index >= text.length() ? text : text.substring(index);
    }

    private int _qualifierEnd(int from) {
        int i = from;
        while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i))
                || text.charAt(i) == '_' || text.charAt(i) == '\'')) {
            i++;
        }
        if (i < text.length() - 1 && text.charAt(i) == '.') {
            return i;
        }
        return -1;
    }

    public boolean isQualified() {
        return !getUnqualifiedText().equals(text);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + line + ":" + column;
    }
}
