package com.hsformatter.plugins.haskell.render;

/**
 * Line-oriented text sink. Strips trailing blanks when a line is closed and
 * remembers whether the current line was re-laid-out, which decides the
 * spacing before an end-of-line comment.
 */
public final class OutputBuffer {
    private final StringBuilder text = new StringBuilder();
    private final String lineSeparator;
    private int lineStart;
    private boolean lineRelaid;

    public OutputBuffer(String lineSeparator) {
        this.lineSeparator = lineSeparator;
    }

    public OutputBuffer append(String value) {
        text.append(value);
        int newline = value.lastIndexOf('\n');
        if (newline >= 0) {
            lineStart = text.length() - value.length() + newline + 1;
        }
        return this;
    }

    public OutputBuffer spaces(int count) {
        for (int i = 0; i < count; i++) {
            text.append(' ');
        }
        return this;
    }

    /**
     * Pads the current line with spaces up to {@code column}. A line that is
     * already at or past the column is left alone.
     */
    public OutputBuffer indentTo(int column) {
        int current = getColumn();
        if (current < column) {
            spaces(column - current);
        }
        return this;
    }

    public OutputBuffer newline() {
        int end = text.length();
        while (end > lineStart && (text.charAt(end - 1) == ' ' || text.charAt(end - 1) == '\t')) {
            end--;
        }
        text.setLength(end);
        text.append(lineSeparator);
        lineStart = text.length();
        lineRelaid = false;
        return this;
    }

    /**
     * 1-based column where the next character goes.
     */
    public int getColumn() {
        return text.codePointCount(lineStart, text.length()) + 1;
    }

    public boolean isAtLineStart() {
        return text.length() == lineStart;
    }

    /**
     * True when the last character of the current line opens a bracket.
     */
    public boolean endsWithOpenBracket() {
        if (text.length() == lineStart) {
            return false;
        }
        char last = text.charAt(text.length() - 1);
        return last == '(' || last == '[';
    }

    public void markRelaid() {
        lineRelaid = true;
    }

    public boolean isLineRelaid() {
        return lineRelaid;
    }

    public String getLineSeparator() {
        return lineSeparator;
    }

    public int length() {
        return text.length();
    }

    @Override
    public String toString() {
        return text.toString();
    }
}
