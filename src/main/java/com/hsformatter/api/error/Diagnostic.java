package com.hsformatter.api.error;

import java.util.Objects;

/**
 * A finding reported against a span of the source text.
 */
public class Diagnostic {
    private final DiagnosticKind kind;
    private final Severity severity;
    private final String message;
    private final int line;
    private final int column;
    private final int startOffset;
    private final int endOffset;
    private final String suggestion;

    public Diagnostic(DiagnosticKind kind, String message, int line, int column) {
        this(kind, kind.getDefaultSeverity(), message, line, column, -1, -1, null);
    }

    public Diagnostic(DiagnosticKind kind, String message, int line, int column,
                      int startOffset, int endOffset, String suggestion) {
        this(kind, kind.getDefaultSeverity(), message, line, column, startOffset, endOffset, suggestion);
    }

    public Diagnostic(DiagnosticKind kind, Severity severity, String message, int line, int column,
                      int startOffset, int endOffset, String suggestion) {
        this.kind = kind;
        this.severity = severity;
        this.message = message;
        this.line = line;
        this.column = column;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.suggestion = suggestion;
    }

    // Getters
    public DiagnosticKind getKind() { return kind; }
    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getStartOffset() { return startOffset; }
    public int getEndOffset() { return endOffset; }
    public String getSuggestion() { return suggestion; }

    public boolean isMechanical() {
        return kind.isMechanical();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Diagnostic)) {
            return false;
        }
        Diagnostic that = (Diagnostic) o;
        return line == that.line && column == that.column
                && startOffset == that.startOffset && endOffset == that.endOffset
                && kind == that.kind && severity == that.severity
                && Objects.equals(message, that.message)
                && Objects.equals(suggestion, that.suggestion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, severity, message, line, column, startOffset, endOffset, suggestion);
    }

    @Override
    public String toString() {
        return kind + "@" + line + ":" + column + " " + message;
    }
}
