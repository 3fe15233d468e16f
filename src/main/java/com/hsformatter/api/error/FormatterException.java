package com.hsformatter.api.error;

/**
 * Base class of every failure raised while formatting a single input.
 */
public class FormatterException extends RuntimeException {
    private final int line;
    private final int column;

    public FormatterException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public FormatterException(String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Converts the failure into the diagnostic reported to callers.
     */
    public Diagnostic toDiagnostic() {
        return new Diagnostic(getKind(), getMessage(), line, column);
    }

    protected DiagnosticKind getKind() {
        return DiagnosticKind.PARSE_ERROR;
    }
}
