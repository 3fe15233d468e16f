package com.hsformatter.api.error;

/**
 * The source is malformed in a way the structural reader cannot represent.
 */
public class ParseException extends FormatterException {
    private final int startOffset;
    private final int endOffset;
    private final String expected;

    public ParseException(String message, String expected, int line, int column, int startOffset, int endOffset) {
        super(message, line, column);
        this.expected = expected;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
    }

    public String getExpected() {
        return expected;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    @Override
    public Diagnostic toDiagnostic() {
        return new Diagnostic(DiagnosticKind.PARSE_ERROR, getMessage(), getLine(), getColumn(),
                startOffset, endOffset, expected == null ? null : "Expected " + expected);
    }
}
