package com.hsformatter.api.error;

/**
 * Input bytes or text are not valid UTF-8.
 */
public class EncodingException extends FormatterException {
    private final int byteOffset;

    public EncodingException(String message, int line, int column, int byteOffset) {
        super(message, line, column);
        this.byteOffset = byteOffset;
    }

    public EncodingException(String message, int line, int column, int byteOffset, Throwable cause) {
        super(message, line, column, cause);
        this.byteOffset = byteOffset;
    }

    public int getByteOffset() {
        return byteOffset;
    }

    @Override
    public Diagnostic toDiagnostic() {
        return new Diagnostic(DiagnosticKind.ENCODING_ERROR, getMessage(), getLine(), getColumn(),
                byteOffset, byteOffset, null);
    }

    @Override
    protected DiagnosticKind getKind() {
        return DiagnosticKind.ENCODING_ERROR;
    }
}
