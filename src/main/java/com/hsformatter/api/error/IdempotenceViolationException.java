package com.hsformatter.api.error;

/**
 * Formatting already formatted text changed it again.
 */
public class IdempotenceViolationException extends FormatterException {
    private final String firstPass;
    private final String secondPass;

    public IdempotenceViolationException(String message, int line, String firstPass, String secondPass) {
        super(message, line, 1);
        this.firstPass = firstPass;
        this.secondPass = secondPass;
    }

    public String getFirstPass() {
        return firstPass;
    }

    public String getSecondPass() {
        return secondPass;
    }

    @Override
    protected DiagnosticKind getKind() {
        return DiagnosticKind.IDEMPOTENCE_VIOLATION;
    }
}
