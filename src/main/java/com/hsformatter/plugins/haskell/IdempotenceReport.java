package com.hsformatter.plugins.haskell;

import java.util.List;

import com.hsformatter.api.error.Diagnostic;

/**
 * Outcome of formatting a text twice.
 */
public final class IdempotenceReport {
    private final boolean idempotent;
    private final String firstPass;
    private final String secondPass;
    private final int firstDifferingLine;
    private final List<Diagnostic> residualDiagnostics;

    public IdempotenceReport(boolean idempotent, String firstPass, String secondPass, int firstDifferingLine,
                             List<Diagnostic> residualDiagnostics) {
        this.idempotent = idempotent;
        this.firstPass = firstPass;
        this.secondPass = secondPass;
        this.firstDifferingLine = firstDifferingLine;
        this.residualDiagnostics = List.copyOf(residualDiagnostics);
    }

    public boolean isIdempotent() { return idempotent; }
    public String getFirstPass() { return firstPass; }
    public String getSecondPass() { return secondPass; }

    /**
     * 1-based line where the two outputs first differ, or 0 when the texts
     * are equal.
     */
    public int getFirstDifferingLine() { return firstDifferingLine; }

    /**
     * Mechanical diagnostics the second run still reported.
     */
    public List<Diagnostic> getResidualDiagnostics() { return residualDiagnostics; }

    @Override
    public String toString() {
        if (idempotent) {
            return "idempotent";
        }
        return firstDifferingLine > 0
                ? "second pass differs from line " + firstDifferingLine
                : "second pass reported " + residualDiagnostics.size() + " mechanical diagnostics";
    }
}
