package com.hsformatter.api;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.api.error.Severity;

/**
 * Result of a formatting operation.
 */
public class FormatterResult {
    private final boolean successful;
    private final String formattedCode;
    private final List<Diagnostic> diagnostics;
    private final List<Refactoring> appliedRefactorings;

    private FormatterResult(Builder builder) {
        this.successful = builder.successful;
        this.formattedCode = builder.formattedCode;
        this.diagnostics = List.copyOf(builder.diagnostics);
        this.appliedRefactorings = List.copyOf(builder.appliedRefactorings);
    }

    public boolean isSuccessful() {
        return successful;
    }

    /**
     * The formatted text, or {@code null} when the input was rejected.
     */
    public String getFormattedCode() {
        return formattedCode;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> getDiagnostics(DiagnosticKind kind) {
        return diagnostics.stream()
                .filter(d -> d.getKind() == kind)
                .collect(Collectors.toList());
    }

    public List<Diagnostic> getMechanicalDiagnostics() {
        return diagnostics.stream()
                .filter(Diagnostic::isMechanical)
                .collect(Collectors.toList());
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.getSeverity() == Severity.ERROR);
    }

    public List<Refactoring> getAppliedRefactorings() {
        return appliedRefactorings;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String formattedCode;
        private List<Diagnostic> diagnostics = new ArrayList<>();
        private List<Refactoring> appliedRefactorings = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder formattedCode(String formattedCode) {
            this.formattedCode = formattedCode;
            return this;
        }

        public Builder addDiagnostic(Diagnostic diagnostic) {
            this.diagnostics.add(diagnostic);
            return this;
        }

        public Builder diagnostics(List<Diagnostic> diagnostics) {
            this.diagnostics = new ArrayList<>(diagnostics);
            return this;
        }

        public Builder addRefactoring(Refactoring refactoring) {
            this.appliedRefactorings.add(refactoring);
            return this;
        }

        public Builder appliedRefactorings(List<Refactoring> refactorings) {
            this.appliedRefactorings = new ArrayList<>(refactorings);
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
