package com.hsformatter.util;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.Severity;

/**
 * Console rendering of diagnostics.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    /**
     * Creates a new error formatter.
     *
     * @param useColors whether to use colors in the output
     */
    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * Formats one diagnostic as {@code SEVERITY kind: message (line:column)}.
     */
    public String formatDiagnostic(Diagnostic diagnostic) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (diagnostic.getSeverity()) {
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
            case ADVISORY -> colorize(ANSI_BLUE, "ADVISORY");
        };

        sb.append(severityStr).append(' ')
                .append(diagnostic.getKind().name().toLowerCase().replace('_', '-'))
                .append(": ")
                .append(diagnostic.getMessage())
                .append(" (").append(diagnostic.getLine()).append(':').append(diagnostic.getColumn()).append(')');

        if (diagnostic.getSuggestion() != null && !diagnostic.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(diagnostic.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * Creates a summary of diagnostics per file.
     */
    public String formatSummary(Map<Path, List<Diagnostic>> fileDiagnostics) {
        StringBuilder sb = new StringBuilder();

        sb.append(colorize(ANSI_BOLD, "Summary:\n"));

        long totalErrors = 0;
        long totalWarnings = 0;
        long totalAdvisories = 0;

        for (Map.Entry<Path, List<Diagnostic>> entry : fileDiagnostics.entrySet()) {
            List<Diagnostic> diagnostics = entry.getValue();
            if (diagnostics.isEmpty()) {
                continue;
            }

            Map<Severity, Long> counts = diagnostics.stream()
                    .collect(Collectors.groupingBy(Diagnostic::getSeverity, Collectors.counting()));
            long errors = counts.getOrDefault(Severity.ERROR, 0L);
            long warnings = counts.getOrDefault(Severity.WARNING, 0L);
            long advisories = counts.getOrDefault(Severity.ADVISORY, 0L);

            totalErrors += errors;
            totalWarnings += warnings;
            totalAdvisories += advisories;

            sb.append(entry.getKey().getFileName()).append(": ")
                    .append(_formatCounts(errors, warnings, advisories))
                    .append("\n");
        }

        sb.append("\nTotal: ").append(_formatCounts(totalErrors, totalWarnings, totalAdvisories));
        return sb.toString();
    }

    private String _formatCounts(long errors, long warnings, long advisories) {
        StringBuilder sb = new StringBuilder();
        if (errors > 0) {
            sb.append(colorize(ANSI_RED, errors + " errors"));
        }
        if (warnings > 0) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(colorize(ANSI_YELLOW, warnings + " warnings"));
        }
        if (advisories > 0) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(colorize(ANSI_BLUE, advisories + " advisories"));
        }
        if (sb.length() == 0) {
            sb.append(colorize(ANSI_GREEN, "clean"));
        }
        return sb.toString();
    }

    /**
     * Groups diagnostics by severity.
     */
    public Map<Severity, List<Diagnostic>> groupBySeverity(List<Diagnostic> diagnostics) {
        return diagnostics.stream().collect(Collectors.groupingBy(Diagnostic::getSeverity));
    }

    /**
     * Applies ANSI color to text if colors are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }
}
