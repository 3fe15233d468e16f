package com.hsformatter.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.api.error.Severity;

class ErrorFormatterTest {
    private final ErrorFormatter plain = new ErrorFormatter(false);

    @Test
    void formatsKindMessageAndPosition() {
        Diagnostic diagnostic = new Diagnostic(DiagnosticKind.LONG_LINE, "Line is 90 characters long", 4, 81);

        assertThat(plain.formatDiagnostic(diagnostic))
                .isEqualTo("ADVISORY long-line: Line is 90 characters long (4:81)");
    }

    @Test
    void appendsSuggestion() {
        Diagnostic diagnostic = new Diagnostic(DiagnosticKind.MISSING_STRICTNESS_ANNOTATION,
                "Field fooBar is lazy", 3, 18, -1, -1, "fooBar :: !Bar");

        assertThat(plain.formatDiagnostic(diagnostic)).endsWith("\n  Suggestion: fooBar :: !Bar");
    }

    @Test
    void colorsOnlyWhenEnabled() {
        ErrorFormatter colored = new ErrorFormatter(true);
        Diagnostic diagnostic = new Diagnostic(DiagnosticKind.PARSE_ERROR, "Unbalanced bracket", 1, 5);

        assertThat(colored.formatDiagnostic(diagnostic))
                .startsWith(ErrorFormatter.ANSI_RED + "ERROR" + ErrorFormatter.ANSI_RESET);
        assertThat(plain.colorize(ErrorFormatter.ANSI_RED, "x")).isEqualTo("x");
    }

    @Test
    void summaryCountsPerFileAndInTotal() {
        Map<Path, List<Diagnostic>> diagnostics = new LinkedHashMap<>();
        diagnostics.put(Path.of("src/A.hs"), List.of(
                new Diagnostic(DiagnosticKind.INDENTATION, "moved", 2, 3),
                new Diagnostic(DiagnosticKind.NAMING_VIOLATION, "snake case", 5, 1)));
        diagnostics.put(Path.of("src/B.hs"), List.of());

        String summary = plain.formatSummary(diagnostics);

        assertThat(summary).contains("A.hs: 1 warnings, 1 advisories\n")
                .doesNotContain("B.hs")
                .endsWith("Total: 1 warnings, 1 advisories");
    }

    @Test
    void emptySummaryIsClean() {
        assertThat(plain.formatSummary(Map.of())).endsWith("Total: clean");
    }

    @Test
    void groupsBySeverity() {
        Map<Severity, List<Diagnostic>> grouped = plain.groupBySeverity(List.of(
                new Diagnostic(DiagnosticKind.ALIGNMENT, "a", 1, 1),
                new Diagnostic(DiagnosticKind.ENCODING_ERROR, "b", 1, 1),
                new Diagnostic(DiagnosticKind.TRAILING_WHITESPACE, "c", 1, 1)));

        assertThat(grouped.get(Severity.WARNING)).hasSize(2);
        assertThat(grouped.get(Severity.ERROR)).hasSize(1);
        assertThat(grouped).doesNotContainKey(Severity.ADVISORY);
    }
}
