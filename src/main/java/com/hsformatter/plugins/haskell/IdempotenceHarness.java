package com.hsformatter.plugins.haskell;

import java.util.List;
import java.util.logging.Logger;

import com.hsformatter.api.FormatterResult;
import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.IdempotenceViolationException;
import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.util.LoggerUtil;

/**
 * Formats a text, formats the result again and checks that the second run
 * neither changes the text nor reports anything it would fix.
 */
public final class IdempotenceHarness {
    private static final Logger logger = LoggerUtil.getLogger(IdempotenceHarness.class);

    private IdempotenceHarness() {
    }

    /**
     * Input the formatter rejects is reported idempotent: there is no output
     * to format again.
     */
    public static IdempotenceReport check(String text, HaskellStyleConfig config) {
        HaskellStyleConfig once = config.toBuilder().verifyIdempotence(false).build();
        HaskellFormatter formatter = new HaskellFormatter();
        FormatterResult first = formatter.format(text, once);
        if (first.getFormattedCode() == null) {
            return new IdempotenceReport(true, null, null, 0, List.of());
        }
        FormatterResult second = formatter.format(first.getFormattedCode(), once);
        return compare(first, second);
    }

    public static IdempotenceReport compare(FormatterResult first, FormatterResult second) {
        String firstText = first.getFormattedCode();
        String secondText = second.getFormattedCode();
        List<Diagnostic> residual = second.getMechanicalDiagnostics();
        int line = secondText == null ? 1 : firstDifferingLine(firstText, secondText);
        boolean idempotent = line == 0 && residual.isEmpty();
        if (!idempotent) {
            logger.fine("Second formatting pass was not a no-op: line " + line + ", "
                    + residual.size() + " mechanical diagnostics");
        }
        return new IdempotenceReport(idempotent, firstText, secondText, line, residual);
    }

    public static void assertIdempotent(String text, HaskellStyleConfig config) {
        IdempotenceReport report = check(text, config);
        if (!report.isIdempotent()) {
            throw new IdempotenceViolationException("Formatting is not idempotent: " + report,
                    Math.max(1, report.getFirstDifferingLine()), report.getFirstPass(), report.getSecondPass());
        }
    }

    /**
     * 1-based number of the first line that differs, or 0 for equal texts.
     */
    static int firstDifferingLine(String left, String right) {
        if (left.equals(right)) {
            return 0;
        }
        int line = 1;
        int limit = Math.min(left.length(), right.length());
        for (int i = 0; i < limit; i++) {
            if (left.charAt(i) != right.charAt(i)) {
                return line;
            }
            if (left.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}
