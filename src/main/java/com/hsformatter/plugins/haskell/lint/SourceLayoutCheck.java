package com.hsformatter.plugins.haskell.lint;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.cst.ModuleHeader;
import com.hsformatter.plugins.haskell.lexer.Token;
import com.hsformatter.plugins.haskell.lexer.TriviaPiece;
import com.hsformatter.util.SourceDecoder;

/**
 * Findings about the text as a whole: over-long lines, trailing whitespace
 * and a missing export list.
 */
public class SourceLayoutCheck implements LintCheck {
    private final int maxLineLength;

    public SourceLayoutCheck(HaskellStyleConfig config) {
        this.maxLineLength = config.getMaxLineLength();
    }

    @Override
    public Set<DiagnosticKind> getKinds() {
        return Set.of(DiagnosticKind.LONG_LINE, DiagnosticKind.TRAILING_WHITESPACE,
                DiagnosticKind.MISSING_EXPORT_LIST);
    }

    @Override
    public LintResult analyze(Module module) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        diagnostics.addAll(longLines(module.getSource(), maxLineLength));
        diagnostics.addAll(trailingWhitespace(module.getTokens()));
        diagnostics.addAll(missingExportList(module));
        return new LintResult(diagnostics);
    }

    /**
     * One finding per line of {@code text} wider than {@code maxLineLength}
     * characters, located at the first character past the budget.
     */
    public static List<Diagnostic> longLines(String text, int maxLineLength) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        int lineNumber = 1;
        int lineStart = 0;
        int lineStartByte = 0;
        while (lineStart <= text.length()) {
            int newline = text.indexOf('\n', lineStart);
            int lineEnd = newline < 0 ? text.length() : newline;
            if (lineEnd > lineStart && text.charAt(lineEnd - 1) == '\r') {
                lineEnd--;
            }
            int width = text.codePointCount(lineStart, lineEnd);
            if (width > maxLineLength) {
                int offset = text.offsetByCodePoints(lineStart, maxLineLength);
                int startByte = lineStartByte + SourceDecoder.utf8Length(text, lineStart, offset);
                int endByte = startByte + SourceDecoder.utf8Length(text, offset, lineEnd);
                diagnostics.add(new Diagnostic(DiagnosticKind.LONG_LINE,
                        "Line is " + width + " characters long (limit " + maxLineLength + ")",
                        lineNumber, maxLineLength + 1, startByte, endByte, null));
            }
            if (newline < 0) {
                break;
            }
            lineStartByte += SourceDecoder.utf8Length(text, lineStart, newline + 1);
            lineStart = newline + 1;
            lineNumber++;
        }
        return diagnostics;
    }

    /**
     * Whitespace runs that end a line of the source.
     */
    public static List<Diagnostic> trailingWhitespace(List<Token> tokens) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Token token : tokens) {
            for (TriviaPiece piece : token.getTrivia().getTrailingWhitespace(token.isEof())) {
                diagnostics.add(new Diagnostic(DiagnosticKind.TRAILING_WHITESPACE, "Trailing whitespace",
                        piece.getLine(), piece.getColumn(), piece.getStartOffset(), piece.getEndOffset(), ""));
            }
        }
        return diagnostics;
    }

    /**
     * A module without a header, or whose header lists no exports, exports
     * every top-level name.
     */
    public static List<Diagnostic> missingExportList(Module module) {
        ModuleHeader header = module.getHeader();
        if (header == null) {
            Token head = module.getToken(0);
            return List.of(new Diagnostic(DiagnosticKind.MISSING_EXPORT_LIST,
                    "Module has no header; everything is exported from the implicit Main module",
                    head.getLine(), head.getColumn(), head.getStartOffset(), head.getStartOffset(), null));
        }
        if (header.getExports() == null) {
            Token moduleToken = module.getToken(header.getFirstToken());
            return List.of(Findings.at(DiagnosticKind.MISSING_EXPORT_LIST,
                    "Module " + header.getName() + " has no export list",
                    moduleToken, module.getToken(header.getLastToken()), null));
        }
        return List.of();
    }
}
