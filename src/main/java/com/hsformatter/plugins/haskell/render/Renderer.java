package com.hsformatter.plugins.haskell.render;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.hsformatter.api.Refactoring;
import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.plugins.haskell.cst.DataDecl;
import com.hsformatter.plugins.haskell.cst.Declaration;
import com.hsformatter.plugins.haskell.cst.FunctionClause;
import com.hsformatter.plugins.haskell.cst.ImportDecl;
import com.hsformatter.plugins.haskell.cst.ImportGroup;
import com.hsformatter.plugins.haskell.cst.IndentPlan;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.cst.ModuleHeader;
import com.hsformatter.plugins.haskell.cst.OpaqueDecl;
import com.hsformatter.plugins.haskell.cst.Pragma;
import com.hsformatter.plugins.haskell.cst.PragmaKind;
import com.hsformatter.plugins.haskell.cst.TypeSignature;
import com.hsformatter.plugins.haskell.lexer.Token;
import com.hsformatter.plugins.haskell.lexer.Tokenizer;
import com.hsformatter.plugins.haskell.lint.Findings;
import com.hsformatter.plugins.haskell.lint.SourceLayoutCheck;
import com.hsformatter.plugins.haskell.parser.LayoutResolver;
import com.hsformatter.plugins.haskell.rules.AlignmentGroup;
import com.hsformatter.plugins.haskell.rules.PassOutcome;
import com.hsformatter.util.LoggerUtil;

/**
 * Prints a module after the passes have run.
 *
 * <p>The output is assembled from units: the header pragmas, the module
 * header, each import and each declaration. Every unit is printed twice,
 * under its plan and verbatim; a unit whose planned text has a different
 * token and layout structure than its verbatim text falls back to verbatim.
 * One mechanical diagnostic is reported per unit whose final text differs
 * from the verbatim one. If the whole output does not carry the same tokens
 * as the input, the input is returned unchanged.
 */
public final class Renderer {
    private static final Logger logger = LoggerUtil.getLogger(Renderer.class);
    private static final Pattern TRAILING_BLANKS = Pattern.compile("[ \\t]+(?=\\r?\\n|$)");

    private final Module module;
    private final List<Token> tokens;
    private final HaskellStyleConfig config;
    private final LineReindenter reindenter;
    private final String lineSeparator;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final List<Refactoring> refactorings = new ArrayList<>();
    private final List<RenderedUnit> units = new ArrayList<>();

    private Renderer(Module module, HaskellStyleConfig config) {
        this.module = module;
        this.tokens = module.getTokens();
        this.config = config;
        this.reindenter = new LineReindenter(tokens);
        this.lineSeparator = module.getLineSeparator();
    }

    public static RenderResult render(PassOutcome outcome, HaskellStyleConfig config) {
        return new Renderer(outcome.getModule(), config)._render(outcome);
    }

    private RenderResult _render(PassOutcome outcome) {
        List<Diagnostic> passDiagnostics = new ArrayList<>();
        for (Diagnostic diagnostic : outcome.getDiagnostics()) {
            if (diagnostic.isMechanical() || config.isCheckEnabled(diagnostic.getKind())) {
                passDiagnostics.add(diagnostic);
            }
        }
        refactorings.addAll(outcome.getRefactorings());
        diagnostics.addAll(SourceLayoutCheck.trailingWhitespace(tokens));

        String text = module.isBodyVerbatim() ? _verbatimFile() : _renderModule();

        List<Diagnostic> result = new ArrayList<>();
        if (!text.equals(module.getSource())
                && !SemanticTokens.of(_retokenize(text)).equals(SemanticTokens.of(tokens))) {
            logger.severe("Formatting " + module.getModuleName()
                    + " would change its tokens; returning the source unchanged");
            text = module.getSource();
            refactorings.clear();
            units.clear();
            for (Diagnostic diagnostic : passDiagnostics) {
                if (diagnostic.getKind().isAdvisory()) {
                    result.add(diagnostic);
                }
            }
        } else {
            result.addAll(passDiagnostics);
            result.addAll(diagnostics);
        }
        if (config.isCheckEnabled(DiagnosticKind.LONG_LINE)) {
            result.addAll(SourceLayoutCheck.longLines(text, config.getMaxLineLength()));
        }
        result.sort(Comparator.comparingInt(Diagnostic::getLine)
                .thenComparingInt(Diagnostic::getColumn)
                .thenComparing(Diagnostic::getKind));
        return new RenderResult(text, result, refactorings, units);
    }

    /**
     * A body the reader could not structure (explicit braces, CPP, an
     * indented first item) is only stripped of trailing blanks.
     */
    private String _verbatimFile() {
        return _finish(TRAILING_BLANKS.matcher(module.getSource()).replaceAll(""));
    }

    private String _renderModule() {
        OutputBuffer out = new OutputBuffer(lineSeparator);
        Token head = tokens.get(0);
        TriviaLines.emitLeading(out, TriviaLines.leadingPieces(head.getTrivia()), 0, 0, true);
        if (!out.isAtLineStart()) {
            out.newline();
        }
        if (head.isEof()) {
            return _finish(out.toString());
        }

        _renderPragmas(out);
        ModuleHeader header = module.getHeader();
        if (header != null) {
            IndentPlan plan = ItemListLayout.headerPlan(tokens, header, config.getIndentWidth());
            _emitUnit(out, "module header", DiagnosticKind.EXPORT_LIST_LAYOUT, header.getFirstToken(),
                    header.getLastToken(), plan, TriviaLines.KEEP_BLANKS, true);
        }
        _renderImports(out);
        _renderDeclarations(out);

        Token eof = tokens.get(tokens.size() - 1);
        TriviaLines.emitLeading(out, TriviaLines.leadingPieces(eof.getTrivia()), 0, TriviaLines.KEEP_BLANKS, true);
        return _finish(out.toString());
    }

    private void _renderPragmas(OutputBuffer out) {
        List<Pragma> pragmas = module.getHeaderPragmas();
        if (pragmas.isEmpty()) {
            return;
        }
        int first = Integer.MAX_VALUE;
        int last = -1;
        for (Pragma pragma : pragmas) {
            first = Math.min(first, pragma.getToken());
            last = Math.max(last, pragma.getToken());
        }
        String verbatim = _unitText(first, last, IndentPlan.EMPTY, TriviaLines.KEEP_BLANKS, true);
        String chosen = verbatim;
        if (module.isPragmasNormalized()) {
            chosen = _normalizedPragmas(pragmas);
            if (!SemanticTokens.of(_retokenize(chosen)).equals(SemanticTokens.of(_retokenize(verbatim)))) {
                logger.fine("Header pragmas of " + module.getModuleName() + " kept as written");
                chosen = verbatim;
            }
        }
        out.append(chosen);
        boolean changed = !chosen.equals(verbatim);
        units.add(new RenderedUnit("header pragmas", first, last, chosen, changed));
        if (changed) {
            _report(DiagnosticKind.PRAGMA_PLACEMENT, first, last,
                    "Split and sorted " + pragmas.size() + " header pragmas");
        }
    }

    private String _normalizedPragmas(List<Pragma> pragmas) {
        OutputBuffer out = new OutputBuffer(lineSeparator);
        int previousGroup = -1;
        for (Pragma pragma : pragmas) {
            int group = pragma.getRenderedText() != null ? 1 : pragma.getPragmaKind() == PragmaKind.OPTIONS ? 0 : 2;
            if (previousGroup >= 0 && group != previousGroup) {
                out.newline();
            }
            previousGroup = group;

            int token = pragma.getToken();
            if (pragma.isPrimary() && token != 0) {
                TriviaLines.emitLeading(out, TriviaLines.leadingPieces(tokens.get(token).getTrivia()), 0, 0, true);
                if (!out.isAtLineStart()) {
                    out.newline();
                }
            }
            out.append(pragma.getRenderedText() != null ? _alignedLanguage(pragma) : tokens.get(token).getText());
            if (pragma.isPrimary()) {
                TriviaLines.emitTrailing(out, tokens.get(token + 1).getTrivia());
            }
            out.newline();
        }
        return out.toString();
    }

    private String _alignedLanguage(Pragma pragma) {
        String text = "{-# LANGUAGE " + pragma.getExtensions().get(0);
        AlignmentGroup alignment = module.getPragmaAlignment();
        int target = alignment == null ? text.length() + 2 : alignment.getTargetColumn();
        return text + " ".repeat(Math.max(1, target - 1 - text.length())) + "#-}";
    }

    /**
     * Imports print group by group with one blank line between groups. The
     * block keeps the blank lines that preceded the first import of the
     * source.
     */
    private void _renderImports(OutputBuffer out) {
        List<ImportDecl> imports = module.getImports();
        if (imports.isEmpty()) {
            return;
        }
        List<ImportDecl> sourceOrder = new ArrayList<>(imports);
        sourceOrder.sort(Comparator.comparingInt(ImportDecl::getSourceIndex));
        int first = sourceOrder.get(0).getFirstToken();
        int last = sourceOrder.get(sourceOrder.size() - 1).getLastToken();

        StringBuilder verbatim = new StringBuilder();
        for (ImportDecl importDecl : sourceOrder) {
            verbatim.append(_unitText(importDecl.getFirstToken(), importDecl.getLastToken(), IndentPlan.EMPTY,
                    TriviaLines.KEEP_BLANKS, true));
        }

        OutputBuffer block = new OutputBuffer(lineSeparator);
        int lead = first == 0 ? 0 : tokens.get(first).getTrivia().getBlankLinesBeforeFirstEntry();
        for (int i = 0; i < lead; i++) {
            block.newline();
        }
        boolean firstGroup = true;
        for (ImportGroup group : module.getImportGroups()) {
            if (!firstGroup) {
                block.newline();
            }
            firstGroup = false;
            for (ImportDecl importDecl : group.getImports()) {
                IndentPlan plan = ItemListLayout.importPlan(tokens, importDecl, config.getIndentWidth());
                Settled settled = _settle("import " + importDecl.getModuleName(), importDecl.getFirstToken(),
                        importDecl.getLastToken(), plan, 0, false);
                block.append(settled.text);
                units.add(new RenderedUnit("import " + importDecl.getModuleName(), importDecl.getFirstToken(),
                        importDecl.getLastToken(), settled.text, settled.isChanged()));
            }
        }

        String chosen = block.toString();
        out.append(chosen);
        if (!chosen.contentEquals(verbatim)) {
            _report(DiagnosticKind.IMPORT_ORDERING, first, last,
                    "Grouped and sorted " + imports.size() + " imports");
        }
    }

    private void _renderDeclarations(OutputBuffer out) {
        Map<Integer, Integer> blankOverrides = new HashMap<>();
        for (int pragma : new TreeSet<>(module.getRelocatedPragmas())) {
            int carried = blankOverrides.containsKey(pragma)
                    ? blankOverrides.get(pragma)
                    : _blankLinesBefore(pragma);
            blankOverrides.put(pragma, 0);
            int successor = pragma + 1;
            if (!tokens.get(successor).isEof()) {
                blankOverrides.put(successor, Math.max(_blankLinesBefore(successor), carried));
            }
        }
        for (Declaration declaration : module.getDeclarations()) {
            int first = declaration.getFirstToken();
            boolean relocated = declaration instanceof Pragma && module.getRelocatedPragmas().contains(first);
            _emitUnit(out, declaration.toString(), relocated ? null : _kindFor(declaration), first,
                    declaration.getLastToken(), declaration.getIndentPlan(),
                    blankOverrides.getOrDefault(first, TriviaLines.KEEP_BLANKS), true);
        }
    }

    private int _blankLinesBefore(int token) {
        return tokens.get(token).getTrivia().getBlankLinesBeforeFirstEntry();
    }

    private DiagnosticKind _kindFor(Declaration declaration) {
        IndentPlan plan = declaration.getIndentPlan();
        if (declaration instanceof TypeSignature) {
            return DiagnosticKind.ALIGNMENT;
        }
        if (declaration instanceof DataDecl) {
            return plan.hasTextOverrides() ? DiagnosticKind.DERIVING_LAYOUT : DiagnosticKind.ALIGNMENT;
        }
        if (declaration instanceof FunctionClause || declaration instanceof OpaqueDecl) {
            for (int token : plan.getBreaks().keySet()) {
                if (!tokens.get(token).isKeyword("where") && !tokens.get(token - 1).isKeyword("where")) {
                    return DiagnosticKind.ALIGNMENT;
                }
            }
        }
        return DiagnosticKind.INDENTATION;
    }

    /**
     * Appends one unit and reports it under {@code kind} when it changed. A
     * null kind records the unit without a diagnostic.
     */
    private void _emitUnit(OutputBuffer out, String label, DiagnosticKind kind, int first, int last,
                           IndentPlan plan, int blankLines, boolean innerBlanks) {
        Settled settled = _settle(label, first, last, plan, blankLines, innerBlanks);
        out.append(settled.text);
        units.add(new RenderedUnit(label, first, last, settled.text, settled.isChanged()));
        if (kind != null && settled.isChanged()) {
            _report(kind, first, last, "Re-laid-out " + label);
        }
    }

    private Settled _settle(String label, int first, int last, IndentPlan plan, int blankLines,
                            boolean innerBlanks) {
        String verbatim = _unitText(first, last, IndentPlan.EMPTY, blankLines, innerBlanks);
        if (plan.isEmpty()) {
            return new Settled(verbatim, verbatim);
        }
        String chosen = _unitText(first, last, plan, blankLines, innerBlanks);
        if (!chosen.equals(verbatim) && !_sameStructure(chosen, verbatim)) {
            logger.fine("Layout of " + label + " would change its structure; kept as written");
            return new Settled(verbatim, verbatim);
        }
        return new Settled(chosen, verbatim);
    }

    /**
     * Text of {@code first .. last} with its own comment lines above and the
     * comments that end its last line, terminated by a line break. Leading
     * comments shift with the first token.
     */
    private String _unitText(int first, int last, IndentPlan plan, int blankLines, boolean innerBlanks) {
        IndentPlan effective = plan;
        Token head = tokens.get(first);
        if (!head.isFirstOnLine() && !plan.hasBreak(first) && !plan.hasColumn(first)) {
            effective = plan.merge(IndentPlan.builder().column(first, 1).build());
        }
        OutputBuffer out = new OutputBuffer(lineSeparator);
        if (first != 0) {
            int delta = reindenter.startColumn(first, effective) - head.getColumn();
            TriviaLines.emitLeading(out, TriviaLines.leadingPieces(head.getTrivia()), delta, blankLines,
                    innerBlanks);
        }
        reindenter.render(out, first, last, effective);
        TriviaLines.emitTrailing(out, tokens.get(last + 1).getTrivia());
        out.newline();
        return out.toString();
    }

    private boolean _sameStructure(String left, String right) {
        return SemanticTokens.canonicalTexts(LayoutResolver.structureSignature(_retokenize(left)))
                .equals(SemanticTokens.canonicalTexts(LayoutResolver.structureSignature(_retokenize(right))));
    }

    private List<Token> _retokenize(String text) {
        return Tokenizer.tokenize(text, module.isQuasiQuotes()).toList();
    }

    private void _report(DiagnosticKind kind, int first, int last, String description) {
        Token firstToken = tokens.get(first);
        Token lastToken = tokens.get(last);
        diagnostics.add(Findings.at(kind, _message(kind), firstToken, lastToken, null));
        refactorings.add(new Refactoring(kind.name(), firstToken.getLine(), lastToken.getEndLine(), description));
    }

    private static String _message(DiagnosticKind kind) {
        return switch (kind) {
            case EXPORT_LIST_LAYOUT -> "Export list is not in canonical layout";
            case IMPORT_ORDERING -> "Imports are not grouped and sorted";
            case PRAGMA_PLACEMENT -> "Header pragmas are not one per line in canonical order";
            case DERIVING_LAYOUT -> "Deriving clause is not in canonical form";
            case ALIGNMENT -> "Layout or alignment differs from the canonical form";
            default -> "Indentation differs from the canonical form";
        };
    }

    /**
     * Trailing blank lines dropped, exactly one final line break; an empty
     * result stays empty.
     */
    private String _finish(String text) {
        int end = text.length();
        while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return end == 0 ? "" : text.substring(0, end) + lineSeparator;
    }

    private static final class Settled {
        final String text;
        final String verbatim;

        Settled(String text, String verbatim) {
            this.text = text;
            this.verbatim = verbatim;
        }

        boolean isChanged() {
            return !text.equals(verbatim);
        }
    }
}
