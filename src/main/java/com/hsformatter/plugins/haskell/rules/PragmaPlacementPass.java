package com.hsformatter.plugins.haskell.rules;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.hsformatter.api.Refactoring;
import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.plugins.haskell.cst.Declaration;
import com.hsformatter.plugins.haskell.cst.FunctionClause;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.cst.NodeKind;
import com.hsformatter.plugins.haskell.cst.Pragma;
import com.hsformatter.plugins.haskell.cst.PragmaKind;
import com.hsformatter.plugins.haskell.cst.TypeSignature;
import com.hsformatter.plugins.haskell.lexer.Token;
import com.hsformatter.plugins.haskell.lint.Findings;
import com.hsformatter.plugins.haskell.parser.PragmaParser;

/**
 * Normalizes the file-header pragmas and moves {@code INLINE}-family pragmas
 * next to the definition they annotate.
 *
 * <p>Header order is {@code OPTIONS_GHC} pragmas as written, then one
 * {@code LANGUAGE} pragma per extension sorted case-insensitively, then
 * everything else. The closing {@code #-}} of the {@code LANGUAGE} lines is
 * aligned one column past the longest one.
 */
public class PragmaPlacementPass implements FormattingPass {
    private static final String LANGUAGE_PREFIX = "{-# LANGUAGE ";

    @Override
    public String getName() {
        return "pragma-placement";
    }

    @Override
    public Set<NodeKind> getNodeKinds() {
        return Set.of(NodeKind.PRAGMA);
    }

    @Override
    public PassResult apply(Module module, HaskellStyleConfig config) {
        if (module.isBodyVerbatim()) {
            return PassResult.unchanged(module);
        }
        Module.Builder builder = module.toBuilder();
        if (!module.getHeaderPragmas().isEmpty()) {
            _normalizeHeader(module.getHeaderPragmas(), builder);
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        List<Refactoring> refactorings = new ArrayList<>();
        Set<Integer> relocated = new LinkedHashSet<>(module.getRelocatedPragmas());
        List<Declaration> declarations = _relocateInlinePragmas(module, relocated, diagnostics, refactorings);
        builder.declarations(declarations).relocatedPragmas(relocated);
        return new PassResult(builder.build(), diagnostics, refactorings);
    }

    private void _normalizeHeader(List<Pragma> pragmas, Module.Builder builder) {
        List<Pragma> options = new ArrayList<>();
        List<Pragma> language = new ArrayList<>();
        List<Pragma> other = new ArrayList<>();
        for (Pragma pragma : pragmas) {
            if (pragma.getPragmaKind() == PragmaKind.OPTIONS) {
                options.add(pragma);
            } else if (pragma.getPragmaKind() == PragmaKind.LANGUAGE && !pragma.getExtensions().isEmpty()) {
                for (String extension : pragma.getExtensions()) {
                    language.add(pragma.withRenderedText(PragmaParser.languagePragma(extension),
                            List.of(extension), false));
                }
            } else {
                other.add(pragma);
            }
        }
        language.sort(Comparator.comparing(p -> p.getExtensions().get(0), String.CASE_INSENSITIVE_ORDER));

        // The first piece of each source pragma in output order carries its comments.
        Set<Integer> seen = new HashSet<>();
        int longest = 0;
        List<Pragma> ordered = new ArrayList<>(options);
        for (Pragma piece : language) {
            boolean primary = seen.add(piece.getToken());
            ordered.add(piece.withRenderedText(piece.getRenderedText(), piece.getExtensions(), primary));
            longest = Math.max(longest, LANGUAGE_PREFIX.length() + piece.getExtensions().get(0).length());
        }
        ordered.addAll(other);

        builder.headerPragmas(ordered)
                .pragmasNormalized(true)
                .pragmaAlignment(language.isEmpty() ? null : new AlignmentGroup("#-}", language.size(), longest + 2));
    }

    private List<Declaration> _relocateInlinePragmas(Module module, Set<Integer> relocated,
                                                     List<Diagnostic> diagnostics, List<Refactoring> refactorings) {
        List<Declaration> declarations = new ArrayList<>(module.getDeclarations());
        List<Pragma> inlinePragmas = new ArrayList<>();
        for (Declaration declaration : declarations) {
            if (_isInline(declaration)) {
                inlinePragmas.add((Pragma) declaration);
            }
        }
        for (Pragma pragma : inlinePragmas) {
            String target = pragma.getTarget();
            if (target == null) {
                continue;
            }
            int current = declarations.indexOf(pragma);
            declarations.remove(current);
            int definition = _lastDefinition(declarations, target);
            if (definition < 0 || _alreadyPlaced(declarations, definition, current, target)) {
                declarations.add(current, pragma);
                continue;
            }
            int position = definition + 1;
            while (position < declarations.size() && _isInlineFor(declarations.get(position), target)) {
                position++;
            }
            declarations.add(position, pragma);
            relocated.add(pragma.getToken());

            Token token = module.getToken(pragma.getToken());
            Token definitionEnd = module.getToken(declarations.get(definition).getLastToken());
            diagnostics.add(Findings.at(DiagnosticKind.PRAGMA_PLACEMENT,
                    "Pragma for " + target + " should follow its definition", token, token, null));
            refactorings.add(new Refactoring(DiagnosticKind.PRAGMA_PLACEMENT.name(), token.getLine(),
                    definitionEnd.getEndLine(), "Moved " + pragma.getDirective() + " pragma for " + target
                            + " below its definition"));
        }
        return declarations;
    }

    /**
     * Index of the last clause or signature that defines {@code target}, or -1.
     */
    private static int _lastDefinition(List<Declaration> declarations, String target) {
        for (int i = declarations.size() - 1; i >= 0; i--) {
            Declaration declaration = declarations.get(i);
            if (declaration instanceof FunctionClause && target.equals(declaration.getName())) {
                return i;
            }
            if (declaration instanceof TypeSignature
                    && ((TypeSignature) declaration).getNames().contains(target)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * A pragma already sitting after the definition, possibly behind other
     * pragmas for the same name, stays where it is.
     */
    private static boolean _alreadyPlaced(List<Declaration> declarations, int definition, int current,
                                          String target) {
        if (current <= definition) {
            return false;
        }
        for (int i = definition + 1; i < current; i++) {
            if (!_isInlineFor(declarations.get(i), target)) {
                return false;
            }
        }
        return true;
    }

    private static boolean _isInline(Declaration declaration) {
        return declaration instanceof Pragma && ((Pragma) declaration).getPragmaKind() == PragmaKind.INLINE;
    }

    private static boolean _isInlineFor(Declaration declaration, String target) {
        return _isInline(declaration) && target.equals(((Pragma) declaration).getTarget());
    }
}
