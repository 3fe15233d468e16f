package com.hsformatter.plugins.haskell.lint;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.plugins.haskell.cst.Constructor;
import com.hsformatter.plugins.haskell.cst.DataDecl;
import com.hsformatter.plugins.haskell.cst.Declaration;
import com.hsformatter.plugins.haskell.cst.DerivingClause;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.cst.RecordField;
import com.hsformatter.plugins.haskell.lexer.Token;
import com.hsformatter.plugins.haskell.render.TokenText;

/**
 * Checks on {@code data} and {@code newtype} declarations: lazy record
 * fields, records inside sum types, classes derived twice, and deriving
 * clauses without a strategy when {@code DerivingStrategies} is on.
 */
public class DataTypeCheck implements LintCheck {
    private static final String DERIVING_STRATEGIES = "DerivingStrategies";

    @Override
    public Set<DiagnosticKind> getKinds() {
        return Set.of(DiagnosticKind.MISSING_STRICTNESS_ANNOTATION, DiagnosticKind.RECORD_IN_SUM_TYPE,
                DiagnosticKind.UNNECESSARY_DERIVE, DiagnosticKind.MISSING_DERIVING_STRATEGY);
    }

    @Override
    public LintResult analyze(Module module) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Declaration declaration : module.getDeclarations()) {
            if (!(declaration instanceof DataDecl)) {
                continue;
            }
            DataDecl decl = (DataDecl) declaration;
            diagnostics.addAll(missingStrictness(module.getTokens(), decl));
            _checkRecordInSum(module, decl, diagnostics);
            _checkDuplicateDerives(module, decl, diagnostics);
            if (module.hasExtension(DERIVING_STRATEGIES)) {
                _checkStrategies(module, decl, diagnostics);
            }
        }
        return new LintResult(diagnostics);
    }

    /**
     * One finding per record field of a {@code data} declaration whose type
     * has no {@code !} or {@code ~}. Newtype fields are always lazy.
     */
    public static List<Diagnostic> missingStrictness(List<Token> tokens, DataDecl decl) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        if (decl.isNewtype()) {
            return diagnostics;
        }
        for (RecordField field : decl.getAllFields()) {
            if (field.isStrict() || field.getDoubleColon() >= field.getLastToken()) {
                continue;
            }
            String names = String.join(", ", field.getNames());
            String type = TokenText.flatText(tokens, field.getDoubleColon() + 1, field.getLastToken());
            String strictType = _isAtomic(tokens, field.getDoubleColon() + 1, field.getLastToken())
                    ? "!" + type
                    : "!(" + type + ")";
            diagnostics.add(Findings.at(DiagnosticKind.MISSING_STRICTNESS_ANNOTATION,
                    "Field " + names + " of " + decl.getName() + " is lazy; mark it strict with '!'",
                    tokens.get(field.getFirstToken()), tokens.get(field.getLastToken()),
                    names + " :: " + strictType));
        }
        return diagnostics;
    }

    private static boolean _isAtomic(List<Token> tokens, int first, int last) {
        if (first == last) {
            return true;
        }
        Token open = tokens.get(first);
        if (!open.isOpenBracket()) {
            return false;
        }
        int depth = 0;
        for (int j = first; j <= last; j++) {
            if (tokens.get(j).isOpenBracket()) {
                depth++;
            } else if (tokens.get(j).isCloseBracket()) {
                depth--;
                if (depth == 0 && j < last) {
                    return false;
                }
            }
        }
        return true;
    }

    private void _checkRecordInSum(Module module, DataDecl decl, List<Diagnostic> diagnostics) {
        if (!decl.isSumType()) {
            return;
        }
        for (Constructor constructor : decl.getConstructors()) {
            if (constructor.isRecord()) {
                diagnostics.add(Findings.at(DiagnosticKind.RECORD_IN_SUM_TYPE,
                        "Record constructor " + constructor.getName() + " in sum type " + decl.getName()
                                + " makes its field selectors partial",
                        module.getToken(constructor.getFirstToken()),
                        module.getToken(constructor.getLastToken()), null));
            }
        }
    }

    private void _checkDuplicateDerives(Module module, DataDecl decl, List<Diagnostic> diagnostics) {
        Set<String> derived = new HashSet<>();
        for (DerivingClause deriving : decl.getDerivings()) {
            for (String className : deriving.getClassNames()) {
                if (!derived.add(className)) {
                    diagnostics.add(Findings.at(DiagnosticKind.UNNECESSARY_DERIVE,
                            "Class " + className + " is derived more than once for " + decl.getName(),
                            module.getToken(deriving.getFirstToken()), module.getToken(deriving.getLastToken()),
                            null));
                }
            }
        }
    }

    private void _checkStrategies(Module module, DataDecl decl, List<Diagnostic> diagnostics) {
        for (DerivingClause deriving : decl.getDerivings()) {
            if (!deriving.hasStrategy()) {
                String suggestion = decl.isNewtype() ? "deriving newtype" : "deriving stock";
                diagnostics.add(Findings.at(DiagnosticKind.MISSING_DERIVING_STRATEGY,
                        "Deriving clause of " + decl.getName() + " has no explicit strategy",
                        module.getToken(deriving.getFirstToken()), module.getToken(deriving.getLastToken()),
                        suggestion));
            }
        }
    }
}
