package com.hsformatter.plugins.haskell.lint;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.plugins.haskell.cst.Declaration;
import com.hsformatter.plugins.haskell.cst.FunctionClause;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.cst.TypeSignature;

/**
 * Top-level bindings without a type signature.
 */
public class SignatureCheck implements LintCheck {

    @Override
    public Set<DiagnosticKind> getKinds() {
        return Set.of(DiagnosticKind.MISSING_SIGNATURE);
    }

    @Override
    public LintResult analyze(Module module) {
        Set<String> signed = new HashSet<>();
        for (Declaration declaration : module.getDeclarations()) {
            if (declaration instanceof TypeSignature) {
                signed.addAll(((TypeSignature) declaration).getNames());
            }
        }
        List<Diagnostic> diagnostics = new ArrayList<>();
        Set<String> reported = new HashSet<>();
        for (Declaration declaration : module.getDeclarations()) {
            if (!(declaration instanceof FunctionClause)) {
                continue;
            }
            String name = declaration.getName();
            if (name == null || signed.contains(name) || !reported.add(name)) {
                continue;
            }
            FunctionClause clause = (FunctionClause) declaration;
            String display = clause.isOperator() ? "(" + name + ")" : name;
            diagnostics.add(Findings.at(DiagnosticKind.MISSING_SIGNATURE,
                    "Top-level binding " + display + " has no type signature",
                    module.getToken(clause.getNameToken()), module.getToken(clause.getNameToken()),
                    display + " :: _"));
        }
        return new LintResult(diagnostics);
    }
}
