package com.hsformatter.plugins.haskell.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.plugins.haskell.cst.DataDecl;
import com.hsformatter.plugins.haskell.cst.Declaration;
import com.hsformatter.plugins.haskell.cst.IndentPlan;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.cst.NodeKind;
import com.hsformatter.plugins.haskell.lint.DataTypeCheck;
import com.hsformatter.plugins.haskell.render.DataDeclLayout;

/**
 * Parenthesizes bare deriving classes ({@code deriving Show} becomes
 * {@code deriving (Show)}) and reports lazy record fields. Strictness
 * annotations change evaluation, so they are only suggested.
 */
public class StrictnessDerivingPass implements FormattingPass {

    @Override
    public String getName() {
        return "strictness-deriving";
    }

    @Override
    public Set<NodeKind> getNodeKinds() {
        return Set.of(NodeKind.DATA_DECL, NodeKind.RECORD_FIELD, NodeKind.DERIVING_CLAUSE);
    }

    @Override
    public PassResult apply(Module module, HaskellStyleConfig config) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<Declaration> declarations = new ArrayList<>();
        boolean changed = false;
        for (Declaration declaration : module.getDeclarations()) {
            if (!(declaration instanceof DataDecl)) {
                declarations.add(declaration);
                continue;
            }
            DataDecl decl = (DataDecl) declaration;
            diagnostics.addAll(DataTypeCheck.missingStrictness(module.getTokens(), decl));
            IndentPlan parens = module.isBodyVerbatim()
                    ? IndentPlan.EMPTY
                    : DataDeclLayout.derivingParens(module.getTokens(), decl);
            if (parens.isEmpty()) {
                declarations.add(decl);
            } else {
                declarations.add(decl.withIndentPlan(decl.getIndentPlan().merge(parens)));
                changed = true;
            }
        }
        if (!changed) {
            return new PassResult(module, diagnostics);
        }
        return new PassResult(module.toBuilder().declarations(declarations).build(), diagnostics);
    }
}
