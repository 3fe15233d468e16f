package com.hsformatter.plugins.haskell.lint;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.plugins.haskell.cst.Declaration;
import com.hsformatter.plugins.haskell.cst.Equation;
import com.hsformatter.plugins.haskell.cst.Expr;
import com.hsformatter.plugins.haskell.cst.FunctionClause;
import com.hsformatter.plugins.haskell.cst.GuardedRhs;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.lexer.Token;
import com.hsformatter.plugins.haskell.lexer.TokenKind;
import com.hsformatter.plugins.haskell.render.TokenText;

/**
 * Heuristics on right-hand sides: equations whose last argument can be
 * dropped, and long chains of function composition.
 */
public class ExpressionCheck implements LintCheck {
    private final int maxCompositionChain;

    public ExpressionCheck(HaskellStyleConfig config) {
        this.maxCompositionChain = config.getMaxCompositionChain();
    }

    @Override
    public Set<DiagnosticKind> getKinds() {
        return Set.of(DiagnosticKind.POINT_FREE_CANDIDATE, DiagnosticKind.EXCESSIVE_COMPOSITION);
    }

    @Override
    public LintResult analyze(Module module) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        Map<String, Integer> clauseCounts = new HashMap<>();
        for (Declaration declaration : module.getDeclarations()) {
            if (declaration instanceof FunctionClause && declaration.getName() != null) {
                clauseCounts.merge(declaration.getName(), 1, Integer::sum);
            }
        }
        for (Declaration declaration : module.getDeclarations()) {
            if (!(declaration instanceof FunctionClause)) {
                continue;
            }
            FunctionClause clause = (FunctionClause) declaration;
            if (clause.getName() != null && clauseCounts.get(clause.getName()) == 1) {
                _checkEtaReduction(module.getTokens(), clause, diagnostics);
            }
            _checkComposition(module.getTokens(), clause, diagnostics);
        }
        return new LintResult(diagnostics);
    }

    /**
     * {@code f a x = g a x} can be written {@code f a = g a}: the last
     * argument is a plain variable used exactly once, as the final argument
     * of a plain application.
     */
    private void _checkEtaReduction(List<Token> tokens, FunctionClause clause, List<Diagnostic> diagnostics) {
        Equation equation = clause.getEquation();
        if (clause.isOperator() || clause.hasWhere() || equation.isGuarded()
                || clause.getNameToken() != equation.getLhsFirst()) {
            return;
        }
        int lhsLast = equation.getLhsLast();
        if (lhsLast <= clause.getNameToken()) {
            return;
        }
        for (int j = clause.getNameToken() + 1; j <= lhsLast; j++) {
            if (!tokens.get(j).isVarId() || tokens.get(j).isQualified() || tokens.get(j).getText().equals("_")) {
                return;
            }
        }
        Expr rhs = equation.getRhs();
        int first = rhs.getFirstToken();
        int last = rhs.getLastToken();
        String variable = tokens.get(lhsLast).getText();
        Token lastToken = tokens.get(last);
        if (last <= first || !rhs.getBlocks().isEmpty() || !lastToken.getText().equals(variable)
                || lastToken.getKind() != TokenKind.IDENTIFIER || lastToken.getTrivia().isEmpty()) {
            return;
        }
        for (int j = first; j < last; j++) {
            Token token = tokens.get(j);
            if (token.getText().equals(variable) || token.getKind() == TokenKind.OPERATOR
                    || token.getKind() == TokenKind.KEYWORD || token.isPunctuation("`")
                    || token.isPunctuation(",") || token.isPunctuation(";")) {
                return;
            }
        }
        if (_depthAt(tokens, first, last) != 0) {
            return;
        }
        String lhs = TokenText.flatText(tokens, clause.getNameToken(), lhsLast - 1);
        String body = TokenText.flatText(tokens, first, last - 1);
        diagnostics.add(Findings.at(DiagnosticKind.POINT_FREE_CANDIDATE,
                "Argument " + variable + " of " + clause.getName() + " can be dropped from both sides",
                tokens.get(clause.getFirstToken()), tokens.get(last), lhs + " = " + body));
    }

    private void _checkComposition(List<Token> tokens, FunctionClause clause, List<Diagnostic> diagnostics) {
        Equation equation = clause.getEquation();
        if (equation.getRhs() != null) {
            _countComposition(tokens, equation.getRhs(), diagnostics);
        }
        for (GuardedRhs guard : equation.getGuards()) {
            _countComposition(tokens, guard.getBody(), diagnostics);
        }
        for (Declaration local : clause.getLocalDeclarations()) {
            if (local instanceof FunctionClause) {
                _checkComposition(tokens, (FunctionClause) local, diagnostics);
            }
        }
    }

    private void _countComposition(List<Token> tokens, Expr expr, List<Diagnostic> diagnostics) {
        int count = 0;
        int firstDot = -1;
        for (int j = expr.getFirstToken(); j <= expr.getLastToken(); j++) {
            Token token = tokens.get(j);
            if (token.isOperator(".") || token.isOperator("\u2218")) {
                count++;
                if (firstDot < 0) {
                    firstDot = j;
                }
            }
        }
        if (count > maxCompositionChain) {
            diagnostics.add(Findings.at(DiagnosticKind.EXCESSIVE_COMPOSITION,
                    count + " composition operators in one right-hand side (limit " + maxCompositionChain
                            + "); name some intermediate steps",
                    tokens.get(firstDot), tokens.get(expr.getLastToken()), null));
        }
    }

    private static int _depthAt(List<Token> tokens, int from, int to) {
        int depth = 0;
        for (int j = from; j < to; j++) {
            if (tokens.get(j).isOpenBracket()) {
                depth++;
            } else if (tokens.get(j).isCloseBracket()) {
                depth--;
            }
        }
        return depth;
    }
}
