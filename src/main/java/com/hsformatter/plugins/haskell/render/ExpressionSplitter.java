package com.hsformatter.plugins.haskell.render;

import java.util.ArrayList;
import java.util.List;

import com.hsformatter.plugins.haskell.cst.IndentPlan;
import com.hsformatter.plugins.haskell.lexer.Keywords;
import com.hsformatter.plugins.haskell.lexer.Token;
import com.hsformatter.plugins.haskell.lexer.TokenKind;

/**
 * Breaks an over-long expression. A plain application puts each
 * argument on its own line; anything else is broken after its top-level
 * operators, which stay at the end of the line:
 *
 * <pre>
 * result = combine
 *   firstArgument
 *   (second argument)
 *
 * total = alpha <>
 *   beta <>
 *   gamma
 * </pre>
 */
public final class ExpressionSplitter {

    private ExpressionSplitter() {
    }

    /**
     * Breaks for the expression {@code first .. last}, continuation lines at
     * {@code column}; empty when the expression offers no place to break.
     */
    public static IndentPlan split(List<Token> tokens, int first, int last, int column) {
        IndentPlan.Builder plan = IndentPlan.builder();
        List<Integer> atoms = applicationAtoms(tokens, first, last);
        if (atoms != null && atoms.size() >= 2) {
            for (int k = 1; k < atoms.size(); k++) {
                plan.breakBefore(atoms.get(k), column);
            }
            return plan.build();
        }
        for (int operator : breakableOperators(tokens, first, last)) {
            plan.breakBefore(operator + 1, column);
        }
        return plan.build();
    }

    /**
     * Start tokens of the head and arguments when {@code first .. last} is a
     * plain application of atoms, otherwise null. A record update brace
     * belongs to the atom before it.
     */
    static List<Integer> applicationAtoms(List<Token> tokens, int first, int last) {
        List<Integer> atoms = new ArrayList<>();
        int j = first;
        while (j <= last) {
            Token token = tokens.get(j);
            if (token.isOpenBracket()) {
                int close = _closing(tokens, j, last);
                if (close < 0) {
                    return null;
                }
                if (!(token.isPunctuation("{") && !atoms.isEmpty())) {
                    atoms.add(j);
                }
                j = close + 1;
            } else if ((token.getKind() == TokenKind.IDENTIFIER || token.getKind() == TokenKind.LITERAL
                    || token.getKind() == TokenKind.QUASI_QUOTE)) {
                atoms.add(j);
                j++;
            } else {
                return null;
            }
        }
        return atoms;
    }

    /**
     * Top-level operators with whitespace on both sides.
     */
    static List<Integer> breakableOperators(List<Token> tokens, int first, int last) {
        List<Integer> operators = new ArrayList<>();
        int depth = 0;
        for (int j = first; j < last; j++) {
            Token token = tokens.get(j);
            if (token.isOpenBracket()) {
                depth++;
            } else if (token.isCloseBracket()) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && j > first && token.getKind() == TokenKind.OPERATOR
                    && Keywords.isBreakableOperator(token.getUnqualifiedText())
                    && !token.getTrivia().isEmpty() && !tokens.get(j + 1).getTrivia().isEmpty()) {
                operators.add(j);
            }
        }
        return operators;
    }

    private static int _closing(List<Token> tokens, int open, int last) {
        int depth = 0;
        for (int j = open; j <= last; j++) {
            if (tokens.get(j).isOpenBracket()) {
                depth++;
            } else if (tokens.get(j).isCloseBracket()) {
                depth--;
                if (depth == 0) {
                    return j;
                }
            }
        }
        return -1;
    }
}
