package com.hsformatter.plugins.haskell.render;

import java.util.List;

import com.hsformatter.plugins.haskell.cst.IndentPlan;
import com.hsformatter.plugins.haskell.cst.LayoutChoice;
import com.hsformatter.plugins.haskell.cst.TypeSignature;
import com.hsformatter.plugins.haskell.lexer.Token;

/**
 * Type signatures. The multi-line form puts {@code ::} and every top-level
 * {@code ->} or {@code =>} at the start of its own line, one indentation
 * unit in:
 *
 * <pre>
 * render
 *   :: Config
 *   -> Module
 *   -> Text
 * </pre>
 */
public final class SignatureLayout {

    private SignatureLayout() {
    }

    public static IndentPlan plan(List<Token> tokens, TypeSignature signature, int indentWidth) {
        LayoutChoice layout = signature.getLayout();
        if (layout == LayoutChoice.UNDECIDED) {
            return IndentPlan.EMPTY;
        }
        IndentPlan.Builder plan = IndentPlan.builder();
        int first = signature.getFirstToken();
        int last = signature.getLastToken();
        TokenText.flatten(plan, tokens, first, last);
        if (layout == LayoutChoice.SINGLE_LINE) {
            return plan.build();
        }
        int column = signature.getAlignment() != null
                ? signature.getAlignment().getTargetColumn()
                : 1 + indentWidth;
        _separator(plan, signature.getDoubleColon(), last, column);
        for (int separator : signature.getSeparators()) {
            _separator(plan, separator, last, column);
        }
        return plan.build();
    }

    /**
     * The {@code ::} at bracket depth 0 of a range, when something precedes
     * it and no {@code =} or {@code <-} does; -1 otherwise.
     */
    public static int doubleColon(List<Token> tokens, int first, int last) {
        int depth = 0;
        for (int j = first; j <= last; j++) {
            Token token = tokens.get(j);
            if (token.isOpenBracket()) {
                depth++;
            } else if (token.isCloseBracket()) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0) {
                if (token.isOperator("::") || token.isOperator("\u2237")) {
                    return j > first ? j : -1;
                }
                if (token.isOperator("=") || token.isOperator("<-") || token.isOperator("\u2190")) {
                    return -1;
                }
            }
        }
        return -1;
    }

    /**
     * Multi-line form of a one-line signature bound inside a block, with
     * {@code ::} and the arrows at {@code column}.
     */
    public static IndentPlan split(List<Token> tokens, int doubleColon, int last, int column) {
        IndentPlan.Builder plan = IndentPlan.builder();
        _separator(plan, doubleColon, last, column);
        int depth = 0;
        for (int j = doubleColon + 1; j < last; j++) {
            Token token = tokens.get(j);
            if (token.isOpenBracket()) {
                depth++;
            } else if (token.isCloseBracket()) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && (token.isOperator("->") || token.isOperator("=>")
                    || token.isOperator("\u2192") || token.isOperator("\u21D2"))) {
                _separator(plan, j, last, column);
            }
        }
        return plan.build();
    }

    private static void _separator(IndentPlan.Builder plan, int separator, int last, int column) {
        plan.breakBefore(separator, column);
        if (separator < last) {
            plan.join(separator + 1, 1);
        }
    }
}
