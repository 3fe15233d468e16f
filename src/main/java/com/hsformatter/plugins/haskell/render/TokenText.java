package com.hsformatter.plugins.haskell.render;

import java.util.List;

import com.hsformatter.plugins.haskell.cst.IndentPlan;
import com.hsformatter.plugins.haskell.lexer.Token;

/**
 * Spacing rules for tokens pulled onto one line.
 */
public final class TokenText {

    private TokenText() {
    }

    /**
     * Spaces between two tokens that end up adjacent on one line: none inside
     * brackets or before a comma, one everywhere else (braces included).
     */
    public static int canonicalGap(Token previous, Token token) {
        if (previous.isPunctuation("(") || previous.isPunctuation("[")) {
            return 0;
        }
        if (token.isPunctuation(")") || token.isPunctuation("]") || token.isPunctuation(",")) {
            return 0;
        }
        return 1;
    }

    /**
     * Joins every line-starting token of {@code from+1 .. to} to its
     * predecessor with the canonical gap. Tokens already on the same line as
     * their predecessor keep their spacing.
     */
    public static void flatten(IndentPlan.Builder plan, List<Token> tokens, int from, int to) {
        for (int i = from + 1; i <= to; i++) {
            if (tokens.get(i).getTrivia().containsNewline()) {
                plan.join(i, canonicalGap(tokens.get(i - 1), tokens.get(i)));
            }
        }
    }

    /**
     * The text {@link #flatten} produces for {@code from .. to}.
     */
    public static String flatText(List<Token> tokens, int from, int to) {
        StringBuilder sb = new StringBuilder(tokens.get(from).getText());
        for (int i = from + 1; i <= to; i++) {
            Token token = tokens.get(i);
            if (token.getTrivia().containsNewline()) {
                sb.append(" ".repeat(canonicalGap(tokens.get(i - 1), token)));
            } else {
                sb.append(token.getTrivia().getText());
            }
            sb.append(token.getText());
        }
        return sb.toString();
    }

    public static int width(String text) {
        return text.codePointCount(0, text.length());
    }

    /**
     * True when any token after {@code from} up to {@code to} carries a
     * comment in its trivia.
     */
    public static boolean hasInteriorComments(List<Token> tokens, int from, int to) {
        for (int i = from + 1; i <= to; i++) {
            if (tokens.get(i).getTrivia().hasComments()) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when any token after {@code from} up to {@code to} starts a line.
     */
    public static boolean spansLines(List<Token> tokens, int from, int to) {
        for (int i = from + 1; i <= to; i++) {
            if (tokens.get(i).getTrivia().containsNewline()) {
                return true;
            }
        }
        return false;
    }
}
