package com.hsformatter.plugins.haskell.render;

import java.util.List;

import com.hsformatter.plugins.haskell.cst.IndentPlan;
import com.hsformatter.plugins.haskell.lexer.Token;
import com.hsformatter.plugins.haskell.lexer.Trivia;

/**
 * Prints a token range under an {@link IndentPlan}.
 *
 * <p>A token with a break starts a new line at the planned column; comments
 * that ended the old line are kept there with two spaces. A joined token
 * follows its predecessor after the planned number of spaces, unless its
 * trivia holds a comment, in which case it is printed as written. Every
 * other token keeps its source whitespace, except that a token starting a
 * line moves to its planned column and takes the comments above it along.
 */
public final class LineReindenter {
    private final List<Token> tokens;

    public LineReindenter(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Renders {@code first .. last}. The leading trivia of {@code first} is
     * not printed; the buffer is expected at the start of a line or right
     * after a comment that shares the first token's line.
     */
    public void render(OutputBuffer out, int first, int last, IndentPlan plan) {
        Token head = tokens.get(first);
        out.indentTo(startColumn(first, plan));
        if (plan.hasBreak(first)) {
            out.markRelaid();
        }
        out.append(plan.getText(first, head.getText()));

        for (int i = first + 1; i <= last; i++) {
            Token token = tokens.get(i);
            Trivia trivia = token.getTrivia();
            String text = plan.getText(i, token.getText());

            if (plan.hasJoin(i) && !trivia.hasComments()) {
                out.spaces(plan.getJoinSpaces(i));
                out.markRelaid();
                out.append(text);
            } else if (plan.hasBreak(i)) {
                int column = plan.getBreakColumn(i);
                _lineBreak(out, trivia, column - token.getColumn(), true);
                out.indentTo(column);
                out.markRelaid();
                out.append(text);
            } else if (trivia.containsNewline()) {
                int column = plan.getColumn(i, token.getColumn());
                _lineBreak(out, trivia, column - token.getColumn(), out.isLineRelaid());
                out.indentTo(column);
                out.append(text);
            } else {
                out.append(trivia.getText());
                out.append(text);
            }
        }
    }

    /**
     * Column the first token of a range is printed at.
     */
    public int startColumn(int first, IndentPlan plan) {
        Token head = tokens.get(first);
        return plan.hasBreak(first) ? plan.getBreakColumn(first) : plan.getColumn(first, head.getColumn());
    }

    /**
     * Widest line, in characters, that {@link #render} produces for the
     * range.
     */
    public int maxWidth(int first, int last, IndentPlan plan) {
        OutputBuffer out = new OutputBuffer("\n");
        render(out, first, last, plan);
        int widest = 0;
        for (String line : out.toString().split("\n", -1)) {
            widest = Math.max(widest, TokenText.width(line));
        }
        return widest;
    }

    private void _lineBreak(OutputBuffer out, Trivia trivia, int delta, boolean twoSpaces) {
        if (twoSpaces) {
            out.markRelaid();
        }
        TriviaLines.emitTrailing(out, trivia);
        out.newline();
        TriviaLines.emitLeading(out, TriviaLines.leadingPieces(trivia), delta, TriviaLines.KEEP_BLANKS, true);
    }
}
