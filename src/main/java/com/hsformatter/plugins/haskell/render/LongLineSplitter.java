package com.hsformatter.plugins.haskell.render;

import java.util.List;

import com.hsformatter.plugins.haskell.cst.BlockItem;
import com.hsformatter.plugins.haskell.cst.Declaration;
import com.hsformatter.plugins.haskell.cst.Equation;
import com.hsformatter.plugins.haskell.cst.Expr;
import com.hsformatter.plugins.haskell.cst.FunctionClause;
import com.hsformatter.plugins.haskell.cst.GuardedRhs;
import com.hsformatter.plugins.haskell.cst.IndentPlan;
import com.hsformatter.plugins.haskell.cst.LayoutBlock;
import com.hsformatter.plugins.haskell.cst.LetBinding;
import com.hsformatter.plugins.haskell.lexer.Token;

/**
 * Breaks the over-long lines of a function clause or of a class or instance
 * body: right-hand sides and guard bodies of equations at any depth,
 * statements, case alternatives, and signatures bound inside blocks.
 *
 * <p>Only a part that sits on one line, ends that line, and holds neither a
 * comment nor a nested block is broken. Its continuation lines go one unit
 * past both the line it starts on and the block that holds it.
 */
public final class LongLineSplitter {
    private final List<Token> tokens;
    private final LineReindenter reindenter;
    private final IndentPlan current;
    private final int maxLineLength;
    private final int indentWidth;
    private final IndentPlan.Builder plan = IndentPlan.builder();

    private LongLineSplitter(List<Token> tokens, LineReindenter reindenter, IndentPlan current,
                             int maxLineLength, int indentWidth) {
        this.tokens = tokens;
        this.reindenter = reindenter;
        this.current = current;
        this.maxLineLength = maxLineLength;
        this.indentWidth = indentWidth;
    }

    /**
     * Breaks for the over-long lines of {@code declaration} as printed under
     * its current plan.
     */
    public static IndentPlan plan(List<Token> tokens, LineReindenter reindenter, Declaration declaration,
                                  int maxLineLength, int indentWidth) {
        LongLineSplitter splitter = new LongLineSplitter(tokens, reindenter, declaration.getIndentPlan(),
                maxLineLength, indentWidth);
        if (declaration instanceof FunctionClause) {
            splitter._clause((FunctionClause) declaration, 1);
        } else {
            for (LayoutBlock block : declaration.getBlocks()) {
                splitter._block(block);
            }
        }
        return splitter.plan.build();
    }

    private void _clause(FunctionClause clause, int enclosingColumn) {
        Equation equation = clause.getEquation();
        if (equation.getRhs() != null) {
            _body(equation.getRhs(), enclosingColumn);
        }
        for (GuardedRhs guard : equation.getGuards()) {
            _body(guard.getBody(), enclosingColumn);
        }
        for (LayoutBlock block : clause.getBlocks()) {
            _block(block);
        }
    }

    private void _body(Expr body, int enclosingColumn) {
        if (body.getBlocks().isEmpty()) {
            _expression(body.getFirstToken(), body.getLastToken(), enclosingColumn);
        }
    }

    private void _block(LayoutBlock block) {
        if (block.isEmpty()) {
            return;
        }
        int column = _newColumn(block.getFirstToken());
        for (BlockItem item : block.getItems()) {
            Declaration local = item instanceof LetBinding ? ((LetBinding) item).getDeclaration() : null;
            if (local instanceof FunctionClause) {
                _clause((FunctionClause) local, column);
                continue;
            }
            if (item.getBlocks().isEmpty()) {
                _item(item.getFirstToken(), item.getLastToken(), column);
            }
            for (LayoutBlock nested : item.getBlocks()) {
                _block(nested);
            }
        }
    }

    /**
     * A statement, alternative or binding: a signature breaks before its
     * arrows, anything else after its last {@code =} or {@code ->}, or its
     * first {@code <-}.
     */
    private void _item(int first, int last, int blockColumn) {
        int doubleColon = SignatureLayout.doubleColon(tokens, first, last);
        if (doubleColon >= 0) {
            int lineStart = _overlongLine(first, last);
            if (lineStart >= 0 && doubleColon < last) {
                plan.addAll(SignatureLayout.split(tokens, doubleColon, last,
                        _continuationColumn(lineStart, blockColumn)));
            }
            return;
        }
        int separator = _separator(first, last);
        if (separator < last) {
            _expression(separator < 0 ? first : separator + 1, last, blockColumn);
        }
    }

    private void _expression(int first, int last, int enclosingColumn) {
        int lineStart = _overlongLine(first, last);
        if (lineStart >= 0) {
            plan.addAll(ExpressionSplitter.split(tokens, first, last,
                    _continuationColumn(lineStart, enclosingColumn)));
        }
    }

    /**
     * Start of the line holding {@code first .. last} when the range is on
     * one line, ends it, carries no comment, and that line is over budget;
     * -1 otherwise.
     */
    private int _overlongLine(int first, int last) {
        if (TokenText.spansLines(tokens, first, last) || TokenText.hasInteriorComments(tokens, first, last)) {
            return -1;
        }
        Token next = tokens.get(last + 1);
        if (!next.isEof() && !next.getTrivia().containsNewline() && !current.hasBreak(last + 1)) {
            return -1;
        }
        for (int k = first + 1; k <= last; k++) {
            if (current.hasBreak(k) || current.hasJoin(k)) {
                return -1;
            }
        }
        int lineStart = _lineStart(first);
        return reindenter.maxWidth(lineStart, last, current) > maxLineLength ? lineStart : -1;
    }

    private int _continuationColumn(int lineStart, int enclosingColumn) {
        return Math.max(reindenter.startColumn(lineStart, current), enclosingColumn) + indentWidth;
    }

    /**
     * Last {@code =} or {@code ->} at bracket depth 0, else the first
     * {@code <-}, else -1.
     */
    private int _separator(int first, int last) {
        int equals = -1;
        int bind = -1;
        int depth = 0;
        for (int j = first; j <= last; j++) {
            Token token = tokens.get(j);
            if (token.isOpenBracket()) {
                depth++;
            } else if (token.isCloseBracket()) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0) {
                if (token.isOperator("=") || token.isOperator("->") || token.isOperator("\u2192")) {
                    equals = j;
                } else if (bind < 0 && (token.isOperator("<-") || token.isOperator("\u2190"))) {
                    bind = j;
                }
            }
        }
        return equals >= 0 ? equals : bind;
    }

    private int _lineStart(int tokenIndex) {
        int j = tokenIndex;
        while (j > 0 && !tokens.get(j).isFirstOnLine() && !current.hasBreak(j)) {
            j--;
        }
        return j;
    }

    /**
     * Column of a token once its line has moved under the current plan.
     */
    private int _newColumn(int tokenIndex) {
        int lineStart = _lineStart(tokenIndex);
        return reindenter.startColumn(lineStart, current)
                + tokens.get(tokenIndex).getColumn() - tokens.get(lineStart).getColumn();
    }
}
