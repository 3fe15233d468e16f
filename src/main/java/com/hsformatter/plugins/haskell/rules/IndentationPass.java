package com.hsformatter.plugins.haskell.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.plugins.haskell.cst.BlockItem;
import com.hsformatter.plugins.haskell.cst.Declaration;
import com.hsformatter.plugins.haskell.cst.FunctionClause;
import com.hsformatter.plugins.haskell.cst.IndentPlan;
import com.hsformatter.plugins.haskell.cst.LayoutBlock;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.cst.NodeKind;
import com.hsformatter.plugins.haskell.cst.OpaqueDecl;
import com.hsformatter.plugins.haskell.lexer.Token;

/**
 * Normalizes the indentation of function clauses and of class, instance and
 * other opaque declarations.
 *
 * <ul>
 *   <li>Continuation lines outside any block keep their relative indentation
 *       and move so that the shallowest one sits one unit in.</li>
 *   <li>A detached block (its opener keyword ends a line) moves one unit past
 *       the line holding the opener, and further by whole units while the
 *       line after the block would otherwise fall inside it.</li>
 *   <li>An attached block moves with the line holding its opener.</li>
 *   <li>A closing {@code where} goes on its own line one unit in, its
 *       bindings two units in; the other blocks of that clause stay deeper
 *       than the {@code where}.</li>
 * </ul>
 */
public class IndentationPass implements FormattingPass {

    @Override
    public String getName() {
        return "indentation";
    }

    @Override
    public Set<NodeKind> getNodeKinds() {
        return Set.of(NodeKind.FUNCTION_CLAUSE, NodeKind.OPAQUE_DECL, NodeKind.LAYOUT_BLOCK);
    }

    @Override
    public PassResult apply(Module module, HaskellStyleConfig config) {
        if (module.isBodyVerbatim()) {
            return PassResult.unchanged(module);
        }
        List<Declaration> declarations = new ArrayList<>();
        boolean changed = false;
        for (Declaration declaration : module.getDeclarations()) {
            if (!_isReindented(declaration)) {
                declarations.add(declaration);
                continue;
            }
            IndentPlan plan = new Indenter(module.getTokens(), declaration, config.getIndentWidth()).plan();
            if (plan.isEmpty()) {
                declarations.add(declaration);
            } else {
                declarations.add(declaration.withIndentPlan(declaration.getIndentPlan().merge(plan)));
                changed = true;
            }
        }
        if (!changed) {
            return PassResult.unchanged(module);
        }
        return new PassResult(module.toBuilder().declarations(declarations).build(), List.of());
    }

    private static boolean _isReindented(Declaration declaration) {
        if (declaration instanceof FunctionClause) {
            return true;
        }
        if (declaration instanceof OpaqueDecl) {
            return switch (((OpaqueDecl) declaration).getOpaqueKind()) {
                case CLASS, INSTANCE, GADT, TYPE_SYNONYM, OTHER -> true;
                default -> false;
            };
        }
        return false;
    }

    /**
     * Column decisions for one top-level declaration.
     */
    static final class Indenter {
        private final List<Token> tokens;
        private final Declaration declaration;
        private final int indentWidth;
        private final int first;
        private final int last;
        private final IndentPlan.Builder plan = IndentPlan.builder();

        Indenter(List<Token> tokens, Declaration declaration, int indentWidth) {
            this.tokens = tokens;
            this.declaration = declaration;
            this.indentWidth = indentWidth;
            this.first = declaration.getFirstToken();
            this.last = declaration.getLastToken();
        }

        IndentPlan plan() {
            LayoutBlock where = _normalizedWhere();
            int whereToken = where == null ? -1 : where.getOpenerToken();
            if (where != null) {
                if (tokens.get(whereToken).isFirstOnLine()) {
                    _move(whereToken, 1 + indentWidth);
                } else {
                    plan.breakBefore(whereToken, 1 + indentWidth);
                }
                int firstBinding = where.getFirstToken();
                if (!tokens.get(firstBinding).isFirstOnLine()) {
                    plan.breakBefore(firstBinding, 1 + 2 * indentWidth);
                }
            }

            _normalizeTopLines(whereToken);

            int floor = where == null ? 0 : 1 + indentWidth;
            for (LayoutBlock block : declaration.getBlocks()) {
                if (block == where) {
                    _shiftBlock(block, 1 + 2 * indentWidth);
                } else {
                    _processBlock(block, 1, floor);
                }
            }
            return plan.build();
        }

        /**
         * The {@code where} block closing a function clause, when it can be
         * moved onto its own line without touching comments.
         */
        private LayoutBlock _normalizedWhere() {
            if (!(declaration instanceof FunctionClause)) {
                return null;
            }
            LayoutBlock where = ((FunctionClause) declaration).getWhereBlock();
            if (where == null || where.isEmpty() || where.getLastToken() != last) {
                return null;
            }
            Token whereToken = tokens.get(where.getOpenerToken());
            if (!whereToken.isFirstOnLine() && whereToken.getTrivia().hasComments()) {
                return null;
            }
            Token firstBinding = tokens.get(where.getFirstToken());
            if (!firstBinding.isFirstOnLine() && !firstBinding.getTrivia().isPlainSpace()) {
                return null;
            }
            return where;
        }

        private void _normalizeTopLines(int whereToken) {
            List<Integer> lines = new ArrayList<>();
            int minColumn = Integer.MAX_VALUE;
            for (int k = first + 1; k <= last; k++) {
                if (k == whereToken || !tokens.get(k).isFirstOnLine() || _inDirectBlock(k)) {
                    continue;
                }
                lines.add(k);
                minColumn = Math.min(minColumn, tokens.get(k).getColumn());
            }
            if (lines.isEmpty()) {
                return;
            }
            int delta = 1 + indentWidth - minColumn;
            if (delta == 0) {
                return;
            }
            for (int k : lines) {
                _move(k, tokens.get(k).getColumn() + delta);
            }
        }

        private void _processBlock(LayoutBlock block, int enclosingColumn, int floor) {
            if (block.isEmpty()) {
                return;
            }
            int blockFirst = block.getFirstToken();
            int column;
            if (tokens.get(blockFirst).isFirstOnLine()) {
                int openerLine = _lineStartOf(block.getOpenerToken());
                column = Math.max(_newColumn(openerLine), enclosingColumn) + indentWidth;
                int following = _nextLineStart(block.getLastToken());
                int bound = Math.max(floor, following < 0 ? 0 : _newColumn(following));
                while (column <= bound) {
                    column += indentWidth;
                }
            } else {
                int line = _lineStartOf(blockFirst);
                column = block.getColumn() + _newColumn(line) - tokens.get(line).getColumn();
            }
            _shiftBlock(block, column);
        }

        /**
         * Moves the lines of a block rigidly so its items start at
         * {@code column}, then places the blocks nested in its items.
         */
        private void _shiftBlock(LayoutBlock block, int column) {
            int delta = column - block.getColumn();
            if (delta != 0) {
                for (int k = block.getFirstToken(); k <= block.getLastToken(); k++) {
                    if (tokens.get(k).isFirstOnLine() && !plan.hasBreak(k) && !_inNestedBlock(block, k)) {
                        _move(k, tokens.get(k).getColumn() + delta);
                    }
                }
            }
            for (BlockItem item : block.getItems()) {
                for (LayoutBlock nested : item.getBlocks()) {
                    _processBlock(nested, column, 0);
                }
            }
        }

        private void _move(int tokenIndex, int column) {
            if (column != tokens.get(tokenIndex).getColumn()) {
                plan.column(tokenIndex, column);
            }
        }

        private int _newColumn(int tokenIndex) {
            if (plan.hasColumn(tokenIndex)) {
                return plan.getColumn(tokenIndex, 0);
            }
            if (plan.hasBreak(tokenIndex)) {
                return plan.getBreakColumn(tokenIndex);
            }
            return tokens.get(tokenIndex).getColumn();
        }

        private int _lineStartOf(int tokenIndex) {
            int j = tokenIndex;
            while (j > first && !tokens.get(j).isFirstOnLine()) {
                j--;
            }
            return j;
        }

        private int _nextLineStart(int after) {
            for (int k = after + 1; k <= last; k++) {
                if (tokens.get(k).isFirstOnLine()) {
                    return k;
                }
            }
            return -1;
        }

        private boolean _inDirectBlock(int tokenIndex) {
            for (LayoutBlock block : declaration.getBlocks()) {
                if (block.contains(tokenIndex)) {
                    return true;
                }
            }
            return false;
        }

        private static boolean _inNestedBlock(LayoutBlock block, int tokenIndex) {
            for (BlockItem item : block.getItems()) {
                for (LayoutBlock nested : item.getBlocks()) {
                    if (nested.contains(tokenIndex)) {
                        return true;
                    }
                }
            }
            return false;
        }
    }
}
