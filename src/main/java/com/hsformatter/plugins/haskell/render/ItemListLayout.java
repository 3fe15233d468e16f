package com.hsformatter.plugins.haskell.render;

import java.util.List;

import com.hsformatter.plugins.haskell.cst.BracketList;
import com.hsformatter.plugins.haskell.cst.ImportDecl;
import com.hsformatter.plugins.haskell.cst.IndentPlan;
import com.hsformatter.plugins.haskell.cst.LayoutChoice;
import com.hsformatter.plugins.haskell.cst.ListItem;
import com.hsformatter.plugins.haskell.cst.ModuleHeader;
import com.hsformatter.plugins.haskell.lexer.Token;

/**
 * Export and import lists.
 *
 * <pre>
 * module Foo (foo, bar) where
 *
 * module Foo
 *   ( foo
 *   , bar
 *   ) where
 * </pre>
 */
public final class ItemListLayout {

    private ItemListLayout() {
    }

    public static IndentPlan headerPlan(List<Token> tokens, ModuleHeader header, int indentWidth) {
        if (header.getExports() == null || header.getExports().getLayout() == LayoutChoice.UNDECIDED) {
            return IndentPlan.EMPTY;
        }
        IndentPlan.Builder plan = IndentPlan.builder();
        apply(plan, tokens, header.getExports(), 1 + indentWidth);
        if (header.getWhereToken() >= 0) {
            plan.join(header.getWhereToken(), 1);
        }
        return plan.build();
    }

    public static IndentPlan importPlan(List<Token> tokens, ImportDecl importDecl, int indentWidth) {
        if (importDecl.getImportList() == null || importDecl.getImportList().getLayout() == LayoutChoice.UNDECIDED) {
            return IndentPlan.EMPTY;
        }
        IndentPlan.Builder plan = IndentPlan.builder();
        apply(plan, tokens, importDecl.getImportList(), 1 + indentWidth);
        return plan.build();
    }

    /**
     * Adds the entries for one list. {@code column} is where the brackets
     * and commas of the multi-line form go.
     */
    public static void apply(IndentPlan.Builder plan, List<Token> tokens, BracketList<? extends ListItem> list,
                             int column) {
        boolean multiLine = list.getLayout() == LayoutChoice.MULTI_LINE && !list.isEmpty();
        int open = list.getOpenToken();
        int close = list.getCloseToken();
        if (multiLine) {
            plan.breakBefore(open, column);
        } else {
            plan.join(open, 1);
        }
        for (int comma : list.getCommas()) {
            if (multiLine) {
                plan.breakBefore(comma, column);
            } else {
                plan.join(comma, 0);
            }
        }
        for (ListItem item : list.getItems()) {
            int first = item.getFirstToken();
            Token previous = tokens.get(first - 1);
            if (multiLine) {
                if (tokens.get(first).getTrivia().hasComments()) {
                    plan.breakBefore(first, column + 2);
                } else {
                    plan.join(first, 1);
                }
            } else {
                plan.join(first, previous.isPunctuation(",") ? 1 : 0);
            }
            TokenText.flatten(plan, tokens, first, item.getLastToken());
        }
        if (multiLine) {
            plan.breakBefore(close, column);
        } else {
            plan.join(close, 0);
        }
    }
}
