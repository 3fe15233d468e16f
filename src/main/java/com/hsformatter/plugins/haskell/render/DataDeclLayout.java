package com.hsformatter.plugins.haskell.render;

import java.util.List;

import com.hsformatter.plugins.haskell.cst.Constructor;
import com.hsformatter.plugins.haskell.cst.DataDecl;
import com.hsformatter.plugins.haskell.cst.DerivingClause;
import com.hsformatter.plugins.haskell.cst.IndentPlan;
import com.hsformatter.plugins.haskell.cst.LayoutChoice;
import com.hsformatter.plugins.haskell.cst.RecordField;
import com.hsformatter.plugins.haskell.lexer.Token;
import com.hsformatter.plugins.haskell.rules.AlignmentGroup;

/**
 * {@code data} and {@code newtype} declarations.
 *
 * <pre>
 * data Person = Person
 *   { name :: !Text
 *   , age  :: !Int
 *   }
 *   deriving (Show)
 *
 * data Shape
 *   = Circle !Double
 *   | Rect
 *       { width  :: !Double
 *       , height :: !Double
 *       }
 *   deriving stock (Eq)
 * </pre>
 */
public final class DataDeclLayout {

    private DataDeclLayout() {
    }

    public static IndentPlan plan(List<Token> tokens, DataDecl decl, int indentWidth) {
        LayoutChoice layout = decl.getLayout();
        if (layout == LayoutChoice.UNDECIDED) {
            return IndentPlan.EMPTY;
        }
        IndentPlan.Builder plan = IndentPlan.builder();
        if (layout == LayoutChoice.SINGLE_LINE || decl.getEqualsToken() < 0) {
            TokenText.flatten(plan, tokens, decl.getFirstToken(), decl.getLastToken());
            return plan.build();
        }

        int column = 1 + indentWidth;
        int equals = decl.getEqualsToken();
        TokenText.flatten(plan, tokens, decl.getFirstToken(), equals - 1);
        int braceColumn = braceColumn(decl, indentWidth);
        AlignmentGroup alignment = decl.getFieldAlignment();

        if (decl.isSingleRecord()) {
            Constructor constructor = decl.getConstructors().get(0);
            plan.join(equals, 1);
            plan.join(constructor.getFirstToken(), 1);
            TokenText.flatten(plan, tokens, constructor.getFirstToken(), constructor.getOpenBrace() - 1);
            _recordBody(plan, tokens, constructor, braceColumn, alignment);
        } else {
            plan.breakBefore(equals, column);
            for (int bar : decl.getBars()) {
                plan.breakBefore(bar, column);
            }
            for (Constructor constructor : decl.getConstructors()) {
                plan.join(constructor.getFirstToken(), 1);
                int headEnd = constructor.isRecord() ? constructor.getOpenBrace() - 1 : constructor.getLastToken();
                TokenText.flatten(plan, tokens, constructor.getFirstToken(), headEnd);
                if (constructor.isRecord()) {
                    _recordBody(plan, tokens, constructor, braceColumn, alignment);
                }
            }
        }

        for (DerivingClause deriving : decl.getDerivings()) {
            plan.breakBefore(deriving.getFirstToken(), column);
            TokenText.flatten(plan, tokens, deriving.getFirstToken(), deriving.getLastToken());
        }
        return plan.build();
    }

    /**
     * Column of the braces of record constructors in multi-line form: one
     * unit in for a single record, one unit past the constructor name in a
     * sum type.
     */
    public static int braceColumn(DataDecl decl, int indentWidth) {
        return decl.isSingleRecord() ? 1 + indentWidth : 1 + indentWidth + 2 + indentWidth;
    }

    /**
     * Column the {@code ::} of every field reaches when aligned: one space
     * past the widest field name list.
     */
    public static int fieldTargetColumn(List<Token> tokens, DataDecl decl, int indentWidth) {
        int braceColumn = braceColumn(decl, indentWidth);
        int widest = 0;
        for (RecordField field : decl.getAllFields()) {
            String names = TokenText.flatText(tokens, field.getFirstToken(), field.getDoubleColon() - 1);
            widest = Math.max(widest, TokenText.width(names));
        }
        return braceColumn + 2 + widest + 1;
    }

    /**
     * Text overrides that put every bare deriving class in parentheses, as
     * in {@code deriving (Show)}.
     */
    public static IndentPlan derivingParens(List<Token> tokens, DataDecl decl) {
        IndentPlan.Builder plan = IndentPlan.builder();
        for (DerivingClause deriving : decl.getDerivings()) {
            if (deriving.isBareClass()) {
                int classToken = deriving.getClassesFirst();
                plan.text(classToken, "(" + tokens.get(classToken).getText() + ")");
            }
        }
        return plan.build();
    }

    private static void _recordBody(IndentPlan.Builder plan, List<Token> tokens, Constructor constructor,
                                    int braceColumn, AlignmentGroup alignment) {
        int open = constructor.getOpenBrace();
        int close = constructor.getCloseBrace();
        if (constructor.getFields().isEmpty()) {
            plan.join(open, 1);
            plan.join(close, 0);
            return;
        }
        plan.breakBefore(open, braceColumn);
        for (int comma : constructor.getCommas()) {
            plan.breakBefore(comma, braceColumn);
        }
        for (RecordField field : constructor.getFields()) {
            int first = field.getFirstToken();
            if (tokens.get(first).getTrivia().hasComments()) {
                plan.breakBefore(first, braceColumn + 2);
            } else {
                plan.join(first, 1);
            }
            TokenText.flatten(plan, tokens, first, field.getLastToken());
            int doubleColon = field.getDoubleColon();
            if (alignment != null) {
                String names = TokenText.flatText(tokens, first, doubleColon - 1);
                int nameEnd = braceColumn + 2 + TokenText.width(names);
                plan.join(doubleColon, Math.max(1, alignment.getTargetColumn() - nameEnd));
            } else {
                plan.join(doubleColon, 1);
            }
            if (doubleColon < field.getLastToken()) {
                plan.join(doubleColon + 1, 1);
            }
        }
        plan.breakBefore(close, braceColumn);
    }
}
