package com.hsformatter.plugins.haskell.lexer;

import java.util.Set;

/**
 * Reserved words, layout openers and reserved operators.
 */
public final class Keywords {
    public static final Set<String> RESERVED = Set.of(
            "case", "class", "data", "default", "deriving", "do", "else", "foreign",
            "if", "import", "in", "infix", "infixl", "infixr", "instance", "let",
            "module", "newtype", "of", "then", "type", "where", "mdo");

    /** Keywords that open an implicit layout block. */
    public static final Set<String> LAYOUT_OPENERS = Set.of("where", "let", "do", "of", "mdo");

    public static final Set<String> RESERVED_OPERATORS = Set.of(
            "..", ":", "::", "=", "\\", "|", "<-", "->", "@", "~", "=>",
            "\u2237", "\u21D2", "\u2192", "\u2190", "\u2200");

    /** Symbols that may start an operator. */
    private static final String SYMBOL_CHARS = "!#$%&*+./<=>?@\\^|-~:";

    private Keywords() {
    }

    public static boolean isKeyword(String word) {
        return RESERVED.contains(word);
    }

    public static boolean isSymbolChar(int codePoint) {
        if (codePoint < 128) {
            return SYMBOL_CHARS.indexOf(codePoint) >= 0;
        }
        int type = Character.getType(codePoint);
        return type == Character.MATH_SYMBOL
                || type == Character.CURRENCY_SYMBOL
                || type == Character.MODIFIER_SYMBOL
                || type == Character.OTHER_SYMBOL
                || type == Character.DASH_PUNCTUATION
                || type == Character.OTHER_PUNCTUATION;
    }

    public static boolean isIdentifierStart(int codePoint) {
        return codePoint == '_' || Character.isLetter(codePoint);
    }

    public static boolean isIdentifierPart(int codePoint) {
        return codePoint == '_' || codePoint == '\'' || Character.isLetterOrDigit(codePoint);
    }

    /**
     * Operators at which a long expression may be broken: anything except
     * the reserved ones that carry syntax.
     */
    public static boolean isBreakableOperator(String operator) {
        return operator.equals(":") || !RESERVED_OPERATORS.contains(operator);
    }
}
