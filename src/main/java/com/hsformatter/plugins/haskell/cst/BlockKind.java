package com.hsformatter.plugins.haskell.cst;

/**
 * The keyword that opened an implicit layout block.
 */
public enum BlockKind {
    WHERE("where"),
    LET("let"),
    DO("do"),
    MDO("mdo"),
    OF("of"),
    LAMBDA_CASE("\\case"),
    /** The guards of {@code if |}; the block column is that of the first {@code |}. */
    MULTI_WAY_IF("if");

    private final String keyword;

    BlockKind(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public static BlockKind forKeyword(String keyword) {
        return switch (keyword) {
            case "where" -> WHERE;
            case "let" -> LET;
            case "do" -> DO;
            case "mdo" -> MDO;
            case "of" -> OF;
            case "case", "cases" -> LAMBDA_CASE;
            default -> null;
        };
    }

    /**
     * Blocks closed by a {@code where} at their depth.
     */
    public boolean closesOnWhere() {
        return this == DO || this == MDO || this == MULTI_WAY_IF;
    }
}
