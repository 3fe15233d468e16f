package com.hsformatter.plugins.haskell.lexer;

public enum TokenKind {
    IDENTIFIER,
    OPERATOR,
    KEYWORD,
    LITERAL,
    PUNCTUATION,
    PRAGMA,
    QUASI_QUOTE,
    CPP_DIRECTIVE,
    UNTERMINATED,
    EOF
}
