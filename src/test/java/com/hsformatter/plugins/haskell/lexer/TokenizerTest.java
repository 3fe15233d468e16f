package com.hsformatter.plugins.haskell.lexer;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TokenizerTest {

    private static List<Token> _tokens(String text) {
        return Tokenizer.tokenize(text).toList();
    }

    private static List<String> _texts(String text) {
        return _tokens(text).stream()
                .filter(t -> !t.isEof())
                .map(Token::getText)
                .collect(Collectors.toList());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "module Main where\n",
            "{-# LANGUAGE OverloadedStrings #-}\nmodule A (f) where\n\nf :: Int\nf = 1 -- one\n",
            "x = \"a \\\"quoted\\\" string\"\r\ny = 'c'\r\n",
            "{- outer {- inner -} still outer -}\nmain = pure ()\n",
            "f x\n  | x > 0 = x\n  | otherwise = negate x\n   \n",
            "\t\tindented = [1..10]\n"
    })
    void reconstructsSourceExactly(String source) {
        assertThat(Tokenizer.tokenize(source).reconstruct()).isEqualTo(source);
    }

    @Test
    void classifiesKeywordsIdentifiersAndOperators() {
        List<Token> tokens = _tokens("module Foo where\nf :: Int -> Int\n");

        assertThat(tokens.get(0).isKeyword("module")).isTrue();
        assertThat(tokens.get(1).getKind()).isEqualTo(TokenKind.IDENTIFIER);
        assertThat(tokens.get(2).isKeyword("where")).isTrue();
        assertThat(tokens.get(3).getKind()).isEqualTo(TokenKind.IDENTIFIER);
        assertThat(tokens.get(4).isOperator("::")).isTrue();
        assertThat(tokens.get(6).isOperator("->")).isTrue();
        assertThat(tokens.get(tokens.size() - 1).isEof()).isTrue();
    }

    @Test
    void readsQualifiedNamesAsOneToken() {
        List<Token> tokens = _tokens("Data.Map.lookup k Map.! Data.Map.Map");

        assertThat(tokens.get(0).getText()).isEqualTo("Data.Map.lookup");
        assertThat(tokens.get(0).isQualified()).isTrue();
        assertThat(tokens.get(0).getUnqualifiedText()).isEqualTo("lookup");
        assertThat(tokens.get(2).getKind()).isEqualTo(TokenKind.OPERATOR);
        assertThat(tokens.get(2).getText()).isEqualTo("Map.!");
        assertThat(tokens.get(3).isConId()).isTrue();
    }

    @Test
    void keepsCommentsInTrivia() {
        List<Token> tokens = _tokens("-- header\n{- block -} x = 1 -- trailing\n");

        Token x = tokens.get(0);
        assertThat(x.getText()).isEqualTo("x");
        assertThat(x.getTrivia().getComments()).extracting(TriviaPiece::getText)
                .containsExactly("-- header", "{- block -}");
        assertThat(x.isFirstOnLine()).isTrue();

        Token eof = tokens.get(tokens.size() - 1);
        assertThat(eof.getTrivia().getComments()).extracting(TriviaPiece::getText)
                .containsExactly("-- trailing");
    }

    @Test
    void operatorStartingWithDashesIsNotAComment() {
        assertThat(_texts("a --> b")).containsExactly("a", "-->", "b");
        assertThat(_texts("a |-- b")).containsExactly("a", "|--", "b");
    }

    @Test
    void tracksLinesAndTabColumns() {
        List<Token> tokens = _tokens("a\n\tb\n  c");

        assertThat(tokens.get(1).getLine()).isEqualTo(2);
        assertThat(tokens.get(1).getColumn()).isEqualTo(9);
        assertThat(tokens.get(2).getLine()).isEqualTo(3);
        assertThat(tokens.get(2).getColumn()).isEqualTo(3);
    }

    @Test
    void pragmasAreSingleTokens() {
        List<Token> tokens = _tokens("{-# LANGUAGE GADTs, RankNTypes #-}\n{-# INLINE f #-}\n");

        assertThat(tokens.get(0).getKind()).isEqualTo(TokenKind.PRAGMA);
        assertThat(tokens.get(0).getText()).isEqualTo("{-# LANGUAGE GADTs, RankNTypes #-}");
        assertThat(tokens.get(1).getKind()).isEqualTo(TokenKind.PRAGMA);
    }

    @Test
    void unterminatedConstructsAreMarked() {
        assertThat(_tokens("x = \"open\ny = 1").get(2).getKind()).isEqualTo(TokenKind.UNTERMINATED);
        assertThat(_tokens("{-# LANGUAGE GADTs").get(0).getKind()).isEqualTo(TokenKind.UNTERMINATED);

        Token eof = _tokens("x = 1 {- never closed").get(3);
        assertThat(eof.isEof()).isTrue();
        assertThat(eof.getTrivia().hasUnterminatedComment()).isTrue();
    }

    @Test
    void characterLiteralsAndPrimes() {
        assertThat(_texts("f' = 'x' : '\\n' : []")).containsExactly("f'", "=", "'x'", ":", "'\\n'", ":", "[", "]");
    }

    @Test
    void numbersIncludeFractionsAndExponents() {
        assertThat(_texts("[0x1F, 1.5e-3, 1_000]")).containsExactly("[", "0x1F", ",", "1.5e-3", ",", "1_000", "]");
    }

    @Test
    void quasiQuotesOnlyWithTheExtension() {
        String source = "{-# LANGUAGE QuasiQuotes #-}\nq = [sql|select * from t|]\n";
        assertThat(Tokenizer.declaresQuasiQuotes(source)).isTrue();
        List<Token> tokens = _tokens(source);
        assertThat(tokens.get(3).getKind()).isEqualTo(TokenKind.QUASI_QUOTE);
        assertThat(tokens.get(3).getText()).isEqualTo("[sql|select * from t|]");

        List<Token> plain = _tokens("q = [x|x <- xs]\n");
        assertThat(plain.get(2).isPunctuation("[")).isTrue();
    }

    @Test
    void cppDirectivesAtColumnOne() {
        List<Token> tokens = _tokens("#if MIN_VERSION_base(4,9,0)\nx = 1\n#endif\n");

        assertThat(tokens.get(0).getKind()).isEqualTo(TokenKind.CPP_DIRECTIVE);
        assertThat(tokens.get(0).getText()).isEqualTo("#if MIN_VERSION_base(4,9,0)");
        assertThat(tokens.get(4).getKind()).isEqualTo(TokenKind.CPP_DIRECTIVE);
    }

    @Test
    void streamCanBeIteratedRepeatedly() {
        TokenStream stream = Tokenizer.tokenize("a b c");
        assertThat(stream.toList()).hasSize(4);
        assertThat(stream.toList()).hasSize(4);
    }

    @Test
    void blankLineCounting() {
        List<Token> tokens = _tokens("a\n\n\n-- note\n\nb");
        Trivia trivia = tokens.get(1).getTrivia();

        assertThat(trivia.getBlankLineCount()).isEqualTo(3);
        assertThat(trivia.getBlankLinesBeforeFirstEntry()).isEqualTo(2);
    }

    @Test
    void offsetsAreUtf8Bytes() {
        List<Token> tokens = _tokens("s = \"\u03bb\" ++ t\n");

        Token literal = tokens.get(2);
        Token append = tokens.get(3);
        assertThat(literal.getStartOffset()).isEqualTo(4);
        assertThat(literal.getEndOffset()).isEqualTo(8);
        assertThat(append.getStartOffset()).isEqualTo(9);
        assertThat(append.getColumn()).isEqualTo(9);
        assertThat(append.getTrivia().getPieces().get(0).getStartOffset()).isEqualTo(8);
    }
}
