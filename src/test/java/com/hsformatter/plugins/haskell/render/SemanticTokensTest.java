package com.hsformatter.plugins.haskell.render;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.hsformatter.plugins.haskell.lexer.Tokenizer;

class SemanticTokensTest {

    private static Map<String, Integer> _of(String source) {
        return SemanticTokens.of(Tokenizer.tokenize(source).toList());
    }

    @Test
    void ignoresLayoutAndComments() {
        assertThat(_of("f x =\n  -- note\n  x + 1\n")).isEqualTo(_of("f x = x + 1"));
    }

    @Test
    void countsRepeatedTokens() {
        Map<String, Integer> counts = _of("a = b + b + b");

        assertThat(counts).containsEntry("b", 3).containsEntry("+", 2);
    }

    @Test
    void languagePragmasCountPerExtension() {
        assertThat(_of("{-# LANGUAGE GADTs, RankNTypes #-}\n"))
                .isEqualTo(_of("{-# LANGUAGE RankNTypes #-}\n{-#   LANGUAGE GADTs #-}\n"));
    }

    @Test
    void otherPragmasCompareByNormalizedText() {
        assertThat(_of("{-#  INLINE   f #-}")).isEqualTo(_of("{-# INLINE f #-}"));
        assertThat(_of("{-# INLINE f #-}")).isNotEqualTo(_of("{-# NOINLINE f #-}"));
    }

    @Test
    void bareDerivingClassEqualsParenthesizedOne() {
        assertThat(_of("data A = A deriving Show")).isEqualTo(_of("data A = A deriving (Show)"));
        assertThat(_of("data A = A deriving stock Show")).isEqualTo(_of("data A = A deriving stock (Show)"));
        assertThat(_of("data A = A deriving Show")).isNotEqualTo(_of("data A = A deriving Eq"));
    }

    @Test
    void canonicalTextsLeaveStandaloneDerivingAlone() {
        assertThat(SemanticTokens.canonicalTexts(List.of("deriving", "instance", "Show", "A")))
                .containsExactly("deriving", "instance", "Show", "A");
        assertThat(SemanticTokens.canonicalTexts(List.of("deriving", "anyclass", "ToJSON")))
                .containsExactly("deriving", "anyclass", "(", "ToJSON", ")");
    }
}
