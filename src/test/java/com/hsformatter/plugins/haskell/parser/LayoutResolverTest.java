package com.hsformatter.plugins.haskell.parser;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.hsformatter.plugins.haskell.cst.BlockKind;
import com.hsformatter.plugins.haskell.cst.LayoutBlock;
import com.hsformatter.plugins.haskell.lexer.Token;
import com.hsformatter.plugins.haskell.lexer.Tokenizer;

class LayoutResolverTest {

    private static List<Token> _tokens(String source) {
        return Tokenizer.tokenize(source).toList();
    }

    @Test
    void splitsTopLevelItemsAtColumnOne() {
        List<Token> tokens = _tokens("f :: Int\nf =\n  1 +\n    2\n\ng = 3\n");

        List<ItemSpan> items = new LayoutResolver(tokens).resolveBody(0);

        assertThat(items).hasSize(3);
        assertThat(tokens.get(items.get(1).getFirstToken()).getText()).isEqualTo("f");
        assertThat(tokens.get(items.get(1).getLastToken()).getText()).isEqualTo("2");
        assertThat(tokens.get(items.get(2).getFirstToken()).getText()).isEqualTo("g");
    }

    @Test
    void opensBlocksAfterLayoutKeywords() {
        List<Token> tokens = _tokens("main = do\n  putStrLn a\n  print b\n  where\n    a = \"x\"\n    b = 1\n");

        List<ItemSpan> items = new LayoutResolver(tokens).resolveBody(0);

        assertThat(items).hasSize(1);
        List<LayoutBlock> blocks = items.get(0).getBlocks();
        assertThat(blocks).extracting(LayoutBlock::getBlockKind).containsExactly(BlockKind.DO, BlockKind.WHERE);
        assertThat(blocks.get(0).getItems()).hasSize(2);
        assertThat(blocks.get(0).getColumn()).isEqualTo(3);
        assertThat(blocks.get(1).getItems()).hasSize(2);
        assertThat(blocks.get(1).getColumn()).isEqualTo(5);
    }

    @Test
    void structureIgnoresUniformReindentation() {
        List<String> narrow = LayoutResolver.structureSignature(_tokens("f = do\n  a\n  b\n"));
        List<String> wide = LayoutResolver.structureSignature(_tokens("f = do\n      a\n      b\n"));

        assertThat(narrow).isEqualTo(wide);
    }

    @Test
    void structureSeesContinuationLines() {
        List<String> twoStatements = LayoutResolver.structureSignature(_tokens("f = do\n  a\n  b\n"));
        List<String> oneStatement = LayoutResolver.structureSignature(_tokens("f = do\n  a\n    b\n"));

        assertThat(twoStatements).isNotEqualTo(oneStatement);
    }

    @Test
    void multiWayIfOpensABlockAtItsFirstGuard() {
        List<Token> tokens = _tokens("f x = if | x > 0 -> 1\n         | otherwise -> 0\n");

        List<ItemSpan> items = new LayoutResolver(tokens).resolveBody(0);

        assertThat(items).hasSize(1);
        List<LayoutBlock> blocks = items.get(0).getBlocks();
        assertThat(blocks).extracting(LayoutBlock::getBlockKind).containsExactly(BlockKind.MULTI_WAY_IF);
        assertThat(blocks.get(0).getColumn()).isEqualTo(10);
        assertThat(blocks.get(0).getItems()).hasSize(2);
    }

    @Test
    void structureSeesMisalignedMultiWayIfGuards() {
        List<String> aligned = LayoutResolver.structureSignature(
                _tokens("f x = if | x > 0 -> 1\n         | otherwise -> 0\n"));
        List<String> pulledLeft = LayoutResolver.structureSignature(
                _tokens("f x = if | x > 0 -> 1\n  | otherwise -> 0\n"));

        assertThat(aligned).isNotEqualTo(pulledLeft);
    }
}
