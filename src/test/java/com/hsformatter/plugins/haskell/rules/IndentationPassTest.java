package com.hsformatter.plugins.haskell.rules;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.hsformatter.api.FormatterResult;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.plugins.haskell.HaskellFormatter;

class IndentationPassTest {
    private final HaskellFormatter formatter = new HaskellFormatter();
    private final HaskellStyleConfig config = HaskellStyleConfig.defaults();

    @Test
    void doBlockMovesToOneIndentUnit() {
        FormatterResult result = formatter.format("main = do\n    putStrLn a\n    print b\n", config);

        assertThat(result.getFormattedCode()).isEqualTo("main = do\n  putStrLn a\n  print b\n");
        assertThat(result.getDiagnostics(DiagnosticKind.INDENTATION)).hasSize(1);
    }

    @Test
    void indentWidthIsConfigurable() {
        String formatted = formatter.format("main = do\n  putStrLn a\n  print b\n",
                config.toBuilder().indentWidth(4).build()).getFormattedCode();

        assertThat(formatted).isEqualTo("main = do\n    putStrLn a\n    print b\n");
    }

    @Test
    void trailingWhereGoesOnItsOwnLine() {
        String formatted = formatter.format("f x = y where y = x\n", config).getFormattedCode();

        assertThat(formatted).isEqualTo("f x = y\n  where\n    y = x\n");
    }

    @Test
    void continuationLinesKeepTheirRelativeIndentation() {
        String formatted = formatter.format("total =\n      a\n        + b\n", config).getFormattedCode();

        assertThat(formatted).isEqualTo("total =\n  a\n    + b\n");
    }

    @Test
    void canonicalCodeIsUnchanged() {
        String source = "main :: IO ()\n"
                + "main = do\n"
                + "  let x = 1\n"
                + "  print x\n"
                + "\n"
                + "helper :: Int\n"
                + "helper = go 1\n"
                + "  where\n"
                + "    go n = n\n";

        FormatterResult result = formatter.format(source, config);

        assertThat(result.getFormattedCode()).isEqualTo(source);
        assertThat(result.getMechanicalDiagnostics()).isEmpty();
    }

    @Test
    void bodyBlockStaysDeeperThanItsWhere() {
        String formatted = formatter.format("main = do\n  print x\n  where\n    x = 1\n", config)
                .getFormattedCode();

        assertThat(formatted).isEqualTo("main = do\n    print x\n  where\n    x = 1\n");
    }

    @Test
    void commentsMoveWithTheirLines() {
        String formatted = formatter.format("main = do\n    -- greet\n    putStrLn a\n", config)
                .getFormattedCode();

        assertThat(formatted).isEqualTo("main = do\n  -- greet\n  putStrLn a\n");
    }

    @Test
    void multiWayIfGuardsStayUnderTheirFirstBar() {
        String source = "{-# LANGUAGE MultiWayIf #-}\n"
                + "module M (f) where\n"
                + "\n"
                + "f :: Int -> Int\n"
                + "f x = if | x > 0 -> 1\n"
                + "         | otherwise -> 0\n";

        FormatterResult result = formatter.format(source, config);

        assertThat(result.getFormattedCode()).isEqualTo(source);
        assertThat(result.getDiagnostics(DiagnosticKind.INDENTATION)).isEmpty();
    }

    @Test
    void multiWayIfGuardsMoveWithTheirBinding() {
        String formatted = formatter.format("f x = g x\n"
                + "  where\n"
                + "      g y = if | y > 0 -> 1\n"
                + "               | otherwise -> 0\n", config).getFormattedCode();

        assertThat(formatted).isEqualTo("f x = g x\n"
                + "  where\n"
                + "    g y = if | y > 0 -> 1\n"
                + "             | otherwise -> 0\n");
    }
}
