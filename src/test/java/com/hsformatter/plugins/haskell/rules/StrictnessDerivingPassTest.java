package com.hsformatter.plugins.haskell.rules;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.hsformatter.api.FormatterResult;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.plugins.haskell.HaskellFormatter;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.lexer.Tokenizer;
import com.hsformatter.plugins.haskell.parser.StructuralReader;

class StrictnessDerivingPassTest {
    private final HaskellStyleConfig config = HaskellStyleConfig.defaults();

    private PassResult _apply(String source) {
        Module module = StructuralReader.parse(Tokenizer.tokenize(source));
        return new StrictnessDerivingPass().apply(module, config);
    }

    @Test
    void bareDerivingClassGetsParentheses() {
        FormatterResult result = new HaskellFormatter()
                .format("data Color = Red | Green deriving Show\n", config);

        assertThat(result.getFormattedCode()).isEqualTo("data Color = Red | Green deriving (Show)\n");
        assertThat(result.getDiagnostics(DiagnosticKind.DERIVING_LAYOUT)).hasSize(1);
    }

    @Test
    void strategyIsKeptInFrontOfTheParentheses() {
        String formatted = new HaskellFormatter()
                .format("newtype Age = Age Int deriving newtype Num\n", config)
                .getFormattedCode();

        assertThat(formatted).isEqualTo("newtype Age = Age Int deriving newtype (Num)\n");
    }

    @Test
    void parenthesizedDerivingIsUntouched() {
        Module module = StructuralReader.parse(Tokenizer.tokenize("data Color = Red deriving (Show, Eq)\n"));

        PassResult result = new StrictnessDerivingPass().apply(module, config);

        assertThat(result.getModule()).isSameAs(module);
    }

    @Test
    void lazyFieldsAreReportedButNotRewritten() {
        PassResult result = _apply("data Account = Account { owner :: Text, balance :: Maybe Int, "
                + "frozen :: !Bool }\n");

        assertThat(result.getDiagnostics()).extracting(d -> d.getSuggestion())
                .containsExactly("owner :: !Text", "balance :: !(Maybe Int)");
        assertThat(result.getDiagnostics()).extracting(d -> d.getKind())
                .containsOnly(DiagnosticKind.MISSING_STRICTNESS_ANNOTATION);
    }

    @Test
    void newtypeFieldsAreNeverReported() {
        PassResult result = _apply("newtype Wrapper = Wrapper { unwrap :: Int }\n");

        assertThat(result.getDiagnostics()).isEmpty();
    }
}
