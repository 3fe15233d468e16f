package com.hsformatter.plugins.haskell.rules;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.hsformatter.api.FormatterResult;
import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.plugins.haskell.HaskellFormatter;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.lexer.Tokenizer;
import com.hsformatter.plugins.haskell.parser.StructuralReader;

class RuleEngineTest {
    private final HaskellStyleConfig config = HaskellStyleConfig.defaults();

    @Test
    void standardPassesRunInFixedOrder() {
        assertThat(RuleEngine.standard().getPasses()).extracting(FormattingPass::getName)
                .containsExactly("indentation", "alignment", "import-ordering", "pragma-placement",
                        "strictness-deriving", "naming");
    }

    @Test
    void emptyEngineLeavesTheModuleAlone() {
        Module module = StructuralReader.parse(Tokenizer.tokenize("module M (x) where\n\nx = 1\n"));

        PassOutcome outcome = new RuleEngine(List.of()).apply(module, config);

        assertThat(outcome.getModule()).isSameAs(module);
        assertThat(outcome.getDiagnostics()).isEmpty();
        assertThat(outcome.getRefactorings()).isEmpty();
    }

    @Test
    void diagnosticsAccumulateAcrossPasses() {
        Module module = StructuralReader.parse(Tokenizer.tokenize(
                "module M (x) where\n\nimport Data.Text\nimport Control.Monad\n\ndata T = T deriving Show\n"));

        PassOutcome outcome = RuleEngine.standard().apply(module, config);

        assertThat(outcome.getDiagnostics()).extracting(d -> d.getKind().name())
                .contains("IMPORT_ORDERING", "DERIVING_LAYOUT");
        assertThat(outcome.getModule()).isNotSameAs(module);
    }

    @ParameterizedTest
    @ValueSource(strings = {"exports", "header", "record", "deriving"})
    void formatsExample(String name) throws IOException {
        String input = _resource(name + ".input.hs");
        String expected = _resource(name + ".expected.hs");
        HaskellFormatter formatter = new HaskellFormatter();

        FormatterResult result = formatter.format(input, config);

        assertThat(result.getFormattedCode()).isEqualTo(expected);
        assertThat(formatter.format(expected, config).getFormattedCode()).isEqualTo(expected);
    }

    private static String _resource(String name) throws IOException {
        try (InputStream in = RuleEngineTest.class.getResourceAsStream("/format-examples/" + name)) {
            assertThat(in).as(name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
