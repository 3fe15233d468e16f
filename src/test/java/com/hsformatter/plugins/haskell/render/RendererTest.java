package com.hsformatter.plugins.haskell.render;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;

import org.junit.jupiter.api.Test;

import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.config.HaskellStyleConfig;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.lexer.Tokenizer;
import com.hsformatter.plugins.haskell.parser.StructuralReader;
import com.hsformatter.plugins.haskell.rules.RuleEngine;

class RendererTest {
    private final HaskellStyleConfig config = HaskellStyleConfig.defaults();

    private static RenderResult _render(String source, HaskellStyleConfig config) {
        Module module = StructuralReader.parse(Tokenizer.tokenize(source));
        return Renderer.render(RuleEngine.standard().apply(module, config), config);
    }

    @Test
    void emptyInputStaysEmpty() {
        assertThat(_render("", config).getText()).isEmpty();
    }

    @Test
    void endsWithExactlyOneLineBreak() {
        assertThat(_render("x = 1\n\n\n", config).getText()).isEqualTo("x = 1\n");
        assertThat(_render("x = 1", config).getText()).isEqualTo("x = 1\n");
    }

    @Test
    void keepsWindowsLineEndings() {
        String source = "module M (x) where\r\n\r\nx = 1\r\n";

        assertThat(_render(source, config).getText()).isEqualTo(source);
    }

    @Test
    void stripsTrailingWhitespace() {
        RenderResult result = _render("x = 1   \ny = 2\n", config);

        assertThat(result.getText()).isEqualTo("x = 1\ny = 2\n");
        assertThat(result.getDiagnostics()).extracting(Diagnostic::getKind)
                .contains(DiagnosticKind.TRAILING_WHITESPACE);
    }

    @Test
    void cppFileIsOnlyStrippedOfTrailingBlanks() {
        String source = "module M where\n#if 1\nx    =   1   \n#endif\n";

        RenderResult result = _render(source, config);

        assertThat(result.getText()).isEqualTo("module M where\n#if 1\nx    =   1\n#endif\n");
    }

    @Test
    void unchangedUnitsAreRecorded() {
        RenderResult result = _render("module M (x) where\n\nx :: Int\nx = 1\n", config);

        assertThat(result.getUnits()).hasSize(3);
        assertThat(result.getUnits()).noneMatch(RenderedUnit::isChanged);
        assertThat(result.getRefactorings()).isEmpty();
    }

    @Test
    void longLinesAreMeasuredOnTheOutput() {
        String source = "message = \"" + "a".repeat(90) + "\"\n";

        RenderResult result = _render(source, config);

        assertThat(result.getDiagnostics()).filteredOn(d -> d.getKind() == DiagnosticKind.LONG_LINE)
                .singleElement()
                .satisfies(d -> assertThat(d.getColumn()).isEqualTo(81));
    }

    @Test
    void disabledChecksAreNotReported() {
        String source = "message = \"" + "a".repeat(90) + "\"\n";
        HaskellStyleConfig onlySignatures = config.toBuilder()
                .enabledLintChecks(Set.of(DiagnosticKind.MISSING_SIGNATURE))
                .build();

        RenderResult result = _render(source, onlySignatures);

        assertThat(result.getDiagnostics()).extracting(Diagnostic::getKind)
                .doesNotContain(DiagnosticKind.LONG_LINE, DiagnosticKind.MISSING_EXPORT_LIST);
    }

    @Test
    void endOfLineCommentsKeepTheirSpacingOnMovedLines() {
        String formatted = _render("main = do\n    a   -- first\n    b\n", config).getText();

        assertThat(formatted).isEqualTo("main = do\n  a   -- first\n  b\n");
    }

    @Test
    void commentsAtTheEndOfTheFileAreKept() {
        String formatted = _render("x = 1\n\n-- the end\n", config).getText();

        assertThat(formatted).isEqualTo("x = 1\n\n-- the end\n");
    }
}
