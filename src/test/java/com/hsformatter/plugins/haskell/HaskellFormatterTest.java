package com.hsformatter.plugins.haskell;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.hsformatter.api.FormatterResult;
import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.config.FormatterConfig;
import com.hsformatter.config.HaskellStyleConfig;

class HaskellFormatterTest {
    private static final String LONG_HEADER =
            "module Inventory.Stock (addStock, removeStock, transferStock, stockLevel, reorderPoint) where\n";

    private final HaskellFormatter formatter = new HaskellFormatter();
    private final HaskellStyleConfig config = HaskellStyleConfig.defaults();

    @Test
    void shortSumTypeIsLeftAlone() {
        String source = "module Traffic (TrafficLight (..)) where\n\n"
                + "data TrafficLight = Red | Yellow | Green deriving (Eq, Ord)\n";

        FormatterResult result = formatter.format(source, config);

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getFormattedCode()).isEqualTo(source);
        assertThat(result.getMechanicalDiagnostics()).isEmpty();
        assertThat(result.getAppliedRefactorings()).isEmpty();
    }

    @Test
    void longExportListGoesOnePerLine() {
        FormatterResult result = formatter.format(LONG_HEADER, config);

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getFormattedCode()).isEqualTo("module Inventory.Stock\n"
                + "  ( addStock\n"
                + "  , removeStock\n"
                + "  , transferStock\n"
                + "  , stockLevel\n"
                + "  , reorderPoint\n"
                + "  ) where\n");
        assertThat(result.getDiagnostics(DiagnosticKind.EXPORT_LIST_LAYOUT)).hasSize(1);
        assertThat(result.getAppliedRefactorings()).isNotEmpty();
    }

    @Test
    void exportSectionHeadingsKeepTheirSpacing() {
        String source = "module Geometry\n"
                + "  ( -- * Types\n"
                + "    Shape (..)\n"
                + "    -- * Measures\n"
                + "  , area\n"
                + "  ) where\n";

        FormatterResult result = formatter.format(source, config);

        assertThat(result.getFormattedCode()).isEqualTo(source);
        assertThat(result.getDiagnostics(DiagnosticKind.EXPORT_LIST_LAYOUT)).isEmpty();
    }

    @Test
    void sectionHeadingAfterTheOpeningBracketGetsOneSpace() {
        String formatted = formatter.format("module Geometry\n"
                + "  (    -- * Types\n"
                + "    Shape (..)\n"
                + "  , area\n"
                + "  ) where\n", config).getFormattedCode();

        assertThat(formatted).startsWith("module Geometry\n  ( -- * Types\n    Shape (..)\n");
    }

    @Test
    void importsAreSortedWithinTheirGroup() {
        String source = "module App.Main (main) where\n\n"
                + "import Data.Text\n"
                + "import Control.Exception\n";

        FormatterResult result = formatter.format(source, config);

        assertThat(result.getFormattedCode()).isEqualTo("module App.Main (main) where\n\n"
                + "import Control.Exception\n"
                + "import Data.Text\n");
        assertThat(result.getDiagnostics(DiagnosticKind.IMPORT_ORDERING)).hasSize(1);
    }

    @Test
    void lazyFieldIsOnlyReported() {
        String source = "module M (Foo (..)) where\n\n"
                + "data Foo = Foo { fooBar :: Bar }\n";

        FormatterResult result = formatter.format(source, config);

        assertThat(result.getFormattedCode()).isEqualTo(source);
        assertThat(result.getMechanicalDiagnostics()).isEmpty();
        List<Diagnostic> strictness = result.getDiagnostics(DiagnosticKind.MISSING_STRICTNESS_ANNOTATION);
        assertThat(strictness).hasSize(1);
        assertThat(strictness.get(0).getLine()).isEqualTo(3);
        assertThat(strictness.get(0).getColumn()).isEqualTo(18);
        assertThat(strictness.get(0).getSuggestion()).isEqualTo("fooBar :: !Bar");
    }

    @Test
    void formattingTwiceChangesNothing() {
        String once = formatter.format(LONG_HEADER, config).getFormattedCode();

        FormatterResult twice = formatter.format(once, config);

        assertThat(twice.getFormattedCode()).isEqualTo(once);
        assertThat(twice.getMechanicalDiagnostics()).isEmpty();
        assertThat(formatter.checkIdempotent(LONG_HEADER, config)).isTrue();
    }

    @Test
    void languagePragmasAreSplitSortedAndAligned() {
        String source = "{-# LANGUAGE RankNTypes, GADTs #-}\nmodule M where\n";

        FormatterResult result = formatter.format(source, config);

        assertThat(result.getFormattedCode()).isEqualTo("{-# LANGUAGE GADTs      #-}\n"
                + "{-# LANGUAGE RankNTypes #-}\n"
                + "module M where\n");
        assertThat(result.getDiagnostics(DiagnosticKind.PRAGMA_PLACEMENT)).hasSize(1);
    }

    @Test
    void inlinePragmaFollowsItsDefinition() {
        String source = "module M (f) where\n\n"
                + "{-# INLINE f #-}\n"
                + "f :: Int\n"
                + "f = 1\n";

        FormatterResult result = formatter.format(source, config);

        assertThat(result.getFormattedCode()).isEqualTo("module M (f) where\n\n"
                + "f :: Int\n"
                + "f = 1\n"
                + "{-# INLINE f #-}\n");
        assertThat(result.getDiagnostics(DiagnosticKind.PRAGMA_PLACEMENT)).isNotEmpty();
    }

    @Test
    void commentsSurviveFormatting() {
        String source = "module M (f) where\n\n"
                + "-- | Adds one.\n"
                + "f :: Int -> Int\n"
                + "f x = x + 1 -- simple\n";

        String formatted = formatter.format(source, config).getFormattedCode();

        assertThat(formatted).contains("-- | Adds one.", "-- simple");
    }

    @Test
    void unparsableInputIsRejected() {
        FormatterResult result = formatter.format("f = (1 + 2\n", config);

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isNull();
        assertThat(result.hasErrors()).isTrue();
        assertThat(result.getDiagnostics(DiagnosticKind.PARSE_ERROR)).hasSize(1);
    }

    @Test
    void lintReportsAdvisoriesOnly() {
        String source = "module M where\n\nf x = g x\n";

        List<Diagnostic> diagnostics = formatter.lint(source, config);

        assertThat(diagnostics).extracting(Diagnostic::getKind)
                .contains(DiagnosticKind.MISSING_EXPORT_LIST, DiagnosticKind.MISSING_SIGNATURE)
                .allMatch(kind -> !kind.isMechanical());
    }

    @Test
    void lintOfUnparsableInputIsAParseError() {
        List<Diagnostic> diagnostics = formatter.lint("x = [1, 2\n", config);

        assertThat(diagnostics).extracting(Diagnostic::getKind).containsExactly(DiagnosticKind.PARSE_ERROR);
    }

    @Test
    void initializeReadsPluginSettings() {
        FormatterConfig formatterConfig = new FormatterConfig(Map.of("indentWidth", 4),
                Map.of(HaskellStyleConfig.PLUGIN_NAME, Map.of("alignRecordFields", false)));

        formatter.initialize(formatterConfig);

        assertThat(formatter.getStyleConfig().getIndentWidth()).isEqualTo(4);
        assertThat(formatter.getStyleConfig().isAlignRecordFields()).isFalse();
        FormatterResult result = formatter.format(Path.of("src/Long.hs"), LONG_HEADER);
        assertThat(result.getFormattedCode()).contains("\n    ( addStock\n");
    }
}
