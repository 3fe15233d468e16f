package com.hsformatter.plugins.haskell;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import org.junit.jupiter.api.Test;

import com.hsformatter.api.FormatterResult;
import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.config.HaskellStyleConfig;

class IdempotenceHarnessTest {
    private final HaskellStyleConfig config = HaskellStyleConfig.defaults();

    @Test
    void formattedOutputIsAFixedPoint() {
        String source = "module Shop.Cart\n"
                + "  (Cart, emptyCart, addToCart, removeFromCart, cartTotal, cartItems, clearCart) where\n\n"
                + "import qualified Data.Map.Strict as Map\n"
                + "import Data.List (sortOn)\n"
                + "import Shop.Item\n\n"
                + "data Cart = Cart { cartLines :: !(Map.Map ItemId Int), cartOwner :: !Text } deriving Show\n";

        IdempotenceReport report = IdempotenceHarness.check(source, config);

        assertThat(report.isIdempotent()).isTrue();
        assertThat(report.getFirstDifferingLine()).isZero();
        assertThat(report.getSecondPass()).isEqualTo(report.getFirstPass());
        assertThat(report.getResidualDiagnostics()).isEmpty();
        assertThatCode(() -> IdempotenceHarness.assertIdempotent(source, config)).doesNotThrowAnyException();
    }

    @Test
    void rejectedInputCountsAsIdempotent() {
        IdempotenceReport report = IdempotenceHarness.check("f = (\n", config);

        assertThat(report.isIdempotent()).isTrue();
        assertThat(report.getFirstPass()).isNull();
    }

    @Test
    void compareFindsTheFirstDifferingLine() {
        FormatterResult first = FormatterResult.builder().successful(true).formattedCode("a\nb\nc\n").build();
        FormatterResult second = FormatterResult.builder().successful(true).formattedCode("a\nb\nd\n").build();

        IdempotenceReport report = IdempotenceHarness.compare(first, second);

        assertThat(report.isIdempotent()).isFalse();
        assertThat(report.getFirstDifferingLine()).isEqualTo(3);
        assertThat(report.toString()).contains("line 3");
    }

    @Test
    void residualMechanicalDiagnosticsBreakIdempotence() {
        FormatterResult first = FormatterResult.builder().successful(true).formattedCode("x = 1\n").build();
        FormatterResult second = FormatterResult.builder().successful(true).formattedCode("x = 1\n")
                .addDiagnostic(new Diagnostic(DiagnosticKind.INDENTATION, "Indentation differs", 1, 1))
                .addDiagnostic(new Diagnostic(DiagnosticKind.LONG_LINE, "Line too long", 1, 81))
                .build();

        IdempotenceReport report = IdempotenceHarness.compare(first, second);

        assertThat(report.isIdempotent()).isFalse();
        assertThat(report.getFirstDifferingLine()).isZero();
        assertThat(report.getResidualDiagnostics()).extracting(Diagnostic::getKind)
                .containsExactly(DiagnosticKind.INDENTATION);
    }

    @Test
    void differingLineOfPrefixedTexts() {
        assertThat(IdempotenceHarness.firstDifferingLine("same\n", "same\n")).isZero();
        assertThat(IdempotenceHarness.firstDifferingLine("one\ntwo\n", "one\ntwo\nthree\n")).isEqualTo(3);
        assertThat(IdempotenceHarness.firstDifferingLine("x", "y")).isEqualTo(1);
    }
}
