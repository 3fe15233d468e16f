package com.hsformatter.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.hsformatter.api.error.Diagnostic;
import com.hsformatter.api.error.DiagnosticKind;
import com.hsformatter.api.error.EncodingException;

class SourceDecoderTest {

    @Test
    void decodesUtf8() {
        byte[] bytes = "f \u03bb = \u2218\n".getBytes(StandardCharsets.UTF_8);

        assertThat(SourceDecoder.decode(bytes)).isEqualTo("f \u03bb = \u2218\n");
    }

    @Test
    void dropsLeadingByteOrderMark() {
        byte[] bytes = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'x', '\n'};

        assertThat(SourceDecoder.decode(bytes)).isEqualTo("x\n");
    }

    @Test
    void malformedBytesReportTheirOffset() {
        byte[] bytes = {'a', 'b', (byte) 0xFF, 'c'};

        assertThatThrownBy(() -> SourceDecoder.decode(bytes))
                .isInstanceOf(EncodingException.class)
                .satisfies(e -> {
                    EncodingException encoding = (EncodingException) e;
                    assertThat(encoding.getByteOffset()).isEqualTo(2);
                    Diagnostic diagnostic = encoding.toDiagnostic();
                    assertThat(diagnostic.getKind()).isEqualTo(DiagnosticKind.ENCODING_ERROR);
                    assertThat(diagnostic.getLine()).isEqualTo(1);
                    assertThat(diagnostic.getColumn()).isEqualTo(3);
                });
    }

    @Test
    void malformedBytesOnALaterLineReportThatLine() {
        byte[] bytes = {'a', '\n', 'b', (byte) 0xCE, (byte) 0xBB, '\n', ' ', ' ', (byte) 0xC0, 'x'};

        assertThatThrownBy(() -> SourceDecoder.decode(bytes))
                .isInstanceOf(EncodingException.class)
                .satisfies(e -> {
                    EncodingException encoding = (EncodingException) e;
                    assertThat(encoding.getByteOffset()).isEqualTo(8);
                    assertThat(encoding.getLine()).isEqualTo(3);
                    assertThat(encoding.getColumn()).isEqualTo(3);
                });
    }

    @Test
    void unpairedSurrogateReportsItsLineAndColumn() {
        String text = "module M where\n\nx = \"\u00e9\ud835\"\n";

        assertThatThrownBy(() -> SourceDecoder.validate(text))
                .isInstanceOf(EncodingException.class)
                .hasMessageContaining("line 3, column 7")
                .satisfies(e -> {
                    Diagnostic diagnostic = ((EncodingException) e).toDiagnostic();
                    assertThat(diagnostic.getLine()).isEqualTo(3);
                    assertThat(diagnostic.getColumn()).isEqualTo(7);
                    assertThat(diagnostic.getStartOffset()).isEqualTo(23);
                });
    }

    @Test
    void truncatedSequenceIsRejected() {
        byte[] bytes = {'x', (byte) 0xCE};

        assertThatThrownBy(() -> SourceDecoder.decode(bytes)).isInstanceOf(EncodingException.class);
    }

    @Test
    void validateRejectsReplacementCharacter() {
        assertThatThrownBy(() -> SourceDecoder.validate("ab\ufffd"))
                .isInstanceOf(EncodingException.class)
                .hasMessageContaining("U+FFFD");
    }

    @Test
    void validateRejectsUnpairedSurrogates() {
        assertThatThrownBy(() -> SourceDecoder.validate("a\ud835"))
                .isInstanceOf(EncodingException.class);
        assertThatThrownBy(() -> SourceDecoder.validate("\udc65b"))
                .isInstanceOf(EncodingException.class);
    }

    @Test
    void validateAcceptsSurrogatePairs() {
        assertThatCode(() -> SourceDecoder.validate("x = \ud835\udc65\n")).doesNotThrowAnyException();
    }
}
