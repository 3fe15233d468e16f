package com.hsformatter.plugins.haskell.render;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class OutputBufferTest {

    @Test
    void newlineStripsTrailingBlanks() {
        OutputBuffer out = new OutputBuffer("\n");

        out.append("x = 1").spaces(3).newline().append("y");

        assertThat(out.toString()).isEqualTo("x = 1\ny");
    }

    @Test
    void indentToPadsOnlyForward() {
        OutputBuffer out = new OutputBuffer("\r\n");

        out.indentTo(5).append("a").indentTo(2).append("b").newline();

        assertThat(out.toString()).isEqualTo("    ab\r\n");
        assertThat(out.isAtLineStart()).isTrue();
    }

    @Test
    void columnsCountCodePoints() {
        OutputBuffer out = new OutputBuffer("\n");

        out.append("\u03bb\ud835\udc65 ");

        assertThat(out.getColumn()).isEqualTo(4);
    }

    @Test
    void relaidFlagResetsPerLine() {
        OutputBuffer out = new OutputBuffer("\n");

        out.markRelaid();
        assertThat(out.isLineRelaid()).isTrue();
        out.newline();
        assertThat(out.isLineRelaid()).isFalse();
    }
}
