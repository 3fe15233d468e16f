package com.hsformatter.util;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;

import com.hsformatter.api.error.EncodingException;

/**
 * Strict UTF-8 handling for source input, and the UTF-8 byte offsets that
 * diagnostics are located with.
 */
public final class SourceDecoder {
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private SourceDecoder() {
    }

    /**
     * Decodes bytes as UTF-8, rejecting malformed or unmappable sequences.
     * A leading byte order mark is dropped.
     */
    public static String decode(byte[] bytes) {
        CharsetDecoder decoder = _strictDecoder();
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        try {
            CharBuffer chars = decoder.decode(buffer);
            String text = chars.toString();
            if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
                return text.substring(1);
            }
            return text;
        } catch (MalformedInputException e) {
            int offset = _findMalformedOffset(bytes);
            String prefix = _validPrefix(bytes, offset);
            throw new EncodingException("Malformed UTF-8 input at byte " + offset, _line(prefix, prefix.length()),
                    _column(prefix, prefix.length()), offset, e);
        } catch (CharacterCodingException e) {
            throw new EncodingException("Input is not valid UTF-8: " + e.getMessage(), 1, 1, 0, e);
        }
    }

    /**
     * Rejects text that carries the marks of a lossy decode: replacement
     * characters or unpaired surrogates.
     */
    public static void validate(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\uFFFD') {
                throw _invalidAt(text, i, "Input contains U+FFFD replacement character");
            }
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= text.length() || !Character.isLowSurrogate(text.charAt(i + 1))) {
                    throw _invalidAt(text, i, "Unpaired surrogate");
                }
                i++;
            } else if (Character.isLowSurrogate(c)) {
                throw _invalidAt(text, i, "Unpaired surrogate");
            }
        }
    }

    /**
     * UTF-8 byte offset of the character at {@code charIndex}.
     */
    public static int byteOffset(CharSequence text, int charIndex) {
        return utf8Length(text, 0, charIndex);
    }

    /**
     * Number of bytes {@code from .. to} (exclusive) takes in UTF-8. Each half
     * of a surrogate pair counts two.
     */
    public static int utf8Length(CharSequence text, int from, int to) {
        int length = 0;
        for (int i = from; i < to; i++) {
            length += utf8Length(text.charAt(i));
        }
        return length;
    }

    public static int utf8Length(char c) {
        if (c < 0x80) {
            return 1;
        }
        if (c < 0x800 || Character.isSurrogate(c)) {
            return 2;
        }
        return 3;
    }

    private static EncodingException _invalidAt(String text, int charIndex, String problem) {
        int line = _line(text, charIndex);
        int column = _column(text, charIndex);
        return new EncodingException(problem + " at line " + line + ", column " + column, line, column,
                byteOffset(text, charIndex));
    }

    /**
     * 1-based line of the character at {@code end}; CRLF, CR and LF each end
     * a line.
     */
    private static int _line(CharSequence text, int end) {
        int line = 1;
        for (int i = 0; i < end; i++) {
            char c = text.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'))) {
                line++;
            }
        }
        return line;
    }

    /**
     * 1-based column, in code points, of the character at {@code end}.
     */
    private static int _column(CharSequence text, int end) {
        int column = 1;
        for (int i = 0; i < end; i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                column = 1;
            } else if (c != BYTE_ORDER_MARK && !Character.isLowSurrogate(c)) {
                column++;
            }
        }
        return column;
    }

    private static String _validPrefix(byte[] bytes, int length) {
        return new String(bytes, 0, length, StandardCharsets.UTF_8);
    }

    private static int _findMalformedOffset(byte[] bytes) {
        CharsetDecoder decoder = _strictDecoder();
        ByteBuffer in = ByteBuffer.wrap(bytes);
        CharBuffer out = CharBuffer.allocate(Math.max(16, bytes.length));
        decoder.decode(in, out, true);
        return in.position();
    }

    private static CharsetDecoder _strictDecoder() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }
}
