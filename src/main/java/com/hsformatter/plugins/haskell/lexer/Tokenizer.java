package com.hsformatter.plugins.haskell.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.hsformatter.util.SourceDecoder;

/**
 * Lossless Haskell lexer. Every character of the input ends up either in a
 * token's text or in the trivia preceding it, so concatenating trivia and
 * text of all tokens reproduces the input exactly. Never throws: malformed
 * strings and pragmas become {@link TokenKind#UNTERMINATED} tokens and an
 * unclosed block comment becomes an unterminated trivia piece.
 */
public final class Tokenizer {
    private static final int TAB_STOP = 8;
    private static final Pattern QUASI_QUOTES = Pattern.compile(
            "\\{-#\\s*LANGUAGE\\b[^#]*\\bQuasiQuotes\\b|-XQuasiQuotes\\b",
            Pattern.CASE_INSENSITIVE);

    private final String src;
    private final boolean quasiQuotes;
    private int pos = 0;
    private int byteOffset = 0;
    private int line = 1;
    private int column = 1;
    private int previousEndLine = 0;
    private boolean finished = false;

    Tokenizer(String text, boolean quasiQuotes) {
        this.src = text;
        this.quasiQuotes = quasiQuotes;
    }

    /**
     * Lexes {@code text}, enabling quasi-quote syntax when the source declares
     * the {@code QuasiQuotes} extension.
     */
    public static TokenStream tokenize(String text) {
        return new TokenStream(text, declaresQuasiQuotes(text));
    }

    public static TokenStream tokenize(String text, boolean quasiQuotes) {
        return new TokenStream(text, quasiQuotes);
    }

    public static boolean declaresQuasiQuotes(String text) {
        return QUASI_QUOTES.matcher(text).find();
    }

    boolean hasNext() {
        return !finished;
    }

    Token next() {
        boolean fileStart = previousEndLine == 0;
        List<TriviaPiece> pieces = _readTrivia();
        Trivia trivia = new Trivia(pieces, fileStart);
        boolean firstOnLine = fileStart || line > previousEndLine;

        int startOffset = pos;
        int startByte = byteOffset;
        int startLine = line;
        int startColumn = column;

        if (pos >= src.length()) {
            finished = true;
            return new Token(TokenKind.EOF, "", startByte, startByte, startLine, startColumn,
                    startLine, firstOnLine, trivia);
        }

        TokenKind kind = _scanToken();
        int end = _tokenEnd;
        String text = src.substring(startOffset, end);
        _advanceTo(end);
        previousEndLine = line;
        return new Token(kind, text, startByte, byteOffset, startLine, startColumn, line, firstOnLine, trivia);
    }

    // Trivia

    private List<TriviaPiece> _readTrivia() {
        List<TriviaPiece> pieces = new ArrayList<>();
        while (pos < src.length()) {
            char c = src.charAt(pos);
            int start = pos;
            int startByte = byteOffset;
            int startLine = line;
            int startColumn = column;
            if (c == '\n' || c == '\r') {
                int end = (c == '\r' && pos + 1 < src.length() && src.charAt(pos + 1) == '\n') ? pos + 2 : pos + 1;
                _advanceTo(end);
                pieces.add(new TriviaPiece(TriviaPiece.Kind.NEWLINE, src.substring(start, end),
                        startByte, byteOffset, startLine, startColumn, true));
            } else if (_isSpace(c)) {
                int end = pos;
                while (end < src.length() && _isSpace(src.charAt(end))) {
                    end++;
                }
                _advanceTo(end);
                pieces.add(new TriviaPiece(TriviaPiece.Kind.WHITESPACE, src.substring(start, end),
                        startByte, byteOffset, startLine, startColumn, true));
            } else if (_startsLineComment(pos)) {
                int end = pos;
                while (end < src.length() && src.charAt(end) != '\n' && src.charAt(end) != '\r') {
                    end++;
                }
                _advanceTo(end);
                pieces.add(new TriviaPiece(TriviaPiece.Kind.LINE_COMMENT, src.substring(start, end),
                        startByte, byteOffset, startLine, startColumn, true));
            } else if (src.startsWith("{-", pos) && !src.startsWith("{-#", pos)) {
                int end = _blockCommentEnd(pos);
                boolean terminated = end > 0;
                if (!terminated) {
                    end = src.length();
                }
                _advanceTo(end);
                pieces.add(new TriviaPiece(TriviaPiece.Kind.BLOCK_COMMENT, src.substring(start, end),
                        startByte, byteOffset, startLine, startColumn, terminated));
            } else {
                break;
            }
        }
        return pieces;
    }

    private static boolean _isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\f' || c == '\u000B' || c == '\uFEFF'
                || (c > 127 && Character.isSpaceChar(c));
    }

    private boolean _startsLineComment(int at) {
        if (!src.startsWith("--", at)) {
            return false;
        }
        int i = at;
        while (i < src.length() && src.charAt(i) == '-') {
            i++;
        }
        return i >= src.length() || !Keywords.isSymbolChar(src.codePointAt(i));
    }

    /**
     * Offset just past the matching {@code -}}, or -1 when the comment never closes.
     */
    private int _blockCommentEnd(int at) {
        int depth = 0;
        int i = at;
        while (i < src.length()) {
            if (src.startsWith("{-", i)) {
                depth++;
                i += 2;
            } else if (src.startsWith("-}", i)) {
                depth--;
                i += 2;
                if (depth == 0) {
                    return i;
                }
            } else {
                i++;
            }
        }
        return -1;
    }

    // Tokens

    private int _tokenEnd;

    private TokenKind _scanToken() {
        char c = src.charAt(pos);

        if (c == '#' && (column == 1 || pos == 0) && _isDirective(pos)) {
            _tokenEnd = _directiveEnd(pos);
            return TokenKind.CPP_DIRECTIVE;
        }
        if (src.startsWith("{-#", pos)) {
            int close = src.indexOf("#-}", pos + 3);
            if (close < 0) {
                _tokenEnd = src.length();
                return TokenKind.UNTERMINATED;
            }
            _tokenEnd = close + 3;
            return TokenKind.PRAGMA;
        }
        if (c == '"') {
            return _scanString();
        }
        if (c == '\'') {
            return _scanQuote();
        }
        int codePoint = src.codePointAt(pos);
        if (Keywords.isIdentifierStart(codePoint)) {
            return _scanIdentifier();
        }
        if (c >= '0' && c <= '9') {
            _tokenEnd = _numberEnd(pos);
            return TokenKind.LITERAL;
        }
        if (c == '[' && quasiQuotes) {
            int bodyStart = _quasiQuoteBodyStart(pos);
            if (bodyStart > 0) {
                int close = src.indexOf("|]", bodyStart);
                if (close < 0) {
                    _tokenEnd = src.length();
                    return TokenKind.UNTERMINATED;
                }
                _tokenEnd = close + 2;
                return TokenKind.QUASI_QUOTE;
            }
        }
        if ("()[]{},;`".indexOf(c) >= 0) {
            _tokenEnd = pos + 1;
            return TokenKind.PUNCTUATION;
        }
        if (Keywords.isSymbolChar(codePoint)) {
            int end = pos;
            while (end < src.length() && Keywords.isSymbolChar(src.codePointAt(end))) {
                end += Character.charCount(src.codePointAt(end));
            }
            _tokenEnd = end;
            return TokenKind.OPERATOR;
        }
        _tokenEnd = pos + Character.charCount(codePoint);
        return TokenKind.PUNCTUATION;
    }

    private boolean _isDirective(int at) {
        if (at == 0 && src.startsWith("#!", at)) {
            return true;
        }
        int i = at + 1;
        while (i < src.length() && (src.charAt(i) == ' ' || src.charAt(i) == '\t')) {
            i++;
        }
        return i < src.length() && Character.isLetter(src.charAt(i));
    }

    private int _directiveEnd(int at) {
        int i = at;
        while (true) {
            while (i < src.length() && src.charAt(i) != '\n' && src.charAt(i) != '\r') {
                i++;
            }
            if (i > at && i < src.length() && src.charAt(i - 1) == '\\') {
                i += (src.charAt(i) == '\r' && i + 1 < src.length() && src.charAt(i + 1) == '\n') ? 2 : 1;
                continue;
            }
            return i;
        }
    }

    private TokenKind _scanString() {
        int i = pos + 1;
        while (i < src.length()) {
            char ch = src.charAt(i);
            if (ch == '"') {
                _tokenEnd = i + 1;
                return TokenKind.LITERAL;
            }
            if (ch == '\n' || ch == '\r') {
                break;
            }
            if (ch == '\\' && i + 1 < src.length()) {
                char escaped = src.charAt(i + 1);
                if (Character.isWhitespace(escaped)) {
                    int gapEnd = i + 1;
                    while (gapEnd < src.length() && Character.isWhitespace(src.charAt(gapEnd))) {
                        gapEnd++;
                    }
                    if (gapEnd < src.length() && src.charAt(gapEnd) == '\\') {
                        i = gapEnd + 1;
                        continue;
                    }
                    break;
                }
                i += 2;
                continue;
            }
            i++;
        }
        _tokenEnd = i;
        return TokenKind.UNTERMINATED;
    }

    private TokenKind _scanQuote() {
        int next = pos + 1;
        if (next < src.length() && src.charAt(next) == '\\') {
            int i = next + 2;
            while (i < src.length() && src.charAt(i) != '\'' && src.charAt(i) != '\n'
                    && i - pos < 12) {
                i++;
            }
            if (i < src.length() && src.charAt(i) == '\'') {
                _tokenEnd = i + 1;
                return TokenKind.LITERAL;
            }
        } else if (next < src.length() && src.charAt(next) == '\'') {
            _tokenEnd = pos + 2;
            return TokenKind.PUNCTUATION;
        } else if (next < src.length() && src.charAt(next) != '\n') {
            int after = next + Character.charCount(src.codePointAt(next));
            if (after < src.length() && src.charAt(after) == '\'') {
                _tokenEnd = after + 1;
                return TokenKind.LITERAL;
            }
        }
        _tokenEnd = pos + 1;
        return TokenKind.PUNCTUATION;
    }

    private TokenKind _scanIdentifier() {
        int i = _identifierEnd(pos);
        boolean conid = Character.isUpperCase(src.codePointAt(pos)) || Character.isTitleCase(src.codePointAt(pos));
        TokenKind kind = TokenKind.IDENTIFIER;
        int segmentStart = pos;
        while (conid && i + 1 < src.length() && src.charAt(i) == '.') {
            int nextCodePoint = src.codePointAt(i + 1);
            if (Character.isUpperCase(nextCodePoint) || Character.isTitleCase(nextCodePoint)) {
                segmentStart = i + 1;
                i = _identifierEnd(i + 1);
            } else if (Keywords.isIdentifierStart(nextCodePoint)) {
                int end = _identifierEnd(i + 1);
                if (Keywords.isKeyword(src.substring(i + 1, end))) {
                    break;
                }
                i = end;
                conid = false;
            } else if (Keywords.isSymbolChar(nextCodePoint)) {
                int end = i + 1;
                while (end < src.length() && Keywords.isSymbolChar(src.codePointAt(end))) {
                    end += Character.charCount(src.codePointAt(end));
                }
                i = end;
                kind = TokenKind.OPERATOR;
                conid = false;
            } else {
                break;
            }
        }
        _tokenEnd = i;
        if (kind == TokenKind.IDENTIFIER && segmentStart == pos && Keywords.isKeyword(src.substring(pos, i))) {
            return TokenKind.KEYWORD;
        }
        return kind;
    }

    private int _identifierEnd(int from) {
        int i = from;
        while (i < src.length() && Keywords.isIdentifierPart(src.codePointAt(i))) {
            i += Character.charCount(src.codePointAt(i));
        }
        return i;
    }

    private int _numberEnd(int from) {
        int i = from;
        if (src.charAt(i) == '0' && i + 1 < src.length()) {
            char radix = Character.toLowerCase(src.charAt(i + 1));
            if (radix == 'x' || radix == 'o' || radix == 'b') {
                int j = i + 2;
                while (j < src.length() && (Character.digit(src.charAt(j), 16) >= 0 || src.charAt(j) == '_')) {
                    j++;
                }
                if (j > i + 2) {
                    return j;
                }
            }
        }
        i = _digitsEnd(i);
        if (i + 1 < src.length() && src.charAt(i) == '.' && Character.isDigit(src.charAt(i + 1))) {
            i = _digitsEnd(i + 1);
        }
        if (i < src.length() && (src.charAt(i) == 'e' || src.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < src.length() && (src.charAt(j) == '+' || src.charAt(j) == '-')) {
                j++;
            }
            if (j < src.length() && Character.isDigit(src.charAt(j))) {
                i = _digitsEnd(j);
            }
        }
        return i;
    }

    private int _digitsEnd(int from) {
        int i = from;
        while (i < src.length() && (Character.isDigit(src.charAt(i)) || src.charAt(i) == '_')) {
            i++;
        }
        return i;
    }

    /**
     * Offset just after {@code [quoter|}, or -1 when {@code at} does not start a quasi-quote.
     */
    private int _quasiQuoteBodyStart(int at) {
        int i = at + 1;
        if (i >= src.length() || !Keywords.isIdentifierStart(src.codePointAt(i))) {
            return -1;
        }
        while (i < src.length() && (Keywords.isIdentifierPart(src.codePointAt(i)) || src.charAt(i) == '.')) {
            i += Character.charCount(src.codePointAt(i));
        }
        if (i < src.length() && src.charAt(i) == '|' && src.charAt(i - 1) != '.') {
            return i + 1;
        }
        return -1;
    }

    private void _advanceTo(int end) {
        while (pos < end) {
            char c = src.charAt(pos);
            if (c == '\n') {
                line++;
                column = 1;
            } else if (c == '\r') {
                if (pos + 1 >= src.length() || src.charAt(pos + 1) != '\n') {
                    line++;
                    column = 1;
                }
            } else if (c == '\t') {
                column = ((column - 1) / TAB_STOP + 1) * TAB_STOP + 1;
            } else if (!Character.isLowSurrogate(c)) {
                column++;
            }
            byteOffset += SourceDecoder.utf8Length(c);
            pos++;
        }
    }
}
