package com.hsformatter.plugins.haskell.render;

import java.util.ArrayList;
import java.util.List;

import com.hsformatter.plugins.haskell.lexer.Trivia;
import com.hsformatter.plugins.haskell.lexer.TriviaPiece;

/**
 * Prints the comment and blank lines of a trivia.
 */
public final class TriviaLines {
    /** Keep blank lines as written. */
    public static final int KEEP_BLANKS = -1;

    private TriviaLines() {
    }

    /**
     * Prints the part of a trivia after its first line break: one output line
     * per source line, comments shifted by {@code delta} columns (never left
     * of column 1). The indentation before the owning token is not printed;
     * a comment sharing the token's line is printed and the buffer is left
     * after it.
     *
     * @param blankLines number of blank lines to print before the first
     *                   comment instead of the source's, or {@link #KEEP_BLANKS}
     * @param innerBlanks whether blank lines after the first comment are kept
     */
    public static void emitLeading(OutputBuffer out, List<TriviaPiece> pieces, int delta, int blankLines,
                                   boolean innerBlanks) {
        List<List<TriviaPiece>> lines = _splitLines(pieces);
        boolean seenComment = false;
        int blanksBeforeComment = 0;
        for (int l = 0; l < lines.size(); l++) {
            List<TriviaPiece> line = lines.get(l);
            boolean terminated = l < lines.size() - 1;
            boolean hasComment = line.stream().anyMatch(TriviaPiece::isComment);
            if (!hasComment) {
                if (!terminated) {
                    break;
                }
                if (!seenComment) {
                    blanksBeforeComment++;
                    if (blankLines == KEEP_BLANKS) {
                        out.newline();
                    }
                } else if (innerBlanks) {
                    out.newline();
                }
                continue;
            }
            if (!seenComment && blankLines != KEEP_BLANKS) {
                for (int i = 0; i < blankLines; i++) {
                    out.newline();
                }
            }
            seenComment = true;
            _emitCommentLine(out, line, delta, terminated);
            if (terminated) {
                out.newline();
            }
        }
        if (!seenComment && blankLines != KEEP_BLANKS) {
            for (int i = 0; i < blankLines; i++) {
                out.newline();
            }
        }
    }

    /**
     * Prints the comments before the first line break of a trivia, the ones
     * that end the previous token's line. On a re-laid-out line they get
     * exactly two spaces, or one right after an opening bracket, as in the
     * section heading {@code ( -- * Types}; otherwise the source spacing is
     * kept.
     */
    public static void emitTrailing(OutputBuffer out, Trivia trivia) {
        List<TriviaPiece> pieces = trivia.getPieces();
        int end = 0;
        while (end < pieces.size() && !pieces.get(end).isNewline()) {
            end++;
        }
        if (out.isLineRelaid()) {
            boolean first = true;
            for (int i = 0; i < end; i++) {
                TriviaPiece piece = pieces.get(i);
                if (piece.isComment()) {
                    out.spaces(first && !out.endsWithOpenBracket() ? 2 : 1).append(piece.getText());
                    first = false;
                }
            }
            return;
        }
        for (int i = 0; i < end; i++) {
            out.append(pieces.get(i).getText());
        }
    }

    /**
     * Pieces after the first line break, or every piece at the start of the
     * file.
     */
    public static List<TriviaPiece> leadingPieces(Trivia trivia) {
        return trivia.getLeadingPieces();
    }

    /**
     * True when the trivia ends with a comment on the same line as the token
     * that owns it.
     */
    public static boolean hasCommentBeforeToken(Trivia trivia) {
        List<TriviaPiece> pieces = trivia.getPieces();
        for (int i = pieces.size() - 1; i >= 0; i--) {
            TriviaPiece piece = pieces.get(i);
            if (piece.isNewline()) {
                return false;
            }
            if (piece.isComment()) {
                return true;
            }
        }
        return false;
    }

    private static void _emitCommentLine(OutputBuffer out, List<TriviaPiece> line, int delta, boolean terminated) {
        int firstComment = 0;
        while (!line.get(firstComment).isComment()) {
            firstComment++;
        }
        out.indentTo(Math.max(1, line.get(firstComment).getColumn() + delta));
        for (int i = firstComment; i < line.size(); i++) {
            TriviaPiece piece = line.get(i);
            if (piece.isNewline()) {
                break;
            }
            out.append(piece.getText());
        }
    }

    /**
     * Splits pieces at line breaks. Each terminated line keeps its newline as
     * last element; the final, unterminated line may be empty.
     */
    private static List<List<TriviaPiece>> _splitLines(List<TriviaPiece> pieces) {
        List<List<TriviaPiece>> lines = new ArrayList<>();
        List<TriviaPiece> current = new ArrayList<>();
        for (TriviaPiece piece : pieces) {
            current.add(piece);
            if (piece.isNewline()) {
                lines.add(current);
                current = new ArrayList<>();
            }
        }
        lines.add(current);
        return lines;
    }
}
