package com.hsformatter.plugins.haskell.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Whitespace and comments preceding a token.
 *
 * <p>Comments before the first line break belong to the line of the previous
 * token ("trailing" comments). Comments after it lead the owning token. At the
 * very start of the file there is no previous line, so every comment leads.
 */
public final class Trivia {
    private static final Trivia EMPTY_CONTINUATION = new Trivia(Collections.emptyList(), false);

    private final List<TriviaPiece> pieces;
    private final boolean fileStart;

    public Trivia(List<TriviaPiece> pieces, boolean fileStart) {
        this.pieces = List.copyOf(pieces);
        this.fileStart = fileStart;
    }

    public static Trivia empty() {
        return EMPTY_CONTINUATION;
    }

    public List<TriviaPiece> getPieces() {
        return pieces;
    }

    public boolean isFileStart() {
        return fileStart;
    }

    public boolean isEmpty() {
        return pieces.isEmpty();
    }

    public String getText() {
        StringBuilder sb = new StringBuilder();
        for (TriviaPiece piece : pieces) {
            sb.append(piece.getText());
        }
        return sb.toString();
    }

    public boolean containsNewline() {
        for (TriviaPiece piece : pieces) {
            if (piece.isNewline()) {
                return true;
            }
        }
        return false;
    }

    public boolean hasComments() {
        for (TriviaPiece piece : pieces) {
            if (piece.isComment()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whitespace only, on a single line.
     */
    public boolean isPlainSpace() {
        for (TriviaPiece piece : pieces) {
            if (piece.getKind() != TriviaPiece.Kind.WHITESPACE) {
                return false;
            }
        }
        return true;
    }

    public List<TriviaPiece> getComments() {
        List<TriviaPiece> comments = new ArrayList<>();
        for (TriviaPiece piece : pieces) {
            if (piece.isComment()) {
                comments.add(piece);
            }
        }
        return comments;
    }

    private int _firstNewlineIndex() {
        if (fileStart) {
            return -1;
        }
        for (int i = 0; i < pieces.size(); i++) {
            if (pieces.get(i).isNewline()) {
                return i;
            }
        }
        return pieces.size();
    }

    /**
     * Comments on the previous token's line.
     */
    public List<TriviaPiece> getTrailingComments() {
        List<TriviaPiece> comments = new ArrayList<>();
        int limit = _firstNewlineIndex();
        for (int i = 0; i < limit; i++) {
            if (pieces.get(i).isComment()) {
                comments.add(pieces.get(i));
            }
        }
        return comments;
    }

    /**
     * Comments after the first line break, in source order. When the trivia
     * holds no line break at all this is empty: those comments sit between
     * two tokens of one line.
     */
    public List<TriviaPiece> getLeadingComments() {
        List<TriviaPiece> comments = new ArrayList<>();
        int start = _firstNewlineIndex();
        if (start >= pieces.size()) {
            return comments;
        }
        for (int i = start + 1; i < pieces.size(); i++) {
            if (pieces.get(i).isComment()) {
                comments.add(pieces.get(i));
            }
        }
        return comments;
    }

    /**
     * Pieces after the first line break (all pieces at the start of the file).
     */
    public List<TriviaPiece> getLeadingPieces() {
        int start = _firstNewlineIndex();
        if (start >= pieces.size()) {
            return Collections.emptyList();
        }
        return pieces.subList(start + 1, pieces.size());
    }

    /**
     * Number of lines in this trivia holding nothing but whitespace.
     */
    public int getBlankLineCount() {
        int blank = 0;
        boolean lineHasContent = !fileStart;
        for (TriviaPiece piece : pieces) {
            if (piece.isNewline()) {
                if (!lineHasContent) {
                    blank++;
                }
                lineHasContent = false;
            } else if (piece.isComment()) {
                lineHasContent = true;
            }
        }
        return blank;
    }

    /**
     * Blank lines before the first leading comment, or before the token when
     * there is none.
     */
    public int getBlankLinesBeforeFirstEntry() {
        int blank = 0;
        boolean lineHasContent = !fileStart;
        for (TriviaPiece piece : pieces) {
            if (piece.isNewline()) {
                if (!lineHasContent) {
                    blank++;
                }
                lineHasContent = false;
            } else if (piece.isComment()) {
                if (lineHasContent) {
                    continue;
                }
                return blank;
            }
        }
        return blank;
    }

    public boolean hasUnterminatedComment() {
        for (TriviaPiece piece : pieces) {
            if (!piece.isTerminated()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whitespace at the end of a line: offsets of every whitespace piece
     * directly followed by a line break or by the end of the trivia when it
     * is the last trivia of the file.
     */
    public List<TriviaPiece> getTrailingWhitespace(boolean endOfFile) {
        List<TriviaPiece> result = new ArrayList<>();
        for (int i = 0; i < pieces.size(); i++) {
            TriviaPiece piece = pieces.get(i);
            if (piece.getKind() != TriviaPiece.Kind.WHITESPACE) {
                continue;
            }
            boolean atLineEnd = i + 1 < pieces.size()
                    ? pieces.get(i + 1).isNewline()
                    : endOfFile;
            if (atLineEnd) {
                result.add(piece);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return pieces.toString();
    }
}
