package com.hsformatter.plugins.haskell.lexer;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazily lexed tokens of one source text. Every call to {@link #iterator()}
 * starts a fresh lexer at offset 0, so the stream can be walked any number
 * of times and by several threads at once.
 */
public final class TokenStream implements Iterable<Token> {
    private final String source;
    private final boolean quasiQuotes;

    TokenStream(String source, boolean quasiQuotes) {
        this.source = source;
        this.quasiQuotes = quasiQuotes;
    }

    public String getSource() {
        return source;
    }

    public boolean isQuasiQuotes() {
        return quasiQuotes;
    }

    @Override
    public Iterator<Token> iterator() {
        Tokenizer tokenizer = new Tokenizer(source, quasiQuotes);
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return tokenizer.hasNext();
            }

            @Override
            public Token next() {
                if (!tokenizer.hasNext()) {
                    throw new NoSuchElementException();
                }
                return tokenizer.next();
            }
        };
    }

    /**
     * All tokens, ending with the {@link TokenKind#EOF} token.
     */
    public List<Token> toList() {
        List<Token> tokens = new ArrayList<>();
        for (Token token : this) {
            tokens.add(token);
        }
        return tokens;
    }

    /**
     * Concatenation of every token's trivia and text; equal to the source.
     */
    public String reconstruct() {
        StringBuilder sb = new StringBuilder(source.length());
        for (Token token : this) {
            sb.append(token.getTrivia().getText()).append(token.getText());
        }
        return sb.toString();
    }
}
