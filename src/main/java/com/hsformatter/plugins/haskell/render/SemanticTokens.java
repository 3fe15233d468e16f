package com.hsformatter.plugins.haskell.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.hsformatter.plugins.haskell.lexer.Token;
import com.hsformatter.plugins.haskell.lexer.TokenKind;
import com.hsformatter.plugins.haskell.parser.PragmaParser;

/**
 * The token content a formatted file must share with its input. Layout,
 * comments and order are ignored; {@code LANGUAGE} pragmas count once per
 * extension, other pragmas by their whitespace-normalized text, and a bare
 * deriving class counts as if it were parenthesized.
 */
public final class SemanticTokens {
    private static final String LANGUAGE_ENTRY = "LANGUAGE:";

    private SemanticTokens() {
    }

    /**
     * Count of every canonical token text in {@code tokens}.
     */
    public static Map<String, Integer> of(List<Token> tokens) {
        List<String> texts = new ArrayList<>();
        for (Token token : tokens) {
            if (token.isEof()) {
                break;
            }
            if (token.getKind() == TokenKind.PRAGMA) {
                texts.addAll(_pragmaEntries(token.getText()));
            } else {
                texts.add(token.getText());
            }
        }
        Map<String, Integer> counts = new TreeMap<>();
        for (String text : canonicalTexts(texts)) {
            counts.merge(text, 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Wraps the class of {@code deriving C} (with or without a strategy) in
     * parentheses so it compares equal to {@code deriving (C)}.
     */
    public static List<String> canonicalTexts(List<String> texts) {
        List<String> result = new ArrayList<>(texts.size() + 4);
        int i = 0;
        while (i < texts.size()) {
            String text = texts.get(i);
            result.add(text);
            i++;
            if (!text.equals("deriving")) {
                continue;
            }
            if (i < texts.size() && _isStrategy(texts.get(i))) {
                result.add(texts.get(i));
                i++;
            }
            if (i < texts.size() && !texts.get(i).equals("(") && !texts.get(i).equals("instance")) {
                result.add("(");
                result.add(texts.get(i));
                result.add(")");
                i++;
            }
        }
        return result;
    }

    private static boolean _isStrategy(String text) {
        return text.equals("stock") || text.equals("newtype") || text.equals("anyclass");
    }

    private static List<String> _pragmaEntries(String text) {
        String body = PragmaParser.innerText(text);
        String[] words = body.split("\\s+", 2);
        if (words[0].equalsIgnoreCase("LANGUAGE") && words.length > 1) {
            List<String> entries = new ArrayList<>();
            for (String extension : words[1].split(",")) {
                String trimmed = extension.trim();
                if (!trimmed.isEmpty()) {
                    entries.add(LANGUAGE_ENTRY + trimmed);
                }
            }
            if (!entries.isEmpty()) {
                return entries;
            }
        }
        return List.of("{-# " + String.join(" ", body.split("\\s+")) + " #-}");
    }
}
