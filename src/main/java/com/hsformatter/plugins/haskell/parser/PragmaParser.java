package com.hsformatter.plugins.haskell.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.hsformatter.plugins.haskell.cst.Pragma;
import com.hsformatter.plugins.haskell.cst.PragmaKind;
import com.hsformatter.plugins.haskell.lexer.Token;

/**
 * Reads the directive and arguments out of a pragma token's text.
 */
public final class PragmaParser {
    private static final Pattern EXTENSION_FLAG = Pattern.compile("(?:^|\\s)-X([A-Za-z0-9_]+)");
    private static final Pattern PHASE_CONTROL = Pattern.compile("~?\\[~?\\d*]");

    private PragmaParser() {
    }

    public static Pragma toPragma(Token token, int index) {
        String body = innerText(token.getText());
        String directive = _firstWord(body);
        String rest = body.substring(directive.length()).trim();
        PragmaKind kind = PragmaKind.forDirective(directive);
        List<String> extensions = new ArrayList<>();
        String target = null;
        switch (kind) {
            case LANGUAGE:
                for (String name : rest.split(",")) {
                    String trimmed = name.trim();
                    if (!trimmed.isEmpty()) {
                        extensions.add(trimmed);
                    }
                }
                break;
            case OPTIONS:
                Matcher matcher = EXTENSION_FLAG.matcher(rest);
                while (matcher.find()) {
                    extensions.add(matcher.group(1));
                }
                break;
            case INLINE:
                target = _inlineTarget(rest);
                break;
            default:
                break;
        }
        return new Pragma(index, kind, directive, extensions, target);
    }

    /**
     * The text between {@code {-#} and {@code #-}}, trimmed.
     */
    public static String innerText(String pragmaText) {
        String body = pragmaText;
        if (body.startsWith("{-#")) {
            body = body.substring(3);
        }
        if (body.endsWith("#-}")) {
            body = body.substring(0, body.length() - 3);
        }
        return body.trim();
    }

    public static String languagePragma(String extension) {
        return "{-# LANGUAGE " + extension + " #-}";
    }

    private static String _firstWord(String body) {
        int end = 0;
        while (end < body.length() && !Character.isWhitespace(body.charAt(end))) {
            end++;
        }
        return body.substring(0, end);
    }

    private static String _inlineTarget(String rest) {
        for (String word : rest.split("\\s+")) {
            if (word.isEmpty() || word.equals("CONLIKE") || PHASE_CONTROL.matcher(word).matches()) {
                continue;
            }
            String name = word;
            if (name.startsWith("(") && name.endsWith(")") && name.length() > 2) {
                name = name.substring(1, name.length() - 1);
            }
            int colon = name.indexOf("::");
            if (colon > 0) {
                name = name.substring(0, colon);
            }
            return name;
        }
        return null;
    }
}
