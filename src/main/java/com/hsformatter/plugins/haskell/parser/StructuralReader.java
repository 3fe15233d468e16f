package com.hsformatter.plugins.haskell.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import com.hsformatter.api.error.ParseException;
import com.hsformatter.plugins.haskell.cst.Declaration;
import com.hsformatter.plugins.haskell.cst.ExportItem;
import com.hsformatter.plugins.haskell.cst.ExportList;
import com.hsformatter.plugins.haskell.cst.ImportDecl;
import com.hsformatter.plugins.haskell.cst.ImportGroup;
import com.hsformatter.plugins.haskell.cst.ImportItem;
import com.hsformatter.plugins.haskell.cst.ImportList;
import com.hsformatter.plugins.haskell.cst.Module;
import com.hsformatter.plugins.haskell.cst.ModuleHeader;
import com.hsformatter.plugins.haskell.cst.Pragma;
import com.hsformatter.plugins.haskell.cst.PragmaKind;
import com.hsformatter.plugins.haskell.lexer.Token;
import com.hsformatter.plugins.haskell.lexer.TokenKind;
import com.hsformatter.plugins.haskell.lexer.TokenStream;
import com.hsformatter.plugins.haskell.lexer.TriviaPiece;
import com.hsformatter.util.LoggerUtil;

/**
 * Builds the {@link Module} tree from a token stream: header pragmas, module
 * header, import groups and top-level declarations. Layout is resolved by
 * {@link LayoutResolver}; declarations are classified by
 * {@link DeclarationReader}.
 *
 * <p>Constructs the reader does not understand are kept as opaque
 * declarations. Only unterminated tokens and unbalanced brackets are errors.
 */
public final class StructuralReader {
    private static final Logger logger = LoggerUtil.getLogger(StructuralReader.class);

    private final TokenStream stream;
    private final List<Token> tokens;
    private final int[] matchingBracket;
    private boolean hasCpp;

    private StructuralReader(TokenStream stream) {
        this.stream = stream;
        this.tokens = stream.toList();
        this.matchingBracket = new int[tokens.size()];
        Arrays.fill(matchingBracket, -1);
    }

    public static Module parse(TokenStream stream) throws ParseException {
        return new StructuralReader(stream)._read();
    }

    private Module _read() throws ParseException {
        _checkTokens();
        _matchBrackets();

        Set<String> extensions = new LinkedHashSet<>();
        List<Pragma> headerPragmas = new ArrayList<>();
        int index = 0;
        while (tokens.get(index).getKind() == TokenKind.PRAGMA) {
            Pragma pragma = PragmaParser.toPragma(tokens.get(index), index);
            if (pragma.getPragmaKind() == PragmaKind.INLINE) {
                break;
            }
            headerPragmas.add(pragma);
            if (pragma.getPragmaKind() == PragmaKind.LANGUAGE || pragma.getPragmaKind() == PragmaKind.OPTIONS) {
                extensions.addAll(pragma.getExtensions());
            }
            index++;
        }

        ModuleHeader header = null;
        if (tokens.get(index).isKeyword("module")) {
            header = _readHeader(index);
            index = header.getLastToken() + 1;
        }

        int bodyStart = index;
        boolean bodyVerbatim = false;
        Token bodyHead = tokens.get(bodyStart);
        if (bodyHead.isPunctuation("{")) {
            bodyVerbatim = true;
        } else if (!bodyHead.isEof() && bodyHead.getColumn() != 1) {
            bodyVerbatim = true;
        }
        for (int j = bodyStart; j < tokens.size(); j++) {
            if (tokens.get(j).getKind() == TokenKind.CPP_DIRECTIVE) {
                bodyVerbatim = true;
                break;
            }
        }

        List<ItemSpan> items = bodyVerbatim && bodyHead.isPunctuation("{")
                ? List.of()
                : new LayoutResolver(tokens).resolveBody(bodyStart);
        for (ItemSpan item : items) {
            if (!tokens.get(item.getFirstToken()).isFirstOnLine()) {
                bodyVerbatim = true;
            }
        }

        DeclarationReader declarationReader = new DeclarationReader(tokens, matchingBracket);
        List<ImportGroup> importGroups = new ArrayList<>();
        List<ImportDecl> currentGroup = new ArrayList<>();
        List<Declaration> declarations = new ArrayList<>();
        int importIndex = 0;
        boolean inImports = true;
        for (ItemSpan item : items) {
            Token head = tokens.get(item.getFirstToken());
            if (inImports && head.isKeyword("import")) {
                ImportDecl importDecl = _readImport(item, importIndex++);
                if (!currentGroup.isEmpty() && head.getTrivia().getBlankLineCount() > 0) {
                    importGroups.add(new ImportGroup(currentGroup, null));
                    currentGroup = new ArrayList<>();
                }
                currentGroup.add(importDecl);
                continue;
            }
            inImports = false;
            declarations.add(declarationReader.read(item.getFirstToken(), item.getLastToken(), item.getBlocks()));
        }
        if (!currentGroup.isEmpty()) {
            importGroups.add(new ImportGroup(currentGroup, null));
        }

        Module module = Module.builder()
                .source(stream.getSource())
                .tokens(tokens)
                .quasiQuotes(stream.isQuasiQuotes())
                .lineSeparator(_detectLineSeparator())
                .headerPragmas(headerPragmas)
                .header(header)
                .importGroups(importGroups)
                .declarations(declarations)
                .bodyVerbatim(bodyVerbatim)
                .extensions(extensions)
                .build();
        logger.fine("Read module " + module.getModuleName() + ": " + importIndex + " imports, "
                + declarations.size() + " declarations" + (bodyVerbatim ? " (body kept verbatim)" : ""));
        return module;
    }

    private void _checkTokens() throws ParseException {
        for (Token token : tokens) {
            for (TriviaPiece piece : token.getTrivia().getPieces()) {
                if (!piece.isTerminated()) {
                    throw new ParseException("Unterminated block comment", "-}", piece.getLine(),
                            piece.getColumn(), piece.getStartOffset(), piece.getEndOffset());
                }
            }
            if (token.getKind() == TokenKind.UNTERMINATED) {
                String text = token.getText();
                String message;
                String expected;
                if (text.startsWith("{-#")) {
                    message = "Unterminated pragma";
                    expected = "#-}";
                } else if (text.startsWith("\"")) {
                    message = "Unterminated string literal";
                    expected = "\"";
                } else if (text.startsWith("'")) {
                    message = "Unterminated character literal";
                    expected = "'";
                } else if (text.startsWith("[")) {
                    message = "Unterminated quasi-quotation";
                    expected = "|]";
                } else {
                    message = "Unterminated token";
                    expected = null;
                }
                throw new ParseException(message, expected, token.getLine(), token.getColumn(),
                        token.getStartOffset(), token.getEndOffset());
            }
            if (token.getKind() == TokenKind.CPP_DIRECTIVE) {
                hasCpp = true;
            }
        }
    }

    /**
     * Pairs brackets. With CPP in play both branches of a conditional are
     * present, so mismatches are tolerated there.
     */
    private void _matchBrackets() throws ParseException {
        Deque<Integer> open = new ArrayDeque<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isOpenBracket()) {
                open.push(i);
            } else if (token.isCloseBracket()) {
                if (open.isEmpty()) {
                    if (hasCpp) {
                        continue;
                    }
                    throw new ParseException("Unmatched closing bracket '" + token.getText() + "'", null,
                            token.getLine(), token.getColumn(), token.getStartOffset(), token.getEndOffset());
                }
                Token opener = tokens.get(open.peek());
                String expected = _closerFor(opener.getText());
                if (!expected.equals(token.getText())) {
                    if (hasCpp) {
                        continue;
                    }
                    throw new ParseException("Mismatched bracket: '" + opener.getText() + "' at line "
                            + opener.getLine() + " closed by '" + token.getText() + "'", expected,
                            token.getLine(), token.getColumn(), token.getStartOffset(), token.getEndOffset());
                }
                int openIndex = open.pop();
                matchingBracket[openIndex] = i;
                matchingBracket[i] = openIndex;
            }
        }
        if (!open.isEmpty() && !hasCpp) {
            Token opener = tokens.get(open.peek());
            Token eof = tokens.get(tokens.size() - 1);
            throw new ParseException("Unclosed bracket '" + opener.getText() + "' opened at line "
                    + opener.getLine(), _closerFor(opener.getText()), eof.getLine(), eof.getColumn(),
                    opener.getStartOffset(), eof.getStartOffset());
        }
    }

    private static String _closerFor(String opener) {
        return switch (opener) {
            case "(" -> ")";
            case "[" -> "]";
            default -> "}";
        };
    }

    private ModuleHeader _readHeader(int moduleToken) {
        int j = moduleToken + 1;
        int nameToken = -1;
        String name = null;
        if (tokens.get(j).getKind() == TokenKind.IDENTIFIER) {
            nameToken = j;
            name = tokens.get(j).getText();
            j++;
        }
        while (tokens.get(j).getKind() == TokenKind.PRAGMA) {
            j++;
        }
        ExportList exports = null;
        if (tokens.get(j).isPunctuation("(") && matchingBracket[j] > j) {
            int close = matchingBracket[j];
            exports = _readExportList(j, close);
            j = close + 1;
        }
        int whereToken = -1;
        if (tokens.get(j).isKeyword("where")) {
            whereToken = j;
            j++;
        }
        return new ModuleHeader(moduleToken, j - 1, nameToken, name, exports, whereToken);
    }

    private ExportList _readExportList(int open, int close) {
        List<ExportItem> items = new ArrayList<>();
        List<Integer> commas = new ArrayList<>();
        for (int[] range : _splitAtCommas(open, close, commas)) {
            String text = _joinTokens(range[0], range[1]);
            boolean reexport = tokens.get(range[0]).isKeyword("module");
            items.add(new ExportItem(range[0], range[1], text, reexport));
        }
        return new ExportList(open, close, items, commas);
    }

    private ImportDecl _readImport(ItemSpan item, int sourceIndex) {
        int first = item.getFirstToken();
        int last = item.getLastToken();
        int j = first + 1;
        boolean qualified = false;
        if (j <= last && tokens.get(j).getKind() == TokenKind.PRAGMA) {
            j++;
        }
        if (j <= last && _isIdentifier(tokens.get(j), "safe")) {
            j++;
        }
        if (j <= last && _isIdentifier(tokens.get(j), "qualified")) {
            qualified = true;
            j++;
        }
        if (j <= last && tokens.get(j).getKind() == TokenKind.LITERAL) {
            j++;
        }
        int moduleNameToken = Math.min(j, last);
        String moduleName = tokens.get(moduleNameToken).getText();
        j = moduleNameToken + 1;
        if (j <= last && _isIdentifier(tokens.get(j), "qualified")) {
            qualified = true;
            j++;
        }
        String alias = null;
        if (j + 1 <= last && _isIdentifier(tokens.get(j), "as")) {
            alias = tokens.get(j + 1).getText();
            j += 2;
        }
        boolean hiding = false;
        if (j <= last && _isIdentifier(tokens.get(j), "hiding")) {
            hiding = true;
            j++;
        }
        ImportList importList = null;
        if (j <= last && tokens.get(j).isPunctuation("(") && matchingBracket[j] > j
                && matchingBracket[j] <= last) {
            List<ImportItem> items = new ArrayList<>();
            List<Integer> commas = new ArrayList<>();
            for (int[] range : _splitAtCommas(j, matchingBracket[j], commas)) {
                items.add(new ImportItem(range[0], range[1], _joinTokens(range[0], range[1])));
            }
            importList = new ImportList(j, matchingBracket[j], items, commas);
        }
        return new ImportDecl(first, last, moduleNameToken, moduleName, qualified, alias, hiding, importList,
                sourceIndex);
    }

    private List<int[]> _splitAtCommas(int open, int close, List<Integer> commas) {
        List<int[]> ranges = new ArrayList<>();
        int start = open + 1;
        int depth = 0;
        for (int j = open + 1; j <= close; j++) {
            Token token = tokens.get(j);
            boolean end = j == close;
            if (!end && token.isOpenBracket()) {
                depth++;
            } else if (!end && token.isCloseBracket()) {
                depth = Math.max(0, depth - 1);
            }
            if (end || (depth == 0 && token.isPunctuation(","))) {
                if (start <= j - 1) {
                    ranges.add(new int[] {start, j - 1});
                }
                if (!end) {
                    commas.add(j);
                }
                start = j + 1;
            }
        }
        return ranges;
    }

    private String _joinTokens(int first, int last) {
        StringBuilder sb = new StringBuilder();
        for (int j = first; j <= last; j++) {
            Token token = tokens.get(j);
            if (j > first && !token.getTrivia().isEmpty()) {
                sb.append(' ');
            }
            sb.append(token.getText());
        }
        return sb.toString();
    }

    private String _detectLineSeparator() {
        for (Token token : tokens) {
            for (TriviaPiece piece : token.getTrivia().getPieces()) {
                if (piece.isNewline()) {
                    return piece.getText();
                }
            }
        }
        return "\n";
    }

    private static boolean _isIdentifier(Token token, String text) {
        return token.getKind() == TokenKind.IDENTIFIER && token.getText().equals(text);
    }
}
