package com.hsformatter.plugins.haskell.parser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.hsformatter.plugins.haskell.cst.BlockItem;
import com.hsformatter.plugins.haskell.cst.BlockKind;
import com.hsformatter.plugins.haskell.cst.CaseAlt;
import com.hsformatter.plugins.haskell.cst.Expr;
import com.hsformatter.plugins.haskell.cst.LayoutBlock;
import com.hsformatter.plugins.haskell.cst.LetBinding;
import com.hsformatter.plugins.haskell.lexer.Token;
import com.hsformatter.plugins.haskell.lexer.TokenKind;

/**
 * Resolves implicit layout by recursive descent. Each call receives the
 * {@link LayoutContext} of the block it reads; no indentation stack is kept
 * between calls.
 *
 * <p>An item ends at a line starting at or left of the block column, at an
 * explicit {@code ;}, or when a token closes the block: a closing bracket or
 * comma opened outside the block, an {@code in}, {@code then}, {@code else}
 * or {@code of} not matched inside it, or a {@code where} inside a
 * {@code do} block.
 */
public final class LayoutResolver {
    static final String OPEN_MARKER = "\u0000{";
    static final String ITEM_MARKER = "\u0000;";
    static final String CLOSE_MARKER = "\u0000}";
    static final String EMPTY_MARKER = "\u0000{}";

    private enum Stop {
        NEW_ITEM,
        SEMICOLON,
        CLOSED
    }

    private static final class ScanResult {
        final int last;
        final int next;
        final Stop stop;
        final List<LayoutBlock> blocks;

        ScanResult(int last, int next, Stop stop, List<LayoutBlock> blocks) {
            this.last = last;
            this.next = next;
            this.stop = stop;
            this.blocks = blocks;
        }
    }

    private static final class BlockScan {
        final LayoutBlock block;
        final int next;

        BlockScan(LayoutBlock block, int next) {
            this.block = block;
            this.next = next;
        }
    }

    private final List<Token> tokens;

    /**
     * @param tokens the token list, ending with the end-of-file token
     */
    public LayoutResolver(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Splits the tokens from {@code from} to the end of input into top-level
     * items whose first lines start at the column of the token at {@code from}.
     */
    public List<ItemSpan> resolveBody(int from) {
        List<ItemSpan> items = new ArrayList<>();
        if (from >= tokens.size() || tokens.get(from).isEof()) {
            return items;
        }
        LayoutContext top = LayoutContext.top(tokens.get(from).getColumn());
        int j = from;
        while (!tokens.get(j).isEof()) {
            ScanResult result = _scanItem(j, top);
            items.add(new ItemSpan(j, result.last, result.blocks));
            j = result.next;
        }
        return items;
    }

    private ScanResult _scanItem(int start, LayoutContext ctx) {
        List<LayoutBlock> blocks = new ArrayList<>();
        int depth = 0;
        int pendingLets = 0;
        int pendingIfs = 0;
        int pendingThens = 0;
        int pendingCases = 0;
        boolean inGuard = false;
        int j = start;

        while (true) {
            Token token = tokens.get(j);
            if (token.isEof()) {
                return new ScanResult(j - 1, j, Stop.CLOSED, blocks);
            }

            if (j > start && token.isFirstOnLine()) {
                if (token.getKind() == TokenKind.CPP_DIRECTIVE) {
                    if (ctx.isTop()) {
                        return new ScanResult(j - 1, j, Stop.NEW_ITEM, blocks);
                    }
                    j++;
                    continue;
                }
                if (token.getColumn() < ctx.getColumn()) {
                    return new ScanResult(j - 1, j, ctx.isTop() ? Stop.NEW_ITEM : Stop.CLOSED, blocks);
                }
                if (token.getColumn() == ctx.getColumn()) {
                    if (ctx.isTop()) {
                        return new ScanResult(j - 1, j, Stop.NEW_ITEM, blocks);
                    }
                    if (!_cannotStartItem(token)) {
                        return new ScanResult(j - 1, j, Stop.NEW_ITEM, blocks);
                    }
                    boolean continuesIf = (token.isKeyword("then") || token.isKeyword("else"))
                            && ctx.getBlockKind().closesOnWhere();
                    if (!continuesIf) {
                        return new ScanResult(j - 1, j, Stop.CLOSED, blocks);
                    }
                }
            }

            if (depth == 0 && j > start) {
                if (token.isCloseBracket()) {
                    if (!ctx.isTop()) {
                        return new ScanResult(j - 1, j, Stop.CLOSED, blocks);
                    }
                } else if (token.isPunctuation(",")) {
                    if (!ctx.isTop() && ctx.isClosesOnComma() && !inGuard) {
                        return new ScanResult(j - 1, j, Stop.CLOSED, blocks);
                    }
                } else if (token.isKeyword("in")) {
                    if (pendingLets > 0) {
                        pendingLets--;
                    } else if (!ctx.isTop()) {
                        return new ScanResult(j - 1, j, Stop.CLOSED, blocks);
                    }
                } else if (token.isKeyword("then")) {
                    if (pendingIfs > 0) {
                        pendingIfs--;
                        pendingThens++;
                    } else if (!ctx.isTop()) {
                        return new ScanResult(j - 1, j, Stop.CLOSED, blocks);
                    }
                } else if (token.isKeyword("else")) {
                    if (pendingThens > 0) {
                        pendingThens--;
                    } else if (!ctx.isTop()) {
                        return new ScanResult(j - 1, j, Stop.CLOSED, blocks);
                    }
                } else if (token.isKeyword("of")) {
                    if (pendingCases > 0) {
                        pendingCases--;
                    } else if (!ctx.isTop()) {
                        return new ScanResult(j - 1, j, Stop.CLOSED, blocks);
                    }
                } else if (token.isKeyword("where")) {
                    if (!ctx.isTop() && ctx.getBlockKind().closesOnWhere()) {
                        return new ScanResult(j - 1, j, Stop.CLOSED, blocks);
                    }
                }
            }

            if (depth == 0 && token.isPunctuation(";")) {
                return new ScanResult(j, j + 1, Stop.SEMICOLON, blocks);
            }

            if (token.isOpenBracket()) {
                depth++;
            } else if (token.isCloseBracket()) {
                if (depth > 0) {
                    depth--;
                }
            } else if (depth == 0 && token.isOperator("|")) {
                inGuard = true;
            } else if (depth == 0 && (token.isOperator("->") || token.isOperator("=")
                    || token.isOperator("\u2192"))) {
                inGuard = false;
            } else if (depth == 0 && token.isKeyword("if") && !_nextIs(j, "|")) {
                pendingIfs++;
            } else if (depth == 0 && token.isKeyword("case") && !_isLambdaCase(j)) {
                pendingCases++;
            }

            BlockKind opened = _openedBlock(j);
            if (opened == null) {
                j++;
                continue;
            }
            if (opened == BlockKind.LET && depth == 0) {
                pendingLets++;
            }
            int next = j + 1;
            Token nextToken = tokens.get(next);
            if (nextToken.isPunctuation("{")) {
                j++;
                continue;
            }
            if (nextToken.isEof() || _cannotStartBlock(nextToken)
                    || nextToken.getKind() == TokenKind.CPP_DIRECTIVE
                    || nextToken.getColumn() <= ctx.getColumn()) {
                blocks.add(LayoutBlock.empty(opened, j));
                j++;
                continue;
            }
            LayoutContext inner = ctx.enter(opened, nextToken.getColumn(), depth > 0);
            BlockScan scan = _scanBlock(opened, j, next, inner);
            blocks.add(scan.block);
            j = scan.next;
        }
    }

    private BlockScan _scanBlock(BlockKind kind, int opener, int first, LayoutContext ctx) {
        List<BlockItem> items = new ArrayList<>();
        int j = first;
        int last = first;
        while (true) {
            ScanResult result = _scanItem(j, ctx);
            if (result.last >= j) {
                items.add(_makeItem(kind, j, result.last, result.blocks));
                last = result.last;
            }
            Token next = tokens.get(result.next);
            boolean continues;
            if (result.stop == Stop.NEW_ITEM) {
                continues = !next.isEof();
            } else if (result.stop == Stop.SEMICOLON) {
                continues = !next.isEof() && !_cannotStartItem(next)
                        && next.getKind() != TokenKind.CPP_DIRECTIVE
                        && !(next.isFirstOnLine() && next.getColumn() < ctx.getColumn());
            } else {
                continues = false;
            }
            if (!continues) {
                return new BlockScan(new LayoutBlock(kind, opener, first, last, ctx.getColumn(), items),
                        result.next);
            }
            j = result.next;
        }
    }

    private static BlockItem _makeItem(BlockKind kind, int first, int last, List<LayoutBlock> blocks) {
        return switch (kind) {
            case OF, LAMBDA_CASE -> new CaseAlt(first, last, blocks);
            case WHERE, LET -> new LetBinding(first, last, blocks, null);
            default -> new Expr(first, last, blocks);
        };
    }

    /**
     * The block kind opened by the token at {@code index}, or null.
     * {@code \case} opens at its {@code case} token, a multi-way if at its
     * {@code if} token.
     */
    private BlockKind _openedBlock(int index) {
        Token token = tokens.get(index);
        if (token.getKind() == TokenKind.KEYWORD) {
            switch (token.getText()) {
                case "where":
                case "let":
                case "do":
                case "mdo":
                case "of":
                    return BlockKind.forKeyword(token.getText());
                case "case":
                    return _isLambdaCase(index) ? BlockKind.LAMBDA_CASE : null;
                case "if":
                    return _nextIs(index, "|") ? BlockKind.MULTI_WAY_IF : null;
                default:
                    return null;
            }
        }
        if (token.getKind() == TokenKind.IDENTIFIER && token.getText().equals("cases") && _isLambdaCase(index)) {
            return BlockKind.LAMBDA_CASE;
        }
        return null;
    }

    private boolean _isLambdaCase(int index) {
        return index > 0 && tokens.get(index - 1).isOperator("\\");
    }

    private boolean _nextIs(int index, String text) {
        return index + 1 < tokens.size() && tokens.get(index + 1).is(text);
    }

    private static boolean _cannotStartItem(Token token) {
        return token.isCloseBracket() || token.isPunctuation(",")
                || token.isKeyword("in") || token.isKeyword("then") || token.isKeyword("else")
                || token.isKeyword("of") || token.isKeyword("where");
    }

    private static boolean _cannotStartBlock(Token token) {
        return token.isCloseBracket() || token.isPunctuation(",")
                || token.isKeyword("in") || token.isKeyword("then") || token.isKeyword("else")
                || token.isKeyword("of");
    }

    /**
     * Token texts of the whole input interleaved with block markers: an
     * opening marker before the first item of each block, an item marker
     * before every further item and every top-level item, and a closing
     * marker after the last one. Two texts with equal signatures have the same
     * tokens in the same layout structure.
     */
    public static List<String> structureSignature(List<Token> tokens) {
        LayoutResolver resolver = new LayoutResolver(tokens);
        List<ItemSpan> items = resolver.resolveBody(0);
        Map<Integer, List<String>> before = new HashMap<>();
        Map<Integer, List<String>> after = new HashMap<>();
        for (ItemSpan item : items) {
            before.computeIfAbsent(item.getFirstToken(), k -> new ArrayList<>()).add(ITEM_MARKER);
            for (LayoutBlock block : item.getBlocks()) {
                _collectMarkers(block, before, after);
            }
        }
        List<String> signature = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isEof()) {
                break;
            }
            signature.addAll(before.getOrDefault(i, List.of()));
            signature.add(token.getText());
            signature.addAll(after.getOrDefault(i, List.of()));
        }
        return signature;
    }

    private static void _collectMarkers(LayoutBlock block, Map<Integer, List<String>> before,
                                        Map<Integer, List<String>> after) {
        if (block.isEmpty()) {
            after.computeIfAbsent(block.getOpenerToken(), k -> new ArrayList<>()).add(EMPTY_MARKER);
            return;
        }
        boolean first = true;
        for (BlockItem item : block.getItems()) {
            before.computeIfAbsent(item.getFirstToken(), k -> new ArrayList<>())
                    .add(first ? OPEN_MARKER : ITEM_MARKER);
            first = false;
            for (LayoutBlock nested : item.getBlocks()) {
                _collectMarkers(nested, before, after);
            }
        }
        after.computeIfAbsent(block.getLastToken(), k -> new ArrayList<>()).add(CLOSE_MARKER);
    }
}
