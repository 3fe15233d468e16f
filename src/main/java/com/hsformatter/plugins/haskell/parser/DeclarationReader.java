package com.hsformatter.plugins.haskell.parser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.hsformatter.plugins.haskell.cst.BlockItem;
import com.hsformatter.plugins.haskell.cst.BlockKind;
import com.hsformatter.plugins.haskell.cst.Constructor;
import com.hsformatter.plugins.haskell.cst.DataDecl;
import com.hsformatter.plugins.haskell.cst.Declaration;
import com.hsformatter.plugins.haskell.cst.DerivingClause;
import com.hsformatter.plugins.haskell.cst.Equation;
import com.hsformatter.plugins.haskell.cst.Expr;
import com.hsformatter.plugins.haskell.cst.FunctionClause;
import com.hsformatter.plugins.haskell.cst.GuardedRhs;
import com.hsformatter.plugins.haskell.cst.LayoutBlock;
import com.hsformatter.plugins.haskell.cst.LetBinding;
import com.hsformatter.plugins.haskell.cst.OpaqueDecl;
import com.hsformatter.plugins.haskell.cst.OpaqueKind;
import com.hsformatter.plugins.haskell.cst.Pragma;
import com.hsformatter.plugins.haskell.cst.RecordField;
import com.hsformatter.plugins.haskell.cst.TypeSignature;
import com.hsformatter.plugins.haskell.lexer.Keywords;
import com.hsformatter.plugins.haskell.lexer.Token;
import com.hsformatter.plugins.haskell.lexer.TokenKind;

/**
 * Classifies the token range of one item (top-level or {@code where}-bound)
 * into a declaration node. Anything not recognized becomes an
 * {@link OpaqueDecl}; this class never fails.
 */
final class DeclarationReader {
    private final List<Token> tokens;
    private final int[] matchingBracket;

    DeclarationReader(List<Token> tokens, int[] matchingBracket) {
        this.tokens = tokens;
        this.matchingBracket = matchingBracket;
    }

    Declaration read(int first, int last, List<LayoutBlock> blocks) {
        Token head = tokens.get(first);
        if (head.getKind() == TokenKind.CPP_DIRECTIVE) {
            return new OpaqueDecl(first, last, blocks, OpaqueKind.CPP, null);
        }
        if (head.getKind() == TokenKind.PRAGMA) {
            return first == last
                    ? PragmaParser.toPragma(head, first)
                    : new OpaqueDecl(first, last, blocks, OpaqueKind.OTHER, null);
        }
        if (head.getKind() == TokenKind.KEYWORD) {
            Declaration keywordDecl = _readKeywordDeclaration(first, last, blocks);
            if (keywordDecl != null) {
                return keywordDecl;
            }
        }
        if (head.getKind() == TokenKind.IDENTIFIER && head.getText().equals("pattern")
                && first < last && tokens.get(first + 1).isConId()) {
            return new OpaqueDecl(first, last, blocks, OpaqueKind.OTHER, tokens.get(first + 1).getText());
        }
        if (head.isOperator("$") || head.isOperator("$$")) {
            return new OpaqueDecl(first, last, blocks, OpaqueKind.SPLICE, null);
        }

        Map<Integer, Integer> skip = _blockRanges(blocks);
        int doubleColon = -1;
        int equals = -1;
        int bar = -1;
        int depth = 0;
        for (int j = first; j <= last; j++) {
            if (skip.containsKey(j)) {
                j = skip.get(j);
                continue;
            }
            Token token = tokens.get(j);
            if (token.isOpenBracket()) {
                depth++;
            } else if (token.isCloseBracket()) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0) {
                if (doubleColon < 0 && _isDoubleColon(token)) {
                    doubleColon = j;
                } else if (equals < 0 && token.isOperator("=")) {
                    equals = j;
                } else if (bar < 0 && equals < 0 && token.isOperator("|")) {
                    bar = j;
                }
            }
        }

        int rhsStart = _minPositive(equals, bar);
        if (doubleColon >= 0 && (rhsStart < 0 || doubleColon < rhsStart)) {
            TypeSignature signature = _readSignature(first, last, blocks, doubleColon);
            return signature != null ? signature : new OpaqueDecl(first, last, blocks, OpaqueKind.OTHER, null);
        }
        if (rhsStart >= 0) {
            FunctionClause clause = _readFunctionClause(first, last, blocks, equals, bar, skip);
            if (clause != null) {
                return clause;
            }
            return new OpaqueDecl(first, last, blocks, OpaqueKind.OTHER, null);
        }
        return new OpaqueDecl(first, last, blocks, OpaqueKind.SPLICE, null);
    }

    private Declaration _readKeywordDeclaration(int first, int last, List<LayoutBlock> blocks) {
        Token head = tokens.get(first);
        Token next = first < last ? tokens.get(first + 1) : null;
        switch (head.getText()) {
            case "data":
            case "newtype": {
                if (next != null && (next.isKeyword("instance")
                        || (next.getKind() == TokenKind.IDENTIFIER && next.getText().equals("family")))) {
                    return new OpaqueDecl(first, last, blocks, OpaqueKind.TYPE_SYNONYM, null);
                }
                if (!blocks.isEmpty()) {
                    return new OpaqueDecl(first, last, blocks, OpaqueKind.GADT, _firstConId(first + 1, last));
                }
                DataDecl data = _readData(first, last);
                return data != null ? data
                        : new OpaqueDecl(first, last, blocks, OpaqueKind.OTHER, _firstConId(first + 1, last));
            }
            case "type":
                return new OpaqueDecl(first, last, blocks, OpaqueKind.TYPE_SYNONYM, _firstConId(first + 1, last));
            case "class":
                return new OpaqueDecl(first, last, blocks, OpaqueKind.CLASS, _firstConId(first + 1, last));
            case "instance":
                return new OpaqueDecl(first, last, blocks, OpaqueKind.INSTANCE, null);
            case "infix":
            case "infixl":
            case "infixr":
                return new OpaqueDecl(first, last, blocks, OpaqueKind.FIXITY, null);
            case "deriving":
            case "foreign":
            case "default":
            case "import":
                return new OpaqueDecl(first, last, blocks, OpaqueKind.OTHER, null);
            default:
                return null;
        }
    }

    // Type signatures

    private TypeSignature _readSignature(int first, int last, List<LayoutBlock> blocks, int doubleColon) {
        List<Integer> nameTokens = new ArrayList<>();
        List<String> names = new ArrayList<>();
        int j = first;
        boolean expectName = true;
        while (j < doubleColon) {
            Token token = tokens.get(j);
            if (expectName) {
                if (token.isVarId()) {
                    nameTokens.add(j);
                    names.add(token.getText());
                    j++;
                } else if (token.isPunctuation("(") && j + 2 < doubleColon + 1
                        && tokens.get(j + 1).getKind() == TokenKind.OPERATOR
                        && tokens.get(j + 2).isPunctuation(")")) {
                    nameTokens.add(j + 1);
                    names.add(tokens.get(j + 1).getText());
                    j += 3;
                } else {
                    return null;
                }
                expectName = false;
            } else if (token.isPunctuation(",")) {
                expectName = true;
                j++;
            } else {
                return null;
            }
        }
        if (names.isEmpty() || expectName) {
            return null;
        }
        List<Integer> separators = _topLevelArrows(doubleColon + 1, last);
        return new TypeSignature(first, last, blocks, nameTokens, names, doubleColon, separators);
    }

    private List<Integer> _topLevelArrows(int from, int to) {
        List<Integer> separators = new ArrayList<>();
        int depth = 0;
        for (int j = from; j <= to; j++) {
            Token token = tokens.get(j);
            if (token.isOpenBracket()) {
                depth++;
            } else if (token.isCloseBracket()) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && _isArrow(token)) {
                separators.add(j);
            }
        }
        return separators;
    }

    static boolean _isArrow(Token token) {
        return token.isOperator("->") || token.isOperator("=>")
                || token.isOperator("\u2192") || token.isOperator("\u21D2");
    }

    private static boolean _isDoubleColon(Token token) {
        return token.isOperator("::") || token.isOperator("\u2237");
    }

    // Data declarations

    private DataDecl _readData(int first, int last) {
        boolean newtype = tokens.get(first).isKeyword("newtype");
        List<Integer> derivingStarts = new ArrayList<>();
        int equals = -1;
        int depth = 0;
        for (int j = first + 1; j <= last; j++) {
            Token token = tokens.get(j);
            if (token.isOpenBracket()) {
                depth++;
            } else if (token.isCloseBracket()) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && token.isKeyword("deriving")) {
                derivingStarts.add(j);
            } else if (depth == 0 && equals < 0 && derivingStarts.isEmpty() && token.isOperator("=")) {
                equals = j;
            }
        }
        int bodyEnd = derivingStarts.isEmpty() ? last : derivingStarts.get(0) - 1;
        int headerEnd = equals >= 0 ? equals - 1 : bodyEnd;

        int nameStart = first + 1;
        for (int j = first + 1; j <= headerEnd; j++) {
            if (tokens.get(j).isOperator("=>") || tokens.get(j).isOperator("\u21D2")) {
                nameStart = j + 1;
            }
        }
        int nameToken = -1;
        for (int j = nameStart; j <= headerEnd; j++) {
            if (tokens.get(j).isConId()) {
                nameToken = j;
                break;
            }
        }
        String typeName = nameToken >= 0 ? tokens.get(nameToken).getText() : null;

        List<Constructor> constructors = new ArrayList<>();
        List<Integer> bars = new ArrayList<>();
        if (equals >= 0) {
            int start = equals + 1;
            depth = 0;
            for (int j = equals + 1; j <= bodyEnd + 1; j++) {
                boolean end = j > bodyEnd;
                Token token = end ? null : tokens.get(j);
                if (!end && token.isOpenBracket()) {
                    depth++;
                } else if (!end && token.isCloseBracket()) {
                    depth = Math.max(0, depth - 1);
                }
                if (end || (depth == 0 && token.isOperator("|"))) {
                    if (start > j - 1) {
                        return null;
                    }
                    Constructor constructor = _readConstructor(start, j - 1);
                    if (constructor == null) {
                        return null;
                    }
                    constructors.add(constructor);
                    if (!end) {
                        bars.add(j);
                    }
                    start = j + 1;
                }
            }
        }

        List<DerivingClause> derivings = new ArrayList<>();
        for (int k = 0; k < derivingStarts.size(); k++) {
            int clauseEnd = k + 1 < derivingStarts.size() ? derivingStarts.get(k + 1) - 1 : last;
            DerivingClause clause = _readDeriving(derivingStarts.get(k), clauseEnd);
            if (clause == null) {
                return null;
            }
            derivings.add(clause);
        }
        return new DataDecl(first, last, first, newtype, nameToken, typeName, equals, constructors, bars,
                derivings);
    }

    private Constructor _readConstructor(int first, int last) {
        int start = first;
        Token head = tokens.get(first);
        if (head.getKind() == TokenKind.IDENTIFIER && (head.getText().equals("forall")
                || head.getText().equals("\u2200"))) {
            for (int j = first + 1; j <= last; j++) {
                if (tokens.get(j).isOperator(".")) {
                    start = j + 1;
                    break;
                }
            }
        }
        int depth = 0;
        for (int j = start; j <= last; j++) {
            Token token = tokens.get(j);
            if (token.isOpenBracket()) {
                depth++;
            } else if (token.isCloseBracket()) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && (token.isOperator("=>") || token.isOperator("\u21D2"))) {
                start = j + 1;
            }
        }
        if (start > last) {
            return null;
        }

        int nameToken = -1;
        depth = 0;
        for (int j = start; j <= last; j++) {
            Token token = tokens.get(j);
            if (token.isOpenBracket()) {
                depth++;
            } else if (token.isCloseBracket()) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && token.getKind() == TokenKind.OPERATOR
                    && token.getText().startsWith(":") && !_isDoubleColon(token)) {
                nameToken = j;
                break;
            }
        }
        Token startToken = tokens.get(start);
        if (nameToken < 0) {
            if (startToken.isConId()) {
                nameToken = start;
            } else if (startToken.isPunctuation("(") && start + 2 <= last
                    && tokens.get(start + 1).getKind() == TokenKind.OPERATOR
                    && tokens.get(start + 2).isPunctuation(")")) {
                nameToken = start + 1;
            }
        }
        String name = nameToken >= 0 ? tokens.get(nameToken).getText() : null;

        int afterName = nameToken >= 0 ? nameToken + 1 : start;
        if (afterName <= last && tokens.get(afterName).isPunctuation("{") && nameToken == start) {
            int open = afterName;
            int close = matchingBracket[open];
            if (close < 0 || close > last) {
                return null;
            }
            List<RecordField> fields = new ArrayList<>();
            List<Integer> commas = new ArrayList<>();
            int fieldStart = open + 1;
            depth = 0;
            for (int j = open + 1; j <= close; j++) {
                Token token = tokens.get(j);
                boolean end = j == close;
                if (!end && token.isOpenBracket()) {
                    depth++;
                } else if (!end && token.isCloseBracket()) {
                    depth = Math.max(0, depth - 1);
                }
                if (end || (depth == 0 && token.isPunctuation(","))) {
                    if (fieldStart <= j - 1) {
                        RecordField field = _readField(fieldStart, j - 1);
                        if (field == null) {
                            return null;
                        }
                        fields.add(field);
                    }
                    if (!end) {
                        commas.add(j);
                    }
                    fieldStart = j + 1;
                }
            }
            return new Constructor(first, last, nameToken, name, open, close, fields, commas);
        }
        return new Constructor(first, last, nameToken, name);
    }

    private RecordField _readField(int first, int last) {
        List<Integer> nameTokens = new ArrayList<>();
        List<String> names = new ArrayList<>();
        int doubleColon = -1;
        for (int j = first; j <= last; j++) {
            Token token = tokens.get(j);
            if (_isDoubleColon(token)) {
                doubleColon = j;
                break;
            }
            if (token.isVarId()) {
                nameTokens.add(j);
                names.add(token.getText());
            } else if (!token.isPunctuation(",")) {
                return null;
            }
        }
        if (doubleColon < 0 || names.isEmpty() || doubleColon == last) {
            return null;
        }
        int typeStart = doubleColon + 1;
        while (typeStart < last && tokens.get(typeStart).getKind() == TokenKind.PRAGMA) {
            typeStart++;
        }
        Token typeHead = tokens.get(typeStart);
        boolean strict = typeHead.isOperator("!") || typeHead.isOperator("~");
        return new RecordField(first, last, nameTokens, names, doubleColon, strict);
    }

    private DerivingClause _readDeriving(int first, int last) {
        int j = first + 1;
        int strategyToken = -1;
        String strategy = null;
        if (j <= last) {
            Token token = tokens.get(j);
            if (token.isKeyword("newtype") || (token.getKind() == TokenKind.IDENTIFIER
                    && (token.getText().equals("stock") || token.getText().equals("anyclass")))) {
                strategyToken = j;
                strategy = token.getText();
                j++;
            }
        }
        if (j > last) {
            return null;
        }
        int classesFirst;
        int classesLast;
        boolean parenthesized;
        List<String> classNames = new ArrayList<>();
        Token token = tokens.get(j);
        if (token.isPunctuation("(")) {
            classesFirst = j;
            classesLast = matchingBracket[j];
            if (classesLast < 0 || classesLast > last) {
                return null;
            }
            parenthesized = true;
            boolean expectName = true;
            int depth = 0;
            for (int k = j + 1; k < classesLast; k++) {
                Token inner = tokens.get(k);
                if (inner.isOpenBracket()) {
                    depth++;
                } else if (inner.isCloseBracket()) {
                    depth = Math.max(0, depth - 1);
                } else if (depth == 0 && inner.isPunctuation(",")) {
                    expectName = true;
                } else if (expectName && inner.isConId()) {
                    classNames.add(inner.getText());
                    expectName = false;
                }
            }
        } else if (token.isConId()) {
            classesFirst = j;
            classesLast = j;
            parenthesized = false;
            classNames.add(token.getText());
        } else {
            return null;
        }
        int viaToken = -1;
        int after = classesLast + 1;
        if (after <= last) {
            Token via = tokens.get(after);
            if (via.getKind() == TokenKind.IDENTIFIER && via.getText().equals("via")) {
                viaToken = after;
                if (strategy == null) {
                    strategy = "via";
                }
            } else {
                return null;
            }
        }
        return new DerivingClause(first, last, strategyToken, strategy, classesFirst, classesLast,
                parenthesized, viaToken, classNames);
    }

    // Function clauses

    private FunctionClause _readFunctionClause(int first, int last, List<LayoutBlock> blocks,
                                               int equals, int bar, Map<Integer, Integer> skip) {
        boolean guarded = bar >= 0 && (equals < 0 || bar < equals);
        int lhsLast = (guarded ? bar : equals) - 1;
        if (lhsLast < first) {
            return null;
        }

        LayoutBlock whereBlock = null;
        for (LayoutBlock block : blocks) {
            if (block.getBlockKind() == BlockKind.WHERE && block.getOpenerToken() > lhsLast) {
                whereBlock = block;
            }
        }
        int rhsEnd = whereBlock != null ? whereBlock.getOpenerToken() - 1 : last;

        int nameToken = -1;
        String name = null;
        boolean operator = false;
        int infix = _findInfixOperator(first, lhsLast);
        Token head = tokens.get(first);
        if (infix >= 0) {
            nameToken = infix;
            name = tokens.get(infix).getText();
            operator = tokens.get(infix).getKind() == TokenKind.OPERATOR;
        } else if (head.isPunctuation("(") && first + 2 <= lhsLast
                && tokens.get(first + 1).getKind() == TokenKind.OPERATOR
                && tokens.get(first + 2).isPunctuation(")")) {
            nameToken = first + 1;
            name = tokens.get(first + 1).getText();
            operator = true;
        } else if (head.isVarId() && !head.isQualified() && !head.getText().equals("_")) {
            nameToken = first;
            name = head.getText();
        }

        Equation equation;
        if (guarded) {
            List<GuardedRhs> guards = new ArrayList<>();
            List<Integer> bars = new ArrayList<>();
            int depth = 0;
            for (int j = bar; j <= rhsEnd; j++) {
                if (skip.containsKey(j)) {
                    j = skip.get(j);
                    continue;
                }
                Token token = tokens.get(j);
                if (token.isOpenBracket()) {
                    depth++;
                } else if (token.isCloseBracket()) {
                    depth = Math.max(0, depth - 1);
                } else if (depth == 0 && token.isOperator("|")) {
                    bars.add(j);
                }
            }
            for (int k = 0; k < bars.size(); k++) {
                int guardBar = bars.get(k);
                int guardEnd = k + 1 < bars.size() ? bars.get(k + 1) - 1 : rhsEnd;
                int guardEquals = _firstTopLevel(guardBar + 1, guardEnd, "=", skip);
                if (guardEquals < 0 || guardEquals >= guardEnd) {
                    return null;
                }
                Expr body = new Expr(guardEquals + 1, guardEnd, _blocksIn(blocks, guardEquals + 1, guardEnd));
                guards.add(new GuardedRhs(guardBar, guardEquals, body));
            }
            if (guards.isEmpty()) {
                return null;
            }
            equation = new Equation(first, lhsLast, -1, null, guards);
        } else {
            if (equals + 1 > rhsEnd) {
                return null;
            }
            Expr rhs = new Expr(equals + 1, rhsEnd, _blocksIn(blocks, equals + 1, rhsEnd));
            equation = new Equation(first, lhsLast, equals, rhs, List.of());
        }

        List<Declaration> locals = new ArrayList<>();
        List<LayoutBlock> allBlocks = new ArrayList<>(blocks);
        if (whereBlock != null && !whereBlock.isEmpty()) {
            List<BlockItem> items = new ArrayList<>();
            for (BlockItem item : whereBlock.getItems()) {
                Declaration local = read(item.getFirstToken(), item.getLastToken(), item.getBlocks());
                locals.add(local);
                items.add(new LetBinding(item.getFirstToken(), item.getLastToken(), item.getBlocks(), local));
            }
            LayoutBlock rebuilt = new LayoutBlock(whereBlock.getBlockKind(), whereBlock.getOpenerToken(),
                    whereBlock.getFirstToken(), whereBlock.getLastToken(), whereBlock.getColumn(), items);
            allBlocks.set(allBlocks.indexOf(whereBlock), rebuilt);
            whereBlock = rebuilt;
        }
        return new FunctionClause(first, last, allBlocks, nameToken, name, operator, equation, whereBlock, locals);
    }

    /**
     * An operator or backtick name used infix at bracket depth 0 of a
     * left-hand side, as in {@code x <+> y} or {@code a `op` b}. Prefix bang
     * and lazy patterns ({@code f !x}) are not infix.
     */
    private int _findInfixOperator(int first, int lhsLast) {
        int depth = 0;
        for (int j = first; j <= lhsLast; j++) {
            Token token = tokens.get(j);
            if (token.isOpenBracket()) {
                depth++;
            } else if (token.isCloseBracket()) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && j > first) {
                if (token.isPunctuation("`") && j + 2 <= lhsLast && tokens.get(j + 2).isPunctuation("`")
                        && tokens.get(j + 1).isVarId()) {
                    return j + 1;
                }
                if (token.getKind() == TokenKind.OPERATOR && !token.isQualified()
                        && !Keywords.RESERVED_OPERATORS.contains(token.getText())
                        && !_isPrefixOccurrence(j)) {
                    return j;
                }
            }
        }
        return -1;
    }

    private boolean _isPrefixOccurrence(int index) {
        Token token = tokens.get(index);
        Token next = tokens.get(index + 1);
        boolean spaceBefore = !token.getTrivia().isEmpty();
        boolean spaceAfter = !next.getTrivia().isEmpty();
        return spaceBefore && !spaceAfter && (token.is("!") || token.is("~") || token.is("@") || token.is("$"));
    }

    private int _firstTopLevel(int from, int to, String text, Map<Integer, Integer> skip) {
        int depth = 0;
        for (int j = from; j <= to; j++) {
            if (skip.containsKey(j)) {
                j = skip.get(j);
                continue;
            }
            Token token = tokens.get(j);
            if (token.isOpenBracket()) {
                depth++;
            } else if (token.isCloseBracket()) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && token.is(text)) {
                return j;
            }
        }
        return -1;
    }

    // Helpers

    private String _firstConId(int from, int to) {
        for (int j = from; j <= to; j++) {
            Token token = tokens.get(j);
            if (token.isOperator("=>") || token.isOperator("=") || token.isKeyword("where")) {
                break;
            }
            if (token.isConId()) {
                return token.getText();
            }
        }
        return null;
    }

    private static Map<Integer, Integer> _blockRanges(List<LayoutBlock> blocks) {
        Map<Integer, Integer> ranges = new HashMap<>();
        for (LayoutBlock block : blocks) {
            if (!block.isEmpty()) {
                ranges.put(block.getFirstToken(), block.getLastToken());
            }
        }
        return ranges;
    }

    private static List<LayoutBlock> _blocksIn(List<LayoutBlock> blocks, int from, int to) {
        List<LayoutBlock> result = new ArrayList<>();
        for (LayoutBlock block : blocks) {
            if (block.getOpenerToken() >= from && block.getOpenerToken() <= to) {
                result.add(block);
            }
        }
        return result;
    }

    private static int _minPositive(int a, int b) {
        if (a < 0) {
            return b;
        }
        if (b < 0) {
            return a;
        }
        return Math.min(a, b);
    }
}
