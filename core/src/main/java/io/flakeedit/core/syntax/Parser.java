package io.flakeedit.core.syntax;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for Nix expressions producing a lossless green tree.
 *
 * <p>
 * Binary operators are parsed by precedence climbing using the Nix operator
 * table. Trivia (whitespace and comments) is never looked at by the grammar:
 * pending trivia is attached to whatever node is open when the next
 * significant token is consumed or the next node is started. Whitespace
 * before a statement therefore belongs to the enclosing node, and whitespace
 * after the last token of a node ends up in the next enclosing node.
 *
 * <p>
 * Parsing never throws. Syntax problems are recorded as {@link ParseError}s
 * and the offending tokens are wrapped in {@link SyntaxKind#NODE_ERROR}
 * nodes, so the tree still covers every input character.
 */
public final class Parser {

    /** Tokens that close an enclosing construct; an expression parse never consumes them on error. */
    private static final Set<SyntaxKind> RECOVERY = EnumSet.of(
            SyntaxKind.TOKEN_SEMICOLON,
            SyntaxKind.TOKEN_R_BRACE,
            SyntaxKind.TOKEN_R_BRACK,
            SyntaxKind.TOKEN_R_PAREN,
            SyntaxKind.TOKEN_INTERPOL_END,
            SyntaxKind.TOKEN_IN,
            SyntaxKind.TOKEN_THEN,
            SyntaxKind.TOKEN_ELSE,
            SyntaxKind.TOKEN_COMMA);

    private static final Set<SyntaxKind> ARGUMENT_START = EnumSet.of(
            SyntaxKind.TOKEN_IDENT,
            SyntaxKind.TOKEN_INTEGER,
            SyntaxKind.TOKEN_FLOAT,
            SyntaxKind.TOKEN_PATH,
            SyntaxKind.TOKEN_URI,
            SyntaxKind.TOKEN_STRING_START,
            SyntaxKind.TOKEN_L_BRACE,
            SyntaxKind.TOKEN_L_BRACK,
            SyntaxKind.TOKEN_L_PAREN,
            SyntaxKind.TOKEN_REC);

    private static final Set<SyntaxKind> ATTR_START = EnumSet.of(
            SyntaxKind.TOKEN_IDENT,
            SyntaxKind.TOKEN_OR,
            SyntaxKind.TOKEN_STRING_START,
            SyntaxKind.TOKEN_INTERPOL_START);

    private static final int NOT_OPERAND_BP = 15;
    private static final int HAS_ATTR_BP = 23;

    private final List<GreenToken> tokens;
    private final TreeBuilder builder = new TreeBuilder();
    private final List<ParseError> errors = new ArrayList<>();
    private int pos;
    private int offset;

    private Parser(List<GreenToken> tokens) {
        this.tokens = tokens;
    }

    /** Parses {@code text} as a single Nix expression. */
    public static Parse parse(String text) {
        Parser parser = new Parser(Lexer.tokenize(text));
        parser.parseRoot();
        return new Parse(parser.builder.finish(), parser.errors);
    }

    private void parseRoot() {
        builder.startNode(SyntaxKind.NODE_ROOT);
        if (atEnd()) {
            error("unexpected end of input");
        } else {
            parseExpr();
            if (!atEnd()) {
                error("unexpected " + describe(0) + " after expression");
                startNode(SyntaxKind.NODE_ERROR);
                while (!atEnd()) {
                    bump();
                }
                builder.finishNode();
            }
        }
        flushTrivia();
        builder.finishNode();
    }

    // --- Expressions ---

    private void parseExpr() {
        SyntaxKind kind = peek();
        if (kind == null) {
            error("expected expression, found end of input");
            return;
        }
        switch (kind) {
            case TOKEN_LET -> parseLetIn();
            case TOKEN_WITH -> parseKeywordBody(SyntaxKind.NODE_WITH);
            case TOKEN_ASSERT -> parseKeywordBody(SyntaxKind.NODE_ASSERT);
            case TOKEN_IF -> parseIfElse();
            case TOKEN_IDENT -> {
                SyntaxKind next = peekNth(1);
                if (next == SyntaxKind.TOKEN_COLON || next == SyntaxKind.TOKEN_AT) {
                    parseLambda();
                } else {
                    parseBinary(0);
                }
            }
            case TOKEN_L_BRACE -> {
                if (isPatternAhead()) {
                    parseLambda();
                } else {
                    parseBinary(0);
                }
            }
            default -> parseBinary(0);
        }
    }

    private void parseLetIn() {
        startNode(SyntaxKind.NODE_LET_IN);
        bump();
        parseBindings(SyntaxKind.TOKEN_IN);
        expect(SyntaxKind.TOKEN_IN, "'in'");
        parseExpr();
        builder.finishNode();
    }

    /** {@code with e; body} and {@code assert e; body}. */
    private void parseKeywordBody(SyntaxKind nodeKind) {
        startNode(nodeKind);
        bump();
        parseExpr();
        expect(SyntaxKind.TOKEN_SEMICOLON, "';'");
        parseExpr();
        builder.finishNode();
    }

    private void parseIfElse() {
        startNode(SyntaxKind.NODE_IF_ELSE);
        bump();
        parseExpr();
        expect(SyntaxKind.TOKEN_THEN, "'then'");
        parseExpr();
        expect(SyntaxKind.TOKEN_ELSE, "'else'");
        parseExpr();
        builder.finishNode();
    }

    private void parseLambda() {
        startNode(SyntaxKind.NODE_LAMBDA);
        if (at(SyntaxKind.TOKEN_IDENT) && peekNth(1) == SyntaxKind.TOKEN_COLON) {
            startNode(SyntaxKind.NODE_IDENT_PARAM);
            parseIdent();
            builder.finishNode();
        } else {
            parsePattern();
        }
        expect(SyntaxKind.TOKEN_COLON, "':'");
        parseExpr();
        builder.finishNode();
    }

    private void parsePattern() {
        startNode(SyntaxKind.NODE_PATTERN);
        if (at(SyntaxKind.TOKEN_IDENT)) {
            startNode(SyntaxKind.NODE_PAT_BIND);
            parseIdent();
            expect(SyntaxKind.TOKEN_AT, "'@'");
            builder.finishNode();
        }
        expect(SyntaxKind.TOKEN_L_BRACE, "'{'");
        while (!atEnd() && !at(SyntaxKind.TOKEN_R_BRACE)) {
            if (at(SyntaxKind.TOKEN_ELLIPSIS)) {
                bump();
            } else if (at(SyntaxKind.TOKEN_IDENT)) {
                startNode(SyntaxKind.NODE_PAT_ENTRY);
                parseIdent();
                if (at(SyntaxKind.TOKEN_QUESTION)) {
                    bump();
                    parseExpr();
                }
                builder.finishNode();
            } else {
                errorNode("unexpected " + describe(0) + " in pattern");
                continue;
            }
            if (at(SyntaxKind.TOKEN_COMMA)) {
                bump();
            } else if (!at(SyntaxKind.TOKEN_R_BRACE)) {
                error("expected ',' or '}', found " + describe(0));
            }
        }
        expect(SyntaxKind.TOKEN_R_BRACE, "'}'");
        if (at(SyntaxKind.TOKEN_AT)) {
            startNode(SyntaxKind.NODE_PAT_BIND);
            bump();
            parseIdent();
            builder.finishNode();
        }
        builder.finishNode();
    }

    /** Decides, at a {@code {}, whether a lambda pattern or an attribute set follows. */
    private boolean isPatternAhead() {
        SyntaxKind first = peekNth(1);
        if (first == SyntaxKind.TOKEN_ELLIPSIS) {
            return true;
        }
        if (first == SyntaxKind.TOKEN_R_BRACE) {
            SyntaxKind after = peekNth(2);
            return after == SyntaxKind.TOKEN_COLON || after == SyntaxKind.TOKEN_AT;
        }
        if (first == SyntaxKind.TOKEN_IDENT) {
            SyntaxKind second = peekNth(2);
            if (second == SyntaxKind.TOKEN_COMMA || second == SyntaxKind.TOKEN_QUESTION) {
                return true;
            }
            if (second == SyntaxKind.TOKEN_R_BRACE) {
                SyntaxKind after = peekNth(3);
                return after == SyntaxKind.TOKEN_COLON || after == SyntaxKind.TOKEN_AT;
            }
        }
        return false;
    }

    private void parseBinary(int minBp) {
        int checkpoint = checkpoint();
        if (at(SyntaxKind.TOKEN_INVERT)) {
            startNode(SyntaxKind.NODE_UNARY_OP);
            bump();
            parseBinary(NOT_OPERAND_BP);
            builder.finishNode();
        } else {
            parseNegation();
        }
        while (true) {
            SyntaxKind op = peek();
            if (op == null) {
                return;
            }
            if (op == SyntaxKind.TOKEN_QUESTION) {
                if (HAS_ATTR_BP < minBp) {
                    return;
                }
                builder.startNodeAt(checkpoint, SyntaxKind.NODE_HAS_ATTR);
                bump();
                parseAttrpath();
                builder.finishNode();
                continue;
            }
            int[] bp = infixBindingPower(op);
            if (bp == null || bp[0] < minBp) {
                return;
            }
            builder.startNodeAt(checkpoint, SyntaxKind.NODE_BIN_OP);
            bump();
            parseBinary(bp[1]);
            builder.finishNode();
        }
    }

    /** Left and right binding power of an infix operator, or {@code null}. */
    private static int[] infixBindingPower(SyntaxKind op) {
        return switch (op) {
            case TOKEN_PIPE_RIGHT, TOKEN_PIPE_LEFT -> new int[] {1, 2};
            case TOKEN_IMPLICATION -> new int[] {3, 3};
            case TOKEN_OR_OR -> new int[] {5, 6};
            case TOKEN_AND_AND -> new int[] {7, 8};
            case TOKEN_EQUAL, TOKEN_NOT_EQUAL -> new int[] {9, 10};
            case TOKEN_LESS, TOKEN_LESS_OR_EQ, TOKEN_MORE, TOKEN_MORE_OR_EQ -> new int[] {11, 12};
            case TOKEN_UPDATE -> new int[] {13, 13};
            case TOKEN_ADD, TOKEN_SUB -> new int[] {17, 18};
            case TOKEN_MUL, TOKEN_DIV -> new int[] {19, 20};
            case TOKEN_CONCAT -> new int[] {21, 21};
            default -> null;
        };
    }

    private void parseNegation() {
        if (at(SyntaxKind.TOKEN_SUB)) {
            startNode(SyntaxKind.NODE_UNARY_OP);
            bump();
            parseNegation();
            builder.finishNode();
        } else {
            parseApply();
        }
    }

    private void parseApply() {
        int checkpoint = checkpoint();
        parseSelect();
        while (ARGUMENT_START.contains(peek())) {
            builder.startNodeAt(checkpoint, SyntaxKind.NODE_APPLY);
            parseSelect();
            builder.finishNode();
        }
    }

    private void parseSelect() {
        int checkpoint = checkpoint();
        parsePrimary();
        if (at(SyntaxKind.TOKEN_DOT)) {
            builder.startNodeAt(checkpoint, SyntaxKind.NODE_SELECT);
            bump();
            parseAttrpath();
            if (at(SyntaxKind.TOKEN_OR)) {
                bump();
                parseSelect();
            }
            builder.finishNode();
        }
    }

    private void parsePrimary() {
        SyntaxKind kind = peek();
        if (kind == null) {
            error("expected expression, found end of input");
            return;
        }
        switch (kind) {
            case TOKEN_IDENT -> parseIdent();
            case TOKEN_INTEGER, TOKEN_FLOAT, TOKEN_URI -> wrap(SyntaxKind.NODE_LITERAL);
            case TOKEN_PATH -> wrap(SyntaxKind.NODE_PATH);
            case TOKEN_STRING_START -> parseString();
            case TOKEN_L_BRACE, TOKEN_REC -> parseAttrSet();
            case TOKEN_L_BRACK -> parseList();
            case TOKEN_L_PAREN -> {
                startNode(SyntaxKind.NODE_PAREN);
                bump();
                parseExpr();
                expect(SyntaxKind.TOKEN_R_PAREN, "')'");
                builder.finishNode();
            }
            default -> {
                if (RECOVERY.contains(kind)) {
                    error("expected expression, found " + describe(0));
                } else {
                    errorNode("unexpected " + describe(0));
                }
            }
        }
    }

    private void parseAttrSet() {
        startNode(SyntaxKind.NODE_ATTR_SET);
        if (at(SyntaxKind.TOKEN_REC)) {
            bump();
        }
        expect(SyntaxKind.TOKEN_L_BRACE, "'{'");
        parseBindings(SyntaxKind.TOKEN_R_BRACE);
        expect(SyntaxKind.TOKEN_R_BRACE, "'}'");
        builder.finishNode();
    }

    private void parseList() {
        startNode(SyntaxKind.NODE_LIST);
        bump();
        while (!atEnd() && !at(SyntaxKind.TOKEN_R_BRACK)) {
            if (ARGUMENT_START.contains(peek())) {
                parseSelect();
            } else {
                errorNode("unexpected " + describe(0) + " in list");
            }
        }
        expect(SyntaxKind.TOKEN_R_BRACK, "']'");
        builder.finishNode();
    }

    // --- Bindings ---

    private void parseBindings(SyntaxKind terminator) {
        while (!atEnd() && !at(terminator)) {
            int before = pos;
            if (at(SyntaxKind.TOKEN_INHERIT)) {
                parseInherit();
            } else if (ATTR_START.contains(peek())) {
                parseAttrpathValue();
            } else {
                errorNode("expected binding, found " + describe(0));
            }
            if (pos == before && !atEnd()) {
                errorNode("unexpected " + describe(0));
            }
        }
    }

    private void parseAttrpathValue() {
        startNode(SyntaxKind.NODE_ATTRPATH_VALUE);
        parseAttrpath();
        expect(SyntaxKind.TOKEN_ASSIGN, "'='");
        parseExpr();
        expect(SyntaxKind.TOKEN_SEMICOLON, "';'");
        builder.finishNode();
    }

    private void parseInherit() {
        startNode(SyntaxKind.NODE_INHERIT);
        bump();
        if (at(SyntaxKind.TOKEN_L_PAREN)) {
            startNode(SyntaxKind.NODE_INHERIT_FROM);
            bump();
            parseExpr();
            expect(SyntaxKind.TOKEN_R_PAREN, "')'");
            builder.finishNode();
        }
        while (ATTR_START.contains(peek())) {
            parseAttr();
        }
        expect(SyntaxKind.TOKEN_SEMICOLON, "';'");
        builder.finishNode();
    }

    private void parseAttrpath() {
        startNode(SyntaxKind.NODE_ATTRPATH);
        parseAttr();
        while (at(SyntaxKind.TOKEN_DOT)) {
            bump();
            parseAttr();
        }
        builder.finishNode();
    }

    private void parseAttr() {
        SyntaxKind kind = peek();
        if (kind == SyntaxKind.TOKEN_IDENT || kind == SyntaxKind.TOKEN_OR) {
            wrap(SyntaxKind.NODE_IDENT);
        } else if (kind == SyntaxKind.TOKEN_STRING_START) {
            parseString();
        } else if (kind == SyntaxKind.TOKEN_INTERPOL_START) {
            startNode(SyntaxKind.NODE_DYNAMIC);
            bump();
            parseExpr();
            expect(SyntaxKind.TOKEN_INTERPOL_END, "'}'");
            builder.finishNode();
        } else {
            error("expected attribute name, found " + describe(0));
        }
    }

    private void parseIdent() {
        if (at(SyntaxKind.TOKEN_IDENT)) {
            wrap(SyntaxKind.NODE_IDENT);
        } else {
            error("expected identifier, found " + describe(0));
        }
    }

    /** Strings carry no trivia, so this walks the raw token stream. */
    private void parseString() {
        startNode(SyntaxKind.NODE_STRING);
        bump();
        while (true) {
            if (pos >= tokens.size()) {
                error("unterminated string");
                break;
            }
            SyntaxKind kind = tokens.get(pos).kind();
            if (kind == SyntaxKind.TOKEN_STRING_CONTENT) {
                advance();
            } else if (kind == SyntaxKind.TOKEN_INTERPOL_START) {
                builder.startNode(SyntaxKind.NODE_INTERPOL);
                advance();
                parseExpr();
                expect(SyntaxKind.TOKEN_INTERPOL_END, "'}'");
                builder.finishNode();
            } else if (kind == SyntaxKind.TOKEN_STRING_END) {
                advance();
                break;
            } else {
                error("unterminated string");
                break;
            }
        }
        builder.finishNode();
    }

    // --- Token plumbing ---

    private void wrap(SyntaxKind nodeKind) {
        startNode(nodeKind);
        bump();
        builder.finishNode();
    }

    private void errorNode(String message) {
        error(message);
        if (!atEnd()) {
            startNode(SyntaxKind.NODE_ERROR);
            bump();
            builder.finishNode();
        }
    }

    private boolean expect(SyntaxKind kind, String what) {
        if (at(kind)) {
            bump();
            return true;
        }
        error("expected " + what + ", found " + describe(0));
        return false;
    }

    private void error(String message) {
        errors.add(new ParseError(message, rangeOf(0)));
    }

    private String describe(int n) {
        int index = significantIndex(n);
        return index < 0 ? "end of input" : "'" + tokens.get(index).text() + "'";
    }

    private TextRange rangeOf(int n) {
        int start = offset;
        int seen = 0;
        for (int i = pos; i < tokens.size(); i++) {
            GreenToken token = tokens.get(i);
            if (!token.kind().isTrivia()) {
                if (seen == n) {
                    return new TextRange(start, start + token.textLength());
                }
                seen++;
            }
            start += token.textLength();
        }
        return null;
    }

    private int significantIndex(int n) {
        int seen = 0;
        for (int i = pos; i < tokens.size(); i++) {
            if (!tokens.get(i).kind().isTrivia()) {
                if (seen == n) {
                    return i;
                }
                seen++;
            }
        }
        return -1;
    }

    private SyntaxKind peekNth(int n) {
        int index = significantIndex(n);
        return index < 0 ? null : tokens.get(index).kind();
    }

    private SyntaxKind peek() {
        return peekNth(0);
    }

    private boolean at(SyntaxKind kind) {
        return peek() == kind;
    }

    private boolean atEnd() {
        return peek() == null;
    }

    private void flushTrivia() {
        while (pos < tokens.size() && tokens.get(pos).kind().isTrivia()) {
            advance();
        }
    }

    private void advance() {
        GreenToken token = tokens.get(pos++);
        offset += token.textLength();
        builder.token(token);
    }

    private void bump() {
        flushTrivia();
        advance();
    }

    private void startNode(SyntaxKind kind) {
        flushTrivia();
        builder.startNode(kind);
    }

    private int checkpoint() {
        flushTrivia();
        return builder.checkpoint();
    }
}
