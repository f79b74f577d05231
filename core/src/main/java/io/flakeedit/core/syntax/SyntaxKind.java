package io.flakeedit.core.syntax;

/**
 * Closed set of token and node kinds produced by the {@link Parser}.
 *
 * <p>
 * Token kinds carry source text; node kinds group tokens and other nodes.
 * The naming follows the usual CST convention: {@code TOKEN_*} for leaves,
 * {@code NODE_*} for interior nodes.
 */
public enum SyntaxKind {

    // ── Trivia ──
    TOKEN_WHITESPACE,
    TOKEN_COMMENT,

    // ── Literals and names ──
    TOKEN_IDENT,
    TOKEN_INTEGER,
    TOKEN_FLOAT,
    TOKEN_PATH,
    TOKEN_URI,

    // ── String pieces ──
    TOKEN_STRING_START,
    TOKEN_STRING_CONTENT,
    TOKEN_STRING_END,
    TOKEN_INTERPOL_START,
    TOKEN_INTERPOL_END,

    // ── Punctuation ──
    TOKEN_L_BRACE,
    TOKEN_R_BRACE,
    TOKEN_L_BRACK,
    TOKEN_R_BRACK,
    TOKEN_L_PAREN,
    TOKEN_R_PAREN,
    TOKEN_SEMICOLON,
    TOKEN_COLON,
    TOKEN_COMMA,
    TOKEN_DOT,
    TOKEN_ELLIPSIS,
    TOKEN_ASSIGN,
    TOKEN_AT,
    TOKEN_QUESTION,

    // ── Operators ──
    TOKEN_CONCAT,
    TOKEN_UPDATE,
    TOKEN_ADD,
    TOKEN_SUB,
    TOKEN_MUL,
    TOKEN_DIV,
    TOKEN_AND_AND,
    TOKEN_OR_OR,
    TOKEN_IMPLICATION,
    TOKEN_EQUAL,
    TOKEN_NOT_EQUAL,
    TOKEN_LESS,
    TOKEN_LESS_OR_EQ,
    TOKEN_MORE,
    TOKEN_MORE_OR_EQ,
    TOKEN_INVERT,
    TOKEN_PIPE_RIGHT,
    TOKEN_PIPE_LEFT,

    // ── Keywords ──
    TOKEN_ASSERT,
    TOKEN_ELSE,
    TOKEN_IF,
    TOKEN_IN,
    TOKEN_INHERIT,
    TOKEN_LET,
    TOKEN_OR,
    TOKEN_REC,
    TOKEN_THEN,
    TOKEN_WITH,

    TOKEN_ERROR,

    // ── Nodes ──
    NODE_ROOT,
    NODE_ATTR_SET,
    NODE_ATTRPATH_VALUE,
    NODE_ATTRPATH,
    NODE_IDENT,
    NODE_STRING,
    NODE_INTERPOL,
    NODE_DYNAMIC,
    NODE_LITERAL,
    NODE_PATH,
    NODE_LAMBDA,
    NODE_PATTERN,
    NODE_PAT_ENTRY,
    NODE_PAT_BIND,
    NODE_IDENT_PARAM,
    NODE_APPLY,
    NODE_SELECT,
    NODE_HAS_ATTR,
    NODE_LIST,
    NODE_LET_IN,
    NODE_WITH,
    NODE_ASSERT,
    NODE_IF_ELSE,
    NODE_BIN_OP,
    NODE_UNARY_OP,
    NODE_PAREN,
    NODE_INHERIT,
    NODE_INHERIT_FROM,
    NODE_ERROR;

    /** Whitespace and comments, which the parser never interprets. */
    public boolean isTrivia() {
        return this == TOKEN_WHITESPACE || this == TOKEN_COMMENT;
    }

    public boolean isToken() {
        return name().startsWith("TOKEN_");
    }

    public boolean isNode() {
        return !isToken();
    }

    /** Keywords recognised by the lexer, or {@code null} for plain identifiers. */
    static SyntaxKind keyword(String text) {
        return switch (text) {
            case "assert" -> TOKEN_ASSERT;
            case "else" -> TOKEN_ELSE;
            case "if" -> TOKEN_IF;
            case "in" -> TOKEN_IN;
            case "inherit" -> TOKEN_INHERIT;
            case "let" -> TOKEN_LET;
            case "or" -> TOKEN_OR;
            case "rec" -> TOKEN_REC;
            case "then" -> TOKEN_THEN;
            case "with" -> TOKEN_WITH;
            default -> null;
        };
    }
}
