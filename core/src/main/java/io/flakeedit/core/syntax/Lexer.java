package io.flakeedit.core.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits Nix source text into tokens without losing a single character.
 *
 * <p>
 * The lexer is modal: plain code, double-quoted strings and indented
 * ({@code ''}) strings are tokenised differently, and {@code ${ … }}
 * interpolations nest code inside strings. A stack of {@link Frame}s tracks
 * the active mode and the brace depth of each code frame so that the closing
 * brace of an interpolation is recognised.
 *
 * <p>
 * Concatenating the text of all returned tokens always yields the input.
 */
final class Lexer {

    private static final String PATH_CHAR = "[a-zA-Z0-9._+\\-]";

    private static final Pattern PATH = Pattern.compile(PATH_CHAR + "*(/" + PATH_CHAR + "+)+/?");
    private static final Pattern HOME_PATH = Pattern.compile("~(/" + PATH_CHAR + "+)+/?");
    private static final Pattern SEARCH_PATH = Pattern.compile("<" + PATH_CHAR + "+(/" + PATH_CHAR + "+)*>");
    private static final Pattern URI =
            Pattern.compile("[a-zA-Z][a-zA-Z0-9+.\\-]*:[a-zA-Z0-9%/?:@&=+$,\\-_.!~*']+");
    private static final Pattern IDENT = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_'\\-]*");
    private static final Pattern FLOAT =
            Pattern.compile("(([1-9][0-9]*\\.[0-9]*)|(0?\\.[0-9]+))([Ee][+-]?[0-9]+)?");
    private static final Pattern INTEGER = Pattern.compile("[0-9]+");

    private enum Mode {
        CODE,
        STRING,
        IND_STRING
    }

    private static final class Frame {
        final Mode mode;
        final boolean interpolation;
        int braceDepth;

        Frame(Mode mode, boolean interpolation) {
            this.mode = mode;
            this.interpolation = interpolation;
        }
    }

    private final String source;
    private final List<GreenToken> tokens = new ArrayList<>();
    private final Deque<Frame> frames = new ArrayDeque<>();
    private int pos;

    private Lexer(String source) {
        this.source = source;
        this.frames.push(new Frame(Mode.CODE, false));
    }

    static List<GreenToken> tokenize(String source) {
        Lexer lexer = new Lexer(source);
        lexer.run();
        return lexer.tokens;
    }

    private void run() {
        while (pos < source.length()) {
            switch (frames.peek().mode) {
                case CODE -> lexCode();
                case STRING -> lexString();
                case IND_STRING -> lexIndentedString();
            }
        }
    }

    // --- Code mode ---

    private void lexCode() {
        char c = source.charAt(pos);

        if (Character.isWhitespace(c)) {
            int start = pos;
            while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
                pos++;
            }
            emit(SyntaxKind.TOKEN_WHITESPACE, start);
            return;
        }
        if (c == '#') {
            int start = pos;
            while (pos < source.length() && source.charAt(pos) != '\n') {
                pos++;
            }
            emit(SyntaxKind.TOKEN_COMMENT, start);
            return;
        }
        if (source.startsWith("/*", pos)) {
            int start = pos;
            int end = source.indexOf("*/", pos + 2);
            pos = end < 0 ? source.length() : end + 2;
            emit(end < 0 ? SyntaxKind.TOKEN_ERROR : SyntaxKind.TOKEN_COMMENT, start);
            return;
        }
        if (c == '"') {
            single(SyntaxKind.TOKEN_STRING_START);
            frames.push(new Frame(Mode.STRING, false));
            return;
        }
        if (source.startsWith("''", pos)) {
            int start = pos;
            pos += 2;
            emit(SyntaxKind.TOKEN_STRING_START, start);
            frames.push(new Frame(Mode.IND_STRING, false));
            return;
        }
        if (source.startsWith("${", pos)) {
            int start = pos;
            pos += 2;
            emit(SyntaxKind.TOKEN_INTERPOL_START, start);
            frames.push(new Frame(Mode.CODE, true));
            return;
        }
        if (c == '{') {
            frames.peek().braceDepth++;
            single(SyntaxKind.TOKEN_L_BRACE);
            return;
        }
        if (c == '}') {
            Frame frame = frames.peek();
            if (frame.braceDepth == 0 && frame.interpolation) {
                frames.pop();
                single(SyntaxKind.TOKEN_INTERPOL_END);
            } else {
                frame.braceDepth = Math.max(0, frame.braceDepth - 1);
                single(SyntaxKind.TOKEN_R_BRACE);
            }
            return;
        }
        if (match(SEARCH_PATH) || match(HOME_PATH) || match(PATH)) {
            return;
        }
        if (Character.isLetter(c) && match(URI, SyntaxKind.TOKEN_URI)) {
            return;
        }
        if (Character.isLetter(c) || c == '_') {
            int start = pos;
            Matcher m = IDENT.matcher(source).region(pos, source.length());
            if (m.lookingAt()) {
                pos = m.end();
                SyntaxKind keyword = SyntaxKind.keyword(source.substring(start, pos));
                emit(keyword != null ? keyword : SyntaxKind.TOKEN_IDENT, start);
                return;
            }
        }
        if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
            if (match(FLOAT, SyntaxKind.TOKEN_FLOAT) || match(INTEGER, SyntaxKind.TOKEN_INTEGER)) {
                return;
            }
        }
        lexOperator(c);
    }

    private void lexOperator(char c) {
        if (source.startsWith("...", pos)) {
            fixed(SyntaxKind.TOKEN_ELLIPSIS, 3);
            return;
        }
        String two = pos + 2 <= source.length() ? source.substring(pos, pos + 2) : "";
        SyntaxKind twoKind =
                switch (two) {
                    case "++" -> SyntaxKind.TOKEN_CONCAT;
                    case "//" -> SyntaxKind.TOKEN_UPDATE;
                    case "==" -> SyntaxKind.TOKEN_EQUAL;
                    case "!=" -> SyntaxKind.TOKEN_NOT_EQUAL;
                    case "<=" -> SyntaxKind.TOKEN_LESS_OR_EQ;
                    case ">=" -> SyntaxKind.TOKEN_MORE_OR_EQ;
                    case "&&" -> SyntaxKind.TOKEN_AND_AND;
                    case "||" -> SyntaxKind.TOKEN_OR_OR;
                    case "->" -> SyntaxKind.TOKEN_IMPLICATION;
                    case "|>" -> SyntaxKind.TOKEN_PIPE_RIGHT;
                    case "<|" -> SyntaxKind.TOKEN_PIPE_LEFT;
                    default -> null;
                };
        if (twoKind != null) {
            fixed(twoKind, 2);
            return;
        }
        SyntaxKind oneKind =
                switch (c) {
                    case '[' -> SyntaxKind.TOKEN_L_BRACK;
                    case ']' -> SyntaxKind.TOKEN_R_BRACK;
                    case '(' -> SyntaxKind.TOKEN_L_PAREN;
                    case ')' -> SyntaxKind.TOKEN_R_PAREN;
                    case ';' -> SyntaxKind.TOKEN_SEMICOLON;
                    case ':' -> SyntaxKind.TOKEN_COLON;
                    case ',' -> SyntaxKind.TOKEN_COMMA;
                    case '.' -> SyntaxKind.TOKEN_DOT;
                    case '=' -> SyntaxKind.TOKEN_ASSIGN;
                    case '@' -> SyntaxKind.TOKEN_AT;
                    case '?' -> SyntaxKind.TOKEN_QUESTION;
                    case '+' -> SyntaxKind.TOKEN_ADD;
                    case '-' -> SyntaxKind.TOKEN_SUB;
                    case '*' -> SyntaxKind.TOKEN_MUL;
                    case '/' -> SyntaxKind.TOKEN_DIV;
                    case '<' -> SyntaxKind.TOKEN_LESS;
                    case '>' -> SyntaxKind.TOKEN_MORE;
                    case '!' -> SyntaxKind.TOKEN_INVERT;
                    default -> SyntaxKind.TOKEN_ERROR;
                };
        single(oneKind);
    }

    // --- String modes ---

    private void lexString() {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '"') {
                flushContent(start);
                single(SyntaxKind.TOKEN_STRING_END);
                frames.pop();
                return;
            }
            if (c == '\\') {
                pos = Math.min(source.length(), pos + 2);
                continue;
            }
            if (source.startsWith("$${", pos)) {
                pos += 3;
                continue;
            }
            if (source.startsWith("${", pos)) {
                flushContent(start);
                enterInterpolation();
                return;
            }
            pos++;
        }
        flushContent(start);
    }

    private void lexIndentedString() {
        int start = pos;
        while (pos < source.length()) {
            if (source.startsWith("'''", pos) || source.startsWith("''$", pos)) {
                pos += 3;
                continue;
            }
            if (source.startsWith("''\\", pos)) {
                pos = Math.min(source.length(), pos + 4);
                continue;
            }
            if (source.startsWith("''", pos)) {
                flushContent(start);
                fixed(SyntaxKind.TOKEN_STRING_END, 2);
                frames.pop();
                return;
            }
            if (source.startsWith("$${", pos)) {
                pos += 3;
                continue;
            }
            if (source.startsWith("${", pos)) {
                flushContent(start);
                enterInterpolation();
                return;
            }
            pos++;
        }
        flushContent(start);
    }

    private void enterInterpolation() {
        fixed(SyntaxKind.TOKEN_INTERPOL_START, 2);
        frames.push(new Frame(Mode.CODE, true));
    }

    private void flushContent(int start) {
        if (pos > start) {
            emit(SyntaxKind.TOKEN_STRING_CONTENT, start);
        }
    }

    // --- Helpers ---

    private boolean match(Pattern pattern) {
        return match(pattern, SyntaxKind.TOKEN_PATH);
    }

    private boolean match(Pattern pattern, SyntaxKind kind) {
        Matcher m = pattern.matcher(source).region(pos, source.length());
        if (!m.lookingAt()) {
            return false;
        }
        int start = pos;
        pos = m.end();
        emit(kind, start);
        return true;
    }

    private void single(SyntaxKind kind) {
        fixed(kind, 1);
    }

    private void fixed(SyntaxKind kind, int length) {
        int start = pos;
        pos += length;
        emit(kind, start);
    }

    private void emit(SyntaxKind kind, int start) {
        tokens.add(new GreenToken(kind, source.substring(start, pos)));
    }
}
