package io.flakeedit.core.syntax;

/**
 * Builds well-formed green fragments by parsing small snippets.
 *
 * <p>
 * Going through the parser guarantees that a synthesized fragment has
 * exactly the shape a parsed file would have, so the walker can treat
 * inserted and original statements alike.
 */
public final class SyntaxFactory {

    private SyntaxFactory() {}

    /**
     * Parses one binding such as {@code inputs.foo.url = "bar";}.
     *
     * @return the {@link SyntaxKind#NODE_ATTRPATH_VALUE} node
     * @throws IllegalArgumentException if the text is not a single binding
     */
    public static GreenNode statement(String text) {
        SyntaxNode set = parseFragment("{ " + text + " }", SyntaxKind.NODE_ATTR_SET);
        return set.firstChild(SyntaxKind.NODE_ATTRPATH_VALUE)
                .orElseThrow(() -> new IllegalArgumentException("Not a binding: " + text))
                .green();
    }

    /** A double-quoted string literal holding {@code value} verbatim. */
    public static GreenNode quotedString(String value) {
        return parseFragment(quote(value), SyntaxKind.NODE_STRING).green();
    }

    /** A lambda pattern entry, e.g. {@code flake-utils} in {@code { self, flake-utils }:}. */
    public static GreenNode patternEntry(String name) {
        SyntaxNode lambda = parseFragment("{ " + name + " }: null", SyntaxKind.NODE_LAMBDA);
        return lambda.firstChild(SyntaxKind.NODE_PATTERN)
                .flatMap(p -> p.firstChild(SyntaxKind.NODE_PAT_ENTRY))
                .orElseThrow(() -> new IllegalArgumentException("Not a pattern entry: " + name))
                .green();
    }

    public static GreenToken whitespace(String text) {
        return GreenToken.whitespace(text);
    }

    public static GreenToken comma() {
        return new GreenToken(SyntaxKind.TOKEN_COMMA, ",");
    }

    /** Wraps {@code value} in double quotes, escaping what Nix would interpret. */
    public static String quote(String value) {
        String escaped = value.replace("\\", "\\\\").replace("\"", "\\\"").replace("${", "\\${");
        return "\"" + escaped + "\"";
    }

    private static SyntaxNode parseFragment(String text, SyntaxKind expected) {
        Parse parse = Parser.parse(text);
        if (parse.hasErrors()) {
            throw new IllegalArgumentException("Invalid fragment '" + text + "': " + parse.errors());
        }
        return parse.syntax()
                .firstChild()
                .filter(node -> node.kind() == expected)
                .orElseThrow(() -> new IllegalArgumentException("Fragment '" + text + "' is not a " + expected));
    }
}
