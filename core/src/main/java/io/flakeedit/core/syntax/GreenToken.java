package io.flakeedit.core.syntax;

import java.util.Objects;

/** Leaf of the green tree: a kind plus the exact source text. */
public final class GreenToken implements GreenElement {

    private final SyntaxKind kind;
    private final String text;

    public GreenToken(SyntaxKind kind, String text) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
        if (!kind.isToken()) {
            throw new IllegalArgumentException("Not a token kind: " + kind);
        }
    }

    /** Creates a whitespace token, e.g. a newline plus indentation. */
    public static GreenToken whitespace(String text) {
        return new GreenToken(SyntaxKind.TOKEN_WHITESPACE, text);
    }

    @Override
    public SyntaxKind kind() {
        return kind;
    }

    @Override
    public int textLength() {
        return text.length();
    }

    @Override
    public void writeTo(StringBuilder out) {
        out.append(text);
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GreenToken that)) return false;
        return kind == that.kind && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text);
    }

    @Override
    public String toString() {
        return kind + "@" + text;
    }
}
