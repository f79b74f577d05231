package io.flakeedit.core.syntax;

/**
 * Immutable, position-independent element of the green tree. Green elements
 * carry no parent pointer, so any subtree can be shared between tree versions.
 */
public sealed interface GreenElement permits GreenNode, GreenToken {

    SyntaxKind kind();

    /** Length of the source text covered by this element, in chars. */
    int textLength();

    /** Appends the exact source text of this element. */
    void writeTo(StringBuilder out);

    default String text() {
        StringBuilder out = new StringBuilder(textLength());
        writeTo(out);
        return out.toString();
    }
}
