package io.flakeedit.core.syntax;

import java.util.Optional;

/**
 * Positioned view ("red" element) over a {@link GreenElement}. Knows its
 * parent, its index among the parent's children and its absolute offset.
 */
public sealed interface SyntaxElement permits SyntaxNode, SyntaxToken {

    SyntaxKind kind();

    GreenElement green();

    /** The enclosing node, or {@code null} for the root. */
    SyntaxNode parent();

    /** Index among all children (tokens included) of the parent. */
    int index();

    TextRange textRange();

    String text();

    default Optional<SyntaxElement> nextSiblingOrToken() {
        SyntaxNode parent = parent();
        if (parent == null) {
            return Optional.empty();
        }
        return parent.childAt(index() + 1);
    }

    default Optional<SyntaxElement> prevSiblingOrToken() {
        SyntaxNode parent = parent();
        if (parent == null) {
            return Optional.empty();
        }
        return parent.childAt(index() - 1);
    }

    /**
     * Replaces this element by {@code replacement} and rebuilds every ancestor
     * up to the root.
     *
     * @return the green node of the new root
     */
    default GreenNode replaceWith(GreenElement replacement) {
        GreenElement current = replacement;
        SyntaxElement cursor = this;
        while (cursor.parent() != null) {
            current = cursor.parent().green().replaceChild(cursor.index(), current);
            cursor = cursor.parent();
        }
        if (!(current instanceof GreenNode root)) {
            throw new IllegalStateException("A token cannot become the root of a tree");
        }
        return root;
    }
}
