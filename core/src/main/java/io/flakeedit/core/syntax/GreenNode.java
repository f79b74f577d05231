package io.flakeedit.core.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Interior node of the green tree.
 *
 * <p>
 * Instances are immutable. The edit operations ({@link #replaceChild},
 * {@link #insertChild}, {@link #removeChild}) return a new node whose child
 * list references the same element instances for every untouched position,
 * so editing a deep node only reallocates the nodes on the path to the root.
 */
public final class GreenNode implements GreenElement {

    private final SyntaxKind kind;
    private final List<GreenElement> children;
    private final int textLength;

    public GreenNode(SyntaxKind kind, List<? extends GreenElement> children) {
        this.kind = Objects.requireNonNull(kind, "kind");
        if (!kind.isNode()) {
            throw new IllegalArgumentException("Not a node kind: " + kind);
        }
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        int length = 0;
        for (GreenElement child : this.children) {
            length += child.textLength();
        }
        this.textLength = length;
    }

    @Override
    public SyntaxKind kind() {
        return kind;
    }

    /** Direct children, tokens included, in source order. */
    public List<GreenElement> children() {
        return children;
    }

    @Override
    public int textLength() {
        return textLength;
    }

    @Override
    public void writeTo(StringBuilder out) {
        for (GreenElement child : children) {
            child.writeTo(out);
        }
    }

    public GreenNode replaceChild(int index, GreenElement replacement) {
        Objects.checkIndex(index, children.size());
        List<GreenElement> copy = new ArrayList<>(children);
        copy.set(index, replacement);
        return new GreenNode(kind, copy);
    }

    /** Inserts {@code element} so that it ends up at {@code index}. */
    public GreenNode insertChild(int index, GreenElement element) {
        if (index < 0 || index > children.size()) {
            throw new IndexOutOfBoundsException("Insert index " + index + " out of bounds for " + children.size());
        }
        List<GreenElement> copy = new ArrayList<>(children);
        copy.add(index, element);
        return new GreenNode(kind, copy);
    }

    public GreenNode removeChild(int index) {
        Objects.checkIndex(index, children.size());
        List<GreenElement> copy = new ArrayList<>(children);
        copy.remove(index);
        return new GreenNode(kind, copy);
    }

    @Override
    public String toString() {
        return kind + "@" + textLength;
    }
}
