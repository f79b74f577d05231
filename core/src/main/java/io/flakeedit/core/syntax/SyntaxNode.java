package io.flakeedit.core.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Positioned view over a {@link GreenNode}.
 *
 * <p>
 * Red nodes are created on demand while navigating and are cheap to discard.
 * They never change: an edit produces a new green root (see
 * {@link #replaceWith}), from which a fresh red tree is obtained with
 * {@link #newRoot(GreenNode)}.
 */
public final class SyntaxNode implements SyntaxElement {

    private final GreenNode green;
    private final SyntaxNode parent;
    private final int index;
    private final int offset;
    private List<SyntaxElement> childrenWithTokens;

    private SyntaxNode(GreenNode green, SyntaxNode parent, int index, int offset) {
        this.green = green;
        this.parent = parent;
        this.index = index;
        this.offset = offset;
    }

    /** Creates the red root for a green tree. */
    public static SyntaxNode newRoot(GreenNode green) {
        return new SyntaxNode(green, null, 0, 0);
    }

    @Override
    public SyntaxKind kind() {
        return green.kind();
    }

    @Override
    public GreenNode green() {
        return green;
    }

    @Override
    public SyntaxNode parent() {
        return parent;
    }

    @Override
    public int index() {
        return index;
    }

    @Override
    public TextRange textRange() {
        return new TextRange(offset, offset + green.textLength());
    }

    @Override
    public String text() {
        return green.text();
    }

    /** All direct children, tokens included, in source order. */
    public List<SyntaxElement> childrenWithTokens() {
        if (childrenWithTokens == null) {
            List<SyntaxElement> result = new ArrayList<>(green.children().size());
            int childOffset = offset;
            int i = 0;
            for (GreenElement child : green.children()) {
                if (child instanceof GreenNode node) {
                    result.add(new SyntaxNode(node, this, i, childOffset));
                } else {
                    result.add(new SyntaxToken((GreenToken) child, this, i, childOffset));
                }
                childOffset += child.textLength();
                i++;
            }
            childrenWithTokens = Collections.unmodifiableList(result);
        }
        return childrenWithTokens;
    }

    /** Direct child nodes only. */
    public List<SyntaxNode> children() {
        List<SyntaxNode> nodes = new ArrayList<>();
        for (SyntaxElement child : childrenWithTokens()) {
            if (child instanceof SyntaxNode node) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    /** Direct child tokens only. */
    public List<SyntaxToken> tokens() {
        List<SyntaxToken> tokens = new ArrayList<>();
        for (SyntaxElement child : childrenWithTokens()) {
            if (child instanceof SyntaxToken token) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    Optional<SyntaxElement> childAt(int i) {
        List<SyntaxElement> all = childrenWithTokens();
        if (i < 0 || i >= all.size()) {
            return Optional.empty();
        }
        return Optional.of(all.get(i));
    }

    public Optional<SyntaxNode> firstChild() {
        List<SyntaxNode> nodes = children();
        return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(0));
    }

    public Optional<SyntaxNode> lastChild() {
        List<SyntaxNode> nodes = children();
        return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(nodes.size() - 1));
    }

    /** First direct child node of the given kind. */
    public Optional<SyntaxNode> firstChild(SyntaxKind kind) {
        for (SyntaxNode child : children()) {
            if (child.kind() == kind) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /** First direct child token of the given kind. */
    public Optional<SyntaxToken> firstToken(SyntaxKind kind) {
        for (SyntaxToken token : tokens()) {
            if (token.kind() == kind) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }

    public Optional<SyntaxNode> nextSibling() {
        if (parent == null) {
            return Optional.empty();
        }
        List<SyntaxElement> siblings = parent.childrenWithTokens();
        for (int i = index + 1; i < siblings.size(); i++) {
            if (siblings.get(i) instanceof SyntaxNode node) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    public Optional<SyntaxNode> prevSibling() {
        if (parent == null) {
            return Optional.empty();
        }
        List<SyntaxElement> siblings = parent.childrenWithTokens();
        for (int i = index - 1; i >= 0; i--) {
            if (siblings.get(i) instanceof SyntaxNode node) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /** Number of nodes in this subtree, this node included. */
    public int nodeCount() {
        int count = 1;
        for (SyntaxNode child : children()) {
            count += child.nodeCount();
        }
        return count;
    }

    @Override
    public String toString() {
        return green.text();
    }
}
