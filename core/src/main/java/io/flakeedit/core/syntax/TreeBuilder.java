package io.flakeedit.core.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Assembles a green tree from a flat sequence of start/token/finish events.
 *
 * <p>
 * {@link #checkpoint()} remembers a position in the current node so that a
 * node can later be opened "in the past" with {@link #startNodeAt}, wrapping
 * everything emitted since. The parser uses this for left-recursive
 * constructs such as binary operators and function application.
 */
final class TreeBuilder {

    private static final class Frame {
        final SyntaxKind kind;
        final List<GreenElement> children;

        Frame(SyntaxKind kind, List<GreenElement> children) {
            this.kind = kind;
            this.children = children;
        }
    }

    private final Deque<Frame> stack = new ArrayDeque<>();
    private GreenNode finished;

    void startNode(SyntaxKind kind) {
        stack.push(new Frame(kind, new ArrayList<>()));
    }

    void startNodeAt(int checkpoint, SyntaxKind kind) {
        List<GreenElement> current = stack.peek().children;
        List<GreenElement> wrapped = new ArrayList<>(current.subList(checkpoint, current.size()));
        current.subList(checkpoint, current.size()).clear();
        stack.push(new Frame(kind, wrapped));
    }

    int checkpoint() {
        return stack.peek().children.size();
    }

    void token(GreenToken token) {
        stack.peek().children.add(token);
    }

    void finishNode() {
        Frame frame = stack.pop();
        GreenNode node = new GreenNode(frame.kind, frame.children);
        if (stack.isEmpty()) {
            finished = node;
        } else {
            stack.peek().children.add(node);
        }
    }

    GreenNode finish() {
        if (finished == null || !stack.isEmpty()) {
            throw new IllegalStateException("Unbalanced tree: " + stack.size() + " node(s) still open");
        }
        return finished;
    }
}
