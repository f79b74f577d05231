package io.flakeedit.core.error;

import io.flakeedit.core.syntax.SyntaxKind;

/** Thrown when a node of one kind is found where another was required. */
public final class UnexpectedNodeKindException extends WalkerException {

    private static final long serialVersionUID = 1L;

    private final SyntaxKind expected;
    private final SyntaxKind found;

    public UnexpectedNodeKindException(SyntaxKind expected, SyntaxKind found) {
        super("Expected " + expected + ", found " + found, null);
        this.expected = expected;
        this.found = found;
    }

    public SyntaxKind expected() {
        return expected;
    }

    public SyntaxKind found() {
        return found;
    }
}
