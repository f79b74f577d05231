package io.flakeedit.core.error;

import io.flakeedit.core.syntax.SyntaxKind;

/** Thrown when the walker is handed a node that is not the root of a parsed file. */
public final class NotARootException extends WalkerException {

    private static final long serialVersionUID = 1L;

    private final SyntaxKind kind;

    public NotARootException(SyntaxKind kind) {
        super("Expected the root of a manifest, found " + kind, null);
        this.kind = kind;
    }

    public SyntaxKind kind() {
        return kind;
    }
}
