package io.flakeedit.core.error;

/**
 * Abstract parent for structural errors raised while walking a manifest tree. The tree has a
 * shape the walker cannot handle; the call fails and no edit is made.
 */
public abstract class WalkerException extends FlakeEditException {

    private static final long serialVersionUID = 1L;

    protected WalkerException(String message, String inputId) {
        super(message, inputId, Phase.WALK);
    }
}
