package io.flakeedit.core.error;

/**
 * Abstract parent for precondition failures of an edit request. These are detected before the
 * tree is touched, so the session is left unchanged when one is thrown.
 */
public abstract class EditException extends FlakeEditException {

    private static final long serialVersionUID = 1L;

    protected EditException(String message, String inputId) {
        super(message, inputId, Phase.EDIT);
    }
}
