package io.flakeedit.core.error;

/** Thrown when changing an input that is not declared. */
public final class InputNotFoundException extends EditException {

    private static final long serialVersionUID = 1L;

    public InputNotFoundException(String inputId) {
        super("Input '" + inputId + "' not found", inputId);
    }
}
