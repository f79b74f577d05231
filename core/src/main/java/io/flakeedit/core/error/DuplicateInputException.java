package io.flakeedit.core.error;

/** Thrown when adding an input whose id is already declared. */
public final class DuplicateInputException extends EditException {

    private static final long serialVersionUID = 1L;

    public DuplicateInputException(String inputId) {
        super("Input '" + inputId + "' already exists", inputId);
    }
}
