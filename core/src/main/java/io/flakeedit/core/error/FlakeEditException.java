package io.flakeedit.core.error;

/**
 * Abstract base for all flake-edit exceptions. Never thrown directly: use the concrete subclasses
 * under {@link WalkerException}, {@link EditException} or {@link LoadException}.
 */
public abstract class FlakeEditException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        WALK,
        EDIT,
        LOAD
    }

    private final String inputId;
    private final Phase phase;

    protected FlakeEditException(String message, String inputId, Phase phase) {
        super(message);
        this.inputId = inputId;
        this.phase = phase;
    }

    protected FlakeEditException(String message, Throwable cause, String inputId, Phase phase) {
        super(message, cause);
        this.inputId = inputId;
        this.phase = phase;
    }

    /** The input the failing operation addressed, or {@code null} if none. */
    public String inputId() {
        return inputId;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    public Phase phase() {
        return phase;
    }
}
