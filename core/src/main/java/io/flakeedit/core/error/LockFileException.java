package io.flakeedit.core.error;

/** Thrown when a {@code flake.lock} file cannot be read or has an unexpected structure. */
public final class LockFileException extends LoadException {

    private static final long serialVersionUID = 1L;

    public LockFileException(String message, String source) {
        super(message, source);
    }

    public LockFileException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
