package io.flakeedit.core.error;

/**
 * Abstract parent for errors reading auxiliary files (lock file, configuration). Carries an
 * additional {@code source} field identifying the file or resource that caused the error.
 */
public abstract class LoadException extends FlakeEditException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected LoadException(String message, String source) {
        super(message, null, Phase.LOAD);
        this.source = source;
    }

    protected LoadException(String message, Throwable cause, String source) {
        super(message, cause, null, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
