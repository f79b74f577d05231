package io.flakeedit.core.error;

/** Thrown when a configuration file has invalid syntax or unknown keys. */
public final class ConfigLoadException extends LoadException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message, String source) {
        super(message, source);
    }

    public ConfigLoadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
