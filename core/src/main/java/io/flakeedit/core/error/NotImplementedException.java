package io.flakeedit.core.error;

/** Thrown for surface forms the walker deliberately does not support. */
public final class NotImplementedException extends WalkerException {

    private static final long serialVersionUID = 1L;

    private final String feature;

    public NotImplementedException(String feature, String inputId) {
        super("Not supported: " + feature, inputId);
        this.feature = feature;
    }

    public String feature() {
        return feature;
    }
}
