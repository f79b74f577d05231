package io.flakeedit.core.validate;

import java.util.Objects;

/** A problem found in a manifest by {@link Validator}. */
public sealed interface ValidationError permits ValidationError.ParseError, ValidationError.DuplicateAttribute {

    /** Human-readable description including the location. */
    String describe();

    /** A syntax error reported by the parser. */
    record ParseError(String message, Location location) implements ValidationError {

        public ParseError {
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(location, "location");
        }

        @Override
        public String describe() {
            return "parse error at " + location + ": " + message;
        }
    }

    /**
     * The same attribute path bound twice in one attribute set.
     *
     * @param path      dotted path as written, string segments unquoted
     * @param first     where the path was first bound
     * @param duplicate where it was bound again
     */
    record DuplicateAttribute(String path, Location first, Location duplicate) implements ValidationError {

        @Override
        public String describe() {
            return "duplicate attribute '" + path + "' at " + duplicate + " (first defined at " + first + ")";
        }
    }
}
