package io.flakeedit.core.syntax;

/**
 * A syntax problem found while parsing.
 *
 * @param message human-readable description
 * @param range   offending source range, or {@code null} when the error is
 *                at the end of input
 */
public record ParseError(String message, TextRange range) {

    @Override
    public String toString() {
        return range == null ? message + " at end of input" : message + " at " + range;
    }
}
