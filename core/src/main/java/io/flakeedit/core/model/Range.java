package io.flakeedit.core.model;

/** Char range {@code [start, end)} of a value in the manifest source. */
public record Range(int start, int end) {

    public static final Range EMPTY = new Range(0, 0);

    public Range {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range: " + start + ".." + end);
        }
    }
}
