package io.flakeedit.core.syntax;

/** Half-open char range {@code [start, end)} into the source text. */
public record TextRange(int start, int end) {

    public TextRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range: " + start + ".." + end);
        }
    }

    public int length() {
        return end - start;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
