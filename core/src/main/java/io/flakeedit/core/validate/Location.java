package io.flakeedit.core.validate;

/** A 1-indexed position in source text. */
public record Location(int line, int column) {

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
