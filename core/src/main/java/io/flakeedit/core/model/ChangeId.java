package io.flakeedit.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Dot-path address of a change target: {@code parent} for a top-level entry or
 * {@code parent.nested} for a nested input of {@code parent}. Only the first dot splits.
 */
public record ChangeId(String value) {

    public ChangeId {
        Objects.requireNonNull(value, "value");
    }

    public static ChangeId of(String value) {
        return new ChangeId(value);
    }

    /** Text before the first dot, or the whole id. */
    public String input() {
        int dot = value.indexOf('.');
        return dot < 0 ? value : value.substring(0, dot);
    }

    /** Text after the first dot, if any. */
    public Optional<String> follows() {
        int dot = value.indexOf('.');
        return dot < 0 ? Optional.empty() : Optional.of(value.substring(dot + 1));
    }

    public boolean isNested() {
        return value.indexOf('.') >= 0;
    }

    /**
     * Matches an entry {@code input} and an optional nested name. A plain id matches any nested
     * name of its entry; a dotted id requires the nested name to be equal too.
     */
    public boolean matchesWithFollows(String input, String follows) {
        if (!input().equals(input)) {
            return false;
        }
        return follows().map(f -> f.equals(follows)).orElse(true);
    }

    @Override
    public String toString() {
        return value;
    }
}
