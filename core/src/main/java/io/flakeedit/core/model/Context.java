package io.flakeedit.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The nesting path accumulated while descending into a block-style entry. The first segment is
 * the id of the top-level entry that owns everything below it.
 */
public final class Context {

    private final List<String> segments;

    private Context(List<String> segments) {
        this.segments = List.copyOf(segments);
    }

    public static Context of(String... segments) {
        return new Context(List.of(segments));
    }

    /** A new context with {@code segment} appended. */
    public Context push(String segment) {
        List<String> next = new ArrayList<>(segments);
        next.add(segment);
        return new Context(next);
    }

    public Optional<String> first() {
        return segments.isEmpty() ? Optional.empty() : Optional.of(segments.get(0));
    }

    public List<String> segments() {
        return segments;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Context that && segments.equals(that.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return String.join(".", segments);
    }
}
