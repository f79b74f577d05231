package io.flakeedit.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One requested edit of a manifest. Values are immutable and may be applied to any number of
 * walker passes.
 */
public sealed interface Change permits Change.None, Change.Add, Change.Remove, Change.ChangeUrl, Change.Follows {

    /** Query only: walk the tree to refresh the registry, never edit. */
    None NONE = new None();

    record None() implements Change {}

    /**
     * Declares a new entry.
     *
     * @param id    entry id, {@code null} when unknown (the change is then a no-op)
     * @param uri   location to write as {@code url}, {@code null} when unknown
     * @param flake {@code false} to also write {@code flake = false;}
     */
    record Add(String id, String uri, boolean flake) implements Change {}

    /** Removes every listed entry ({@code parent}) or nested alias ({@code parent.child}). */
    record Remove(List<ChangeId> ids) implements Change {

        public Remove {
            ids = List.copyOf(ids);
        }

        public static Remove of(String... ids) {
            return new Remove(Arrays.stream(ids).map(ChangeId::new).toList());
        }
    }

    /**
     * Points an existing entry at a new location.
     *
     * @param refOrRev carried for callers; the walker ignores it
     */
    record ChangeUrl(String id, String uri, String refOrRev) implements Change {

        public ChangeUrl(String id, String uri) {
            this(id, uri, null);
        }
    }

    /**
     * Makes {@code input} follow {@code target}. {@code input} is {@code parent.child} for a
     * nested input or a bare {@code parent} for a whole-entry alias.
     */
    record Follows(ChangeId input, String target) implements Change {

        public Follows {
            Objects.requireNonNull(input, "input");
            Objects.requireNonNull(target, "target");
        }

        public static Follows of(String input, String target) {
            return new Follows(new ChangeId(input), target);
        }
    }
}
