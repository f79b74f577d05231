package io.flakeedit.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A "follows" edge whose source is the entry that holds it.
 *
 * <p>
 * Edges are plain string-keyed references. Nothing here resolves a target
 * to an {@link Entry} or checks for cycles.
 */
public sealed interface Alias permits Alias.Indirect, Alias.Direct {

    /** Total order used to keep an entry's alias list sorted and free of duplicates. */
    Comparator<Alias> ORDER = Comparator.comparing(Alias::from)
            .thenComparingInt(alias -> alias instanceof Indirect ? 0 : 1)
            .thenComparing(Alias::targetText);

    /** Name of the nested input this edge starts from. */
    String from();

    /** The target as written, used for ordering and display. */
    String targetText();

    /**
     * Nested input {@code from} resolves to the entry at {@code target}, a raw (usually quoted)
     * path such as {@code "nixpkgs"} or {@code "parent/child"}.
     */
    record Indirect(String from, String target) implements Alias {

        public Indirect {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(target, "target");
        }

        @Override
        public String targetText() {
            return target;
        }

        /** The target with surrounding double quotes removed. */
        public String unquotedTarget() {
            return Entry.unquote(target);
        }
    }

    /** Nested input {@code from} is declared inline with no external target. */
    record Direct(String from, Entry entry) implements Alias {

        public Direct {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(entry, "entry");
        }

        @Override
        public String targetText() {
            return entry.id();
        }
    }
}
