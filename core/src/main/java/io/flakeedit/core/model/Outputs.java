package io.flakeedit.core.model;

import java.util.List;

/** Parameter list of the {@code outputs} function. */
public sealed interface Outputs permits Outputs.None, Outputs.Multiple, Outputs.Any {

    /** Names bound by the pattern, in source order. */
    List<String> names();

    default boolean contains(String name) {
        return names().contains(name);
    }

    /** No {@code outputs} lambda with a pattern parameter was found. */
    record None() implements Outputs {
        @Override
        public List<String> names() {
            return List.of();
        }
    }

    /** A closed pattern such as {@code { self, nixpkgs }}. */
    record Multiple(List<String> names) implements Outputs {
        public Multiple {
            names = List.copyOf(names);
        }
    }

    /** A pattern with {@code ...}, which accepts inputs it does not name. */
    record Any(List<String> names) implements Outputs {
        public Any {
            names = List.copyOf(names);
        }
    }
}
