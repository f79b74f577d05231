package io.flakeedit.core.walk;

import java.util.List;

/**
 * Role of a binding below {@code inputs}, derived from its normalized path. Flat dotted keys and
 * nested blocks that spell the same path get the same kind.
 */
public enum BindingKind {
    /** {@code inputs} itself. */
    INPUTS,
    /** {@code inputs.<id>}, usually a block. */
    ENTRY,
    /** {@code inputs.<id>.url}. */
    URL,
    /** {@code inputs.<id>.flake}. */
    FLAKE,
    /** {@code inputs.<id>.follows}, an alias for the whole entry. */
    FOLLOWS,
    /** {@code inputs.<id>.inputs}. */
    NESTED_INPUTS,
    /** {@code inputs.<id>.inputs.<child>}. */
    NESTED_ENTRY,
    /** {@code inputs.<id>.inputs.<child>.follows}. */
    NESTED_FOLLOWS,
    /** {@code inputs.<id>.inputs.<child>.url}. */
    NESTED_URL,
    /** Anything else below an entry, e.g. {@code inputs.<id>.type}. */
    OTHER;

    static BindingKind of(List<String> path) {
        int n = path.size();
        if (n == 1) {
            return INPUTS;
        }
        if (n == 2) {
            return ENTRY;
        }
        if (n == 3) {
            return switch (path.get(2)) {
                case "url" -> URL;
                case "flake" -> FLAKE;
                case "follows" -> FOLLOWS;
                case "inputs" -> NESTED_INPUTS;
                default -> OTHER;
            };
        }
        if (!path.get(2).equals("inputs")) {
            return OTHER;
        }
        if (n == 4) {
            return NESTED_ENTRY;
        }
        if (n == 5) {
            return switch (path.get(4)) {
                case "follows" -> NESTED_FOLLOWS;
                case "url" -> NESTED_URL;
                default -> OTHER;
            };
        }
        return OTHER;
    }

    /** Kinds whose block value holds further bindings of the same entry. */
    boolean isContainer() {
        return this == INPUTS || this == ENTRY || this == NESTED_INPUTS || this == NESTED_ENTRY;
    }
}
