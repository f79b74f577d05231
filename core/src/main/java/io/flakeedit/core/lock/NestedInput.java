package io.flakeedit.core.lock;

import java.util.Objects;
import java.util.Optional;

/**
 * An input of a top-level dependency as recorded in the lock file.
 *
 * @param path          {@code parent.child}
 * @param followsTarget the follows path joined with {@code /} when the lock records the input as
 *                      following another node, otherwise {@code null}
 */
public record NestedInput(String path, String followsTarget) {

    public NestedInput {
        Objects.requireNonNull(path, "path");
    }

    public String parent() {
        return path.substring(0, path.indexOf('.'));
    }

    /** The nested input name, the part after the first dot. */
    public String name() {
        return path.substring(path.indexOf('.') + 1);
    }

    public Optional<String> follows() {
        return Optional.ofNullable(followsTarget);
    }
}
