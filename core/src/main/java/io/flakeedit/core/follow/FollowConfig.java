package io.flakeedit.core.follow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Settings of the {@code follow} command.
 *
 * @param ignore        nested inputs never to touch: {@code parent.child} for one specific
 *                      input, a bare name for every nested input of that name
 * @param transitiveMin minimum number of dependencies sharing a nested input before it is worth
 *                      promoting to a top-level entry; {@code 0} disables promotion
 * @param aliases       canonical name to alternative names that may follow it, e.g.
 *                      {@code nixpkgs -> [nixpkgs-lib]}
 */
public record FollowConfig(List<String> ignore, int transitiveMin, Map<String, List<String>> aliases) {

    public static final int DEFAULT_TRANSITIVE_MIN = 2;

    public FollowConfig {
        ignore = List.copyOf(ignore);
        if (transitiveMin < 0) {
            throw new IllegalArgumentException("transitiveMin must not be negative: " + transitiveMin);
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        aliases.forEach((canonical, alternatives) -> copy.put(canonical, List.copyOf(alternatives)));
        aliases = Collections.unmodifiableMap(copy);
    }

    public static FollowConfig defaults() {
        return new FollowConfig(List.of(), DEFAULT_TRANSITIVE_MIN, Map.of());
    }

    /** Whether nested input {@code name} at {@code path} is excluded. */
    public boolean isIgnored(String path, String name) {
        for (String ignored : ignore) {
            if (ignored.contains(".") ? ignored.equals(path) : ignored.equals(name)) {
                return true;
            }
        }
        return false;
    }

    /** The canonical name {@code name} is an alternative of, if any. */
    public Optional<String> resolveAlias(String name) {
        for (Map.Entry<String, List<String>> alias : aliases.entrySet()) {
            if (alias.getValue().contains(name)) {
                return Optional.of(alias.getKey());
            }
        }
        return Optional.empty();
    }

    /** Whether a nested input called {@code nestedName} may follow top-level {@code topLevelName}. */
    public boolean canFollow(String nestedName, String topLevelName) {
        if (nestedName.equals(topLevelName)) {
            return true;
        }
        return resolveAlias(nestedName).map(topLevelName::equals).orElse(false);
    }
}
