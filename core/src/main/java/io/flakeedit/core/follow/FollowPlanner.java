package io.flakeedit.core.follow;

import io.flakeedit.core.lock.NestedInput;
import io.flakeedit.core.model.Change;
import io.flakeedit.core.model.ChangeId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Works out which nested inputs can follow a top-level entry.
 *
 * <p>
 * A nested input qualifies when the lock does not already record it as following something, it
 * is not ignored, and its name matches a top-level entry directly or through an alias.
 */
public final class FollowPlanner {

    private static final Logger LOG = LoggerFactory.getLogger(FollowPlanner.class);

    private FollowPlanner() {
        // utility class
    }

    /**
     * Plans one {@link Change.Follows} per qualifying nested input, in the order of
     * {@code nestedInputs}.
     */
    public static List<Change.Follows> plan(
            List<NestedInput> nestedInputs, Collection<String> topLevelIds, FollowConfig config) {
        List<Change.Follows> changes = new ArrayList<>();
        for (NestedInput nested : nestedInputs) {
            if (nested.follows().isPresent()) {
                continue;
            }
            if (config.isIgnored(nested.path(), nested.name())) {
                LOG.debug("Ignoring {} as configured", nested.path());
                continue;
            }
            target(nested, topLevelIds, config)
                    .ifPresent(target -> changes.add(new Change.Follows(new ChangeId(nested.path()), target)));
        }
        return changes;
    }

    /**
     * Names of nested inputs that no top-level entry covers but that at least
     * {@link FollowConfig#transitiveMin()} dependencies share. Such a name is worth declaring at
     * top level so all of them can follow it. Empty when promotion is disabled.
     */
    public static List<String> promotionCandidates(
            List<NestedInput> nestedInputs, Collection<String> topLevelIds, FollowConfig config) {
        if (config.transitiveMin() == 0) {
            return List.of();
        }
        Map<String, Integer> parents = new TreeMap<>();
        for (NestedInput nested : nestedInputs) {
            if (nested.follows().isPresent()
                    || config.isIgnored(nested.path(), nested.name())
                    || target(nested, topLevelIds, config).isPresent()) {
                continue;
            }
            String name = config.resolveAlias(nested.name()).orElse(nested.name());
            parents.merge(name, 1, Integer::sum);
        }
        List<String> candidates = new ArrayList<>();
        parents.forEach((name, count) -> {
            if (count >= config.transitiveMin()) {
                candidates.add(name);
            }
        });
        return candidates;
    }

    private static Optional<String> target(NestedInput nested, Collection<String> topLevelIds, FollowConfig config) {
        if (topLevelIds.contains(nested.name()) && !nested.name().equals(nested.parent())) {
            return Optional.of(nested.name());
        }
        for (String candidate : topLevelIds) {
            if (!candidate.equals(nested.parent()) && config.canFollow(nested.name(), candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
