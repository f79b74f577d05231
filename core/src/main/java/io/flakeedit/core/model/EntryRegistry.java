package io.flakeedit.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Flat map of discovered entries, filled as a side effect of walking a manifest.
 *
 * <p>
 * Entries are keyed by id in discovery order. A nested alias seen before its owning entry
 * creates a stub for the owner that is completed once the owner's own declaration is visited
 * (stub-then-fill). Not thread-safe: a registry belongs to a single edit session.
 */
public final class EntryRegistry {

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /**
     * Records {@code entry}.
     *
     * <p>
     * With a context whose first segment is {@code p}, {@code id} names a nested input of
     * {@code p}: an {@link Alias.Indirect} from {@code id} to the entry's url is added to
     * {@code p} (created as a stub when unknown). Without a context the entry is merged into
     * the existing one of the same id via {@link Entry#merge(Entry)}, or inserted fresh.
     *
     * @param id      entry id, or nested input name when {@code context} is set
     * @param entry   what was found at this position
     * @param context enclosing entry context, or {@code null} at top level
     */
    public void insert(String id, Entry entry, Context context) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(entry, "entry");
        Optional<String> owner = context == null ? Optional.empty() : context.first();
        if (owner.isPresent()) {
            String parent = owner.get();
            Entry current = entries.getOrDefault(parent, Entry.stub(parent));
            entries.put(parent, current.withAlias(new Alias.Indirect(id, entry.url())));
            return;
        }
        Entry existing = entries.get(id);
        entries.put(id, existing == null ? entry : existing.merge(entry));
    }

    /** Records {@code nested} as an inline nested input of {@code owner}. */
    public void insertDirect(String owner, Entry nested) {
        Entry current = entries.getOrDefault(owner, Entry.stub(owner));
        entries.put(owner, current.withAlias(new Alias.Direct(nested.id(), nested)));
    }

    /** Marks {@code id} as a non-flake, creating a stub if the entry is not known yet. */
    public void markNonFlake(String id) {
        Entry current = entries.getOrDefault(id, Entry.stub(id));
        entries.put(id, current.withFlake(false));
    }

    public Optional<Entry> get(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    public boolean contains(String id) {
        return entries.containsKey(id);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    /** An unmodifiable copy of the current entries, in discovery order. */
    public Map<String, Entry> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }
}
