package io.flakeedit.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * One declared dependency of a manifest.
 *
 * @param id      key of the entry in its declaring scope
 * @param url     the raw location expression, quotes included (e.g. {@code "github:nixos/nixpkgs"})
 * @param flake   {@code false} when the dependency is not itself a flake
 * @param follows alias edges whose source is this entry, sorted by {@link Alias#ORDER}
 * @param range   char range of the url value in the source it was read from
 */
public record Entry(String id, String url, boolean flake, List<Alias> follows, Range range) {

    public Entry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(range, "range");
        follows = List.copyOf(follows);
    }

    /** A placeholder for an entry known only through an alias so far. */
    public static Entry stub(String id) {
        return new Entry(id, "", true, List.of(), Range.EMPTY);
    }

    public static Entry withUrl(String id, String url, Range range) {
        return new Entry(id, url, true, List.of(), range);
    }

    /** The url with surrounding double quotes removed. */
    public String plainUrl() {
        return unquote(url);
    }

    public Entry withFlake(boolean flake) {
        return new Entry(id, url, flake, follows, range);
    }

    /** Adds {@code alias}, keeping the list sorted and deduplicated. */
    public Entry withAlias(Alias alias) {
        TreeSet<Alias> sorted = new TreeSet<>(Alias.ORDER);
        sorted.addAll(follows);
        sorted.add(alias);
        return new Entry(id, url, flake, new ArrayList<>(sorted), range);
    }

    /**
     * Folds a later sighting of the same entry into this one. A non-empty url replaces the current
     * one together with its range; {@code flake = false} is sticky; aliases are unioned.
     */
    public Entry merge(Entry other) {
        String mergedUrl = other.url.isEmpty() ? url : other.url;
        Range mergedRange = other.url.isEmpty() ? range : other.range;
        TreeSet<Alias> sorted = new TreeSet<>(Alias.ORDER);
        sorted.addAll(follows);
        sorted.addAll(other.follows);
        return new Entry(id, mergedUrl, flake && other.flake, new ArrayList<>(sorted), mergedRange);
    }

    static String unquote(String text) {
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }
}
