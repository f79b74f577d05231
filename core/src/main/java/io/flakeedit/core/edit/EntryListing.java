package io.flakeedit.core.edit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.flakeedit.core.model.Alias;
import io.flakeedit.core.model.Entry;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders a registry snapshot for display. Every format lists entries sorted by id.
 *
 * <ul>
 * <li>{@link Format#SIMPLE}: one id per line, followed by {@code id.child} for each nested
 * alias</li>
 * <li>{@link Format#TOPLEVEL}: one id per line</li>
 * <li>{@link Format#DETAILED}: {@code · id - url} with indented {@code child => target}
 * lines</li>
 * <li>{@link Format#JSON}: an object keyed by id</li>
 * </ul>
 */
public final class EntryListing {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String ALIAS_INDENT = " ".repeat(5);

    public enum Format {
        SIMPLE,
        TOPLEVEL,
        DETAILED,
        JSON
    }

    private EntryListing() {}

    public static String render(Map<String, Entry> entries, Format format) {
        Map<String, Entry> sorted = new TreeMap<>(entries);
        return switch (format) {
            case SIMPLE -> simple(sorted);
            case TOPLEVEL -> String.join("\n", sorted.keySet());
            case DETAILED -> detailed(sorted);
            case JSON -> json(sorted);
        };
    }

    private static String simple(Map<String, Entry> entries) {
        List<String> lines = new ArrayList<>();
        for (Entry entry : entries.values()) {
            lines.add(entry.id());
            for (Alias alias : entry.follows()) {
                if (alias instanceof Alias.Indirect indirect) {
                    lines.add(entry.id() + "." + indirect.from());
                }
            }
        }
        return String.join("\n", lines);
    }

    private static String detailed(Map<String, Entry> entries) {
        List<String> lines = new ArrayList<>();
        for (Entry entry : entries.values()) {
            lines.add("· " + entry.id() + " - " + entry.url());
            for (Alias alias : entry.follows()) {
                if (alias instanceof Alias.Indirect indirect) {
                    lines.add(ALIAS_INDENT + indirect.from() + " => " + indirect.target());
                }
            }
        }
        return String.join("\n", lines);
    }

    private static String json(Map<String, Entry> entries) {
        ObjectNode root = MAPPER.createObjectNode();
        entries.forEach((id, entry) -> root.set(id, entryNode(entry)));
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static ObjectNode entryNode(Entry entry) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", entry.id());
        node.put("url", entry.url());
        node.put("flake", entry.flake());
        ArrayNode follows = node.putArray("follows");
        for (Alias alias : entry.follows()) {
            ObjectNode edge = follows.addObject();
            edge.put("from", alias.from());
            if (alias instanceof Alias.Indirect indirect) {
                edge.put("target", indirect.target());
            } else if (alias instanceof Alias.Direct direct) {
                edge.set("entry", entryNode(direct.entry()));
            }
        }
        ObjectNode range = node.putObject("range");
        range.put("start", entry.range().start());
        range.put("end", entry.range().end());
        return node;
    }
}
