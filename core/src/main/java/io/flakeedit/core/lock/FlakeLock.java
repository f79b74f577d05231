package io.flakeedit.core.lock;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flakeedit.core.error.LockFileException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of a {@code flake.lock} file.
 *
 * <p>
 * The lock is a JSON object with {@code nodes}, the name of the {@code root} node and a
 * {@code version}. A node's {@code inputs} map each input name either to the name of another
 * node or, for an input that follows something, to a path of input names starting at the root.
 */
public final class FlakeLock {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String INLINE_SOURCE = "<inline>";

    private final JsonNode nodes;
    private final String root;
    private final int version;
    private final String source;

    private FlakeLock(JsonNode nodes, String root, int version, String source) {
        this.nodes = nodes;
        this.root = root;
        this.version = version;
        this.source = source;
    }

    /**
     * Parses lock file content.
     *
     * @throws LockFileException if the text is not JSON or lacks {@code nodes} or {@code root}
     */
    public static FlakeLock read(String json) {
        return parse(json, INLINE_SOURCE);
    }

    /**
     * Reads and parses the lock file at {@code path}.
     *
     * @throws LockFileException if the file cannot be read or is malformed
     */
    public static FlakeLock read(Path path) {
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new LockFileException("Failed to read lock file: " + path, e, path.toString());
        }
        return parse(content, path.toString());
    }

    private static FlakeLock parse(String json, String source) {
        JsonNode tree;
        try {
            tree = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new LockFileException("Lock file is not valid JSON: " + e.getOriginalMessage(), e, source);
        }
        if (tree == null || !tree.isObject()) {
            throw new LockFileException("Lock file must contain a JSON object", source);
        }
        JsonNode nodes = tree.path("nodes");
        if (!nodes.isObject()) {
            throw new LockFileException("Lock file has no 'nodes' object", source);
        }
        JsonNode root = tree.path("root");
        if (!root.isTextual()) {
            throw new LockFileException("Lock file has no 'root' node name", source);
        }
        if (!nodes.has(root.asText())) {
            throw new LockFileException("Lock file root node '" + root.asText() + "' is missing", source);
        }
        return new FlakeLock(nodes, root.asText(), tree.path("version").asInt(0), source);
    }

    public String root() {
        return root;
    }

    public int version() {
        return version;
    }

    /**
     * The locked revision of top-level input {@code id}.
     *
     * @throws LockFileException if {@code id} is unknown, follows another input, or has no
     *                           locked revision
     */
    public String revisionOf(String id) {
        JsonNode reference = rootNode().path("inputs").path(id);
        if (reference.isMissingNode()) {
            throw new LockFileException("Could not resolve input '" + id + "' from the root node", source);
        }
        if (!reference.isTextual()) {
            throw new LockFileException("Input '" + id + "' follows another input and has no revision", source);
        }
        JsonNode rev = nodes.path(reference.asText()).path("locked").path("rev");
        if (!rev.isTextual()) {
            throw new LockFileException("Node '" + reference.asText() + "' has no locked revision", source);
        }
        return rev.asText();
    }

    /** Names of the root node's inputs, in lock file order. */
    public List<String> topLevelInputs() {
        List<String> names = new ArrayList<>();
        rootNode().path("inputs").fieldNames().forEachRemaining(names::add);
        return names;
    }

    /** Every input of every top-level dependency, sorted by path. */
    public List<NestedInput> nestedInputs() {
        List<NestedInput> result = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> topLevel = rootNode().path("inputs").fields();
        while (topLevel.hasNext()) {
            Map.Entry<String, JsonNode> input = topLevel.next();
            if (!input.getValue().isTextual()) {
                continue;
            }
            JsonNode node = nodes.path(input.getValue().asText());
            Iterator<Map.Entry<String, JsonNode>> nested = node.path("inputs").fields();
            while (nested.hasNext()) {
                Map.Entry<String, JsonNode> child = nested.next();
                String path = input.getKey() + "." + child.getKey();
                result.add(new NestedInput(path, followsPath(child.getValue()).orElse(null)));
            }
        }
        result.sort(Comparator.comparing(NestedInput::path));
        return result;
    }

    private JsonNode rootNode() {
        return nodes.path(root);
    }

    private static Optional<String> followsPath(JsonNode reference) {
        if (!reference.isArray()) {
            return Optional.empty();
        }
        List<String> segments = new ArrayList<>();
        reference.forEach(segment -> segments.add(segment.asText()));
        return Optional.of(String.join("/", segments));
    }
}
