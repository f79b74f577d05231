package io.flakeedit.core.follow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import io.flakeedit.core.error.ConfigLoadException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link FollowConfig} from TOML.
 *
 * <p>
 * Without an explicit path the first existing file wins:
 * <ol>
 * <li>{@code flake-edit.toml} or {@code .flake-edit.toml} in the working directory or any of its
 * ancestors</li>
 * <li>{@code $XDG_CONFIG_HOME/flake-edit/config.toml}, or
 * {@code $HOME/.config/flake-edit/config.toml} when {@code XDG_CONFIG_HOME} is unset</li>
 * </ol>
 * When none exists the defaults apply. A file that exists but has invalid syntax or unknown keys
 * is an error, never silently ignored.
 *
 * <pre>
 * [follow]
 * ignore = ["crane.nixpkgs", "systems"]
 * transitive_min = 2
 *
 * [follow.aliases]
 * nixpkgs = ["nixpkgs-lib"]
 * </pre>
 */
public final class FollowConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(FollowConfigLoader.class);

    private static final TomlMapper TOML_MAPPER = new TomlMapper();
    private static final List<String> PROJECT_FILE_NAMES = List.of("flake-edit.toml", ".flake-edit.toml");
    private static final Set<String> TOP_LEVEL_KEYS = Set.of("follow");
    private static final Set<String> FOLLOW_KEYS = Set.of("ignore", "transitive_min", "aliases");

    private FollowConfigLoader() {
        // utility class
    }

    /** Loads using the search order, reading the environment from {@link System#getenv}. */
    public static FollowConfig load(Path workingDirectory) {
        return load(workingDirectory, System::getenv);
    }

    /**
     * Loads using the search order.
     *
     * @param workingDirectory directory the project search starts from
     * @param envLookup        environment variable lookup; {@code null} means unset
     * @throws ConfigLoadException if the file found is malformed
     */
    public static FollowConfig load(Path workingDirectory, Function<String, String> envLookup) {
        Optional<Path> path = projectConfig(workingDirectory).or(() -> userConfig(envLookup));
        if (path.isEmpty()) {
            LOG.debug("No configuration file found, using defaults");
            return FollowConfig.defaults();
        }
        return loadFile(path.get());
    }

    /**
     * Loads an explicitly named file.
     *
     * @throws ConfigLoadException if the file is missing or malformed
     */
    public static FollowConfig loadFile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigLoadException("Configuration file not found: " + path, path.toString());
        }
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read configuration file: " + path, e, path.toString());
        }
        LOG.debug("Loading configuration from {}", path);
        return parse(content, path.toString());
    }

    /**
     * Parses TOML text.
     *
     * @param source file name used in error messages
     * @throws ConfigLoadException on invalid syntax, unknown keys or values of the wrong type
     */
    public static FollowConfig parse(String toml, String source) {
        JsonNode root;
        try {
            root = TOML_MAPPER.readTree(toml);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse configuration file '" + source + "': " + e.getMessage(), e, source);
        }
        if (root == null || root.isMissingNode()) {
            return FollowConfig.defaults();
        }
        rejectUnknown(root, TOP_LEVEL_KEYS, "", source);
        JsonNode follow = root.path("follow");
        if (follow.isMissingNode()) {
            return FollowConfig.defaults();
        }
        if (!follow.isObject()) {
            throw new ConfigLoadException("'follow' must be a table", source);
        }
        rejectUnknown(follow, FOLLOW_KEYS, "follow.", source);

        List<String> ignore = follow.has("ignore") ? strings(follow.get("ignore"), "follow.ignore", source) : List.of();
        int transitiveMin = FollowConfig.DEFAULT_TRANSITIVE_MIN;
        if (follow.has("transitive_min")) {
            JsonNode value = follow.get("transitive_min");
            if (!value.canConvertToInt() || !value.isIntegralNumber() || value.asInt() < 0) {
                throw new ConfigLoadException("'follow.transitive_min' must be a non-negative integer", source);
            }
            transitiveMin = value.asInt();
        }
        Map<String, List<String>> aliases = new LinkedHashMap<>();
        if (follow.has("aliases")) {
            JsonNode table = follow.get("aliases");
            if (!table.isObject()) {
                throw new ConfigLoadException("'follow.aliases' must be a table", source);
            }
            Iterator<Map.Entry<String, JsonNode>> fields = table.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> alias = fields.next();
                aliases.put(alias.getKey(), strings(alias.getValue(), "follow.aliases." + alias.getKey(), source));
            }
        }
        return new FollowConfig(ignore, transitiveMin, aliases);
    }

    private static void rejectUnknown(JsonNode table, Set<String> known, String prefix, String source) {
        Iterator<String> names = table.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!known.contains(name)) {
                throw new ConfigLoadException("Unknown configuration key '" + prefix + name + "'", source);
            }
        }
    }

    private static List<String> strings(JsonNode array, String key, String source) {
        if (!array.isArray()) {
            throw new ConfigLoadException("'" + key + "' must be an array of strings", source);
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : array) {
            if (!element.isTextual()) {
                throw new ConfigLoadException("'" + key + "' must be an array of strings", source);
            }
            values.add(element.asText());
        }
        return values;
    }

    static Optional<Path> projectConfig(Path start) {
        Path current = start.toAbsolutePath().normalize();
        while (current != null) {
            for (String name : PROJECT_FILE_NAMES) {
                Path candidate = current.resolve(name);
                if (Files.isRegularFile(candidate)) {
                    return Optional.of(candidate);
                }
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    static Optional<Path> userConfig(Function<String, String> envLookup) {
        Optional<Path> base = nonBlank(envLookup.apply("XDG_CONFIG_HOME"))
                .map(Path::of)
                .or(() -> nonBlank(envLookup.apply("HOME")).map(home -> Path.of(home, ".config")));
        return base.map(dir -> dir.resolve("flake-edit").resolve("config.toml")).filter(Files::isRegularFile);
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
