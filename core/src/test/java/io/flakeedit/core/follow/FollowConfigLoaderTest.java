package io.flakeedit.core.follow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flakeedit.core.error.ConfigLoadException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class FollowConfigLoaderTest {

    private static final String FULL = """
            [follow]
            ignore = ["crane.nixpkgs", "systems"]
            transitive_min = 3

            [follow.aliases]
            nixpkgs = ["nixpkgs-lib"]
            """;

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        void everyKey() {
            FollowConfig config = FollowConfigLoader.parse(FULL, "test.toml");

            assertThat(config.ignore()).containsExactly("crane.nixpkgs", "systems");
            assertThat(config.transitiveMin()).isEqualTo(3);
            assertThat(config.aliases()).isEqualTo(Map.of("nixpkgs", List.of("nixpkgs-lib")));
        }

        @Test
        void missingFollowTableMeansDefaults() {
            assertThat(FollowConfigLoader.parse("# nothing here\n", "test.toml")).isEqualTo(FollowConfig.defaults());
        }

        @Test
        void partialTableKeepsOtherDefaults() {
            FollowConfig config = FollowConfigLoader.parse("[follow]\nignore = [\"systems\"]\n", "test.toml");

            assertThat(config.ignore()).containsExactly("systems");
            assertThat(config.transitiveMin()).isEqualTo(FollowConfig.DEFAULT_TRANSITIVE_MIN);
        }

        @ParameterizedTest
        @ValueSource(
                strings = {
                    "[follow\n",
                    "[other]\nkey = 1\n",
                    "[follow]\nunknown = 1\n",
                    "[follow]\nignore = \"systems\"\n",
                    "[follow]\nignore = [1, 2]\n",
                    "[follow]\ntransitive_min = -1\n",
                    "[follow]\ntransitive_min = \"two\"\n",
                    "[follow]\naliases = [\"x\"]\n",
                    "follow = 1\n"
                })
        void invalidContentIsAnError(String toml) {
            assertThatThrownBy(() -> FollowConfigLoader.parse(toml, "bad.toml"))
                    .isInstanceOf(ConfigLoadException.class)
                    .satisfies(e -> assertThat(((ConfigLoadException) e).source()).isEqualTo("bad.toml"));
        }
    }

    @Nested
    @DisplayName("search order")
    class SearchOrder {

        @Test
        void projectFileInAnAncestor(@TempDir Path dir) throws Exception {
            Files.writeString(dir.resolve("flake-edit.toml"), FULL);
            Path nested = Files.createDirectories(dir.resolve("a/b"));

            assertThat(FollowConfigLoader.projectConfig(nested)).contains(dir.resolve("flake-edit.toml"));
            assertThat(FollowConfigLoader.load(nested, name -> null).transitiveMin()).isEqualTo(3);
        }

        @Test
        void hiddenProjectFile(@TempDir Path dir) throws Exception {
            Files.writeString(dir.resolve(".flake-edit.toml"), "[follow]\ntransitive_min = 0\n");

            assertThat(FollowConfigLoader.load(dir, name -> null).transitiveMin()).isZero();
        }

        @Test
        void xdgConfigHome(@TempDir Path dir) throws Exception {
            Path project = Files.createDirectories(dir.resolve("project"));
            Path xdg = Files.createDirectories(dir.resolve("xdg/flake-edit"));
            Files.writeString(xdg.resolve("config.toml"), "[follow]\nignore = [\"systems\"]\n");
            Map<String, String> env = Map.of("XDG_CONFIG_HOME", dir.resolve("xdg").toString());

            assertThat(FollowConfigLoader.load(project, env::get).ignore()).containsExactly("systems");
        }

        @Test
        void homeConfigWhenXdgIsUnset(@TempDir Path dir) throws Exception {
            Path project = Files.createDirectories(dir.resolve("project"));
            Path config = Files.createDirectories(dir.resolve("home/.config/flake-edit"));
            Files.writeString(config.resolve("config.toml"), "[follow]\ntransitive_min = 5\n");
            Map<String, String> env = Map.of("HOME", dir.resolve("home").toString());

            assertThat(FollowConfigLoader.load(project, env::get).transitiveMin()).isEqualTo(5);
        }

        @Test
        void projectFileWinsOverUserFile(@TempDir Path dir) throws Exception {
            Path project = Files.createDirectories(dir.resolve("project"));
            Files.writeString(project.resolve("flake-edit.toml"), "[follow]\ntransitive_min = 1\n");
            Path xdg = Files.createDirectories(dir.resolve("xdg/flake-edit"));
            Files.writeString(xdg.resolve("config.toml"), "[follow]\ntransitive_min = 9\n");
            Map<String, String> env = Map.of("XDG_CONFIG_HOME", dir.resolve("xdg").toString());

            assertThat(FollowConfigLoader.load(project, env::get).transitiveMin()).isEqualTo(1);
        }

        @Test
        void nothingFoundMeansDefaults(@TempDir Path dir) {
            assertThat(FollowConfigLoader.load(dir, name -> null)).isEqualTo(FollowConfig.defaults());
        }

        @Test
        void explicitFileMustExist(@TempDir Path dir) {
            assertThatThrownBy(() -> FollowConfigLoader.loadFile(dir.resolve("missing.toml")))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("not found");
        }
    }
}
