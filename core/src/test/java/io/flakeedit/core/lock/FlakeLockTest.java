package io.flakeedit.core.lock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flakeedit.core.error.LockFileException;
import io.flakeedit.core.testkit.Fixtures;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class FlakeLockTest {

    private static FlakeLock lock;

    @BeforeAll
    static void readFixture() {
        lock = FlakeLock.read(Fixtures.read("flake.lock"));
    }

    @Test
    void rootAndVersion() {
        assertThat(lock.root()).isEqualTo("root");
        assertThat(lock.version()).isEqualTo(7);
    }

    @Test
    void topLevelInputsInFileOrder() {
        assertThat(lock.topLevelInputs()).containsExactly("crane", "nixpkgs", "treefmt-nix");
    }

    @Test
    void nestedInputsRecordFollows() {
        assertThat(lock.nestedInputs())
                .containsExactly(
                        new NestedInput("crane.nixpkgs", "nixpkgs"),
                        new NestedInput("treefmt-nix.nixpkgs", null));

        NestedInput treefmt = lock.nestedInputs().get(1);
        assertThat(treefmt.parent()).isEqualTo("treefmt-nix");
        assertThat(treefmt.name()).isEqualTo("nixpkgs");
        assertThat(treefmt.follows()).isEmpty();
    }

    @Test
    void followsPathJoinsSegments() {
        FlakeLock deep = FlakeLock.read("""
                {
                  "nodes": {
                    "root": { "inputs": { "a": "a" } },
                    "a": { "inputs": { "b": ["c", "d"] } }
                  },
                  "root": "root",
                  "version": 7
                }
                """);

        assertThat(deep.nestedInputs()).containsExactly(new NestedInput("a.b", "c/d"));
    }

    @Nested
    @DisplayName("revisionOf")
    class Revision {

        @Test
        void lockedRevision() {
            assertThat(lock.revisionOf("nixpkgs")).isEqualTo("ad0b5eed1b6031efaed382844806550c3dcb4206");
        }

        @Test
        void unknownInput() {
            assertThatThrownBy(() -> lock.revisionOf("missing"))
                    .isInstanceOf(LockFileException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        void followingInputHasNoRevision() {
            FlakeLock following = FlakeLock.read(
                    "{\"nodes\":{\"root\":{\"inputs\":{\"a\":[\"b\"]}}},\"root\":\"root\",\"version\":7}");

            assertThatThrownBy(() -> following.revisionOf("a")).isInstanceOf(LockFileException.class);
        }
    }

    @Nested
    @DisplayName("malformed files")
    class Malformed {

        @ParameterizedTest
        @ValueSource(
                strings = {
                    "not json",
                    "[]",
                    "{\"root\":\"root\"}",
                    "{\"nodes\":{}}",
                    "{\"nodes\":{\"other\":{}},\"root\":\"root\"}"
                })
        void areRejected(String json) {
            assertThatThrownBy(() -> FlakeLock.read(json))
                    .isInstanceOf(LockFileException.class)
                    .satisfies(e -> assertThat(((LockFileException) e).source()).isEqualTo("<inline>"));
        }

        @Test
        void missingFileNamesThePath(@TempDir Path dir) {
            Path path = dir.resolve("flake.lock");

            assertThatThrownBy(() -> FlakeLock.read(path))
                    .isInstanceOf(LockFileException.class)
                    .satisfies(e -> assertThat(((LockFileException) e).source()).isEqualTo(path.toString()));
        }

        @Test
        void readsFromDisk(@TempDir Path dir) throws Exception {
            Path path = Files.writeString(dir.resolve("flake.lock"), Fixtures.read("flake.lock"));

            assertThat(FlakeLock.read(path).topLevelInputs()).hasSize(3);
        }
    }
}
