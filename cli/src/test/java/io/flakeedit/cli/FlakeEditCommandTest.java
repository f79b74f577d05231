package io.flakeedit.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class FlakeEditCommandTest {

    private static final String FLAKE = """
            {
              inputs = {
                nixpkgs.url = "github:nixos/nixpkgs";
                crane.url = "github:ipetkov/crane";
                treefmt-nix.url = "github:numtide/treefmt-nix";
              };
              outputs = { self, nixpkgs, crane, treefmt-nix }: { };
            }
            """;

    private static final String LOCK = """
            {
              "nodes": {
                "root": { "inputs": { "crane": "crane", "nixpkgs": "nixpkgs", "treefmt-nix": "treefmt-nix" } },
                "nixpkgs": { "locked": { "rev": "ad0b5eed1b6031efaed382844806550c3dcb4206" } },
                "nixpkgs_2": { "locked": { "rev": "2741b4b489b55df32afac57bc4bfd220e8bf617e" } },
                "crane": { "inputs": { "nixpkgs": ["nixpkgs"] } },
                "treefmt-nix": { "inputs": { "nixpkgs": "nixpkgs_2" } }
              },
              "root": "root",
              "version": 7
            }
            """;

    @TempDir
    Path dir;

    private Path flake;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void writeFlake() throws IOException {
        flake = Files.writeString(dir.resolve("flake.nix"), FLAKE);
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine commandLine = FlakeEditCommand.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        List<String> all = new ArrayList<>(List.of("--flake", flake.toString()));
        all.addAll(List.of(args));
        return commandLine.execute(all.toArray(String[]::new));
    }

    private String flakeText() throws IOException {
        return Files.readString(flake);
    }

    @Nested
    @DisplayName("list")
    class ListCommand {

        @Test
        void simpleByDefault() {
            assertThat(run("list")).isZero();
            assertThat(out.toString()).isEqualTo("crane\nnixpkgs\ntreefmt-nix" + System.lineSeparator());
        }

        @Test
        void formatIsCaseInsensitive() {
            assertThat(run("list", "--format", "toplevel")).isZero();
            assertThat(out.toString()).startsWith("crane\nnixpkgs\ntreefmt-nix");
        }

        @Test
        void missingFileIsReportedWithoutStackTrace() throws IOException {
            Files.delete(flake);

            assertThat(run("list")).isEqualTo(FlakeEditCommand.FAILED);
            assertThat(err.toString())
                    .startsWith("Error: Cannot read " + flake)
                    .doesNotContain("Exception")
                    .doesNotContain("\tat ");
        }
    }

    @Nested
    @DisplayName("add")
    class AddCommand {

        @Test
        void writesTheFile() throws IOException {
            assertThat(run("add", "flake-utils", "github:numtide/flake-utils")).isZero();

            assertThat(flakeText())
                    .contains("    flake-utils.url = \"github:numtide/flake-utils\";\n    nixpkgs.url")
                    .contains("{ self, nixpkgs, crane, treefmt-nix, flake-utils }");
        }

        @Test
        void noFlakeFlag() throws IOException {
            assertThat(run("add", "--no-flake", "data", "github:a/data")).isZero();

            assertThat(flakeText()).contains("data.flake = false;");
        }

        @Test
        void diffPrintsAUnifiedPatchInsteadOfWriting() throws IOException {
            assertThat(run("--diff", "add", "flake-utils", "github:numtide/flake-utils")).isZero();

            List<String> lines = out.toString().lines().toList();
            assertThat(lines).startsWith("--- original", "+++ modified");
            assertThat(lines).anyMatch(line -> line.startsWith("@@ -"));
            assertThat(lines)
                    .contains(
                            "+    flake-utils.url = \"github:numtide/flake-utils\";",
                            "     nixpkgs.url = \"github:nixos/nixpkgs\";",
                            "-  outputs = { self, nixpkgs, crane, treefmt-nix }: { };",
                            "+  outputs = { self, nixpkgs, crane, treefmt-nix, flake-utils }: { };");
            assertThat(flakeText()).isEqualTo(FLAKE);
        }

        @Test
        void missingFlakeFileIsAnError() throws IOException {
            Files.delete(flake);

            assertThat(run("add", "flake-utils", "github:numtide/flake-utils")).isEqualTo(FlakeEditCommand.FAILED);
            assertThat(err.toString()).startsWith("Error: Cannot read " + flake);
            assertThat(Files.exists(flake)).isFalse();
        }

        @Test
        void duplicateIsReported() throws IOException {
            assertThat(run("add", "nixpkgs", "github:nixos/nixpkgs")).isEqualTo(FlakeEditCommand.FAILED);

            assertThat(err.toString()).contains("Error: Input 'nixpkgs' already exists");
            assertThat(flakeText()).isEqualTo(FLAKE);
        }

        @Test
        void invalidResultIsNotWritten() throws IOException {
            String broken = FLAKE.replace("{\n  inputs", "{\n  description = \"a\";\n  description = \"b\";\n  inputs");
            Files.writeString(flake, broken);

            assertThat(run("add", "flake-utils", "github:numtide/flake-utils")).isEqualTo(FlakeEditCommand.FAILED);

            assertThat(err.toString())
                    .contains("There are errors in the changes:")
                    .contains("duplicate attribute 'description'")
                    .contains("The changes have not been applied.");
            assertThat(flakeText()).isEqualTo(broken);
        }
    }

    @Nested
    @DisplayName("remove and change")
    class RemoveAndChange {

        @Test
        void removeSeveral() throws IOException {
            assertThat(run("remove", "crane", "treefmt-nix")).isZero();

            assertThat(flakeText())
                    .doesNotContain("crane")
                    .doesNotContain("treefmt-nix")
                    .contains("{ self, nixpkgs }");
        }

        @Test
        void removeUnknown() {
            assertThat(run("remove", "missing")).isEqualTo(FlakeEditCommand.FAILED);
            assertThat(err.toString()).contains("No input named missing");
        }

        @Test
        void changeUrl() throws IOException {
            assertThat(run("change", "nixpkgs", "github:nixos/nixpkgs/nixos-24.05")).isZero();

            assertThat(flakeText()).contains("nixpkgs.url = \"github:nixos/nixpkgs/nixos-24.05\";");
        }

        @Test
        void changeUnknown() {
            assertThat(run("change", "missing", "github:a/b")).isEqualTo(FlakeEditCommand.FAILED);
            assertThat(err.toString()).contains("Error: ").contains("missing");
        }
    }

    @Nested
    @DisplayName("follow")
    class FollowCommand {

        @Test
        void manual() throws IOException {
            assertThat(run("follow", "crane.nixpkgs", "nixpkgs")).isZero();

            assertThat(flakeText())
                    .contains("    crane.url = \"github:ipetkov/crane\";\n    crane.inputs.nixpkgs.follows = \"nixpkgs\";\n");
        }

        @Test
        void manualNeedsTwoArguments() {
            assertThat(run("follow", "crane.nixpkgs")).isEqualTo(FlakeEditCommand.FAILED);
            assertThat(err.toString()).contains("Expected INPUT and TARGET, or --auto");
        }

        @Test
        void manualNoOpExplainsTheAddress() {
            assertThat(run("follow", "missing.nixpkgs", "nixpkgs")).isEqualTo(FlakeEditCommand.FAILED);
            assertThat(err.toString()).contains("parent.child");
        }

        @Test
        void autoFollowsFromTheLockFile() throws IOException {
            Path lock = Files.writeString(dir.resolve("flake.lock"), LOCK);
            Path config = Files.writeString(dir.resolve("flake-edit.toml"), "[follow]\ntransitive_min = 0\n");

            int code = run("--lock", lock.toString(), "--config", config.toString(), "follow", "--auto");

            assertThat(code).isZero();
            assertThat(out.toString()).contains("Added follows: treefmt-nix.inputs.nixpkgs.follows = \"nixpkgs\"");
            assertThat(flakeText()).contains("    treefmt-nix.inputs.nixpkgs.follows = \"nixpkgs\";\n");
            assertThat(flakeText()).doesNotContain("crane.inputs.nixpkgs.follows");
        }

        @Test
        void autoWithNothingToDo() throws IOException {
            Path lock = Files.writeString(dir.resolve("flake.lock"), LOCK);
            Path config = Files.writeString(dir.resolve("flake-edit.toml"), "[follow]\nignore = [\"nixpkgs\"]\n");

            int code = run("--lock", lock.toString(), "--config", config.toString(), "follow", "--auto");

            assertThat(code).isZero();
            assertThat(out.toString()).contains("No inputs to auto-follow.");
            assertThat(flakeText()).isEqualTo(FLAKE);
        }

        @Test
        void autoWithBrokenLock() throws IOException {
            Path lock = Files.writeString(dir.resolve("flake.lock"), "{ not json");
            Path config = Files.writeString(dir.resolve("flake-edit.toml"), "");

            int code = run("--lock", lock.toString(), "--config", config.toString(), "follow", "--auto");

            assertThat(code).isEqualTo(FlakeEditCommand.FAILED);
            assertThat(err.toString()).contains("Error: Lock file is not valid JSON");
        }
    }

    @Nested
    @DisplayName("validate")
    class ValidateCommand {

        @Test
        void validFile() {
            assertThat(run("validate")).isZero();
            assertThat(out.toString()).contains("No errors found.");
        }

        @Test
        void invalidFile() throws IOException {
            Files.writeString(flake, "{ a = 1; a = 2; }");

            assertThat(run("validate")).isEqualTo(FlakeEditCommand.FAILED);
            assertThat(err.toString()).contains("duplicate attribute 'a' at line 1, column 10");
        }
    }
}
