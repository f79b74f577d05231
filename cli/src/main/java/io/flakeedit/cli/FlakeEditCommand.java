package io.flakeedit.cli;

import io.flakeedit.core.edit.EntryListing;
import io.flakeedit.core.edit.FlakeEdit;
import io.flakeedit.core.error.FlakeEditException;
import io.flakeedit.core.follow.FollowConfig;
import io.flakeedit.core.follow.FollowConfigLoader;
import io.flakeedit.core.follow.FollowPlanner;
import io.flakeedit.core.lock.FlakeLock;
import io.flakeedit.core.lock.NestedInput;
import io.flakeedit.core.model.Change;
import io.flakeedit.core.model.ChangeId;
import io.flakeedit.core.validate.ValidationError;
import io.flakeedit.core.validate.ValidationResult;
import io.flakeedit.core.validate.Validator;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Root command. Every editing subcommand reads the manifest, applies one change, validates the
 * result and then either writes it back or, with {@code --diff}, prints a unified diff against
 * the original. Invalid results are printed to stderr and never written. A manifest that cannot
 * be read or written is reported as an error, not a stack trace.
 */
@Command(
        name = "flake-edit",
        mixinStandardHelpOptions = true,
        description = "Structural editor for flake.nix inputs",
        subcommands = {
            FlakeEditCommand.ListCommand.class,
            FlakeEditCommand.AddCommand.class,
            FlakeEditCommand.RemoveCommand.class,
            FlakeEditCommand.ChangeCommand.class,
            FlakeEditCommand.FollowCommand.class,
            FlakeEditCommand.ValidateCommand.class
        })
public final class FlakeEditCommand implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(FlakeEditCommand.class);

    static final int OK = 0;
    static final int FAILED = 1;

    @Spec
    CommandSpec spec;

    @Option(names = "--flake", description = "Manifest to edit", defaultValue = "flake.nix")
    Path flake;

    @Option(names = "--lock", description = "Lock file used by 'follow --auto'", defaultValue = "flake.lock")
    Path lock;

    @Option(names = "--config", description = "Configuration file; searched for when absent")
    Path config;

    @Option(names = "--diff", description = "Print a unified diff of the edit instead of writing it")
    boolean diff;

    @Option(names = {"-v", "--verbose"}, description = "Log walker and session details")
    boolean verbose;

    /** A command line with the options every entry point uses. */
    public static CommandLine commandLine() {
        return new CommandLine(new FlakeEditCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler(FlakeEditCommand::handleExecutionException);
    }

    private static int handleExecutionException(
            Exception e, CommandLine commandLine, CommandLine.ParseResult parseResult) throws Exception {
        if (!(e instanceof UncheckedIOException io)) {
            throw e;
        }
        LOG.debug("File access failed", io);
        commandLine.getErr().println("Error: " + io.getMessage());
        commandLine.getErr().flush();
        return FAILED;
    }

    @Override
    public void run() {
        spec.commandLine().usage(out());
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    String readFlake() {
        LogbackConfigurator.configure(verbose);
        try {
            return Files.readString(flake);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + flake, e);
        }
    }

    /**
     * Applies {@code change} and persists the result.
     *
     * @param noOpMessage printed when the change matched nothing
     */
    int edit(Change change, String noOpMessage) {
        String text = readFlake();
        Optional<String> result;
        try {
            result = FlakeEdit.fromText(text).applyChange(change);
        } catch (FlakeEditException e) {
            err().println("Error: " + e.detail());
            return FAILED;
        }
        if (result.isEmpty()) {
            err().println(noOpMessage);
            return FAILED;
        }
        return persist(text, result.get());
    }

    /** Validates {@code text}, then writes it or prints its diff against {@code original}. */
    int persist(String original, String text) {
        ValidationResult validation = Validator.validate(text);
        if (validation.hasErrors()) {
            err().println("There are errors in the changes:");
            for (ValidationError error : validation.errors()) {
                err().println("  " + error.describe());
            }
            err().println(text);
            err().println("The changes have not been applied.");
            return FAILED;
        }
        if (diff) {
            out().print(ManifestDiff.unified(original, text));
            out().flush();
            return OK;
        }
        try {
            Files.writeString(flake, text);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + flake, e);
        }
        LOG.info("Wrote {}", flake);
        return OK;
    }

    @Command(name = "list", description = "List the inputs of the manifest")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        FlakeEditCommand parent;

        @Option(
                names = "--format",
                defaultValue = "SIMPLE",
                description = "Output format: ${COMPLETION-CANDIDATES}")
        EntryListing.Format format;

        @Override
        public Integer call() {
            FlakeEdit session = FlakeEdit.fromText(parent.readFlake());
            parent.out().println(EntryListing.render(session.list(), format));
            parent.out().flush();
            return OK;
        }
    }

    @Command(name = "add", description = "Add an input")
    static final class AddCommand implements Callable<Integer> {
        @ParentCommand
        FlakeEditCommand parent;

        @Parameters(index = "0", description = "Input id")
        String id;

        @Parameters(index = "1", description = "Flake reference, e.g. github:nixos/nixpkgs")
        String uri;

        @Option(names = "--no-flake", description = "Mark the input as not being a flake")
        boolean noFlake;

        @Override
        public Integer call() {
            int code = parent.edit(new Change.Add(id, uri, !noFlake), "Nothing to add for " + id);
            if (code == OK) {
                LOG.info("Added input {} ({})", id, uri);
            }
            return code;
        }
    }

    @Command(name = "remove", description = "Remove inputs and every alias that points at them")
    static final class RemoveCommand implements Callable<Integer> {
        @ParentCommand
        FlakeEditCommand parent;

        @Parameters(arity = "1..*", description = "Input ids, or parent.child for a nested alias")
        List<String> ids;

        @Override
        public Integer call() {
            Change.Remove change = Change.Remove.of(ids.toArray(String[]::new));
            int code = parent.edit(change, "No input named " + String.join(", ", ids));
            if (code == OK) {
                LOG.info("Removed {}", ids);
            }
            return code;
        }
    }

    @Command(name = "change", description = "Point an input at a new location")
    static final class ChangeCommand implements Callable<Integer> {
        @ParentCommand
        FlakeEditCommand parent;

        @Parameters(index = "0", description = "Input id")
        String id;

        @Parameters(index = "1", description = "New flake reference")
        String uri;

        @Override
        public Integer call() {
            return parent.edit(new Change.ChangeUrl(id, uri), "Input " + id + " has no url to change");
        }
    }

    @Command(name = "follow", description = "Make a nested input follow a top-level input")
    static final class FollowCommand implements Callable<Integer> {
        @ParentCommand
        FlakeEditCommand parent;

        @Option(names = "--auto", description = "Follow every nested input that matches a top-level input")
        boolean auto;

        @Parameters(arity = "0..2", description = "INPUT TARGET, e.g. crane.nixpkgs nixpkgs")
        List<String> arguments;

        @Override
        public Integer call() {
            if (auto) {
                return followAuto();
            }
            if (arguments == null || arguments.size() != 2) {
                parent.err().println("Expected INPUT and TARGET, or --auto");
                return FAILED;
            }
            String input = arguments.get(0);
            return parent.edit(
                    new Change.Follows(new ChangeId(input), arguments.get(1)),
                    "Could not create follows for " + input
                            + ". Use parent.child to name a nested input, e.g. crane.nixpkgs");
        }

        private int followAuto() {
            String text = parent.readFlake();
            FlakeLock lock;
            FollowConfig config;
            try {
                lock = FlakeLock.read(parent.lock);
                config = parent.config != null
                        ? FollowConfigLoader.loadFile(parent.config)
                        : FollowConfigLoader.load(workingDirectory());
            } catch (FlakeEditException e) {
                parent.err().println("Error: " + e.detail());
                return FAILED;
            }
            List<String> topLevel = List.copyOf(FlakeEdit.fromText(text).list().keySet());
            List<NestedInput> nested = lock.nestedInputs();
            List<Change.Follows> plan = FollowPlanner.plan(nested, topLevel, config);
            for (String candidate : FollowPlanner.promotionCandidates(nested, topLevel, config)) {
                LOG.info("Several inputs depend on '{}'; consider adding it as a top-level input", candidate);
            }
            if (plan.isEmpty()) {
                parent.out().println("No inputs to auto-follow.");
                parent.out().flush();
                return OK;
            }
            String current = text;
            int applied = 0;
            for (Change.Follows follows : plan) {
                Optional<String> result = FlakeEdit.fromText(current).applyChange(follows);
                if (result.isEmpty()) {
                    parent.err().println("Could not create follows for " + follows.input());
                    continue;
                }
                current = result.get();
                applied++;
                if (!parent.diff) {
                    parent.out().println("Added follows: " + describe(follows));
                }
            }
            if (applied == 0) {
                return FAILED;
            }
            return parent.persist(text, current);
        }

        private Path workingDirectory() {
            Path parentDirectory = parent.flake.toAbsolutePath().getParent();
            return parentDirectory != null ? parentDirectory : Path.of("").toAbsolutePath();
        }

        private static String describe(Change.Follows follows) {
            ChangeId input = follows.input();
            return input.input() + ".inputs." + input.follows().orElse("") + ".follows = \"" + follows.target() + "\"";
        }
    }

    @Command(name = "validate", description = "Check the manifest for syntax errors and duplicate attributes")
    static final class ValidateCommand implements Callable<Integer> {
        @ParentCommand
        FlakeEditCommand parent;

        @Override
        public Integer call() {
            ValidationResult result = Validator.validate(parent.readFlake());
            if (result.isOk()) {
                parent.out().println("No errors found.");
                parent.out().flush();
                return OK;
            }
            result.errors().stream().map(ValidationError::describe).forEach(parent.err()::println);
            parent.err().flush();
            return FAILED;
        }
    }
}
