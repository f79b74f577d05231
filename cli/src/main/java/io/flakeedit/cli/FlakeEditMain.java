package io.flakeedit.cli;

/** Entry point of the {@code flake-edit} command. */
public final class FlakeEditMain {

    private FlakeEditMain() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int code = FlakeEditCommand.commandLine().execute(args);
        System.exit(code);
    }
}
