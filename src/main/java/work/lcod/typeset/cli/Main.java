package work.lcod.typeset.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /**
     * The {@code lcod-typeset} command with its error handling, as run by {@link #main}.
     */
    static CommandLine commandLine() {
        return new CommandLine(new TypesetCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
