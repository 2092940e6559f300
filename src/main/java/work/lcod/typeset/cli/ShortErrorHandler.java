package work.lcod.typeset.cli;

import picocli.CommandLine;
import work.lcod.typeset.api.RunResult;
import work.lcod.typeset.api.TypesetRunner;

/**
 * Reports unexpected command failures as a single {@code lcod-typeset: ...} line.
 * Template problems never get here: they end up as diagnostics in the run result.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        var err = commandLine.getErr();
        err.println(commandLine.getColorScheme().errorText(commandLine.getCommandName() + ": " + describe(ex)));
        if (Boolean.getBoolean(TypesetRunner.DEBUG_PROPERTY)) {
            ex.printStackTrace(err);
        }
        return RunResult.Status.FAILURE.exitCode();
    }

    /**
     * The first non-blank message of the cause chain, followed by the root cause when
     * that message does not already mention it.
     */
    static String describe(Throwable ex) {
        String message = null;
        Throwable root = ex;
        for (Throwable current = ex; current != null; current = current.getCause()) {
            if (message == null && current.getMessage() != null && !current.getMessage().isBlank()) {
                message = current.getMessage();
            }
            root = current;
        }
        if (message == null) {
            return root.getClass().getSimpleName();
        }
        String rootMessage = root.getMessage();
        if (root != ex && rootMessage != null && !message.contains(rootMessage)) {
            return message + " (" + root.getClass().getSimpleName() + ": " + rootMessage + ")";
        }
        return message;
    }
}
