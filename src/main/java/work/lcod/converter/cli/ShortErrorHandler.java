package work.lcod.converter.cli;

import java.io.IOException;
import java.io.UncheckedIOException;
import picocli.CommandLine;

/**
 * Prints one line per failed conversion run, tagged by where it went wrong.
 *
 * <p>Rejected settings or option values are reported as {@code Configuration error}, file system failures (also
 * when wrapped) as {@code I/O error}. Set {@value #DEBUG_PROPERTY} to get the stack trace as well.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "wfconvert.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Exception ex) {
        IOException io = ioCause(ex);
        if (io != null) {
            String detail = io == ex || ex instanceof UncheckedIOException ? messageOf(io) : messageOf(ex);
            return "I/O error: " + detail + " (" + io.getClass().getSimpleName() + ")";
        }
        if (ex instanceof IllegalArgumentException) {
            return "Configuration error: " + messageOf(ex);
        }
        return messageOf(ex);
    }

    private static IOException ioCause(Throwable ex) {
        for (Throwable current = ex; current != null; current = current.getCause()) {
            if (current instanceof IOException io) {
                return io;
            }
        }
        return null;
    }

    private static String messageOf(Throwable ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }
}
