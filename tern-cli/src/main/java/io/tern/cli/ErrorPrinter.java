package io.tern.cli;

import io.tern.core.TernException;
import io.tern.core.migrate.ErrorLine;
import io.tern.core.migrate.MigrationExecutionException;

import java.io.PrintStream;

import static com.google.common.base.Strings.isNullOrEmpty;

public class ErrorPrinter
{
    private ErrorPrinter()
    { }

    /**
     * Prints a failure the way psql does: the message, the DETAIL of the
     * server, and the line of the statement that the server pointed to.
     */
    public static void print(PrintStream err, Throwable ex)
    {
        err.println("error: " + formatExceptionMessage(ex));
        if (ex instanceof MigrationExecutionException) {
            MigrationExecutionException failure = (MigrationExecutionException) ex;
            if (failure.getDetail().isPresent()) {
                err.println("DETAIL: " + failure.getDetail().get());
            }
            if (failure.getErrorLine().isPresent()) {
                ErrorLine line = failure.getErrorLine().get();
                err.println(line.format());
            }
        }
    }

    public static String formatExceptionMessage(Throwable ex)
    {
        StringBuilder sb = new StringBuilder();
        collectExceptionMessage(sb, ex, new StringBuilder());
        return sb.toString();
    }

    private static void collectExceptionMessage(StringBuilder sb, Throwable ex, StringBuilder used)
    {
        String message = ex.getMessage();
        if (isNullOrEmpty(message)) {
            message = ex.getClass().getSimpleName();
        }
        if (used.indexOf(message) == -1) {
            used.append("\n").append(message);
            if (sb.length() > 0) {
                sb.append("\n> ");
            }
            sb.append(message);
            if (!(ex instanceof TernException)) {
                // messages of TernException are written for users
                sb.append(" (");
                sb.append(ex.getClass().getSimpleName()
                            .replaceFirst("(?:Exception|Error)$", "")
                            .replaceAll("([A-Z]+)([A-Z][a-z])", "$1 $2")
                            .replaceAll("([a-z])([A-Z])", "$1 $2")
                            .toLowerCase());
                sb.append(")");
            }
        }
        if (ex.getCause() != null) {
            collectExceptionMessage(sb, ex.getCause(), used);
        }
        for (Throwable t : ex.getSuppressed()) {
            collectExceptionMessage(sb, t, used);
        }
    }
}
