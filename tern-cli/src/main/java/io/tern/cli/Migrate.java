package io.tern.cli;

import com.beust.jcommander.Parameter;
import io.tern.core.TernException;
import io.tern.core.migrate.Direction;
import io.tern.core.migrate.MigrationCancelledException;
import io.tern.core.migrate.MigrationListener;
import io.tern.core.migrate.Migrator;
import io.tern.core.migrate.PathMigrationSource;

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

import static io.tern.cli.SystemExitException.systemExit;

public class Migrate
    extends ConfigCommand
{
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ENGLISH);

    // Ctrl-C waits this long for the running step to roll back
    private static final long CANCEL_WAIT_SECONDS = 60;

    @Parameter(names = {"-d", "--destination"})
    String destination = "last";

    @Override
    public void main()
        throws Exception
    {
        checkArgumentCount(0, 0);

        Destination dest = parseDestination();

        TernConfig config = loadValidConfig();
        withHandle(config, handle -> {
            Migrator migrator = Migrator.create(handle, config.toMigratorConfig(), templateEngine);
            migrator.loadMigrations(new PathMigrationSource(migrationsPath()), config.getData());
            migrator.setListener(new PrintingListener(out));

            migrateCancellable(dest, migrator, migrator.getCurrentVersion(), err, CANCEL_WAIT_SECONDS);
        });
    }

    static void migrateCancellable(Destination dest, Migrator migrator, int currentVersion,
            PrintStream err, long cancelWaitSeconds)
        throws TernException, SystemExitException
    {
        try (InterruptHandler interrupt = InterruptHandler.install(cancelWaitSeconds)) {
            try {
                dest.migrate(migrator, currentVersion);
            }
            catch (MigrationCancelledException ex) {
                // the JVM may halt as soon as the shutdown hook is released
                ErrorPrinter.print(err, ex);
                err.flush();
                throw SystemExitException.cancelled();
            }
        }
    }

    private Destination parseDestination()
        throws SystemExitException
    {
        try {
            return Destination.parse(destination);
        }
        catch (IllegalArgumentException ex) {
            throw systemExit(ex.getMessage());
        }
    }

    static class PrintingListener
            implements MigrationListener
    {
        private final PrintStream out;

        PrintingListener(PrintStream out)
        {
            this.out = out;
        }

        @Override
        public void onStart(int sequence, String name, Direction direction, String sql)
        {
            out.printf(Locale.ENGLISH, "%s executing %s %s\n%s\n\n",
                    LocalDateTime.now().format(TIMESTAMP_FORMAT), name, direction, sql);
            out.flush();
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " migrate [options...]");
        err.println("  Options:");
        err.println("    -d, --destination DEST           destination version: last, N, +N, -N or -+N to redo N (default: last)");
        showConfigOptions();
        showCommonOptions();
        err.println("  Example:");
        err.println("    $ " + programName + " migrate -m migrations -d +1");
        return systemExit(error);
    }
}
