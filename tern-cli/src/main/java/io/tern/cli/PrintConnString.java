package io.tern.cli;

import io.tern.core.database.DatabaseConfig;

import java.util.Locale;

import static io.tern.cli.SystemExitException.systemExit;

public class PrintConnString
    extends ConfigCommand
{
    static final int DEFAULT_PORT = 5432;

    @Override
    public void main()
        throws Exception
    {
        checkArgumentCount(0, 0);
        out.print(format(loadConfig().getDatabase()));
        out.flush();
    }

    static String format(DatabaseConfig db)
    {
        if (db.getConnString().isPresent()) {
            return db.getConnString().get();
        }

        StringBuilder options = new StringBuilder();
        if (db.getSslmode().isPresent()) {
            options.append("sslmode=").append(db.getSslmode().get()).append('&');
        }
        if (db.getSslrootcert().isPresent()) {
            options.append("sslrootcert=").append(db.getSslrootcert().get());
        }
        return String.format(Locale.ENGLISH, "postgres://%s:%s@%s:%d/%s?%s",
                db.getUser().or(""),
                db.getPassword().or(""),
                db.getHost().or(""),
                db.getPort().or(DEFAULT_PORT),
                db.getDatabase().or(""),
                options);
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " print-connstring [options...]");
        err.println("  Options:");
        showConfigOptions();
        showCommonOptions();
        return systemExit(error);
    }
}
