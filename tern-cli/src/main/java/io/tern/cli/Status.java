package io.tern.cli;

import io.tern.core.database.DatabaseConfig;
import io.tern.core.migrate.Migrator;
import io.tern.core.migrate.PathMigrationSource;

import static io.tern.cli.SystemExitException.systemExit;

public class Status
    extends ConfigCommand
{
    @Override
    public void main()
        throws Exception
    {
        checkArgumentCount(0, 0);

        TernConfig config = loadValidConfig();
        withHandle(config, handle -> {
            Migrator migrator = Migrator.create(handle, config.toMigratorConfig(), templateEngine);
            migrator.loadMigrations(new PathMigrationSource(migrationsPath()), config.getData());

            int currentVersion = migrator.getCurrentVersion();
            int count = migrator.getMigrations().size();
            DatabaseConfig db = config.getDatabase();

            out.println("status:   " + (currentVersion == count ? "up to date" : "migration(s) pending"));
            out.println("version:  " + currentVersion + " of " + count);
            out.println("host:     " + db.getHost().or(""));
            out.println("database: " + db.getDatabase().or(db.getPath()).or(""));
        });
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " status [options...]");
        err.println("  Options:");
        showConfigOptions();
        showCommonOptions();
        return systemExit(error);
    }
}
