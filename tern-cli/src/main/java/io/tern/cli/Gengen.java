package io.tern.cli;

import com.beust.jcommander.Parameter;
import io.tern.core.migrate.GengenScriptGenerator;
import io.tern.core.migrate.MigrationLoader;
import io.tern.core.migrate.PathMigrationSource;
import io.tern.core.migrate.SqlMigration;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import static io.tern.cli.SystemExitException.systemExit;
import static java.nio.charset.StandardCharsets.UTF_8;

public class Gengen
    extends ConfigCommand
{
    @Parameter(names = {"-o", "--output"})
    String outputPath = null;

    @Override
    public void main()
        throws Exception
    {
        checkArgumentCount(0, 0);

        TernConfig config = loadValidConfig();
        List<SqlMigration> migrations = new MigrationLoader(templateEngine)
            .load(new PathMigrationSource(migrationsPath()), config.getData());

        String script = new GengenScriptGenerator(templateEngine, version.toString())
            .generate(config.getVersionTable(), migrations);

        if (outputPath == null) {
            out.print(script);
            out.flush();
        }
        else {
            Files.write(Paths.get(outputPath), script.getBytes(UTF_8));
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " gengen [options...]");
        err.println("  Generates a SQL script that prints the migrations a database needs when run with psql:");
        err.println("    psql --no-psqlrc --tuples-only --quiet --no-align -f script.sql | psql");
        err.println("  Options:");
        err.println("    -o, --output PATH                write the script to a file (default: stdout)");
        showConfigOptions();
        showCommonOptions();
        return systemExit(error);
    }
}
