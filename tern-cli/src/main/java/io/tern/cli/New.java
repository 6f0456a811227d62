package io.tern.cli;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import com.google.common.base.Strings;
import com.google.common.io.Resources;
import io.tern.core.migrate.MigrationDiscoveryException;
import io.tern.core.migrate.MigrationLoader;
import io.tern.core.migrate.PathMigrationSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import static io.tern.cli.SystemExitException.systemExit;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardOpenOption.CREATE_NEW;
import static java.nio.file.StandardOpenOption.WRITE;

public class New
    extends Command
{
    static final String TEMPLATE_RESOURCE = Init.RESOURCE_PREFIX + "new_migration.sql";

    @ParametersDelegate
    MigrationsPathOption migrationsPathOption = new MigrationsPathOption();

    @Parameter(names = {"-e", "--edit"})
    boolean edit = false;

    @Override
    public void main()
        throws Exception
    {
        checkArgumentCount(1, 1);

        Path path = create(migrationsPathOption.resolve(env), args.get(0));
        out.println("  Creating " + path);

        if (edit) {
            openEditor(path);
        }
    }

    /**
     * Writes a migration named after the next sequence number.
     */
    static Path create(Path migrationsPath, String name)
        throws IOException, MigrationDiscoveryException
    {
        List<String> migrations = MigrationLoader.findMigrations(new PathMigrationSource(migrationsPath));
        String fileName = String.format(Locale.ENGLISH, "%03d_%s.sql", migrations.size() + 1, name);
        Path path = migrationsPath.resolve(fileName);

        String text = Resources.toString(New.class.getResource(TEMPLATE_RESOURCE), UTF_8);
        Files.write(path, text.getBytes(UTF_8), CREATE_NEW, WRITE);
        return path;
    }

    private void openEditor(Path path)
        throws Exception
    {
        String editor = env.get("EDITOR");
        if (Strings.isNullOrEmpty(editor)) {
            throw systemExit("EDITOR environment variable not set");
        }

        Process process = new ProcessBuilder("sh", "-c", editor + " '" + path + "'")
            .inheritIO()
            .start();
        int code = process.waitFor();
        if (code != 0) {
            throw systemExit("Editor exited with code " + code);
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " new <name> [options...]");
        err.println("  Options:");
        MigrationsPathOption.showOptions(err);
        err.println("    -e, --edit                       open the new migration in $EDITOR");
        showCommonOptions();
        err.println("  Example:");
        err.println("    $ " + programName + " new create_users -m migrations");
        return systemExit(error);
    }
}
