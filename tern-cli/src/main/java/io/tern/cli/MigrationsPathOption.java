package io.tern.cli;

import com.beust.jcommander.Parameter;
import com.google.common.base.Strings;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * {@code -m, --migrations DIR}. Falls back to {@code TERN_MIGRATIONS} and
 * then to the working directory.
 */
public class MigrationsPathOption
{
    static final String ENV_NAME = "TERN_MIGRATIONS";

    @Parameter(names = {"-m", "--migrations"})
    String migrationsPath = null;

    public Path resolve(Map<String, String> env)
    {
        if (!Strings.isNullOrEmpty(migrationsPath)) {
            return Paths.get(migrationsPath);
        }
        String fromEnv = env.get(ENV_NAME);
        if (!Strings.isNullOrEmpty(fromEnv)) {
            return Paths.get(fromEnv);
        }
        return Paths.get(".");
    }

    static void showOptions(PrintStream err)
    {
        err.println("    -m, --migrations DIR             migrations path (default: $TERN_MIGRATIONS or .)");
    }
}
