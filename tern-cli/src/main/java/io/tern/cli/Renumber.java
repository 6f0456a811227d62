package io.tern.cli;

import com.beust.jcommander.ParametersDelegate;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.tern.core.migrate.MigrationDiscoveryException;
import io.tern.core.migrate.MigrationLoader;
import io.tern.core.migrate.PathMigrationSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.tern.cli.SystemExitException.systemExit;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Resolves conflicting migration numbers after a merge.
 *
 * {@code renumber start} records the migrations before the merge.
 * {@code renumber finish} moves every migration that is not in the record
 * after the last recorded one, keeping their order.
 */
public class Renumber
    extends Command
{
    private static final Logger logger = LoggerFactory.getLogger(Renumber.class);

    static final String RENUMBER_FILE = ".tern-renumber.tmp";

    private static final Pattern MIGRATION_PATTERN = Pattern.compile("^(\\d+)_.+\\.sql$");

    @ParametersDelegate
    MigrationsPathOption migrationsPathOption = new MigrationsPathOption();

    @Override
    public void main()
        throws Exception
    {
        checkArgumentCount(1, 1);

        Path migrationsPath = migrationsPathOption.resolve(env);
        switch (args.get(0)) {
        case "start":
            start(migrationsPath);
            break;
        case "finish":
            try {
                for (String renamed : finish(migrationsPath)) {
                    out.println("  Renumbered " + renamed);
                }
            }
            catch (NoSuchFileException ex) {
                throw systemExit("Renumber file not found. Run `" + programName + " renumber start` before the merge: " + ex.getMessage());
            }
            break;
        default:
            throw usage("Unknown subcommand: " + args.get(0));
        }
    }

    static void start(Path migrationsPath)
        throws IOException, MigrationDiscoveryException
    {
        List<String> migrations = MigrationLoader.findMigrations(new PathMigrationSource(migrationsPath));
        Files.write(migrationsPath.resolve(RENUMBER_FILE), migrations, UTF_8);
    }

    /**
     * Renames migrations that were added since {@link #start(Path)} and
     * returns their new names.
     */
    static List<String> finish(Path migrationsPath)
        throws IOException
    {
        Path renumberFile = migrationsPath.resolve(RENUMBER_FILE);
        List<String> recorded = Files.readAllLines(renumberFile, UTF_8);

        long lastNumber = 0;
        for (String name : recorded) {
            if (name.isEmpty()) {
                continue;
            }
            lastNumber = Math.max(lastNumber, sequenceOf(name));
        }

        Set<String> recordedSet = ImmutableSet.copyOf(recorded);
        List<String> added = new ArrayList<>();
        for (String name : listMigrationFiles(migrationsPath)) {
            if (!recordedSet.contains(name)) {
                added.add(name);
            }
        }
        added.sort(Comparator.comparingLong(Renumber::sequenceOf));

        ImmutableList.Builder<String> renamed = ImmutableList.builder();
        for (String name : added) {
            Matcher m = MIGRATION_PATTERN.matcher(name);
            m.matches();
            lastNumber++;
            String newName = String.format(Locale.ENGLISH, "%03d", lastNumber) + name.substring(m.end(1));
            Files.move(migrationsPath.resolve(name), migrationsPath.resolve(newName));
            logger.debug("Renamed {} to {}", name, newName);
            renamed.add(newName);
        }

        Files.delete(renumberFile);
        return renamed.build();
    }

    // unlike MigrationLoader.findMigrations, this allows duplicated numbers
    static List<String> listMigrationFiles(Path migrationsPath)
        throws IOException
    {
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(migrationsPath)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                if (!Files.isDirectory(path) && MIGRATION_PATTERN.matcher(name).matches()) {
                    names.add(name);
                }
            }
        }
        names.sort(null);
        return names;
    }

    private static long sequenceOf(String name)
    {
        Matcher m = MIGRATION_PATTERN.matcher(name);
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a migration file name: " + name);
        }
        return Long.parseLong(m.group(1));
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " renumber (start|finish) [options...]");
        err.println("  start      records the current migrations (run before merging)");
        err.println("  finish     renumbers the migrations added by the merge after the recorded ones");
        err.println("  Options:");
        MigrationsPathOption.showOptions(err);
        showCommonOptions();
        return systemExit(error);
    }
}
