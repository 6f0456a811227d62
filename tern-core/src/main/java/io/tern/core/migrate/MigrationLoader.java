package io.tern.core.migrate;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.tern.core.TernException;
import io.tern.core.code.CodePackage;
import io.tern.core.template.TemplateContext;
import io.tern.core.template.TemplateEngine;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds migration files in a {@link MigrationSource} and renders them.
 *
 * A migration file is named {@code <sequence>_<description>.sql} and lives at
 * the top level of the source. Its up and down parts are separated by
 * {@link #SEPARATOR}. {@code .sql} files in subdirectories are shared
 * templates that migrations may include.
 */
public class MigrationLoader
{
    static final Pattern MIGRATION_PATTERN = Pattern.compile("^(\\d+)_.+\\.sql$");

    public static final String SEPARATOR = "---- create above / drop below ----";

    private final TemplateEngine templateEngine;

    public MigrationLoader(TemplateEngine templateEngine)
    {
        this.templateEngine = templateEngine;
    }

    /**
     * Returns file names of the migrations ordered by sequence. Empty if
     * there are none.
     */
    public static List<String> findMigrations(MigrationSource source)
        throws MigrationDiscoveryException
    {
        List<SourceEntry> entries;
        try {
            entries = source.list("");
        }
        catch (IOException ex) {
            throw new MigrationDiscoveryException("Unable to list migrations in " + source + ": " + ex.getMessage(), ex);
        }

        List<String> paths = new ArrayList<>();
        for (SourceEntry entry : entries) {
            if (entry.isDirectory()) {
                continue;
            }
            Matcher m = MIGRATION_PATTERN.matcher(entry.getName());
            if (!m.matches()) {
                continue;
            }

            int n;
            try {
                n = Integer.parseInt(m.group(1));
            }
            catch (NumberFormatException ex) {
                throw new MigrationDiscoveryException("Bad migration sequence: " + entry.getName(), ex);
            }
            if (n < 1) {
                throw new MigrationDiscoveryException("Migration sequence must start at 1: " + entry.getName());
            }

            while (paths.size() < n) {
                paths.add(null);
            }
            if (paths.get(n - 1) != null) {
                throw new DuplicateMigrationException(n);
            }
            paths.set(n - 1, entry.getName());
        }

        for (int i = 0; i < paths.size(); i++) {
            if (paths.get(i) == null) {
                throw new MissingMigrationException(i + 1);
            }
        }

        return ImmutableList.copyOf(paths);
    }

    /**
     * Loads and renders every migration of {@code source} against {@code data}.
     */
    public List<SqlMigration> load(MigrationSource source, Map<String, ?> data)
        throws TernException
    {
        List<String> paths = findMigrations(source);
        if (paths.isEmpty()) {
            throw new NoMigrationsFoundException();
        }

        TemplateContext context = TemplateContext.of(data)
            .withPartials(loadPartials(source))
            .withSnapshotResolver(name ->
                    CodePackage.load(source.sub("snapshots/" + name), templateEngine).eval(data));

        ImmutableList.Builder<SqlMigration> migrations = ImmutableList.builder();
        int sequence = 1;
        for (String path : paths) {
            String body = read(source, path);

            String[] pieces = body.split(Pattern.quote(SEPARATOR), 2);
            String upSql = templateEngine.render(path + " up", trim(pieces[0]), context);
            if (!containsSql(upSql)) {
                throw new NoForwardSqlException(path);
            }

            String downSql = "";
            if (pieces.length == 2) {
                downSql = templateEngine.render(path + " down", trim(pieces[1]), context);
            }

            migrations.add(new SqlMigration(sequence++, path, upSql, downSql));
        }
        return migrations.build();
    }

    private static Map<String, String> loadPartials(MigrationSource source)
        throws MigrationDiscoveryException
    {
        ImmutableMap.Builder<String, String> partials = ImmutableMap.builder();
        List<String> files;
        try {
            files = source.walk();
        }
        catch (IOException ex) {
            throw new MigrationDiscoveryException("Unable to list shared templates in " + source + ": " + ex.getMessage(), ex);
        }
        for (String path : files) {
            if (path.indexOf('/') >= 0 && path.endsWith(".sql")) {
                partials.put(path, read(source, path));
            }
        }
        return partials.build();
    }

    private static String read(MigrationSource source, String path)
        throws MigrationDiscoveryException
    {
        try {
            return source.read(path);
        }
        catch (IOException ex) {
            throw new MigrationDiscoveryException("Unable to read " + path + ": " + ex.getMessage(), ex);
        }
    }

    private static String trim(String text)
    {
        return CharMatcher.whitespace().trimFrom(text);
    }

    // a line that is neither blank nor a line comment
    static boolean containsSql(String sql)
    {
        for (String line : sql.split("\n")) {
            String clean = trim(line);
            if (!clean.isEmpty() && !clean.startsWith("--")) {
                return true;
            }
        }
        return false;
    }
}
