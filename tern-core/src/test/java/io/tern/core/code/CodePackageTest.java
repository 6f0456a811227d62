package io.tern.core.code;

import com.google.common.collect.ImmutableMap;
import io.tern.core.database.DatabaseTestingUtils.TestDatabase;
import io.tern.core.migrate.MigrationDiscoveryException;
import io.tern.core.migrate.MigrationExecutionException;
import io.tern.core.migrate.PathMigrationSource;
import org.jdbi.v3.core.Handle;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static io.tern.core.database.DatabaseTestingUtils.setupDatabase;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.fail;

public class CodePackageTest
{
    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private Path dir;
    private TestDatabase database;
    private Handle handle;

    @Before
    public void setUp()
        throws IOException
    {
        dir = folder.newFolder("code").toPath();
        database = setupDatabase();
        handle = database.open();
    }

    @After
    public void destroy()
    {
        database.close();
    }

    private void write(String path, String content)
        throws IOException
    {
        Path file = dir.resolve(path);
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(UTF_8));
    }

    @Test
    public void requiresInstallSql()
        throws Exception
    {
        write("counters.sql", "create table counters(n int);");
        try {
            CodePackage.load(new PathMigrationSource(dir));
            fail();
        }
        catch (MigrationDiscoveryException ex) {
            assertThat(ex.getMessage(), is("install.sql not found"));
        }
    }

    @Test
    public void evalIncludesFilesOfThePackage()
        throws Exception
    {
        write("install.sql", "{% include \"tables/counters.sql\" %}\n{% include \"seed.sql\" %}");
        write("tables/counters.sql", "create table counters(n int);");
        write("seed.sql", "insert into counters(n) values ({{ start }});");
        write("README.md", "not sql");

        CodePackage codePackage = CodePackage.load(new PathMigrationSource(dir));
        assertThat(codePackage.getPartials(), hasKey("tables/counters.sql"));
        assertThat(codePackage.getPartials(), not(hasKey("README.md")));
        assertThat(codePackage.getPartials(), not(hasKey("install.sql")));

        String sql = codePackage.eval(ImmutableMap.of("start", 5));
        assertThat(sql, is("create table counters(n int);\ninsert into counters(n) values (5);"));
    }

    @Test
    public void installRunsInOneTransaction()
        throws Exception
    {
        write("install.sql", "create table counters(n int);\ninsert into counters(n) values ({{ start }});");
        CodePackage codePackage = CodePackage.load(new PathMigrationSource(dir));

        CodePackageInstaller.install(handle, codePackage, ImmutableMap.of("start", 7));

        assertThat(handle.createQuery("select n from counters").mapTo(Integer.class).one(), is(7));
        assertThat(handle.isInTransaction(), is(false));
    }

    @Test
    public void failedInstallIsRolledBack()
        throws Exception
    {
        handle.execute("create table counters(n int primary key)");
        write("install.sql", "insert into counters(n) values (1);\ninsert into counters(n) values (1);");
        CodePackage codePackage = CodePackage.load(new PathMigrationSource(dir));

        try {
            CodePackageInstaller.install(handle, codePackage, ImmutableMap.of());
            fail();
        }
        catch (MigrationExecutionException ex) {
            assertThat(ex.getMigrationName(), is("install.sql"));
            assertThat(ex.getSql(), is("insert into counters(n) values (1);"));
        }

        assertThat(handle.createQuery("select count(*) from counters").mapTo(Integer.class).one(), is(0));
        assertThat(handle.isInTransaction(), is(false));
    }
}
