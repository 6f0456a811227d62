package io.tern.core.migrate;

import com.google.common.collect.ImmutableMap;
import io.tern.core.template.JinjaTemplateEngine;
import io.tern.core.template.TemplateRenderException;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

public class MigrationLoaderTest
{
    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    @Rule
    public final ExpectedException exception = ExpectedException.none();

    private Path dir;
    private MigrationLoader loader;

    @Before
    public void setUp()
        throws IOException
    {
        dir = folder.newFolder("migrations").toPath();
        loader = new MigrationLoader(new JinjaTemplateEngine());
    }

    private void write(String path, String content)
        throws IOException
    {
        Path file = dir.resolve(path);
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(UTF_8));
    }

    private List<SqlMigration> load(Map<String, ?> data)
        throws Exception
    {
        return loader.load(new PathMigrationSource(dir), data);
    }

    @Test
    public void findsMigrationsInSequenceOrder()
        throws Exception
    {
        write("10_ten.sql", "select 10;");
        write("1_one.sql", "select 1;");
        for (int i = 2; i <= 9; i++) {
            write("00" + i + "_n.sql", "select " + i + ";");
        }
        write("README.md", "not a migration");
        write("notes.sql", "not a migration either");
        write("shared/003_not_top_level.sql", "select 0;");

        List<String> found = MigrationLoader.findMigrations(new PathMigrationSource(dir));
        assertThat(found.size(), is(10));
        assertThat(found.get(0), is("1_one.sql"));
        assertThat(found.get(1), is("002_n.sql"));
        assertThat(found.get(9), is("10_ten.sql"));
    }

    @Test
    public void emptyDirectoryHasNoMigrations()
        throws Exception
    {
        assertThat(MigrationLoader.findMigrations(new PathMigrationSource(dir)), is(empty()));

        exception.expect(NoMigrationsFoundException.class);
        load(ImmutableMap.of());
    }

    @Test
    public void duplicateSequence()
        throws Exception
    {
        write("001_a.sql", "select 1;");
        write("002_b.sql", "select 2;");
        write("02_c.sql", "select 2;");

        exception.expect(DuplicateMigrationException.class);
        exception.expectMessage("Duplicate migration 2");
        MigrationLoader.findMigrations(new PathMigrationSource(dir));
    }

    @Test
    public void missingSequence()
        throws Exception
    {
        write("001_a.sql", "select 1;");
        write("003_c.sql", "select 3;");

        exception.expect(MissingMigrationException.class);
        exception.expectMessage("Missing migration 2");
        MigrationLoader.findMigrations(new PathMigrationSource(dir));
    }

    @Test
    public void sequenceZeroIsRejected()
        throws Exception
    {
        write("000_zero.sql", "select 0;");
        write("001_a.sql", "select 1;");

        exception.expect(MigrationDiscoveryException.class);
        exception.expectMessage("000_zero.sql");
        MigrationLoader.findMigrations(new PathMigrationSource(dir));
    }

    @Test
    public void missingDirectory()
        throws Exception
    {
        exception.expect(MigrationDiscoveryException.class);
        exception.expectMessage("Unable to list migrations");
        MigrationLoader.findMigrations(new PathMigrationSource(dir.resolve("nope")));
    }

    @Test
    public void splitsUpAndDown()
        throws Exception
    {
        write("001_create_t1.sql", "\ncreate table t1(id int);\n\n"
                + MigrationLoader.SEPARATOR + "\n"
                + "drop table t1;\n");
        write("002_fill_t1.sql", "insert into t1 values (1);\n");

        List<SqlMigration> migrations = load(ImmutableMap.of());
        assertThat(migrations.size(), is(2));

        SqlMigration first = migrations.get(0);
        assertThat(first.getSequence(), is(1));
        assertThat(first.getName(), is("001_create_t1.sql"));
        assertThat(first.getUpSql(), is("create table t1(id int);"));
        assertThat(first.getDownSql(), is("drop table t1;"));

        SqlMigration second = migrations.get(1);
        assertThat(second.getSequence(), is(2));
        assertThat(second.getDownSql(), is(""));
        assertThat(second.isIrreversible(), is(true));
    }

    @Test
    public void upSqlOfOnlyCommentsIsRejected()
        throws Exception
    {
        write("001_empty.sql", "-- nothing here\n\n" + MigrationLoader.SEPARATOR + "\ndrop table t1;\n");

        exception.expect(NoForwardSqlException.class);
        exception.expectMessage("no sql in forward migration step: 001_empty.sql");
        load(ImmutableMap.of());
    }

    @Test
    public void upSqlRenderedToNothingIsRejected()
        throws Exception
    {
        write("001_conditional.sql", "{% if enabled %}create table t1(id int);{% endif %}\n");

        exception.expect(NoForwardSqlException.class);
        load(ImmutableMap.of("enabled", false));
    }

    @Test
    public void rendersData()
        throws Exception
    {
        write("001_create.sql", "create table {{ table }}(id int);\n"
                + MigrationLoader.SEPARATOR + "\n"
                + "drop table {{ table }};\n");

        List<SqlMigration> migrations = load(ImmutableMap.of("table", "people"));
        assertThat(migrations.get(0).getUpSql(), is("create table people(id int);"));
        assertThat(migrations.get(0).getDownSql(), is("drop table people;"));
    }

    @Test
    public void undefinedVariableNamesTheMigration()
        throws Exception
    {
        write("001_create.sql", "create table {{ missing }}(id int);\n");

        exception.expect(TemplateRenderException.class);
        exception.expectMessage("001_create.sql up");
        load(ImmutableMap.of());
    }

    @Test
    public void includesSharedTemplates()
        throws Exception
    {
        write("shared/columns.sql", "id int primary key, name {{ name_type }}");
        write("001_create_people.sql", "create table people({% include \"shared/columns.sql\" %});\n");

        List<SqlMigration> migrations = load(ImmutableMap.of("name_type", "text"));
        assertThat(migrations.size(), is(1));
        assertThat(migrations.get(0).getUpSql(), is("create table people(id int primary key, name text);"));
    }

    @Test
    public void unknownSharedTemplate()
        throws Exception
    {
        write("001_create_people.sql", "create table people({% include \"shared/missing.sql\" %});\n");

        exception.expect(TemplateRenderException.class);
        load(ImmutableMap.of());
    }

    @Test
    public void keepsDisableTxMarker()
        throws Exception
    {
        write("001_index.sql", "---- tern: disable-tx ----\ncreate index concurrently i1 on t1(id);\n");

        SqlMigration migration = load(ImmutableMap.of()).get(0);
        assertThat(migration.isDisableTx(Direction.UP), is(true));
    }

    @Test
    public void installsSnapshots()
        throws Exception
    {
        write("snapshots/002/install.sql", "create function {{ schema }}.f() returns int as $$ select 1 $$ language sql;\n"
                + "{% include \"views.sql\" %}");
        write("snapshots/002/views.sql", "create view {{ schema }}.v as select {{ schema }}.f();");
        write("001_create_schema.sql", "create schema app;\n");
        write("002_install_code.sql", "{{ install_snapshot(\"002\") }}\n");

        List<SqlMigration> migrations = load(ImmutableMap.of("schema", "app"));
        assertThat(migrations.size(), is(2));

        String sql = migrations.get(1).getUpSql();
        assertThat(sql, containsString("create function app.f() returns int"));
        assertThat(sql, containsString("create view app.v as select app.f();"));
        assertThat(sql, not(containsString("{{")));
    }

    @Test
    public void missingSnapshot()
        throws Exception
    {
        write("001_install_code.sql", "{{ install_snapshot(\"001\") }}\n");

        exception.expect(TemplateRenderException.class);
        exception.expectMessage("install_snapshot");
        load(ImmutableMap.of());
    }

    @Test
    public void findMigrationsIgnoresDirectoriesNamedLikeMigrations()
        throws Exception
    {
        write("001_a.sql", "select 1;");
        Files.createDirectories(dir.resolve("002_dir.sql"));

        assertThat(MigrationLoader.findMigrations(new PathMigrationSource(dir)), contains("001_a.sql"));
    }
}
