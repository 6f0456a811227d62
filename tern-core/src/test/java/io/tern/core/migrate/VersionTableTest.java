package io.tern.core.migrate;

import io.tern.core.database.DatabaseTestingUtils.TestDatabase;
import org.jdbi.v3.core.Handle;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import static io.tern.core.database.DatabaseTestingUtils.setupDatabase;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

public class VersionTableTest
{
    @Rule
    public final ExpectedException exception = ExpectedException.none();

    private TestDatabase database;
    private Handle handle;
    private MigrationContext context;

    @Before
    public void setUp()
        throws Exception
    {
        database = setupDatabase();
        handle = database.open();
        context = MigrationContext.of(handle);
    }

    @After
    public void destroy()
    {
        database.close();
    }

    @Test
    public void createsTableWithVersionZero()
        throws Exception
    {
        VersionTable table = new VersionTable(handle, context, "public.schema_version");
        assertThat(table.exists(), is(false));

        table.ensureExists();

        assertThat(table.exists(), is(true));
        assertThat(table.getCurrentVersion(), is(0));
    }

    @Test
    public void ensureExistsKeepsVersion()
        throws Exception
    {
        VersionTable table = new VersionTable(handle, context, "other_version");
        table.ensureExists();
        table.setVersion(5);

        table.ensureExists();

        assertThat(table.getCurrentVersion(), is(5));
        assertThat(handle.createQuery("select count(*) from other_version").mapTo(Integer.class).one(), is(1));
    }

    @Test
    public void unqualifiedAndQualifiedNamesFindTheSameTable()
        throws Exception
    {
        new VersionTable(handle, context, "other_version").ensureExists();

        assertThat(new VersionTable(handle, context, "public.other_version").exists(), is(true));
        assertThat(new VersionTable(handle, context, "public.schema_version").exists(), is(false));
    }

    @Test
    public void missingTableFails()
        throws Exception
    {
        exception.expect(VersionTableException.class);
        exception.expectMessage(containsString("other_version"));
        new VersionTable(handle, context, "other_version").getCurrentVersion();
    }

    @Test
    public void moreThanOneRowFails()
        throws Exception
    {
        VersionTable table = new VersionTable(handle, context, "other_version");
        table.ensureExists();
        handle.execute("insert into other_version(version) values (3)");

        exception.expect(VersionTableException.class);
        exception.expectMessage("version table other_version must have exactly one row but has 2");
        table.getCurrentVersion();
    }
}
