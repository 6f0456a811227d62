package io.tern.core.migrate;

import io.tern.core.TernException;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Single-row table that stores the sequence number of the last applied
 * migration. 0 means that no migrations are applied.
 */
public class VersionTable
{
    private static final Logger logger = LoggerFactory.getLogger(VersionTable.class);

    private final Handle handle;
    private final MigrationContext context;
    private final String tableName;

    public VersionTable(Handle handle, MigrationContext context, String tableName)
    {
        this.handle = handle;
        this.context = context;
        this.tableName = tableName;
    }

    public String getTableName()
    {
        return tableName;
    }

    public boolean exists()
        throws VersionTableException
    {
        int i = tableName.indexOf('.');
        try {
            if (context.isPostgres()) {
                if (i < 0) {
                    return handle.createQuery("select count(*) from pg_catalog.pg_class where relname = :table and relkind = 'r' and pg_table_is_visible(oid)")
                        .bind("table", tableName)
                        .mapTo(Integer.class)
                        .one() > 0;
                }
                return handle.createQuery("select count(*) from pg_catalog.pg_tables where schemaname = :schema and tablename = :table")
                    .bind("schema", tableName.substring(0, i))
                    .bind("table", tableName.substring(i + 1))
                    .mapTo(Integer.class)
                    .one() > 0;
            }
            else {
                // h2 folds unquoted identifiers to upper case
                if (i < 0) {
                    return handle.createQuery("select count(*) from information_schema.tables where table_schema = current_schema and upper(table_name) = upper(:table)")
                        .bind("table", tableName)
                        .mapTo(Integer.class)
                        .one() > 0;
                }
                return handle.createQuery("select count(*) from information_schema.tables where upper(table_schema) = upper(:schema) and upper(table_name) = upper(:table)")
                    .bind("schema", tableName.substring(0, i))
                    .bind("table", tableName.substring(i + 1))
                    .mapTo(Integer.class)
                    .one() > 0;
            }
        }
        catch (JdbiException ex) {
            throw new VersionTableException("Unable to look up version table " + tableName, ex);
        }
    }

    /**
     * Creates the table with version 0 unless it exists.
     */
    public void ensureExists()
        throws TernException
    {
        try (AdvisoryLock lock = AdvisoryLock.acquire(handle, context)) {
            if (exists()) {
                return;
            }
            logger.debug("Creating version table {}", tableName);
            try {
                handle.execute("create table if not exists " + tableName + "(version int4 not null)");
                // the row count is checked under the lock so that two initial runs don't insert twice
                int rows = handle.createQuery("select count(*) from " + tableName)
                    .mapTo(Integer.class)
                    .one();
                if (rows == 0) {
                    handle.execute("insert into " + tableName + "(version) values (0)");
                }
            }
            catch (JdbiException ex) {
                throw new VersionTableException("Unable to create version table " + tableName, ex);
            }
        }
    }

    public int getCurrentVersion()
        throws VersionTableException
    {
        List<Integer> versions;
        try {
            versions = handle.createQuery("select version from " + tableName)
                .mapTo(Integer.class)
                .list();
        }
        catch (JdbiException ex) {
            throw new VersionTableException("Unable to read version table " + tableName, ex);
        }
        if (versions.size() != 1) {
            throw new VersionTableException(String.format(
                        "version table %s must have exactly one row but has %d", tableName, versions.size()));
        }
        return versions.get(0);
    }

    public void setVersion(int version)
        throws VersionTableException
    {
        try {
            handle.execute("update " + tableName + " set version = ?", version);
        }
        catch (JdbiException ex) {
            throw new VersionTableException("Unable to update version table " + tableName, ex);
        }
    }
}
