package io.tern.core.migrate;

import io.tern.core.database.DatabaseConfig;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.JdbiException;

import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.sql.Statement;

public class MigrationContext
{
    private final String databaseType;
    private final String databaseUrl;
    private final boolean transactional;

    public MigrationContext(String databaseType, String databaseUrl)
    {
        this(databaseType, databaseUrl, true);
    }

    private MigrationContext(String databaseType, String databaseUrl, boolean transactional)
    {
        this.databaseType = databaseType;
        this.databaseUrl = databaseUrl;
        this.transactional = transactional;
    }

    /**
     * Builds a context from the metadata of the connection behind {@code handle}.
     */
    public static MigrationContext of(Handle handle)
        throws MigrationDatabaseException
    {
        try {
            DatabaseMetaData meta = handle.getConnection().getMetaData();
            String product = meta.getDatabaseProductName();
            String type;
            if ("PostgreSQL".equals(product)) {
                type = DatabaseConfig.POSTGRESQL;
            }
            else if ("H2".equals(product)) {
                type = DatabaseConfig.H2;
            }
            else {
                throw new MigrationDatabaseException("Unsupported database: " + product, null);
            }
            return new MigrationContext(type, meta.getURL());
        }
        catch (SQLException | JdbiException ex) {
            throw new MigrationDatabaseException("Unable to read database metadata", ex);
        }
    }

    public String getDatabaseType()
    {
        return databaseType;
    }

    public String getDatabaseUrl()
    {
        return databaseUrl;
    }

    public boolean isPostgres()
    {
        return DatabaseConfig.isPostgres(databaseType);
    }

    /**
     * False if the current step runs outside of a transaction. SQL steps run
     * statement by statement in that case.
     */
    public boolean isTransactional()
    {
        return transactional;
    }

    public MigrationContext withTransactional(boolean transactional)
    {
        if (this.transactional == transactional) {
            return this;
        }
        return new MigrationContext(databaseType, databaseUrl, transactional);
    }

    /**
     * Sends {@code sql} to the database as is.
     */
    public void execute(Handle handle, String migrationName, String sql)
        throws MigrationExecutionException, MigrationCancelledException
    {
        checkCancelled();
        if (sql.trim().isEmpty()) {
            return;
        }
        try (Statement stmt = handle.getConnection().createStatement()) {
            stmt.execute(sql);
        }
        catch (SQLException ex) {
            throw new MigrationExecutionException(migrationName, sql, ex);
        }
    }

    static void checkCancelled()
        throws MigrationCancelledException
    {
        if (Thread.interrupted()) {
            throw new MigrationCancelledException("Migration cancelled");
        }
    }
}
