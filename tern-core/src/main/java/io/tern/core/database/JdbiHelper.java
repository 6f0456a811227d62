package io.tern.core.database;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.h2.H2DatabasePlugin;
import org.jdbi.v3.postgres.PostgresPlugin;

import javax.sql.DataSource;

public class JdbiHelper
{
    private JdbiHelper()
    { }

    public static Jdbi createJdbi(DataSource ds, String databaseType)
    {
        Jdbi jdbi = Jdbi.create(ds);
        if (DatabaseConfig.isPostgres(databaseType)) {
            jdbi.installPlugin(new PostgresPlugin());
        }
        else {
            jdbi.installPlugin(new H2DatabasePlugin());
        }
        return jdbi;
    }
}
