package io.tern.cli;

import com.beust.jcommander.Parameter;

import java.io.PrintStream;
import java.util.Properties;

/**
 * Connection options of the command line. They override configuration files.
 */
public class ConnectionOptions
{
    @Parameter(names = {"--conn-string"})
    String connString = null;

    @Parameter(names = {"--host"})
    String host = null;

    @Parameter(names = {"--port"})
    Integer port = null;

    @Parameter(names = {"--user"})
    String user = null;

    @Parameter(names = {"--password"})
    String password = null;

    @Parameter(names = {"--database"})
    String database = null;

    @Parameter(names = {"--sslmode"})
    String sslmode = null;

    @Parameter(names = {"--sslrootcert"})
    String sslrootcert = null;

    @Parameter(names = {"--version-table"})
    String versionTable = null;

    public void applyTo(Properties props)
    {
        set(props, ConfigLoader.CONN_STRING, connString);
        set(props, ConfigLoader.HOST, host);
        set(props, ConfigLoader.PORT, port == null ? null : port.toString());
        set(props, ConfigLoader.USER, user);
        set(props, ConfigLoader.PASSWORD, password);
        set(props, ConfigLoader.DATABASE, database);
        set(props, ConfigLoader.SSLMODE, sslmode);
        set(props, ConfigLoader.SSLROOTCERT, sslrootcert);
        set(props, ConfigLoader.VERSION_TABLE, versionTable);
    }

    private static void set(Properties props, String key, String value)
    {
        if (value != null && !value.isEmpty()) {
            props.setProperty(key, value);
        }
    }

    static void showOptions(PrintStream err)
    {
        err.println("    --conn-string URL                JDBC URL of the database");
        err.println("    --host HOST                      database host");
        err.println("    --port PORT                      database port");
        err.println("    --user USER                      database user");
        err.println("    --password PASSWORD              database password");
        err.println("    --database NAME                  database name");
        err.println("    --sslmode MODE                   SSL mode");
        err.println("    --sslrootcert PATH               SSL root certificate");
        err.println("    --version-table NAME             version table name (default: public.schema_version)");
    }
}
