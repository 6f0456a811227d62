package io.tern.core.database;

import com.google.common.base.Optional;
import org.immutables.value.Value;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;
import java.util.UUID;

@Value.Immutable
public interface DatabaseConfig
{
    String POSTGRESQL = "postgresql";
    String H2 = "h2";

    String getType();

    Optional<String> getHost();

    Optional<Integer> getPort();

    Optional<String> getDatabase();

    Optional<String> getUser();

    Optional<String> getPassword();

    Optional<String> getSslmode();

    Optional<String> getSslrootcert();

    // a complete JDBC URL. host, port and database are ignored when this is set
    Optional<String> getConnString();

    // h2 only. in-memory database if absent
    Optional<String> getPath();

    @Value.Default
    default int getConnectionTimeout()  // seconds
    {
        return 30;
    }

    @Value.Default
    default int getMaximumPoolSize()
    {
        return 2;
    }

    static ImmutableDatabaseConfig.Builder builder()
    {
        return ImmutableDatabaseConfig.builder();
    }

    static String buildJdbcUrl(DatabaseConfig config)
    {
        if (config.getConnString().isPresent()) {
            return config.getConnString().get();
        }

        switch (config.getType()) {
        case H2:
            if (config.getPath().isPresent()) {
                Path path = FileSystems.getDefault().getPath(config.getPath().get());
                return String.format(Locale.ENGLISH,
                        "jdbc:h2:%s",
                        path.toAbsolutePath().toString());  // h2 requires absolute path
            }
            else {
                return String.format(Locale.ENGLISH,
                        "jdbc:h2:mem:tern-%s",
                        UUID.randomUUID());
            }

        case POSTGRESQL:
            {
                if (!config.getHost().isPresent()) {
                    throw new IllegalArgumentException("Config must contain host but it does not");
                }
                if (!config.getDatabase().isPresent()) {
                    throw new IllegalArgumentException("Config must contain database but it does not");
                }
                if (config.getPort().isPresent()) {
                    return String.format(Locale.ENGLISH,
                            "jdbc:postgresql://%s:%d/%s",
                            config.getHost().get(), config.getPort().get(), config.getDatabase().get());
                }
                else {
                    return String.format(Locale.ENGLISH,
                            "jdbc:postgresql://%s/%s",
                            config.getHost().get(), config.getDatabase().get());
                }
            }

        default:
            throw new IllegalArgumentException("Unsupported database type: " + config.getType());
        }
    }

    static Properties buildJdbcProperties(DatabaseConfig config)
    {
        Properties props = new Properties();

        switch (config.getType()) {
        case H2:
            // nothing
            break;

        case POSTGRESQL:
            props.setProperty("loginTimeout", Integer.toString(config.getConnectionTimeout())); // seconds
            props.setProperty("tcpKeepAlive", "true");
            props.setProperty("ApplicationName", "tern");
            if (config.getSslmode().isPresent()) {
                props.setProperty("sslmode", config.getSslmode().get());
            }
            if (config.getSslrootcert().isPresent()) {
                props.setProperty("sslrootcert", config.getSslrootcert().get());
            }
            break;

        default:
            throw new IllegalArgumentException("Unsupported database type: " + config.getType());
        }

        if (config.getUser().isPresent()) {
            props.setProperty("user", config.getUser().get());
        }
        if (config.getPassword().isPresent()) {
            props.setProperty("password", config.getPassword().get());
        }

        return props;
    }

    static String getDriverClassName(String type)
    {
        switch (type) {
        case H2:
            return "org.h2.Driver";
        case POSTGRESQL:
            return "org.postgresql.Driver";
        default:
            throw new IllegalArgumentException("Unsupported database type: " + type);
        }
    }

    static boolean isPostgres(String databaseType)
    {
        return databaseType.equals(POSTGRESQL);
    }
}
