package io.tern.cli;

import com.google.common.collect.ImmutableSet;
import io.tern.core.database.DatabaseConfig;
import io.tern.core.migrate.MigratorConfig;
import org.immutables.value.Value;

import java.util.Map;
import java.util.Set;

/**
 * Settings of one command invocation, merged from configuration files,
 * environment variables and command line options.
 */
@Value.Immutable
public interface TernConfig
{
    Set<String> SSL_MODES = ImmutableSet.of("disable", "allow", "prefer", "require", "verify-ca", "verify-full");

    DatabaseConfig getDatabase();

    @Value.Default
    default String getVersionTable()
    {
        return MigratorConfig.DEFAULT_VERSION_TABLE;
    }

    // variables of migration templates
    Map<String, String> getData();

    default MigratorConfig toMigratorConfig()
    {
        return MigratorConfig.builder()
            .versionTable(getVersionTable())
            .build();
    }

    /**
     * Checks that the settings are enough to connect to the database.
     *
     * @throws IllegalArgumentException if not
     */
    default void validate()
    {
        DatabaseConfig db = getDatabase();
        switch (db.getType()) {
        case DatabaseConfig.POSTGRESQL:
            if (!db.getConnString().isPresent()) {
                if (!db.getHost().isPresent()) {
                    throw new IllegalArgumentException("Config must contain host but it does not");
                }
                if (!db.getDatabase().isPresent()) {
                    throw new IllegalArgumentException("Config must contain database but it does not");
                }
            }
            if (db.getSslmode().isPresent() && !SSL_MODES.contains(db.getSslmode().get())) {
                throw new IllegalArgumentException("sslmode is invalid");
            }
            break;
        case DatabaseConfig.H2:
            break;
        default:
            throw new IllegalArgumentException("Unsupported database type: " + db.getType());
        }
    }

    static ImmutableTernConfig.Builder builder()
    {
        return ImmutableTernConfig.builder();
    }
}
