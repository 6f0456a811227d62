package io.tern.core.migrate;

import org.immutables.value.Value;

@Value.Immutable
public interface MigratorConfig
{
    String DEFAULT_VERSION_TABLE = "public.schema_version";

    /**
     * Name of the single-row table holding the schema version. Should be
     * qualified with a schema.
     */
    @Value.Default
    default String getVersionTable()
    {
        return DEFAULT_VERSION_TABLE;
    }

    /**
     * Runs every step outside of a transaction.
     */
    @Value.Default
    default boolean getDisableTx()
    {
        return false;
    }

    static ImmutableMigratorConfig.Builder builder()
    {
        return ImmutableMigratorConfig.builder();
    }

    static MigratorConfig defaultConfig()
    {
        return builder().build();
    }
}
