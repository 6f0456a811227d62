package io.tern.core.migrate;

import org.jdbi.v3.core.Handle;

/**
 * Code that moves the schema in one direction. The handle is inside a
 * transaction unless the owning {@link FunctionMigration} disables it.
 */
@FunctionalInterface
public interface MigrationFunction
{
    void migrate(Handle handle, MigrationContext context)
        throws Exception;
}
