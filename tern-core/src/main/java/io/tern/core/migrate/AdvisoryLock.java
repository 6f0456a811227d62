package io.tern.core.migrate;

import org.jdbi.v3.core.Handle;

/**
 * Database-wide lock held by a session while it changes the schema.
 *
 * Every tern process uses the same key, so a migration and a code package
 * installation never run at the same time against one database.
 */
public interface AdvisoryLock
        extends AutoCloseable
{
    long LOCK_ID = 9628173550095224L;

    /**
     * Blocks until the session of {@code handle} holds the lock.
     */
    static AdvisoryLock acquire(Handle handle, MigrationContext context)
        throws MigrationLockException, MigrationCancelledException
    {
        if (context.isPostgres()) {
            return PostgresAdvisoryLock.lock(handle);
        }
        else {
            return LocalAdvisoryLock.lock(handle, context.getDatabaseUrl());
        }
    }

    @Override
    void close() throws MigrationLockException;
}
