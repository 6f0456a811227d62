package io.tern.core.migrate;

import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class PostgresAdvisoryLock
        implements AdvisoryLock
{
    private static final Logger logger = LoggerFactory.getLogger(PostgresAdvisoryLock.class);

    private final Handle handle;
    private boolean released = false;

    private PostgresAdvisoryLock(Handle handle)
    {
        this.handle = handle;
    }

    static PostgresAdvisoryLock lock(Handle handle)
        throws MigrationLockException
    {
        logger.debug("Acquiring advisory lock {}", LOCK_ID);
        try {
            handle.execute("select pg_advisory_lock(?)", LOCK_ID);
        }
        catch (JdbiException ex) {
            throw new MigrationLockException("Unable to acquire advisory lock", ex);
        }
        logger.debug("Acquired advisory lock {}", LOCK_ID);
        return new PostgresAdvisoryLock(handle);
    }

    @Override
    public void close()
        throws MigrationLockException
    {
        if (released) {
            return;
        }
        released = true;
        try {
            boolean held = handle.createQuery("select pg_advisory_unlock(:id)")
                .bind("id", LOCK_ID)
                .mapTo(Boolean.class)
                .one();
            if (!held) {
                logger.warn("Advisory lock {} was not held by this session", LOCK_ID);
            }
        }
        catch (JdbiException ex) {
            throw new MigrationLockException("Unable to release advisory lock", ex);
        }
    }
}
