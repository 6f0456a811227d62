package io.tern.core.migrate;

import io.tern.core.database.LocalLockMap;
import org.jdbi.v3.core.Handle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// h2 doesn't have advisory locks. Sessions of this JVM are serialized with a
// lock keyed by the database URL.
class LocalAdvisoryLock
        implements AdvisoryLock
{
    private static final Logger logger = LoggerFactory.getLogger(LocalAdvisoryLock.class);

    private final LocalLockMap lockMap;
    private final String key;
    private final Handle owner;
    private boolean released = false;

    private LocalAdvisoryLock(LocalLockMap lockMap, String key, Handle owner)
    {
        this.lockMap = lockMap;
        this.key = key;
        this.owner = owner;
    }

    static LocalAdvisoryLock lock(Handle handle, String databaseUrl)
        throws MigrationCancelledException
    {
        return lock(LocalLockMap.shared(), handle, databaseUrl);
    }

    static LocalAdvisoryLock lock(LocalLockMap lockMap, Handle handle, String databaseUrl)
        throws MigrationCancelledException
    {
        String key = databaseUrl + "#" + LOCK_ID;
        logger.debug("Acquiring local lock {}", key);
        try {
            lockMap.lock(key, handle);
        }
        catch (InterruptedException ex) {
            throw new MigrationCancelledException("Migration cancelled while waiting for lock", ex);
        }
        return new LocalAdvisoryLock(lockMap, key, handle);
    }

    @Override
    public void close()
        throws MigrationLockException
    {
        if (released) {
            return;
        }
        released = true;
        if (!lockMap.unlock(key, owner)) {
            throw new MigrationLockException("Lock " + key + " was not held by this session", null);
        }
    }
}
