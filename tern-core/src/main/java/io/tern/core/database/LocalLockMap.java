package io.tern.core.database;

import java.util.HashMap;
import java.util.Map;

/**
 * In-process replacement of a session-scoped advisory lock, for databases
 * that don't have one (h2).
 *
 * A lock is identified by a key and held by an owner object. The owner that
 * holds a lock may take it again; it is released when every lock call has been
 * matched by an unlock call.
 */
public class LocalLockMap
{
    private static final LocalLockMap SHARED = new LocalLockMap();

    public static LocalLockMap shared()
    {
        return SHARED;
    }

    private static class Holder
    {
        private final Object owner;
        private int count;

        Holder(Object owner)
        {
            this.owner = owner;
        }
    }

    private static class Block
    {
        private final Map<String, Holder> holders = new HashMap<>();

        public synchronized void lock(String key, Object owner)
            throws InterruptedException
        {
            while (true) {
                Holder holder = holders.get(key);
                if (holder == null) {
                    holder = new Holder(owner);
                    holders.put(key, holder);
                }
                if (holder.owner == owner) {
                    holder.count++;
                    return;
                }
                wait();
            }
        }

        public synchronized boolean unlock(String key, Object owner)
        {
            Holder holder = holders.get(key);
            if (holder == null || holder.owner != owner) {
                return false;
            }
            if (--holder.count == 0) {
                holders.remove(key);
                notifyAll();
            }
            return true;
        }
    }

    private final Block[] blocks = new Block[256];

    public LocalLockMap()
    {
        for (int i = 0; i < blocks.length; i++) {
            blocks[i] = new Block();
        }
    }

    /**
     * Blocks until {@code owner} holds the lock.
     */
    public void lock(String key, Object owner)
        throws InterruptedException
    {
        block(key).lock(key, owner);
    }

    /**
     * Returns false if {@code owner} did not hold the lock.
     */
    public boolean unlock(String key, Object owner)
    {
        return block(key).unlock(key, owner);
    }

    private Block block(String key)
    {
        return blocks[Math.floorMod(key.hashCode(), blocks.length)];
    }
}
