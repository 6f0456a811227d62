package io.tern.core.database;

import org.junit.After;
import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class LocalLockMapTest
{
    private final LocalLockMap lockMap = new LocalLockMap();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @After
    public void shutdown()
    {
        executor.shutdownNow();
    }

    private Future<Boolean> lockInBackground(String key, Object owner)
        throws InterruptedException
    {
        CountDownLatch started = new CountDownLatch(1);
        Future<Boolean> locked = executor.submit(() -> {
            started.countDown();
            lockMap.lock(key, owner);
            return true;
        });
        started.await();
        Thread.sleep(50);
        return locked;
    }

    @Test
    public void ownerCanLockAgain()
        throws Exception
    {
        Object owner = new Object();
        Object waiter = new Object();
        lockMap.lock("k", owner);
        lockMap.lock("k", owner);

        Future<Boolean> locked = lockInBackground("k", waiter);

        assertThat(lockMap.unlock("k", owner), is(true));
        Thread.sleep(50);
        assertThat(locked.isDone(), is(false));

        assertThat(lockMap.unlock("k", owner), is(true));
        assertThat(locked.get(10, TimeUnit.SECONDS), is(true));
        assertThat(lockMap.unlock("k", waiter), is(true));
    }

    @Test
    public void onlyOwnerCanUnlock()
        throws Exception
    {
        Object owner = new Object();
        lockMap.lock("k", owner);

        assertThat(lockMap.unlock("k", new Object()), is(false));
        assertThat(lockMap.unlock("other-key", owner), is(false));
        assertThat(lockMap.unlock("k", owner), is(true));
        assertThat(lockMap.unlock("k", owner), is(false));
    }

    @Test
    public void keysAreIndependent()
        throws Exception
    {
        lockMap.lock("k", new Object());

        Future<Boolean> locked = lockInBackground("other-key", new Object());
        assertThat(locked.get(10, TimeUnit.SECONDS), is(true));
    }

    @Test
    public void unlockWakesUpWaiter()
        throws Exception
    {
        Object owner = new Object();
        Object waiter = new Object();
        lockMap.lock("k", owner);

        Future<Boolean> locked = lockInBackground("k", waiter);
        assertThat(locked.isDone(), is(false));

        lockMap.unlock("k", owner);
        assertThat(locked.get(10, TimeUnit.SECONDS), is(true));
        assertThat(lockMap.unlock("k", waiter), is(true));
    }
}
