package io.tern.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Interrupts the current thread when the JVM is asked to shut down (for
 * example by Ctrl-C), and holds the shutdown until the thread calls
 * {@link #close()} so that it can roll back and unlock.
 *
 * A second Ctrl-C does not stop a JVM that is shutting down. The hook gives
 * up waiting after {@code maxWaitSeconds}.
 */
public class InterruptHandler
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(InterruptHandler.class);

    private final Thread hook;
    private final CountDownLatch done = new CountDownLatch(1);

    private InterruptHandler(Thread target, long maxWaitSeconds)
    {
        this.hook = new Thread(() -> {
            if (done.getCount() == 0) {
                return;
            }
            logger.warn("Interrupted. Cancelling the migration");
            target.interrupt();
            try {
                if (!done.await(maxWaitSeconds, TimeUnit.SECONDS)) {
                    logger.warn("Migration didn't stop within {} seconds", maxWaitSeconds);
                }
            }
            catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, "tern-shutdown");
    }

    public static InterruptHandler install(long maxWaitSeconds)
    {
        InterruptHandler handler = new InterruptHandler(Thread.currentThread(), maxWaitSeconds);
        Runtime.getRuntime().addShutdownHook(handler.hook);
        return handler;
    }

    @Override
    public void close()
    {
        done.countDown();
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        }
        catch (IllegalStateException ex) {
            logger.debug("JVM is shutting down", ex);
        }
    }
}
