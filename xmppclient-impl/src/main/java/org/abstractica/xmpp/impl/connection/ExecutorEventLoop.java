package org.abstractica.xmpp.impl.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link EventLoop} backed by a single-thread scheduled executor.
 *
 * <p>The loop thread is a daemon so an abandoned client does not keep the
 * JVM alive.</p>
 */
public class ExecutorEventLoop implements EventLoop
{
    private static final Logger LOG = LoggerFactory.getLogger(ExecutorEventLoop.class);

    private final ScheduledExecutorService executor;

    /**
     * Creates a loop running on a thread with the given name.
     *
     * @param threadName name of the loop thread
     */
    public ExecutorEventLoop(String threadName)
    {
        Objects.requireNonNull(threadName, "threadName");
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable ->
        {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void execute(Runnable task)
    {
        Objects.requireNonNull(task, "task");
        try
        {
            executor.execute(() -> runSafely(task));
        }
        catch (RejectedExecutionException e)
        {
            LOG.debug("Event loop closed, dropping task");
        }
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay)
    {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(delay, "delay");
        try
        {
            ScheduledFuture<?> future = executor.schedule(() -> runSafely(task), delay.toMillis(), TimeUnit.MILLISECONDS);
            return new FutureTask(future);
        }
        catch (RejectedExecutionException e)
        {
            LOG.debug("Event loop closed, not scheduling task");
            return new FutureTask(null);
        }
    }

    @Override
    public void close()
    {
        executor.shutdownNow();
    }

    private static void runSafely(Runnable task)
    {
        try
        {
            task.run();
        }
        catch (Exception e)
        {
            LOG.error("Error in event loop task", e);
        }
    }

    private static final class FutureTask implements ScheduledTask
    {
        private final ScheduledFuture<?> future;
        private volatile boolean cancelled;

        private FutureTask(ScheduledFuture<?> future)
        {
            this.future = future;
            this.cancelled = future == null;
        }

        @Override
        public void cancel()
        {
            cancelled = true;
            if (future != null)
            {
                future.cancel(false);
            }
        }

        @Override
        public boolean isCancelled()
        {
            return cancelled;
        }
    }
}
