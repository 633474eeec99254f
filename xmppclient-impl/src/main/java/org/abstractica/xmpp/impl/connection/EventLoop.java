package org.abstractica.xmpp.impl.connection;

import java.time.Duration;

/**
 * Single-threaded, run-to-completion executor for session state.
 *
 * <p>Every task runs to completion before the next one starts, so state
 * confined to the loop needs no locking. Engine callbacks, timer expiries
 * and public API calls are all posted here.</p>
 */
public interface EventLoop extends AutoCloseable
{
    /**
     * Queues a task for execution on the loop.
     *
     * @param task the task
     */
    void execute(Runnable task);

    /**
     * Schedules a task to run on the loop after a delay.
     *
     * @param task  the task
     * @param delay how long to wait
     * @return handle for cancelling the task
     */
    ScheduledTask schedule(Runnable task, Duration delay);

    /**
     * Stops the loop. Pending tasks are discarded.
     */
    @Override
    void close();

    /**
     * Handle to a scheduled task.
     */
    interface ScheduledTask
    {
        /**
         * Cancels the task if it has not yet run.
         */
        void cancel();

        boolean isCancelled();
    }
}
