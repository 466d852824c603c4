package org.nostrkit.nostr.subscription;

import java.util.concurrent.TimeUnit;

/**
 * Runs delayed tasks. Production code uses {@link ExecutorScheduler}; tests
 * drive time by hand.
 */
public interface Scheduler {

    /**
     * Run a task once after a delay.
     *
     * @param task Task to run
     * @param delay Delay before running
     * @param unit Unit of the delay
     * @return Handle that can cancel the task before it runs
     */
    ScheduledTask schedule(Runnable task, long delay, TimeUnit unit);

    /**
     * Handle to a scheduled task.
     */
    interface ScheduledTask {
        /**
         * @return true if the task was cancelled before running
         */
        boolean cancel();
    }
}
