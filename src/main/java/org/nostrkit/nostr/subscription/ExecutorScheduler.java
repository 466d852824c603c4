package org.nostrkit.nostr.subscription;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link Scheduler} backed by a single-threaded {@link ScheduledExecutorService}
 * running on daemon threads.
 */
public class ExecutorScheduler implements Scheduler {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorScheduler.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final ScheduledExecutorService executor;

    public ExecutorScheduler() {
        this(Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "nostr-scheduler-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }));
    }

    public ExecutorScheduler(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    @Override
    public ScheduledTask schedule(Runnable task, long delay, TimeUnit unit) {
        ScheduledFuture<?> future = executor.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("Scheduled task failed", e);
            }
        }, delay, unit);
        return () -> future.cancel(false);
    }

    /**
     * Stop accepting tasks. Already scheduled tasks are discarded.
     */
    public void shutdown() {
        executor.shutdownNow();
    }
}
