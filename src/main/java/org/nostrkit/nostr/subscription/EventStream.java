package org.nostrkit.nostr.subscription;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Bounded multi-consumer stream.
 *
 * <p>The stream keeps a replay buffer of the last {@code replayCapacity} items
 * and hands it to every consumer that attaches later. Each pull consumer
 * ({@link Cursor}) owns a queue of {@code replayCapacity + bufferCapacity}
 * items. When any buffer is full the {@link OverflowPolicy} decides what is
 * lost; emitting never blocks and never throws.
 *
 * @param <T> Item type
 */
public class EventStream<T> {

    private static final Logger logger = LoggerFactory.getLogger(EventStream.class);

    /**
     * What to discard when a buffer is full.
     */
    public enum OverflowPolicy {
        /** Evict the oldest buffered item to make room for the new one. */
        DROP_OLDEST,
        /** Keep what is buffered and discard the new item. */
        DROP_NEWEST
    }

    private final int replayCapacity;
    private final int bufferCapacity;
    private final OverflowPolicy overflowPolicy;

    private final ArrayDeque<T> replay = new ArrayDeque<>();
    private final List<Cursor> cursors = new CopyOnWriteArrayList<>();
    private final List<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong droppedCount = new AtomicLong();

    /**
     * @param replayCapacity Items replayed to late consumers (0 disables replay)
     * @param bufferCapacity Extra per-consumer buffer for bursts
     * @param overflowPolicy What to discard when full
     */
    public EventStream(int replayCapacity, int bufferCapacity, OverflowPolicy overflowPolicy) {
        if (replayCapacity < 0 || bufferCapacity < 0) {
            throw new IllegalArgumentException("Capacities cannot be negative");
        }
        if (replayCapacity + bufferCapacity == 0) {
            throw new IllegalArgumentException("Stream needs replay or buffer capacity");
        }
        this.replayCapacity = replayCapacity;
        this.bufferCapacity = bufferCapacity;
        this.overflowPolicy = overflowPolicy;
    }

    /**
     * Emit an item to the replay buffer, every cursor and every listener.
     * Listeners run on the calling thread after the stream lock is released.
     *
     * @return false if the item was dropped anywhere because a buffer was full
     */
    public boolean tryEmit(T item) {
        boolean accepted = true;
        List<Consumer<? super T>> listenerSnapshot;
        synchronized (this) {
            if (replayCapacity > 0) {
                if (replay.size() >= replayCapacity) {
                    if (overflowPolicy == OverflowPolicy.DROP_OLDEST) {
                        replay.pollFirst();
                        replay.addLast(item);
                    }
                } else {
                    replay.addLast(item);
                }
            }

            for (Cursor cursor : cursors) {
                accepted &= cursor.offer(item);
            }
            listenerSnapshot = new ArrayList<>(listeners);
        }

        for (Consumer<? super T> listener : listenerSnapshot) {
            try {
                listener.accept(item);
            } catch (RuntimeException e) {
                logger.warn("Stream listener failed", e);
            }
        }

        if (!accepted) {
            droppedCount.incrementAndGet();
        }
        return accepted;
    }

    /**
     * Open a pull consumer. It starts with a copy of the replay buffer.
     */
    public synchronized Cursor open() {
        Cursor cursor = new Cursor(replayCapacity + bufferCapacity);
        for (T item : replay) {
            cursor.offer(item);
        }
        cursors.add(cursor);
        return cursor;
    }

    /**
     * Register a push consumer. The replay buffer is delivered to it first,
     * on the calling thread.
     *
     * @return Handle that removes the listener
     */
    public synchronized Runnable addListener(Consumer<? super T> listener) {
        for (T item : replay) {
            try {
                listener.accept(item);
            } catch (RuntimeException e) {
                logger.warn("Stream listener failed during replay", e);
            }
        }
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * @return Snapshot of the replay buffer, oldest first
     */
    public synchronized List<T> getReplayCache() {
        return new ArrayList<>(replay);
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    public int getReplayCapacity() {
        return replayCapacity;
    }

    /**
     * @return Number of emissions that lost the item in at least one cursor
     */
    public long getDroppedCount() {
        return droppedCount.get();
    }

    /**
     * @return Number of attached cursors and listeners
     */
    public int getConsumerCount() {
        return cursors.size() + listeners.size();
    }

    /**
     * Pull consumer with its own bounded queue.
     */
    public class Cursor implements AutoCloseable {

        private final BlockingQueue<T> queue;
        private final AtomicLong dropped = new AtomicLong();

        private Cursor(int capacity) {
            this.queue = new ArrayBlockingQueue<>(capacity);
        }

        // Called with the stream lock held, so offers are never concurrent
        private boolean offer(T item) {
            if (queue.offer(item)) {
                return true;
            }
            dropped.incrementAndGet();
            if (overflowPolicy == OverflowPolicy.DROP_OLDEST) {
                queue.poll();
                queue.offer(item);
            }
            return false;
        }

        /**
         * @return Next item, or null if none is buffered
         */
        public T poll() {
            return queue.poll();
        }

        /**
         * @return Next item, or null if none arrives within the timeout
         */
        public T poll(long timeout, TimeUnit unit) throws InterruptedException {
            return queue.poll(timeout, unit);
        }

        /**
         * Move every buffered item into the given collection.
         *
         * @return Number of items moved
         */
        public int drainTo(Collection<? super T> target) {
            return queue.drainTo(target);
        }

        /**
         * @return Items this cursor lost to overflow
         */
        public long getDroppedCount() {
            return dropped.get();
        }

        /**
         * Detach from the stream. Buffered items stay readable.
         */
        @Override
        public void close() {
            cursors.remove(this);
        }
    }
}
