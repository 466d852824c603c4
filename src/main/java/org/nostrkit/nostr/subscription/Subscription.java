package org.nostrkit.nostr.subscription;

import org.nostrkit.nostr.cache.CacheAdapter;
import org.nostrkit.nostr.protocol.Event;
import org.nostrkit.nostr.protocol.Filter;
import org.nostrkit.nostr.relay.Relay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * A consumer's live registration of filters against a set of relays.
 *
 * <p>Events are published on a bounded {@link EventStream} that keeps the last
 * {@link #DEFAULT_REPLAY_SIZE} events for consumers that attach late. When the
 * buffers are full the oldest events are dropped, so delivery is at most N
 * buffered events rather than guaranteed.
 *
 * <p>Filters are fixed at construction. Relays can be added while the
 * subscription is running; {@link #stop()} detaches all of them and is
 * idempotent.
 */
public class Subscription {

    private static final Logger logger = LoggerFactory.getLogger(Subscription.class);

    /** Events kept for consumers that attach late. */
    public static final int DEFAULT_REPLAY_SIZE = 100;

    /** Extra per-consumer buffer for bursts. */
    public static final int DEFAULT_EXTRA_BUFFER = 500;

    /**
     * States of a one-shot {@link #fetchEvent()} query.
     */
    public enum FetchState {
        WAITING,
        EVENT_FOUND,
        ALL_EOSED_NO_EVENT
    }

    private final String id;
    private final List<Filter> filters;
    private final EventStream<Event> events;
    private final CacheAdapter cacheAdapter;
    private final Executor cacheExecutor;

    private final Map<String, Relay> activeRelays = new ConcurrentHashMap<>();
    private final Map<String, Boolean> eosePerRelay = new ConcurrentHashMap<>();
    private final List<NostrEventListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicBoolean eoseNotified = new AtomicBoolean(false);
    private volatile boolean cacheEose;
    private volatile boolean pending;

    private volatile GroupedSubscription group;
    private volatile Consumer<Subscription> stopHandler;

    // Guarded by fetchLock
    private final Object fetchLock = new Object();
    private FetchState fetchState;
    private CompletableFuture<Event> fetchFuture;

    public Subscription(String id, List<Filter> filters) {
        this(id, filters, DEFAULT_REPLAY_SIZE, DEFAULT_EXTRA_BUFFER, null, null);
    }

    /**
     * @param id Unique subscription id
     * @param filters Filters, at least one
     * @param replaySize Events replayed to late consumers
     * @param extraBuffer Extra buffer per consumer
     * @param cacheAdapter Cache used by {@link #loadFromCache()}, may be null
     * @param cacheExecutor Executor for cache queries; null uses the common pool
     */
    public Subscription(String id, List<Filter> filters, int replaySize, int extraBuffer,
                        CacheAdapter cacheAdapter, Executor cacheExecutor) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Subscription id cannot be empty");
        }
        if (filters == null || filters.isEmpty()) {
            throw new IllegalArgumentException("Subscription needs at least one filter");
        }
        for (Filter filter : filters) {
            if (filter == null) {
                throw new IllegalArgumentException("Filters cannot contain null");
            }
        }
        this.id = id;
        this.filters = Collections.unmodifiableList(new ArrayList<>(filters));
        this.events = new EventStream<>(replaySize, extraBuffer, EventStream.OverflowPolicy.DROP_OLDEST);
        this.cacheAdapter = cacheAdapter;
        this.cacheExecutor = cacheExecutor != null ? cacheExecutor : ForkJoinPool.commonPool();
    }

    public String getId() {
        return id;
    }

    public List<Filter> getFilters() {
        return filters;
    }

    /**
     * @return Stream of events delivered to this subscription
     */
    public EventStream<Event> getEvents() {
        return events;
    }

    /**
     * @return Whether any of this subscription's filters matches the event
     */
    public boolean matches(Event event) {
        for (Filter filter : filters) {
            if (filter.matches(event)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Start the subscription on the given relays, sending a REQ to each.
     * Relays already attached are skipped.
     */
    public void start(Collection<? extends Relay> relays) {
        if (stopped.get()) {
            logger.debug("Ignoring start of stopped subscription {}", id);
            return;
        }
        pending = false;
        for (Relay relay : relays) {
            if (attach(relay)) {
                relay.subscribe(id, filters);
            }
        }
        checkFetchCompletion();
    }

    /**
     * Add relays to a running subscription. Only relays not yet attached get
     * a subscribe call; for a grouped subscription the shared relay-level
     * subscription is extended instead.
     */
    public void addRelays(Collection<? extends Relay> relays) {
        if (stopped.get()) {
            return;
        }
        List<Relay> added = new ArrayList<>();
        for (Relay relay : relays) {
            if (attach(relay)) {
                added.add(relay);
            }
        }
        if (added.isEmpty()) {
            return;
        }

        GroupedSubscription currentGroup = group;
        if (currentGroup != null) {
            currentGroup.addRelays(added);
        } else {
            for (Relay relay : added) {
                relay.subscribe(id, filters);
            }
        }
    }

    public boolean hasRelay(String url) {
        return activeRelays.containsKey(url);
    }

    /**
     * @return Snapshot of attached relays
     */
    public List<Relay> getActiveRelays() {
        return new ArrayList<>(activeRelays.values());
    }

    /**
     * Deliver an event to the stream and listeners. No-op after {@link #stop()}.
     *
     * @param event The event
     * @param relay Relay that sent it, null for cached events
     */
    public void emit(Event event, Relay relay) {
        if (stopped.get()) {
            return;
        }
        events.tryEmit(event);
        for (NostrEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.error("Listener failed for subscription {}", id, e);
            }
        }

        boolean resolved = false;
        CompletableFuture<Event> future;
        synchronized (fetchLock) {
            future = fetchFuture;
            if (fetchState == FetchState.WAITING) {
                fetchState = FetchState.EVENT_FOUND;
                resolved = true;
            }
        }
        if (resolved) {
            future.complete(event);
            stop();
        }
    }

    /**
     * Record End-Of-Stored-Events from a relay.
     */
    public void markEose(Relay relay) {
        markEose(relay.getUrl());
    }

    public void markEose(String relayUrl) {
        eosePerRelay.put(relayUrl, Boolean.TRUE);
        if (!activeRelays.containsKey(relayUrl)) {
            logger.debug("EOSE from unattached relay {} for subscription {}", relayUrl, id);
            return;
        }
        if (isEoseComplete() && eoseNotified.compareAndSet(false, true)) {
            for (NostrEventListener listener : listeners) {
                try {
                    listener.onEndOfStoredEvents(id);
                } catch (RuntimeException e) {
                    logger.error("Listener failed for subscription {}", id, e);
                }
            }
        }
        checkFetchCompletion();
    }

    /**
     * A relay closed the subscription. Listeners get the relay's message and
     * the relay counts as finished.
     */
    public void markClosed(Relay relay, String message) {
        logger.warn("Relay {} closed subscription {}: {}", relay.getUrl(), id, message);
        for (NostrEventListener listener : listeners) {
            try {
                listener.onError(id, message);
            } catch (RuntimeException e) {
                logger.error("Listener failed for subscription {}", id, e);
            }
        }
        markEose(relay);
    }

    /**
     * @return true once every attached relay has sent EOSE; false with no relays
     */
    public boolean isEoseComplete() {
        if (activeRelays.isEmpty()) {
            return false;
        }
        for (String url : activeRelays.keySet()) {
            if (!Boolean.TRUE.equals(eosePerRelay.get(url))) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return Snapshot of relay URL to EOSE-received
     */
    public Map<String, Boolean> getEosePerRelay() {
        Map<String, Boolean> snapshot = new HashMap<>();
        for (String url : activeRelays.keySet()) {
            snapshot.put(url, Boolean.TRUE.equals(eosePerRelay.get(url)));
        }
        return snapshot;
    }

    /**
     * @return true once cached results have been emitted
     */
    public boolean isCacheEose() {
        return cacheEose;
    }

    public void addListener(NostrEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(NostrEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Resolve with the first event delivered, or null once every relay has sent
     * EOSE with nothing delivered. Either way the subscription is stopped.
     * Repeated calls return the same future.
     */
    public CompletableFuture<Event> fetchEvent() {
        Event found = null;
        boolean done = false;
        CompletableFuture<Event> future;
        synchronized (fetchLock) {
            if (fetchFuture != null) {
                return fetchFuture;
            }
            fetchFuture = new CompletableFuture<>();
            future = fetchFuture;

            List<Event> replayed = events.getReplayCache();
            if (stopped.get()) {
                fetchState = FetchState.ALL_EOSED_NO_EVENT;
                done = true;
            } else if (!replayed.isEmpty()) {
                fetchState = FetchState.EVENT_FOUND;
                found = replayed.get(0);
                done = true;
            } else if (isNothingToWaitFor()) {
                fetchState = FetchState.ALL_EOSED_NO_EVENT;
                done = true;
            } else {
                fetchState = FetchState.WAITING;
            }
        }
        if (done) {
            future.complete(found);
            stop();
        }
        return future;
    }

    /**
     * @return State of the one-shot query, or null if {@link #fetchEvent()} was never called
     */
    public FetchState getFetchState() {
        synchronized (fetchLock) {
            return fetchState;
        }
    }

    /**
     * Emit cached events matching the filters, with time bounds and limit
     * removed, then mark the cache as done. Runs on the cache executor;
     * cache failures are logged and never reach the caller.
     */
    public CompletableFuture<Void> loadFromCache() {
        if (cacheAdapter == null) {
            cacheEose = true;
            return CompletableFuture.completedFuture(null);
        }
        try {
            return CompletableFuture.runAsync(this::emitCachedEvents, cacheExecutor);
        } catch (RejectedExecutionException e) {
            logger.warn("Cache executor rejected preload for subscription {}", id, e);
            cacheEose = true;
            return CompletableFuture.completedFuture(null);
        }
    }

    private void emitCachedEvents() {
        try {
            for (Filter filter : filters) {
                if (stopped.get()) {
                    break;
                }
                try (Stream<Event> cached = cacheAdapter.query(filter.withoutTemporalConstraints())) {
                    cached.forEach(event -> emit(event, null));
                }
            }
        } catch (RuntimeException e) {
            logger.warn("Cache query failed for subscription {}", id, e);
        } finally {
            cacheEose = true;
        }
    }

    /**
     * Stop the subscription: unsubscribe from every attached relay and drop
     * them. Safe to call more than once and from a delivery thread.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        pending = false;

        if (group == null) {
            for (Relay relay : activeRelays.values()) {
                try {
                    relay.unsubscribe(id);
                } catch (RuntimeException e) {
                    logger.warn("Failed to unsubscribe {} from {}", id, relay.getUrl(), e);
                }
            }
        }
        activeRelays.clear();

        CompletableFuture<Event> future;
        synchronized (fetchLock) {
            future = fetchFuture;
            if (fetchState == FetchState.WAITING) {
                fetchState = FetchState.ALL_EOSED_NO_EVENT;
            }
        }
        if (future != null) {
            future.complete(null);
        }

        Consumer<Subscription> handler = stopHandler;
        if (handler != null) {
            handler.accept(this);
        }
        logger.debug("Subscription {} stopped", id);
    }

    public boolean isStopped() {
        return stopped.get();
    }

    /**
     * @return Group this subscription belongs to, or null if it runs on its own id
     */
    public GroupedSubscription getGroup() {
        return group;
    }

    public boolean isGrouped() {
        return group != null;
    }

    void setStopHandler(Consumer<Subscription> stopHandler) {
        this.stopHandler = stopHandler;
    }

    /**
     * Waiting for a grouping batch: no relays yet, but a fetch should not
     * resolve as empty.
     */
    void markPending() {
        pending = true;
    }

    /**
     * Join a shared relay-level subscription. The relays are recorded for EOSE
     * tracking; the group owns the relay traffic.
     */
    void attachToGroup(GroupedSubscription group, Collection<? extends Relay> relays) {
        this.group = group;
        pending = false;
        for (Relay relay : relays) {
            attach(relay);
        }
        checkFetchCompletion();
    }

    private boolean attach(Relay relay) {
        if (activeRelays.putIfAbsent(relay.getUrl(), relay) != null) {
            return false;
        }
        eosePerRelay.putIfAbsent(relay.getUrl(), Boolean.FALSE);
        return true;
    }

    private boolean isNothingToWaitFor() {
        if (activeRelays.isEmpty()) {
            return !pending;
        }
        return isEoseComplete();
    }

    private void checkFetchCompletion() {
        boolean resolved = false;
        CompletableFuture<Event> future;
        synchronized (fetchLock) {
            future = fetchFuture;
            if (fetchState == FetchState.WAITING && isNothingToWaitFor()) {
                fetchState = FetchState.ALL_EOSED_NO_EVENT;
                resolved = true;
            }
        }
        if (resolved) {
            future.complete(null);
            stop();
        }
    }

    @Override
    public String toString() {
        return "Subscription{" +
                "id='" + id + '\'' +
                ", filters=" + filters.size() +
                ", relays=" + activeRelays.keySet() +
                ", grouped=" + (group != null) +
                '}';
    }
}
