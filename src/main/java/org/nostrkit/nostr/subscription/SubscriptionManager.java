package org.nostrkit.nostr.subscription;

import org.nostrkit.nostr.cache.CacheAdapter;
import org.nostrkit.nostr.crypto.EventVerifier;
import org.nostrkit.nostr.protocol.Event;
import org.nostrkit.nostr.protocol.Filter;
import org.nostrkit.nostr.relay.Relay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;

/**
 * Single entry point for everything relays deliver.
 *
 * <p>{@link #dispatchEvent} runs each event through, in order:
 * <ol>
 *   <li>deduplication against an LRU index of first-seen keys</li>
 *   <li>sampled signature verification, weighted by the relay's track record</li>
 *   <li>recording the key as seen</li>
 *   <li>an asynchronous cache write</li>
 *   <li>the global event stream</li>
 *   <li>the group that owns the relay-level subscription id, if any</li>
 *   <li>every ungrouped subscription whose filters match</li>
 * </ol>
 * Duplicates and invalid events stop at their step with no side effects further down.
 */
public class SubscriptionManager {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionManager.class);

    /** Extra buffer of the global event stream. */
    public static final int DEFAULT_GLOBAL_BUFFER = 1000;

    private static final String SUBSCRIPTION_ID_PREFIX = "sub-";

    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final EventDeduplicationIndex seenEvents;
    private final EventStream<RelayEvent> allEvents;
    private final SubscriptionGrouper grouper;
    private final ValidationRatioTracker validationTracker;
    private final EventVerifier eventVerifier;
    private final CacheAdapter cacheAdapter;
    private final Executor cacheExecutor;

    private volatile int replaySize = Subscription.DEFAULT_REPLAY_SIZE;
    private volatile int extraBuffer = Subscription.DEFAULT_EXTRA_BUFFER;

    /**
     * Manager with signature sampling and default buffer sizes. The grouper's
     * scheduler stays owned by the caller.
     */
    public SubscriptionManager(SubscriptionGrouper grouper, CacheAdapter cacheAdapter, Executor cacheExecutor) {
        this(grouper, new ValidationRatioTracker(), new EventVerifier(), cacheAdapter, cacheExecutor,
                EventDeduplicationIndex.DEFAULT_MAX_SIZE, DEFAULT_GLOBAL_BUFFER);
    }

    /**
     * @param grouper Grouper for batched subscriptions
     * @param validationTracker Per-relay validation statistics
     * @param eventVerifier Signature verifier; null disables verification
     * @param cacheAdapter Cache for writes and preloads, may be null
     * @param cacheExecutor Executor for cache work; null uses the common pool
     * @param dedupCapacity Keys kept in the deduplication index
     * @param globalBuffer Extra buffer of the global event stream
     */
    public SubscriptionManager(SubscriptionGrouper grouper,
                               ValidationRatioTracker validationTracker,
                               EventVerifier eventVerifier,
                               CacheAdapter cacheAdapter,
                               Executor cacheExecutor,
                               int dedupCapacity,
                               int globalBuffer) {
        if (grouper == null || validationTracker == null) {
            throw new IllegalArgumentException("Grouper and validation tracker are required");
        }
        this.grouper = grouper;
        this.validationTracker = validationTracker;
        this.eventVerifier = eventVerifier;
        this.cacheAdapter = cacheAdapter;
        this.cacheExecutor = cacheExecutor != null ? cacheExecutor : ForkJoinPool.commonPool();
        this.seenEvents = new EventDeduplicationIndex(dedupCapacity);
        this.allEvents = new EventStream<>(0, globalBuffer, EventStream.OverflowPolicy.DROP_NEWEST);
    }

    /**
     * Register a subscription. No relay traffic is sent until the caller
     * starts it or hands it to {@link #enqueueForGrouping}.
     */
    public Subscription subscribe(List<Filter> filters) {
        String subscriptionId = SUBSCRIPTION_ID_PREFIX + UUID.randomUUID();
        Subscription subscription = new Subscription(subscriptionId, filters, replaySize, extraBuffer,
                cacheAdapter, cacheExecutor);
        subscription.setStopHandler(this::onSubscriptionStopped);
        subscriptions.put(subscriptionId, subscription);
        logger.debug("Created subscription {} with {} filters", subscriptionId, filters.size());
        return subscription;
    }

    public Subscription subscribe(Filter... filters) {
        return subscribe(Arrays.asList(filters));
    }

    /**
     * Start a subscription through the grouper's batching window.
     */
    public void enqueueForGrouping(Subscription subscription, Collection<? extends Relay> relays) {
        grouper.enqueue(subscription, relays);
    }

    /**
     * Stop a subscription and detach it from its group.
     */
    public void unsubscribe(String subscriptionId) {
        Subscription subscription = subscriptions.get(subscriptionId);
        if (subscription != null) {
            subscription.stop();
        } else {
            grouper.remove(subscriptionId);
        }
    }

    private void onSubscriptionStopped(Subscription subscription) {
        subscriptions.remove(subscription.getId());
        grouper.remove(subscription.getId());
    }

    /**
     * Handle an event delivered by a relay.
     *
     * @param event The event
     * @param relay Relay that delivered it
     * @param subscriptionId Relay-level subscription id it arrived on
     * @return true if the event was new and valid and went on to delivery
     */
    public boolean dispatchEvent(Event event, Relay relay, String subscriptionId) {
        String dedupKey = event.getDeduplicationKey();
        if (seenEvents.contains(dedupKey)) {
            return false;
        }

        if (eventVerifier != null) {
            String relayUrl = relay.getUrl();
            if (validationTracker.shouldValidate(relayUrl)) {
                boolean valid = eventVerifier.verify(event);
                validationTracker.recordValidation(relayUrl, valid);
                if (!valid) {
                    logger.warn("Dropping event {} with invalid signature from {}", event.getId(), relayUrl);
                    return false;
                }
            } else {
                validationTracker.recordSkipped(relayUrl);
            }
        }

        // Another relay may have delivered the same key while this one was verifying
        if (!seenEvents.markSeen(dedupKey, System.currentTimeMillis() / 1000)) {
            return false;
        }

        storeInCache(event);
        allEvents.tryEmit(new RelayEvent(event, relay));

        if (grouper.isGroupSubscriptionId(subscriptionId)) {
            grouper.dispatchToGroup(event, relay, subscriptionId);
        }

        for (Subscription subscription : subscriptions.values()) {
            // The grouper registers members before their group's REQ goes out
            if (subscription.isGrouped() || grouper.isGrouped(subscription.getId())) {
                continue;
            }
            if (subscription.matches(event)) {
                subscription.emit(event, relay);
            }
        }
        return true;
    }

    /**
     * Handle End-Of-Stored-Events. Unknown ids are ignored.
     */
    public void dispatchEose(Relay relay, String subscriptionId) {
        if (grouper.dispatchEoseToGroup(relay, subscriptionId)) {
            return;
        }
        Subscription subscription = subscriptions.get(subscriptionId);
        if (subscription == null) {
            logger.debug("EOSE from {} for unknown subscription {}", relay.getUrl(), subscriptionId);
            return;
        }
        subscription.markEose(relay);
    }

    /**
     * Handle a relay closing a subscription. Unknown ids are ignored.
     */
    public void dispatchClosed(Relay relay, String subscriptionId, String message) {
        if (grouper.dispatchClosedToGroup(relay, subscriptionId, message)) {
            return;
        }
        Subscription subscription = subscriptions.get(subscriptionId);
        if (subscription == null) {
            logger.debug("CLOSED from {} for unknown subscription {}", relay.getUrl(), subscriptionId);
            return;
        }
        subscription.markClosed(relay, message);
    }

    private void storeInCache(Event event) {
        if (cacheAdapter == null) {
            return;
        }
        try {
            CompletableFuture.runAsync(() -> cacheAdapter.store(event), cacheExecutor)
                    .exceptionally(e -> {
                        logger.warn("Failed to cache event {}", event.getId(), e);
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            logger.warn("Cache executor rejected event {}", event.getId(), e);
        }
    }

    /**
     * @return Every accepted event paired with its relay. No replay; slow
     *         consumers lose new events when their buffer is full.
     */
    public EventStream<RelayEvent> getAllEvents() {
        return allEvents;
    }

    public Subscription getSubscription(String subscriptionId) {
        return subscriptions.get(subscriptionId);
    }

    public List<Subscription> getSubscriptions() {
        return new ArrayList<>(subscriptions.values());
    }

    public SubscriptionGrouper getGrouper() {
        return grouper;
    }

    public ValidationRatioTracker getValidationTracker() {
        return validationTracker;
    }

    public EventDeduplicationIndex getDeduplicationIndex() {
        return seenEvents;
    }

    public CacheAdapter getCacheAdapter() {
        return cacheAdapter;
    }

    /**
     * Replay buffer size for subscriptions created from now on.
     */
    public void setReplaySize(int replaySize) {
        this.replaySize = replaySize;
    }

    /**
     * Extra buffer for subscriptions created from now on.
     */
    public void setExtraBuffer(int extraBuffer) {
        this.extraBuffer = extraBuffer;
    }
}
