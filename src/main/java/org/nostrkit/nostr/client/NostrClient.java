package org.nostrkit.nostr.client;

import okhttp3.OkHttpClient;
import org.nostrkit.nostr.cache.CacheAdapter;
import org.nostrkit.nostr.protocol.Event;
import org.nostrkit.nostr.protocol.Filter;
import org.nostrkit.nostr.relay.OkHttpRelay;
import org.nostrkit.nostr.relay.Relay;
import org.nostrkit.nostr.relay.RelayConnectionListener;
import org.nostrkit.nostr.subscription.EventStream;
import org.nostrkit.nostr.subscription.ExecutorScheduler;
import org.nostrkit.nostr.subscription.NostrEventListener;
import org.nostrkit.nostr.subscription.RelayEvent;
import org.nostrkit.nostr.subscription.Subscription;
import org.nostrkit.nostr.subscription.SubscriptionGrouper;
import org.nostrkit.nostr.subscription.SubscriptionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main Nostr client: connects to relays and routes everything they deliver
 * through one {@link SubscriptionManager}.
 * Supports multiple relay connections, automatic reconnection, subscription
 * grouping and an optional event cache.
 */
public class NostrClient {

    private static final Logger logger = LoggerFactory.getLogger(NostrClient.class);
    private static final int CONNECTION_TIMEOUT_SECONDS = 30;
    private static final int DEFAULT_QUERY_TIMEOUT_MS = 5000;
    private static final int DEFAULT_PING_INTERVAL_MS = 25000;

    private final OkHttpClient httpClient;
    private final ExecutorScheduler scheduler;
    private final SubscriptionManager subscriptionManager;

    private final Map<String, Relay> relays = new ConcurrentHashMap<>();
    private final List<RelayConnectionListener> connectionListeners = new CopyOnWriteArrayList<>();

    // Configuration options
    private int queryTimeoutMs = DEFAULT_QUERY_TIMEOUT_MS;
    private boolean autoReconnect = true;
    private int reconnectIntervalMs = OkHttpRelay.DEFAULT_RECONNECT_INTERVAL_MS;
    private int maxReconnectIntervalMs = OkHttpRelay.DEFAULT_MAX_RECONNECT_INTERVAL_MS;
    private boolean groupingEnabled = true;

    /**
     * Create a client without an event cache.
     */
    public NostrClient() {
        this((CacheAdapter) null);
    }

    /**
     * Create a client that stores received events in a cache and preloads
     * subscriptions from it.
     *
     * @param cacheAdapter Event cache, may be null
     */
    public NostrClient(CacheAdapter cacheAdapter) {
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(CONNECTION_TIMEOUT_SECONDS, TimeUnit.SECONDS)
            .readTimeout(0, TimeUnit.SECONDS)  // No read timeout for WebSocket
            .writeTimeout(CONNECTION_TIMEOUT_SECONDS, TimeUnit.SECONDS)
            .pingInterval(DEFAULT_PING_INTERVAL_MS, TimeUnit.MILLISECONDS)
            .build();
        this.scheduler = new ExecutorScheduler();
        this.subscriptionManager = new SubscriptionManager(new SubscriptionGrouper(scheduler), cacheAdapter, null);
    }

    /**
     * Create a client around an existing manager, e.g. one with custom
     * validation or grouping settings.
     */
    public NostrClient(OkHttpClient httpClient, ExecutorScheduler scheduler, SubscriptionManager subscriptionManager) {
        this.httpClient = httpClient;
        this.scheduler = scheduler;
        this.subscriptionManager = subscriptionManager;
    }

    public void addConnectionListener(RelayConnectionListener listener) {
        connectionListeners.add(listener);
        for (Relay relay : relays.values()) {
            if (relay instanceof OkHttpRelay) {
                ((OkHttpRelay) relay).addConnectionListener(listener);
            }
        }
    }

    public void removeConnectionListener(RelayConnectionListener listener) {
        connectionListeners.remove(listener);
        for (Relay relay : relays.values()) {
            if (relay instanceof OkHttpRelay) {
                ((OkHttpRelay) relay).removeConnectionListener(listener);
            }
        }
    }

    /**
     * Set whether automatic reconnection is enabled for relays connected from now on.
     *
     * @param autoReconnect true to enable auto-reconnect (default: true)
     */
    public void setAutoReconnect(boolean autoReconnect) {
        this.autoReconnect = autoReconnect;
    }

    /**
     * Set the initial reconnect interval.
     *
     * @param intervalMs Initial reconnect interval in milliseconds
     */
    public void setReconnectIntervalMs(int intervalMs) {
        this.reconnectIntervalMs = intervalMs;
    }

    /**
     * Set the maximum reconnect interval (for exponential backoff).
     *
     * @param maxIntervalMs Maximum reconnect interval in milliseconds
     */
    public void setMaxReconnectIntervalMs(int maxIntervalMs) {
        this.maxReconnectIntervalMs = maxIntervalMs;
    }

    public int getQueryTimeoutMs() {
        return queryTimeoutMs;
    }

    /**
     * Set the timeout for {@link #fetchEvent(Filter)}.
     *
     * @param timeoutMs Timeout in milliseconds
     */
    public void setQueryTimeoutMs(int timeoutMs) {
        this.queryTimeoutMs = timeoutMs;
    }

    public boolean isGroupingEnabled() {
        return groupingEnabled;
    }

    /**
     * Whether new subscriptions go through the grouper (default) or are sent
     * to relays immediately under their own id.
     */
    public void setGroupingEnabled(boolean groupingEnabled) {
        this.groupingEnabled = groupingEnabled;
    }

    /**
     * Connect to Nostr relays.
     *
     * @param relayUrls Relay WebSocket URLs
     * @return CompletableFuture that completes when all relays are connected
     */
    public CompletableFuture<Void> connect(String... relayUrls) {
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (String relayUrl : relayUrls) {
            futures.add(connectToRelay(relayUrl));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
    }

    private CompletableFuture<Void> connectToRelay(String relayUrl) {
        if (relays.containsKey(relayUrl)) {
            logger.debug("Already connected to relay: {}", relayUrl);
            return CompletableFuture.completedFuture(null);
        }

        OkHttpRelay relay = new OkHttpRelay(relayUrl, httpClient, subscriptionManager, scheduler);
        relay.setAutoReconnect(autoReconnect);
        relay.setReconnectIntervalMs(reconnectIntervalMs);
        relay.setMaxReconnectIntervalMs(maxReconnectIntervalMs);
        for (RelayConnectionListener listener : connectionListeners) {
            relay.addConnectionListener(listener);
        }
        relays.put(relayUrl, relay);
        return relay.connect();
    }

    /**
     * Use a relay handle that is connected by other means. Subscriptions
     * created afterwards include it.
     *
     * @param relay Relay handle
     */
    public void addRelay(Relay relay) {
        relays.putIfAbsent(relay.getUrl(), relay);
    }

    /**
     * Disconnect from all relays and stop background threads.
     */
    public void disconnect() {
        logger.info("Disconnecting from all relays");
        for (Subscription subscription : subscriptionManager.getSubscriptions()) {
            subscription.stop();
        }
        for (Relay relay : relays.values()) {
            if (relay instanceof OkHttpRelay) {
                ((OkHttpRelay) relay).close();
            }
        }
        relays.clear();
        scheduler.shutdown();
    }

    /**
     * Check if client is connected to any relay.
     *
     * @return true if connected to at least one relay
     */
    public boolean isConnected() {
        return !getConnectedRelays().isEmpty();
    }

    /**
     * Get connected relay URLs. Relays added with {@link #addRelay(Relay)}
     * count as connected.
     *
     * @return set of connected relay URLs
     */
    public Set<String> getConnectedRelays() {
        Set<String> connected = new HashSet<>();
        for (Map.Entry<String, Relay> entry : relays.entrySet()) {
            Relay relay = entry.getValue();
            if (!(relay instanceof OkHttpRelay) || ((OkHttpRelay) relay).isConnected()) {
                connected.add(entry.getKey());
            }
        }
        return connected;
    }

    /**
     * Subscribe on all relays. Cached events are replayed first when a cache is configured.
     *
     * @param filters Filters, at least one
     * @return The running subscription
     */
    public Subscription subscribe(Filter... filters) {
        return subscribe(Arrays.asList(filters), null);
    }

    /**
     * Subscribe on all relays with a listener attached before any event can arrive.
     *
     * @param filters Filters, at least one
     * @param listener Listener for events, EOSE and CLOSED, may be null
     * @return The running subscription
     */
    public Subscription subscribe(List<Filter> filters, NostrEventListener listener) {
        Subscription subscription = subscriptionManager.subscribe(filters);
        if (listener != null) {
            subscription.addListener(listener);
        }
        subscription.loadFromCache();

        List<Relay> targets = new ArrayList<>(relays.values());
        if (groupingEnabled) {
            subscriptionManager.enqueueForGrouping(subscription, targets);
        } else {
            subscription.start(targets);
        }
        logger.debug("Subscribed with ID: {}", subscription.getId());
        return subscription;
    }

    /**
     * Unsubscribe from events.
     *
     * @param subscriptionId Subscription ID
     */
    public void unsubscribe(String subscriptionId) {
        subscriptionManager.unsubscribe(subscriptionId);
        logger.debug("Unsubscribed: {}", subscriptionId);
    }

    /**
     * Fetch the first event matching a filter. Completes with null when every
     * relay has answered without a match, or after the query timeout.
     *
     * @param filter Filter to match
     * @return Future with the event or null
     */
    public CompletableFuture<Event> fetchEvent(Filter filter) {
        Subscription subscription = subscriptionManager.subscribe(filter);
        subscription.loadFromCache();
        subscription.start(new ArrayList<>(relays.values()));

        CompletableFuture<Event> result = subscription.fetchEvent();

        CompletableFuture.delayedExecutor(queryTimeoutMs, TimeUnit.MILLISECONDS).execute(() -> {
            if (!result.isDone()) {
                logger.warn("Query {} timed out after {}ms", subscription.getId(), queryTimeoutMs);
                subscription.stop();
            }
        });
        return result;
    }

    /**
     * Publish an event to all relays.
     *
     * @param event Event to publish
     * @return CompletableFuture with the event ID once a relay accepts it; fails if all reject it
     */
    public CompletableFuture<String> publishEvent(Event event) {
        List<Relay> targets = new ArrayList<>(relays.values());
        CompletableFuture<String> future = new CompletableFuture<>();
        if (targets.isEmpty()) {
            future.completeExceptionally(new Exception("No relays to publish to"));
            return future;
        }

        AtomicInteger remaining = new AtomicInteger(targets.size());
        for (Relay relay : targets) {
            relay.publish(event).whenComplete((eventId, error) -> {
                if (error == null) {
                    future.complete(eventId);
                } else if (remaining.decrementAndGet() == 0) {
                    future.completeExceptionally(error);
                }
            });
        }
        return future;
    }

    /**
     * Every accepted event from every relay, for cross-subscription consumers.
     */
    public EventStream<RelayEvent> getAllEvents() {
        return subscriptionManager.getAllEvents();
    }

    public SubscriptionManager getSubscriptionManager() {
        return subscriptionManager;
    }
}
