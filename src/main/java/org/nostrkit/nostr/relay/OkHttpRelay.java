package org.nostrkit.nostr.relay;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.nostrkit.nostr.protocol.ClientMessage;
import org.nostrkit.nostr.protocol.Event;
import org.nostrkit.nostr.protocol.Filter;
import org.nostrkit.nostr.protocol.RelayMessage;
import org.nostrkit.nostr.subscription.Scheduler;
import org.nostrkit.nostr.subscription.SubscriptionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * WebSocket relay handle built on OkHttp.
 *
 * <p>Parsed relay messages are handed to the {@link SubscriptionManager}:
 * EVENT, EOSE and CLOSED go to its dispatch methods, OK completes the matching
 * {@link #publish} future. Active subscriptions are re-sent after every
 * reconnect, and events published while offline are queued until the socket opens.
 */
public class OkHttpRelay extends WebSocketListener implements Relay {

    private static final Logger logger = LoggerFactory.getLogger(OkHttpRelay.class);

    public static final int DEFAULT_RECONNECT_INTERVAL_MS = 1000;
    public static final int DEFAULT_MAX_RECONNECT_INTERVAL_MS = 30000;

    private final String url;
    private final OkHttpClient httpClient;
    private final SubscriptionManager subscriptionManager;
    private final Scheduler reconnectScheduler;

    private final Map<String, List<Filter>> activeSubscriptions = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<String>> pendingPublishes = new ConcurrentHashMap<>();
    private final List<String> messageQueue = new CopyOnWriteArrayList<>();
    private final List<RelayConnectionListener> connectionListeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger reconnectAttempts = new AtomicInteger();

    private volatile WebSocket webSocket;
    private volatile CompletableFuture<Void> connectFuture;
    private volatile boolean connected = false;
    private volatile boolean wasConnected = false;
    private volatile boolean running = false;

    private volatile boolean autoReconnect = true;
    private volatile int reconnectIntervalMs = DEFAULT_RECONNECT_INTERVAL_MS;
    private volatile int maxReconnectIntervalMs = DEFAULT_MAX_RECONNECT_INTERVAL_MS;

    /**
     * @param url Relay WebSocket URL
     * @param httpClient Shared OkHttp client
     * @param subscriptionManager Receives events, EOSE and CLOSED from this relay
     * @param reconnectScheduler Runs delayed reconnect attempts
     */
    public OkHttpRelay(String url, OkHttpClient httpClient, SubscriptionManager subscriptionManager,
                       Scheduler reconnectScheduler) {
        if (url == null || url.isEmpty()) {
            throw new IllegalArgumentException("Relay URL cannot be empty");
        }
        this.url = url;
        this.httpClient = httpClient;
        this.subscriptionManager = subscriptionManager;
        this.reconnectScheduler = reconnectScheduler;
    }

    @Override
    public String getUrl() {
        return url;
    }

    public void addConnectionListener(RelayConnectionListener listener) {
        connectionListeners.add(listener);
    }

    public void removeConnectionListener(RelayConnectionListener listener) {
        connectionListeners.remove(listener);
    }

    public void setAutoReconnect(boolean autoReconnect) {
        this.autoReconnect = autoReconnect;
    }

    public void setReconnectIntervalMs(int intervalMs) {
        this.reconnectIntervalMs = intervalMs;
    }

    public void setMaxReconnectIntervalMs(int maxIntervalMs) {
        this.maxReconnectIntervalMs = maxIntervalMs;
    }

    /**
     * Open the WebSocket.
     *
     * @return Future completed when the socket opens, or exceptionally if the first attempt fails
     */
    public CompletableFuture<Void> connect() {
        running = true;
        CompletableFuture<Void> future = new CompletableFuture<>();
        connectFuture = future;
        logger.info("Connecting to relay: {}", url);
        openSocket();
        return future;
    }

    /**
     * Close the WebSocket and stop reconnecting. Pending publishes fail.
     */
    public void close() {
        running = false;
        WebSocket socket = webSocket;
        if (socket != null) {
            socket.close(1000, "Client disconnect");
        }
        connected = false;
        for (Map.Entry<String, CompletableFuture<String>> entry : pendingPublishes.entrySet()) {
            entry.getValue().completeExceptionally(new Exception("Relay closed before OK: " + url));
        }
        pendingPublishes.clear();
    }

    public boolean isConnected() {
        return connected;
    }

    @Override
    public void subscribe(String subscriptionId, List<Filter> filters) {
        activeSubscriptions.put(subscriptionId, new ArrayList<>(filters));
        if (connected) {
            send(ClientMessage.req(subscriptionId, filters).toJson());
        }
        logger.debug("Subscribed {} on {}", subscriptionId, url);
    }

    @Override
    public void unsubscribe(String subscriptionId) {
        if (activeSubscriptions.remove(subscriptionId) == null) {
            return;
        }
        if (connected) {
            send(ClientMessage.close(subscriptionId).toJson());
        }
        logger.debug("Unsubscribed {} on {}", subscriptionId, url);
    }

    /**
     * @return Ids of subscriptions currently open on this relay
     */
    public List<String> getActiveSubscriptionIds() {
        return new ArrayList<>(activeSubscriptions.keySet());
    }

    @Override
    public CompletableFuture<String> publish(Event event) {
        CompletableFuture<String> future = pendingPublishes.computeIfAbsent(event.getId(),
                id -> new CompletableFuture<>());
        String json = ClientMessage.event(event).toJson();
        if (connected) {
            send(json);
        } else {
            messageQueue.add(json);
            logger.debug("Queued event {} until {} connects", event.getId(), url);
        }
        return future;
    }

    private void send(String message) {
        WebSocket socket = webSocket;
        if (socket != null && !socket.send(message)) {
            logger.warn("Failed to send message to {}", url);
        }
    }

    private void openSocket() {
        Request request = new Request.Builder()
                .url(url)
                .build();
        webSocket = httpClient.newWebSocket(request, this);
    }

    /**
     * Handle one text frame from the relay.
     */
    void handleMessage(String text) {
        RelayMessage message;
        try {
            message = RelayMessage.parse(text);
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring malformed message from {}: {}", url, e.getMessage());
            return;
        }

        switch (message.getType()) {
            case EVENT:
                RelayMessage.EventMessage eventMessage = (RelayMessage.EventMessage) message;
                subscriptionManager.dispatchEvent(eventMessage.getEvent(), this, eventMessage.getSubscriptionId());
                break;
            case EOSE:
                subscriptionManager.dispatchEose(this, ((RelayMessage.Eose) message).getSubscriptionId());
                break;
            case CLOSED:
                RelayMessage.Closed closed = (RelayMessage.Closed) message;
                activeSubscriptions.remove(closed.getSubscriptionId());
                subscriptionManager.dispatchClosed(this, closed.getSubscriptionId(), closed.getMessage());
                break;
            case OK:
                handleOk((RelayMessage.Ok) message);
                break;
            case NOTICE:
                logger.info("Relay notice from {}: {}", url, ((RelayMessage.Notice) message).getMessage());
                break;
            case AUTH:
                logger.debug("Relay {} requested authentication", url);
                break;
            case COUNT:
                RelayMessage.Count count = (RelayMessage.Count) message;
                logger.debug("COUNT {} from {}: {}", count.getSubscriptionId(), url, count.getCount());
                break;
            default:
                logger.debug("Unhandled message type from {}: {}", url, message.getType());
        }
    }

    private void handleOk(RelayMessage.Ok ok) {
        CompletableFuture<String> future = pendingPublishes.remove(ok.getEventId());
        if (ok.isSuccess()) {
            logger.debug("Event accepted by {}: {}", url, ok.getEventId());
            if (future != null) {
                future.complete(ok.getEventId());
            }
        } else {
            logger.warn("Event rejected by {}: {} - {}", url, ok.getEventId(), ok.getMessage());
            if (future != null) {
                future.completeExceptionally(new Exception("Event rejected by " + url + ": " + ok.getMessage()));
            }
        }
    }

    @Override
    public void onOpen(WebSocket webSocket, Response response) {
        connected = true;
        boolean wasReconnecting = wasConnected;
        wasConnected = true;
        reconnectAttempts.set(0);

        if (wasReconnecting) {
            logger.info("Reconnected to relay: {}", url);
            emitConnectionEvent(listener -> listener.onReconnected(url));
        } else {
            logger.info("Connected to relay: {}", url);
            emitConnectionEvent(listener -> listener.onConnect(url));
        }

        CompletableFuture<Void> future = connectFuture;
        if (future != null && !future.isDone()) {
            future.complete(null);
        }

        // Re-establish subscriptions
        for (Map.Entry<String, List<Filter>> entry : activeSubscriptions.entrySet()) {
            webSocket.send(ClientMessage.req(entry.getKey(), entry.getValue()).toJson());
        }

        // Flush queued messages
        for (String queued : messageQueue) {
            webSocket.send(queued);
        }
        messageQueue.clear();
    }

    @Override
    public void onMessage(WebSocket webSocket, String text) {
        try {
            handleMessage(text);
        } catch (RuntimeException e) {
            logger.error("Error handling message from {}", url, e);
        }
    }

    @Override
    public void onFailure(WebSocket webSocket, Throwable t, Response response) {
        boolean wasConnectedBefore = connected;
        connected = false;

        boolean isEOF = t instanceof EOFException;
        String reason = t != null ? t.getMessage() : "Unknown error";

        if (isEOF && !running) {
            logger.debug("WebSocket closed during disconnect: {}", url);
        } else if (isEOF) {
            logger.warn("Relay closed connection unexpectedly: {}", url);
            reason = "Connection closed unexpectedly";
        } else {
            logger.error("Relay connection failed: {}", url, t);
        }

        if (wasConnectedBefore) {
            String disconnectReason = reason;
            emitConnectionEvent(listener -> listener.onDisconnect(url, disconnectReason));
        }

        CompletableFuture<Void> future = connectFuture;
        if (future != null && !future.isDone()) {
            future.completeExceptionally(t);
        }

        scheduleReconnect();
    }

    @Override
    public void onClosed(WebSocket webSocket, int code, String reason) {
        connected = false;
        logger.info("Relay closed: {} - {} (code: {})", url, reason, code);
        String disconnectReason = reason != null ? reason : "Connection closed";
        emitConnectionEvent(listener -> listener.onDisconnect(url, disconnectReason));
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (!running || !autoReconnect) {
            return;
        }

        int attempt = reconnectAttempts.incrementAndGet();
        long delay = reconnectDelay(attempt, reconnectIntervalMs, maxReconnectIntervalMs);

        logger.info("Scheduling reconnect to {} in {}ms (attempt {})", url, delay, attempt);
        emitConnectionEvent(listener -> listener.onReconnecting(url, attempt));

        reconnectScheduler.schedule(() -> {
            if (running && autoReconnect) {
                logger.info("Attempting to reconnect to relay: {}", url);
                connectFuture = new CompletableFuture<>();
                openSocket();
            }
        }, delay, TimeUnit.MILLISECONDS);
    }

    /**
     * Exponential backoff: {@code base * 2^(attempt-1)}, capped at {@code max}.
     */
    static long reconnectDelay(int attempt, long baseMs, long maxMs) {
        long delay = (long) (baseMs * Math.pow(2, Math.max(0, attempt - 1)));
        return Math.min(delay, maxMs);
    }

    private void emitConnectionEvent(Consumer<RelayConnectionListener> event) {
        for (RelayConnectionListener listener : connectionListeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("Error in connection listener", e);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Relay)) return false;
        return url.equals(((Relay) o).getUrl());
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }

    @Override
    public String toString() {
        return "OkHttpRelay{" + url + (connected ? ", connected" : "") + '}';
    }
}
