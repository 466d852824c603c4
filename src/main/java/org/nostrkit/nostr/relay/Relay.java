package org.nostrkit.nostr.relay;

import org.nostrkit.nostr.protocol.Event;
import org.nostrkit.nostr.protocol.Filter;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Handle to a single relay connection.
 *
 * <p>Subscription code only issues requests through this interface; events and
 * EOSE notices come back through the subscription manager's dispatch methods.
 * Both {@link #subscribe} and {@link #unsubscribe} must return without waiting
 * for the relay.
 *
 * <p>The URL is the identity of a relay: implementations must base
 * {@code equals}/{@code hashCode} on it, or callers must not mix instances.
 */
public interface Relay {

    /**
     * @return Stable relay URL, used as a map key throughout the subscription layer
     */
    String getUrl();

    /**
     * Send (or replace) a subscription on this relay.
     *
     * @param subscriptionId Relay-level subscription id
     * @param filters Filters to send in the REQ
     */
    void subscribe(String subscriptionId, List<Filter> filters);

    /**
     * Close a subscription on this relay.
     *
     * @param subscriptionId Relay-level subscription id
     */
    void unsubscribe(String subscriptionId);

    /**
     * Publish an event.
     *
     * @param event Signed event
     * @return Future completed with the event id when the relay accepts it
     */
    CompletableFuture<String> publish(Event event);
}
