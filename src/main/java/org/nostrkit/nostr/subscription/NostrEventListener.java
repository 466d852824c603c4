package org.nostrkit.nostr.subscription;

import org.nostrkit.nostr.protocol.Event;

/**
 * Push-style callbacks for a {@link Subscription}.
 */
public interface NostrEventListener {

    /**
     * Called when an event matching the subscription filters is delivered.
     *
     * @param event The received event
     */
    void onEvent(Event event);

    /**
     * Called once every relay the subscription is attached to has sent
     * End-Of-Stored-Events (EOSE).
     * Optional: default implementation does nothing.
     *
     * @param subscriptionId The subscription ID
     */
    default void onEndOfStoredEvents(String subscriptionId) {
        // Optional callback
    }

    /**
     * Called when a relay closes the subscription (CLOSED message).
     * Optional: default implementation does nothing.
     *
     * @param subscriptionId The subscription ID
     * @param error Message sent by the relay
     */
    default void onError(String subscriptionId, String error) {
        // Optional callback
    }
}
