package org.nostrkit.nostr.relay;

/**
 * Connection event listener for monitoring relay connections.
 */
public interface RelayConnectionListener {
    /** Called when a relay connection is established. */
    default void onConnect(String relayUrl) {}
    /** Called when a relay connection is lost. */
    default void onDisconnect(String relayUrl, String reason) {}
    /** Called when reconnection is being attempted. */
    default void onReconnecting(String relayUrl, int attempt) {}
    /** Called when reconnection succeeds. */
    default void onReconnected(String relayUrl) {}
}
