package org.nostrkit.nostr.subscription;

import org.nostrkit.nostr.protocol.Event;
import org.nostrkit.nostr.relay.Relay;

/**
 * An event paired with the relay that delivered it first.
 */
public final class RelayEvent {

    private final Event event;
    private final Relay relay;

    public RelayEvent(Event event, Relay relay) {
        this.event = event;
        this.relay = relay;
    }

    public Event getEvent() { return event; }
    public Relay getRelay() { return relay; }

    @Override
    public String toString() {
        return "RelayEvent{" + event + " from " + relay.getUrl() + '}';
    }
}
