package org.nostrkit.nostr.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Messages sent from client to relay.
 * Each serializes to a JSON array whose first element is the message type.
 */
public abstract class ClientMessage {

    private static final ObjectMapper JSON = new ObjectMapper();

    /** Client message types. */
    public enum Type {
        REQ, CLOSE, EVENT, AUTH, COUNT
    }

    private ClientMessage() {}

    public abstract Type getType();

    /** Elements following the type string. */
    protected abstract List<Object> payload();

    /**
     * Serialize to the JSON array sent over the wire.
     */
    public String toJson() {
        List<Object> array = new ArrayList<>();
        array.add(getType().name());
        array.addAll(payload());
        try {
            return JSON.writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + getType() + " message", e);
        }
    }

    public static ClientMessage req(String subscriptionId, List<Filter> filters) {
        return new Req(subscriptionId, filters);
    }

    public static ClientMessage close(String subscriptionId) {
        return new Close(subscriptionId);
    }

    public static ClientMessage event(Event event) {
        return new EventMessage(event);
    }

    public static ClientMessage auth(Event authEvent) {
        return new Auth(authEvent);
    }

    public static ClientMessage count(String subscriptionId, List<Filter> filters) {
        return new Count(subscriptionId, filters);
    }

    /** ["REQ", &lt;subscription_id&gt;, &lt;filter&gt;...] */
    public static final class Req extends ClientMessage {
        private final String subscriptionId;
        private final List<Filter> filters;

        Req(String subscriptionId, List<Filter> filters) {
            this.subscriptionId = subscriptionId;
            this.filters = Collections.unmodifiableList(new ArrayList<>(filters));
        }

        public String getSubscriptionId() { return subscriptionId; }
        public List<Filter> getFilters() { return filters; }

        @Override
        public Type getType() { return Type.REQ; }

        @Override
        protected List<Object> payload() {
            List<Object> payload = new ArrayList<>();
            payload.add(subscriptionId);
            payload.addAll(filters);
            return payload;
        }
    }

    /** ["CLOSE", &lt;subscription_id&gt;] */
    public static final class Close extends ClientMessage {
        private final String subscriptionId;

        Close(String subscriptionId) {
            this.subscriptionId = subscriptionId;
        }

        public String getSubscriptionId() { return subscriptionId; }

        @Override
        public Type getType() { return Type.CLOSE; }

        @Override
        protected List<Object> payload() {
            return Collections.singletonList(subscriptionId);
        }
    }

    /** ["EVENT", &lt;event&gt;] */
    public static final class EventMessage extends ClientMessage {
        private final Event event;

        EventMessage(Event event) {
            this.event = event;
        }

        public Event getEvent() { return event; }

        @Override
        public Type getType() { return Type.EVENT; }

        @Override
        protected List<Object> payload() {
            return Collections.singletonList(event);
        }
    }

    /** ["AUTH", &lt;signed kind 22242 event&gt;] */
    public static final class Auth extends ClientMessage {
        private final Event event;

        Auth(Event event) {
            this.event = event;
        }

        public Event getEvent() { return event; }

        @Override
        public Type getType() { return Type.AUTH; }

        @Override
        protected List<Object> payload() {
            return Collections.singletonList(event);
        }
    }

    /** ["COUNT", &lt;subscription_id&gt;, &lt;filter&gt;...] */
    public static final class Count extends ClientMessage {
        private final String subscriptionId;
        private final List<Filter> filters;

        Count(String subscriptionId, List<Filter> filters) {
            this.subscriptionId = subscriptionId;
            this.filters = Collections.unmodifiableList(new ArrayList<>(filters));
        }

        public String getSubscriptionId() { return subscriptionId; }
        public List<Filter> getFilters() { return filters; }

        @Override
        public Type getType() { return Type.COUNT; }

        @Override
        protected List<Object> payload() {
            List<Object> payload = new ArrayList<>(Arrays.asList(subscriptionId));
            payload.addAll(filters);
            return payload;
        }
    }
}
