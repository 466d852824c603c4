package org.nostrkit.nostr.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Map;

/**
 * Messages sent from relay to client (NIP-01, NIP-42, NIP-45).
 *
 * <p>The set of variants is closed: every instance is one of the nested classes,
 * identified by {@link #getType()}, so callers can switch over {@link Type} exhaustively.
 */
public abstract class RelayMessage {

    private static final ObjectMapper JSON = new ObjectMapper();

    /** Relay message types. */
    public enum Type {
        EVENT, EOSE, OK, NOTICE, AUTH, CLOSED, COUNT
    }

    private RelayMessage() {}

    public abstract Type getType();

    /** ["EVENT", &lt;subscription_id&gt;, &lt;event&gt;] */
    public static final class EventMessage extends RelayMessage {
        private final String subscriptionId;
        private final Event event;

        public EventMessage(String subscriptionId, Event event) {
            this.subscriptionId = subscriptionId;
            this.event = event;
        }

        public String getSubscriptionId() { return subscriptionId; }
        public Event getEvent() { return event; }

        @Override
        public Type getType() { return Type.EVENT; }
    }

    /** ["EOSE", &lt;subscription_id&gt;] */
    public static final class Eose extends RelayMessage {
        private final String subscriptionId;

        public Eose(String subscriptionId) {
            this.subscriptionId = subscriptionId;
        }

        public String getSubscriptionId() { return subscriptionId; }

        @Override
        public Type getType() { return Type.EOSE; }
    }

    /** ["OK", &lt;event_id&gt;, &lt;true|false&gt;, &lt;message&gt;] */
    public static final class Ok extends RelayMessage {
        private final String eventId;
        private final boolean success;
        private final String message;

        public Ok(String eventId, boolean success, String message) {
            this.eventId = eventId;
            this.success = success;
            this.message = message;
        }

        public String getEventId() { return eventId; }
        public boolean isSuccess() { return success; }
        public String getMessage() { return message; }

        @Override
        public Type getType() { return Type.OK; }
    }

    /** ["NOTICE", &lt;message&gt;] */
    public static final class Notice extends RelayMessage {
        private final String message;

        public Notice(String message) {
            this.message = message;
        }

        public String getMessage() { return message; }

        @Override
        public Type getType() { return Type.NOTICE; }
    }

    /** ["AUTH", &lt;challenge&gt;] */
    public static final class Auth extends RelayMessage {
        private final String challenge;

        public Auth(String challenge) {
            this.challenge = challenge;
        }

        public String getChallenge() { return challenge; }

        @Override
        public Type getType() { return Type.AUTH; }
    }

    /** ["CLOSED", &lt;subscription_id&gt;, &lt;message&gt;] */
    public static final class Closed extends RelayMessage {
        private final String subscriptionId;
        private final String message;

        public Closed(String subscriptionId, String message) {
            this.subscriptionId = subscriptionId;
            this.message = message;
        }

        public String getSubscriptionId() { return subscriptionId; }
        public String getMessage() { return message; }

        @Override
        public Type getType() { return Type.CLOSED; }
    }

    /** ["COUNT", &lt;subscription_id&gt;, {"count": &lt;n&gt;}] */
    public static final class Count extends RelayMessage {
        private final String subscriptionId;
        private final long count;

        public Count(String subscriptionId, long count) {
            this.subscriptionId = subscriptionId;
            this.count = count;
        }

        public String getSubscriptionId() { return subscriptionId; }
        public long getCount() { return count; }

        @Override
        public Type getType() { return Type.COUNT; }
    }

    /**
     * Parse a relay message from its JSON array form.
     *
     * @param json Raw text frame from the relay
     * @return Parsed message
     * @throws IllegalArgumentException if the JSON is malformed or the type is unknown
     */
    public static RelayMessage parse(String json) {
        List<?> array;
        try {
            array = JSON.readValue(json, List.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
        }

        if (array == null || array.isEmpty()) {
            throw new IllegalArgumentException("Empty message array");
        }
        if (!(array.get(0) instanceof String)) {
            throw new IllegalArgumentException("Message type must be a string");
        }

        String type = (String) array.get(0);
        switch (type) {
            case "EVENT":
                requireSize(array, 3, type);
                return new EventMessage(string(array, 1, "Subscription ID"), toEvent(array.get(2)));
            case "EOSE":
                requireSize(array, 2, type);
                return new Eose(string(array, 1, "Subscription ID"));
            case "OK":
                requireSize(array, 3, type);
                if (!(array.get(2) instanceof Boolean)) {
                    throw new IllegalArgumentException("Success flag must be a boolean");
                }
                String okMessage = array.size() > 3 ? string(array, 3, "Message") : "";
                return new Ok(string(array, 1, "Event ID"), (Boolean) array.get(2), okMessage);
            case "NOTICE":
                requireSize(array, 2, type);
                return new Notice(string(array, 1, "Message"));
            case "AUTH":
                requireSize(array, 2, type);
                return new Auth(string(array, 1, "Challenge"));
            case "CLOSED":
                requireSize(array, 2, type);
                String closedMessage = array.size() > 2 ? string(array, 2, "Message") : "";
                return new Closed(string(array, 1, "Subscription ID"), closedMessage);
            case "COUNT":
                requireSize(array, 3, type);
                if (!(array.get(2) instanceof Map)) {
                    throw new IllegalArgumentException("Count data must be an object");
                }
                Object count = ((Map<?, ?>) array.get(2)).get("count");
                if (!(count instanceof Number)) {
                    throw new IllegalArgumentException("Count must be a number");
                }
                return new Count(string(array, 1, "Subscription ID"), ((Number) count).longValue());
            default:
                throw new IllegalArgumentException("Unknown message type: " + type);
        }
    }

    private static void requireSize(List<?> array, int size, String type) {
        if (array.size() < size) {
            throw new IllegalArgumentException(type + " message requires " + size + " elements");
        }
    }

    private static String string(List<?> array, int index, String what) {
        Object value = array.get(index);
        if (!(value instanceof String)) {
            throw new IllegalArgumentException(what + " must be a string");
        }
        return (String) value;
    }

    private static Event toEvent(Object raw) {
        if (!(raw instanceof Map)) {
            throw new IllegalArgumentException("Event must be an object");
        }
        try {
            return JSON.convertValue(raw, Event.class);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed event: " + e.getMessage(), e);
        }
    }
}
