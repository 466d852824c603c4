package org.nostrkit.nostr.subscription;

import org.nostrkit.nostr.protocol.Event;
import org.nostrkit.nostr.protocol.Filter;
import org.nostrkit.nostr.relay.Relay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One relay-level subscription shared by several {@link Subscription}s whose
 * filters have the same fingerprints.
 *
 * <p>The relay sees merged filters: member filters that differ only in time
 * window and limit collapse into one with the widest window and the largest
 * limit; any other difference keeps them apart. Members re-apply their own
 * filters on delivery, so the over-fetch never reaches them.
 */
public class GroupedSubscription {

    private static final Logger logger = LoggerFactory.getLogger(GroupedSubscription.class);

    /** Prefix of relay-level ids owned by groups. */
    public static final String ID_PREFIX = "group-";

    private final String fingerprint;
    private final String relaySubscriptionId;
    private final Map<String, Subscription> members = new ConcurrentHashMap<>();

    // Guarded by this
    private final Map<String, Relay> relays = new LinkedHashMap<>();
    private List<Filter> mergedFilters = Collections.emptyList();
    private boolean closed;

    GroupedSubscription(String fingerprint) {
        this.fingerprint = fingerprint;
        this.relaySubscriptionId = ID_PREFIX + UUID.randomUUID();
    }

    public String getFingerprint() {
        return fingerprint;
    }

    /**
     * @return Id used on the wire for the shared subscription
     */
    public String getRelaySubscriptionId() {
        return relaySubscriptionId;
    }

    public synchronized List<Filter> getMergedFilters() {
        return mergedFilters;
    }

    public List<Subscription> getMembers() {
        return new ArrayList<>(members.values());
    }

    public int getMemberCount() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Add members and their relays. Merged filters are recomputed; if they
     * changed, the REQ is re-sent under the same id on every relay, otherwise
     * only relays new to the group are subscribed.
     */
    void join(Collection<Subscription> joining, Collection<? extends Relay> newRelays) {
        List<Relay> subscribeOn;
        List<Filter> filters;
        synchronized (this) {
            if (closed) {
                throw new IllegalStateException("Group " + relaySubscriptionId + " is closed");
            }
            for (Subscription subscription : joining) {
                members.put(subscription.getId(), subscription);
            }
            List<Filter> previous = mergedFilters;
            mergedFilters = mergeFilters(members.values());
            // Member iteration order is not stable, so compare as sets
            boolean widened = !new HashSet<>(mergedFilters).equals(new HashSet<>(previous));

            List<Relay> added = new ArrayList<>();
            for (Relay relay : newRelays) {
                if (relays.putIfAbsent(relay.getUrl(), relay) == null) {
                    added.add(relay);
                }
            }
            subscribeOn = widened ? new ArrayList<>(relays.values()) : added;
            filters = mergedFilters;
        }

        for (Relay relay : subscribeOn) {
            relay.subscribe(relaySubscriptionId, filters);
        }
        for (Subscription subscription : joining) {
            subscription.attachToGroup(this, newRelays);
        }
        logger.debug("Group {} now has {} members on {} relays",
                relaySubscriptionId, members.size(), subscribeOn.size());
    }

    /**
     * Extend the shared subscription to more relays.
     */
    void addRelays(Collection<? extends Relay> newRelays) {
        List<Relay> added = new ArrayList<>();
        List<Filter> filters;
        synchronized (this) {
            if (closed) {
                return;
            }
            for (Relay relay : newRelays) {
                if (relays.putIfAbsent(relay.getUrl(), relay) == null) {
                    added.add(relay);
                }
            }
            filters = mergedFilters;
        }
        for (Relay relay : added) {
            relay.subscribe(relaySubscriptionId, filters);
        }
    }

    /**
     * Deliver an event to each member whose own filters match it.
     *
     * @return Number of members that received the event
     */
    int dispatch(Event event, Relay relay) {
        int delivered = 0;
        for (Subscription member : members.values()) {
            if (member.matches(event)) {
                member.emit(event, relay);
                delivered++;
            }
        }
        return delivered;
    }

    void markEose(Relay relay) {
        for (Subscription member : members.values()) {
            member.markEose(relay);
        }
    }

    void markClosed(Relay relay, String message) {
        for (Subscription member : members.values()) {
            member.markClosed(relay, message);
        }
    }

    /**
     * @return true if the member was present
     */
    boolean removeMember(String subscriptionId) {
        return members.remove(subscriptionId) != null;
    }

    /**
     * Tear down the shared subscription on every relay. Runs once.
     */
    void close() {
        List<Relay> toClose;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toClose = new ArrayList<>(relays.values());
            relays.clear();
        }
        for (Relay relay : toClose) {
            try {
                relay.unsubscribe(relaySubscriptionId);
            } catch (RuntimeException e) {
                logger.warn("Failed to close group {} on {}", relaySubscriptionId, relay.getUrl(), e);
            }
        }
        logger.debug("Group {} closed", relaySubscriptionId);
    }

    /**
     * Merge member filters that select the same events apart from their time
     * window and limit, keeping the widest window and limit. A missing bound
     * is wider than any value. Filters with other differences, such as a
     * different search term, stay separate entries. Output is grouped in
     * fingerprint order.
     */
    static List<Filter> mergeFilters(Collection<Subscription> subscriptions) {
        Map<String, List<Filter>> byFingerprint = new TreeMap<>();
        for (Subscription subscription : subscriptions) {
            for (Filter filter : subscription.getFilters()) {
                List<Filter> bucket = byFingerprint.computeIfAbsent(filter.fingerprint(), key -> new ArrayList<>());
                Filter criteria = filter.withoutTemporalConstraints();
                boolean merged = false;
                for (int i = 0; i < bucket.size(); i++) {
                    if (bucket.get(i).withoutTemporalConstraints().equals(criteria)) {
                        bucket.set(i, widen(bucket.get(i), filter));
                        merged = true;
                        break;
                    }
                }
                if (!merged) {
                    bucket.add(filter);
                }
            }
        }
        List<Filter> result = new ArrayList<>();
        for (List<Filter> bucket : byFingerprint.values()) {
            result.addAll(bucket);
        }
        return Collections.unmodifiableList(result);
    }

    private static Filter widen(Filter a, Filter b) {
        Long since = a.getSince() == null || b.getSince() == null
                ? null : Math.min(a.getSince(), b.getSince());
        Long until = a.getUntil() == null || b.getUntil() == null
                ? null : Math.max(a.getUntil(), b.getUntil());
        Integer limit = a.getLimit() == null || b.getLimit() == null
                ? null : Math.max(a.getLimit(), b.getLimit());
        return a.withTemporalConstraints(since, until, limit);
    }

    @Override
    public String toString() {
        return "GroupedSubscription{" +
                "id='" + relaySubscriptionId + '\'' +
                ", fingerprint='" + fingerprint + '\'' +
                ", members=" + members.size() +
                '}';
    }
}
