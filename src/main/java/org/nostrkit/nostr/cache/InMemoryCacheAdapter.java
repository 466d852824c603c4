package org.nostrkit.nostr.cache;

import org.nostrkit.nostr.protocol.Event;
import org.nostrkit.nostr.protocol.EventKinds;
import org.nostrkit.nostr.protocol.Filter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory {@link CacheAdapter}. Useful for tests and for clients that don't
 * need storage across restarts.
 */
public class InMemoryCacheAdapter implements CacheAdapter {

    // eventId -> event
    private final Map<String, Event> events = new ConcurrentHashMap<>();

    // deduplication key -> eventId, for replaceable and parameterized replaceable events
    private final Map<String, String> replaceableIndex = new ConcurrentHashMap<>();

    @Override
    public void store(Event event) {
        if (event.isEphemeral()) {
            return;
        }

        if (!event.isReplaceable() && !event.isParameterizedReplaceable()) {
            events.put(event.getId(), event);
            return;
        }

        synchronized (replaceableIndex) {
            String indexKey = event.getDeduplicationKey();
            String existingId = replaceableIndex.get(indexKey);
            Event existing = existingId != null ? events.get(existingId) : null;

            // Only replace with a strictly newer version
            if (existing == null || event.getCreatedAt() > existing.getCreatedAt()) {
                if (existingId != null) {
                    events.remove(existingId);
                }
                events.put(event.getId(), event);
                replaceableIndex.put(indexKey, event.getId());
            }
        }
    }

    @Override
    public Stream<Event> query(Filter filter) {
        List<Event> matches = events.values().stream()
                .filter(filter::matches)
                .sorted(Comparator.comparingLong(Event::getCreatedAt).reversed())
                .collect(Collectors.toCollection(ArrayList::new));

        Stream<Event> stream = matches.stream();
        if (filter.getLimit() != null) {
            stream = stream.limit(filter.getLimit());
        }
        return stream;
    }

    @Override
    public Event getEvent(String id) {
        return events.get(id);
    }

    @Override
    public void delete(String id) {
        synchronized (replaceableIndex) {
            Event event = events.remove(id);
            if (event != null && (event.isReplaceable() || event.isParameterizedReplaceable())) {
                replaceableIndex.remove(event.getDeduplicationKey(), id);
            }
        }
    }

    @Override
    public void clear() {
        synchronized (replaceableIndex) {
            events.clear();
            replaceableIndex.clear();
        }
    }

    /**
     * @return The author's latest profile (kind 0), or null
     */
    public Event getProfile(String pubkey) {
        return getReplaceable(EventKinds.PROFILE, pubkey);
    }

    /**
     * @return The author's latest contact list (kind 3), or null
     */
    public Event getContacts(String pubkey) {
        return getReplaceable(EventKinds.CONTACTS, pubkey);
    }

    /**
     * @return The author's latest relay list (kind 10002), or null
     */
    public Event getRelayList(String pubkey) {
        return getReplaceable(EventKinds.RELAY_LIST, pubkey);
    }

    private Event getReplaceable(int kind, String pubkey) {
        String eventId = replaceableIndex.get(kind + ":" + pubkey);
        return eventId != null ? events.get(eventId) : null;
    }

    /**
     * @return Number of cached events
     */
    public int size() {
        return events.size();
    }
}
