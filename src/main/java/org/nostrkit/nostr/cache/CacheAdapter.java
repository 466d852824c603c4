package org.nostrkit.nostr.cache;

import org.nostrkit.nostr.protocol.Event;
import org.nostrkit.nostr.protocol.Filter;

import java.util.stream.Stream;

/**
 * Persistent event storage used to answer subscriptions before relays respond.
 *
 * <p>Implementations handle replacement semantics:
 * <ul>
 *   <li>regular events are stored by id</li>
 *   <li>replaceable events (kind 0, 3, 10000-19999) keep the newest per kind+author</li>
 *   <li>parameterized replaceable events (30000-39999) keep the newest per kind+author+d-tag</li>
 *   <li>ephemeral events (20000-29999) are never stored</li>
 * </ul>
 *
 * <p>{@link #store(Event)} is called from background threads and may throw;
 * callers treat failures as non-fatal.
 */
public interface CacheAdapter {

    /**
     * Store an event, applying replacement rules.
     *
     * @param event The event to store
     */
    void store(Event event);

    /**
     * Query events matching a filter, newest first, honoring the filter's limit.
     * The stream is lazy; callers should close it when done.
     *
     * @param filter The filter criteria to match
     * @return Stream of matching events
     */
    Stream<Event> query(Filter filter);

    /**
     * @param id Event id
     * @return The event, or null if not cached
     */
    Event getEvent(String id);

    /**
     * @param id Event id to remove
     */
    void delete(String id);

    /**
     * Remove every cached event.
     */
    void clear();
}
