package org.nostrkit.nostr.subscription;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded least-recently-used set of deduplication keys, each mapped to the
 * unix time (seconds) it was first seen. When full, the least recently
 * touched key is evicted. All methods are thread-safe.
 */
public class EventDeduplicationIndex {

    public static final int DEFAULT_MAX_SIZE = 10_000;

    private final int maxSize;
    private final LinkedHashMap<String, Long> entries;

    public EventDeduplicationIndex() {
        this(DEFAULT_MAX_SIZE);
    }

    public EventDeduplicationIndex(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        // accessOrder = true gives LRU iteration order
        this.entries = new LinkedHashMap<String, Long>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Long> eldest) {
                return size() > EventDeduplicationIndex.this.maxSize;
            }
        };
    }

    /**
     * Whether the key has been seen. A hit refreshes the key's recency.
     */
    public synchronized boolean contains(String key) {
        return entries.get(key) != null;
    }

    /**
     * Record a key as seen unless it already is.
     *
     * @param key Deduplication key
     * @param firstSeenAt Unix time in seconds
     * @return true if the key was new; false if another caller recorded it first
     */
    public synchronized boolean markSeen(String key, long firstSeenAt) {
        if (entries.get(key) != null) {
            return false;
        }
        entries.put(key, firstSeenAt);
        return true;
    }

    /**
     * @return Unix time the key was first seen, or null if unknown or evicted
     */
    public synchronized Long getFirstSeen(String key) {
        return entries.get(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getMaxSize() {
        return maxSize;
    }

    public synchronized void clear() {
        entries.clear();
    }
}
