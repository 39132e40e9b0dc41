package com.physio.search.cache;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded key/value cache with per-entry TTL and least-recently-used eviction.
 *
 * <p>Every operation holds the instance lock, so a lookup that finds a stale entry and removes it,
 * or an insert that evicts, is atomic with respect to other callers. Expired entries are only
 * removed when looked up or when they are the eviction victim; there is no background sweep.
 */
public class LruTtlCache<V> {
    private final LinkedHashMap<String, CacheEntry<V>> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final int maxEntries;
    private final Clock clock;

    public LruTtlCache(int maxEntries, Clock clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
    }

    public synchronized Optional<CacheEntry<V>> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    /**
     * Inserts or replaces {@code key}.
     *
     * @return number of entries evicted to stay within the bound (0 or 1)
     */
    public synchronized int put(String key, V value, long ttlMs) {
        if (key == null || value == null || ttlMs <= 0) {
            return 0;
        }
        entries.put(key, new CacheEntry<>(value, clock.millis(), ttlMs));
        int evicted = 0;
        Iterator<Map.Entry<String, CacheEntry<V>>> eldest = entries.entrySet().iterator();
        while (entries.size() > maxEntries && eldest.hasNext()) {
            eldest.next();
            eldest.remove();
            evicted++;
        }
        return evicted;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }
}
