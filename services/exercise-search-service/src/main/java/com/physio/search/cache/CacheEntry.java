package com.physio.search.cache;

public class CacheEntry<V> {
    private final V value;
    private final long storedAt;
    private final long ttlMs;

    public CacheEntry(V value, long storedAt, long ttlMs) {
        this.value = value;
        this.storedAt = storedAt;
        this.ttlMs = ttlMs;
    }

    public V getValue() {
        return value;
    }

    public boolean isExpired(long now) {
        return now - storedAt >= ttlMs;
    }
}
