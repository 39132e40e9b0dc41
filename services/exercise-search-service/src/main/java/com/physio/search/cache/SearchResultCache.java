package com.physio.search.cache;

import com.physio.search.api.dto.SearchResponse;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Process-wide memo of assembled search responses. A fault here never fails a search: it is
 * logged and treated as a miss.
 */
@Service
public class SearchResultCache {
    private static final Logger log = LoggerFactory.getLogger(SearchResultCache.class);

    private final SearchCacheProperties properties;
    private final LruTtlCache<SearchResponse> cache;
    private final MeterRegistry meterRegistry;

    public SearchResultCache(SearchCacheProperties properties, Clock searchClock, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.cache = new LruTtlCache<>(properties.getMaxEntries(), searchClock);
        this.meterRegistry = meterRegistry;
    }

    public Optional<SearchResponse> get(String key) {
        if (!properties.isEnabled() || key == null) {
            return Optional.empty();
        }
        try {
            Optional<SearchResponse> cached = cache.get(key).map(CacheEntry::getValue);
            meterRegistry.counter(cached.isPresent()
                ? "exercise_search_cache_hit_total"
                : "exercise_search_cache_miss_total").increment();
            return cached;
        } catch (RuntimeException ex) {
            log.debug("search cache get failed", ex);
            return Optional.empty();
        }
    }

    public void put(String key, SearchResponse response) {
        put(key, response, properties.getTtlMs());
    }

    public void put(String key, SearchResponse response, long ttlMs) {
        if (!properties.isEnabled() || key == null || response == null) {
            return;
        }
        try {
            int evicted = cache.put(key, response, ttlMs);
            if (evicted > 0) {
                meterRegistry.counter("exercise_search_cache_eviction_total").increment(evicted);
            }
        } catch (RuntimeException ex) {
            log.debug("search cache put failed", ex);
        }
    }

    public int size() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
        log.info("search cache cleared");
    }
}
