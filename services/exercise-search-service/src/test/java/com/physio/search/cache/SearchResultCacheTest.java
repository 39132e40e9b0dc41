package com.physio.search.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.physio.search.api.dto.SearchResponse;
import com.physio.search.support.MutableClock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class SearchResultCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    @Test
    void countsHitsAndMisses() {
        SearchResultCache cache = new SearchResultCache(new SearchCacheProperties(), clock, registry);
        SearchResponse response = new SearchResponse();

        assertThat(cache.get("search:a")).isEmpty();
        cache.put("search:a", response);
        assertThat(cache.get("search:a")).containsSame(response);

        assertThat(registry.counter("exercise_search_cache_miss_total").count()).isEqualTo(1.0);
        assertThat(registry.counter("exercise_search_cache_hit_total").count()).isEqualTo(1.0);
    }

    @Test
    void expiresAfterConfiguredTtl() {
        SearchCacheProperties properties = new SearchCacheProperties();
        properties.setTtlMs(5_000);
        SearchResultCache cache = new SearchResultCache(properties, clock, registry);
        cache.put("search:a", new SearchResponse());

        clock.advanceMillis(4_999);
        assertThat(cache.get("search:a")).isPresent();
        clock.advanceMillis(1);
        assertThat(cache.get("search:a")).isEmpty();
    }

    @Test
    void evictionsAreCounted() {
        SearchCacheProperties properties = new SearchCacheProperties();
        properties.setMaxEntries(1);
        SearchResultCache cache = new SearchResultCache(properties, clock, registry);

        cache.put("search:a", new SearchResponse());
        cache.put("search:b", new SearchResponse());

        assertThat(cache.size()).isEqualTo(1);
        assertThat(registry.counter("exercise_search_cache_eviction_total").count()).isEqualTo(1.0);
    }

    @Test
    void disabledCacheNeverStores() {
        SearchCacheProperties properties = new SearchCacheProperties();
        properties.setEnabled(false);
        SearchResultCache cache = new SearchResultCache(properties, clock, registry);

        cache.put("search:a", new SearchResponse());

        assertThat(cache.get("search:a")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void registryFaultDegradesToMiss() {
        MeterRegistry failing = new SimpleMeterRegistry() {
            @Override
            public io.micrometer.core.instrument.Counter counter(String name, String... tags) {
                throw new IllegalStateException("registry down");
            }
        };
        SearchResultCache cache = new SearchResultCache(new SearchCacheProperties(), clock, failing);
        cache.put("search:a", new SearchResponse());

        assertThat(cache.get("search:a")).isEmpty();
    }

    @Test
    void nullKeyBypassesCache() {
        SearchResultCache cache = new SearchResultCache(new SearchCacheProperties(), clock, registry);
        cache.put(null, new SearchResponse());

        assertThat(cache.get(null)).isEmpty();
        assertThat(cache.size()).isZero();
    }
}
