package com.physio.search.index;

import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Refresh bookkeeping for the full-text index.
 *
 * <p>Full-text matching is answered by the exercise store, so no in-memory index is built: a
 * refresh only records when it last ran and the indexed size stays 0.
 */
@Component
@EnableConfigurationProperties(SearchIndexProperties.class)
public class SearchIndexTracker {
    private static final Logger log = LoggerFactory.getLogger(SearchIndexTracker.class);

    private final SearchIndexProperties properties;
    private final Clock clock;
    private volatile long lastRefreshedAtMs;

    public SearchIndexTracker(SearchIndexProperties properties, Clock searchClock) {
        this.properties = properties;
        this.clock = searchClock;
    }

    /**
     * @return true when a refresh ran, false when the previous one is still within the interval
     */
    public synchronized boolean refreshIfStale() {
        long now = clock.millis();
        if (now - lastRefreshedAtMs < properties.getRefreshIntervalMs()) {
            return false;
        }
        lastRefreshedAtMs = now;
        log.debug("search index refresh tick at {}", Instant.ofEpochMilli(now));
        return true;
    }

    public Instant getLastRefreshedAt() {
        return Instant.ofEpochMilli(lastRefreshedAtMs);
    }

    public int getIndexedCount() {
        return 0;
    }
}
