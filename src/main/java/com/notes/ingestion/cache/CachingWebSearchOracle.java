package com.notes.ingestion.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.notes.ingestion.core.model.Values;
import com.notes.ingestion.enrichment.LocationSearchResult;
import com.notes.ingestion.enrichment.WebSearchOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed cache in front of a {@link WebSearchOracle}, keyed by the lower-cased office name.
 * Empty answers are cached too; failed lookups are not, so the next note retries them.
 */
public class CachingWebSearchOracle implements WebSearchOracle {
    private static final Logger log = LoggerFactory.getLogger(CachingWebSearchOracle.class);

    private final WebSearchOracle delegate;
    private final Cache<String, Optional<LocationSearchResult>> cache;
    private final boolean enabled;

    public CachingWebSearchOracle(WebSearchOracle delegate, LocationCacheConfig config) {
        this.delegate = delegate;
        this.enabled = config.enabled();
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("Location cache initialized: enabled={}, maxSize={}, ttl={}s",
                config.enabled(), config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<LocationSearchResult> searchOfficeLocation(String officeName) {
        if (!enabled) {
            return delegate.searchOfficeLocation(officeName);
        }
        String key = Values.normalizeKey(officeName);
        Optional<LocationSearchResult> cached = cache.getIfPresent(key);
        if (cached != null) {
            log.debug("Location cache hit for '{}'", key);
            return cached;
        }
        Optional<LocationSearchResult> result = delegate.searchOfficeLocation(officeName);
        cache.put(key, result);
        return result;
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public LocationCacheStats stats() {
        CacheStats caffeineStats = cache.stats();
        return new LocationCacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize());
    }
}
