package com.notes.ingestion.cache;

/**
 * Configuration for the office location lookup cache.
 *
 * @param maxSize    maximum number of cached office names
 * @param ttlSeconds time-to-live in seconds for each lookup
 * @param enabled    whether lookups are cached at all
 */
public record LocationCacheConfig(int maxSize, long ttlSeconds, boolean enabled) {

    public LocationCacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 1,000 names kept for 24 hours.
     */
    public static LocationCacheConfig defaults() {
        return new LocationCacheConfig(1_000, 86_400, true);
    }

    public static LocationCacheConfig disabled() {
        return new LocationCacheConfig(1, 1, false);
    }
}
