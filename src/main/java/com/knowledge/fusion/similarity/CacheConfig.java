package com.knowledge.fusion.similarity;

/**
 * Configuration for the similarity score cache.
 *
 * @param maxSize    maximum number of memoized pairs
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default cache configuration: 50,000 pairs, 600s TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(50_000, 600, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
