package com.content.visibility.rules;

/**
 * Configuration for the restriction rule read cache.
 *
 * @param maxSize    maximum number of cached rule sets
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether caching is enabled
 */
public record RuleCacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public RuleCacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default cache configuration: 1,000 users, 300s TTL, enabled.
     */
    public static RuleCacheConfig defaults() {
        return new RuleCacheConfig(1_000, 300, true);
    }

    public static RuleCacheConfig disabled() {
        return new RuleCacheConfig(1, 1, false);
    }
}
