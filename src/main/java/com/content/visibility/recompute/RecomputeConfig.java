package com.content.visibility.recompute;

import java.time.Duration;

/**
 * Configuration for recompute scheduling.
 *
 * @param maxParallelUsers   worker threads used by recompute-all and async requests
 * @param passTimeoutMs      deadline of a single user's pass
 * @param recomputeOnUnhide  whether unhiding queues an asynchronous recompute
 */
public record RecomputeConfig(int maxParallelUsers, long passTimeoutMs, boolean recomputeOnUnhide) {

    public RecomputeConfig {
        if (maxParallelUsers <= 0) {
            throw new IllegalArgumentException("maxParallelUsers must be > 0");
        }
        if (passTimeoutMs <= 0) {
            throw new IllegalArgumentException("passTimeoutMs must be > 0");
        }
    }

    /**
     * Default configuration: 4 workers, 5 minute pass deadline, recompute on unhide.
     */
    public static RecomputeConfig defaults() {
        return new RecomputeConfig(4, 300_000, true);
    }

    public Duration passTimeout() {
        return Duration.ofMillis(passTimeoutMs);
    }
}
