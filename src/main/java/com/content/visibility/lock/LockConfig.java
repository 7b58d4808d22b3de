package com.content.visibility.lock;

/**
 * Configuration for recompute lock implementations.
 *
 * @param timeoutMs maximum time to wait for a user's recompute lock
 */
public record LockConfig(long timeoutMs) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * Default configuration: 30s timeout, long enough to queue behind one pass.
     */
    public static LockConfig defaults() {
        return new LockConfig(30_000);
    }

    /**
     * Returns a configuration whose wait is never shorter than one recompute pass,
     * so a caller queued behind a legal pass does not time out before it ends.
     */
    public static LockConfig coveringPass(long timeoutMs, long passTimeoutMs) {
        return new LockConfig(Math.max(timeoutMs, passTimeoutMs));
    }
}
