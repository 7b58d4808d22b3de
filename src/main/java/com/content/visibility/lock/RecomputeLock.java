package com.content.visibility.lock;

/**
 * Per-user mutual exclusion for recompute passes. Different users never contend.
 */
public interface RecomputeLock {

    /**
     * Blocks until the user's lock is held or the configured timeout elapses.
     *
     * @throws LockAcquisitionException if the lock could not be acquired in time
     */
    void lock(long userId);

    /**
     * Releases the user's lock if the calling thread holds it.
     */
    void unlock(long userId);

    boolean isLocked(long userId);
}
