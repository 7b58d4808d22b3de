package com.content.visibility.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process recompute lock using one fair {@link ReentrantLock} per user.
 * Suitable for single-JVM deployments.
 */
public class LocalRecomputeLock implements RecomputeLock {
    private static final Logger log = LoggerFactory.getLogger(LocalRecomputeLock.class);

    private final ConcurrentHashMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalRecomputeLock() {
        this(LockConfig.defaults());
    }

    public LocalRecomputeLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public void lock(long userId) {
        ReentrantLock lock = locks.computeIfAbsent(userId, k -> new ReentrantLock(true));
        try {
            if (!lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException(
                        "Failed to acquire recompute lock for user " + userId + " within " + config.timeoutMs() + "ms");
            }
            log.debug("Lock acquired: user={}", userId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring recompute lock for user " + userId, e);
        }
    }

    @Override
    public void unlock(long userId) {
        ReentrantLock lock = locks.get(userId);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("Lock released: user={}", userId);
        }
    }

    @Override
    public boolean isLocked(long userId) {
        ReentrantLock lock = locks.get(userId);
        return lock != null && lock.isLocked();
    }
}
