package com.content.visibility.metrics;

import com.content.visibility.core.model.EntityType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRecompute(Duration duration, boolean success) {
    }

    @Override
    public void recordExcludedCount(EntityType type, int count) {
    }

    @Override
    public void recordCascadeRounds(int rounds) {
    }

    @Override
    public void incrementHidden(EntityType type) {
    }

    @Override
    public void incrementUnhidden(EntityType type) {
    }

    @Override
    public void recordRuleCacheHit() {
    }

    @Override
    public void recordRuleCacheMiss() {
    }
}
