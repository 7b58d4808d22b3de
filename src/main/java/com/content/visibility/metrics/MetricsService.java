package com.content.visibility.metrics;

import com.content.visibility.core.model.EntityType;

import java.time.Duration;

/**
 * Interface for recording visibility engine metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordRecompute(Duration duration, boolean success);

    void recordExcludedCount(EntityType type, int count);

    void recordCascadeRounds(int rounds);

    void incrementHidden(EntityType type);

    void incrementUnhidden(EntityType type);

    void recordRuleCacheHit();

    void recordRuleCacheMiss();
}
