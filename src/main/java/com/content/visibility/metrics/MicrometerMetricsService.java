package com.content.visibility.metrics;

import com.content.visibility.core.model.EntityType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code visibility.recompute.duration} Timer (tag: outcome)</li>
 *   <li>{@code visibility.excluded.count} DistributionSummary (tag: entityType)</li>
 *   <li>{@code visibility.cascade.rounds} DistributionSummary</li>
 *   <li>{@code visibility.hidden} Counter (tag: entityType)</li>
 *   <li>{@code visibility.unhidden} Counter (tag: entityType)</li>
 *   <li>{@code visibility.rules.cache.hit} Counter</li>
 *   <li>{@code visibility.rules.cache.miss} Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<EntityType, DistributionSummary> excludedSummaries = new ConcurrentHashMap<>();
    private final DistributionSummary cascadeRoundsSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cascadeRoundsSummary = DistributionSummary.builder("visibility.cascade.rounds")
                .description("Worklist rounds needed to reach the cascade fixed point")
                .register(registry);
        this.cacheHitCounter = Counter.builder("visibility.rules.cache.hit")
                .description("Number of restriction rule cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("visibility.rules.cache.miss")
                .description("Number of restriction rule cache misses")
                .register(registry);
    }

    @Override
    public void recordRecompute(Duration duration, boolean success) {
        String outcome = success ? "success" : "failure";
        Timer timer = timerCache.computeIfAbsent(outcome, k ->
                Timer.builder("visibility.recompute.duration")
                        .description("Duration of per-user exclusion recomputes")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordExcludedCount(EntityType type, int count) {
        DistributionSummary summary = excludedSummaries.computeIfAbsent(type, t ->
                DistributionSummary.builder("visibility.excluded.count")
                        .description("Excluded entities per user and type after a recompute")
                        .tag("entityType", t.getWireName())
                        .register(registry));
        summary.record(count);
    }

    @Override
    public void recordCascadeRounds(int rounds) {
        cascadeRoundsSummary.record(rounds);
    }

    @Override
    public void incrementHidden(EntityType type) {
        counter("visibility.hidden", "Number of entities hidden by users", type).increment();
    }

    @Override
    public void incrementUnhidden(EntityType type) {
        counter("visibility.unhidden", "Number of entities unhidden by users", type).increment();
    }

    @Override
    public void recordRuleCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordRuleCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String name, String description, EntityType type) {
        String key = name + ":" + type.name();
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("entityType", type.getWireName())
                        .register(registry));
    }
}
