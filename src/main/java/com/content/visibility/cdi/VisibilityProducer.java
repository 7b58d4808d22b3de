package com.content.visibility.cdi;

import com.content.visibility.catalog.EntityCatalog;
import com.content.visibility.exclusion.ExclusionComputer;
import com.content.visibility.exclusion.ExclusionQueryService;
import com.content.visibility.exclusion.ExclusionStore;
import com.content.visibility.exclusion.InMemoryExclusionStore;
import com.content.visibility.hidden.HiddenEntityRepository;
import com.content.visibility.hidden.HiddenEntityService;
import com.content.visibility.hidden.InMemoryHiddenEntityRepository;
import com.content.visibility.lock.LocalRecomputeLock;
import com.content.visibility.lock.LockConfig;
import com.content.visibility.lock.RecomputeLock;
import com.content.visibility.metrics.MetricsService;
import com.content.visibility.metrics.MicrometerMetricsService;
import com.content.visibility.metrics.NoOpMetricsService;
import com.content.visibility.recompute.RecomputeConfig;
import com.content.visibility.recompute.RecomputeCoordinator;
import com.content.visibility.rest.security.ApiKeyAuthFilter;
import com.content.visibility.rest.security.RoleAuthorizationFilter;
import com.content.visibility.rest.security.SecurityConfig;
import com.content.visibility.rest.security.SecurityRole;
import com.content.visibility.rules.InMemoryRestrictionRuleRepository;
import com.content.visibility.rules.RestrictionRuleRepository;
import com.content.visibility.rules.RestrictionService;
import com.content.visibility.rules.RuleCacheConfig;
import com.content.visibility.stats.StatsAggregator;
import com.content.visibility.user.InMemoryUserDirectory;
import com.content.visibility.user.UserDirectory;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * CDI producer that wires the visibility engine from MicroProfile Config properties.
 *
 * <p>The host application supplies the {@link EntityCatalog} and {@link UserDirectory}
 * beans. Without a catalog every recompute fails with a not-ready error; without a
 * user directory an empty in-memory one is used. Storage defaults to the in-memory
 * repositories unless the host produces its own.</p>
 *
 * <h2>Configuration</h2>
 * <pre>
 * content-visibility.recompute.max-parallel-users=4
 * content-visibility.recompute.pass-timeout-ms=300000
 * content-visibility.recompute.on-unhide=true
 * content-visibility.lock.timeout-ms=30000
 * content-visibility.rules.cache.enabled=true
 * content-visibility.security.admin-keys=cv-admin-xxxx=1
 * </pre>
 */
@ApplicationScoped
public class VisibilityProducer {

    private static final Logger log = LoggerFactory.getLogger(VisibilityProducer.class);

    // ── Recompute ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "content-visibility.recompute.max-parallel-users", defaultValue = "4")
    int maxParallelUsers;

    @Inject
    @ConfigProperty(name = "content-visibility.recompute.pass-timeout-ms", defaultValue = "300000")
    long passTimeoutMs;

    @Inject
    @ConfigProperty(name = "content-visibility.recompute.on-unhide", defaultValue = "true")
    boolean recomputeOnUnhide;

    @Inject
    @ConfigProperty(name = "content-visibility.lock.timeout-ms", defaultValue = "30000")
    long lockTimeoutMs;

    // ── Rule cache ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "content-visibility.rules.cache.enabled", defaultValue = "true")
    boolean ruleCacheEnabled;

    @Inject
    @ConfigProperty(name = "content-visibility.rules.cache.max-size", defaultValue = "1000")
    int ruleCacheMaxSize;

    @Inject
    @ConfigProperty(name = "content-visibility.rules.cache.ttl-seconds", defaultValue = "300")
    int ruleCacheTtlSeconds;

    // ── Security ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "content-visibility.security.enabled", defaultValue = "true")
    boolean securityEnabled;

    @Inject
    @ConfigProperty(name = "content-visibility.security.api-key-header", defaultValue = "X-API-Key")
    String apiKeyHeader;

    @Inject
    @ConfigProperty(name = "content-visibility.security.admin-keys")
    Optional<List<String>> adminKeys;

    @Inject
    @ConfigProperty(name = "content-visibility.security.user-keys")
    Optional<List<String>> userKeys;

    // ── Host-provided collaborators ───────────────────────────

    @Inject
    Instance<EntityCatalog> catalogs;

    @Inject
    Instance<UserDirectory> userDirectories;

    @Inject
    Instance<MeterRegistry> meterRegistries;

    private UserDirectory fallbackDirectory;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (meterRegistries.isResolvable()) {
            log.info("Metrics enabled: Micrometer");
            return new MicrometerMetricsService(meterRegistries.get());
        }
        log.info("Metrics disabled: no MeterRegistry bean");
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public RestrictionRuleRepository restrictionRuleRepository() {
        return new InMemoryRestrictionRuleRepository();
    }

    @Produces
    @ApplicationScoped
    public HiddenEntityRepository hiddenEntityRepository() {
        return new InMemoryHiddenEntityRepository();
    }

    @Produces
    @ApplicationScoped
    public ExclusionStore exclusionStore() {
        return new InMemoryExclusionStore();
    }

    @Produces
    @ApplicationScoped
    public RecomputeLock recomputeLock() {
        LockConfig lockConfig = LockConfig.coveringPass(lockTimeoutMs, passTimeoutMs);
        if (lockConfig.timeoutMs() != lockTimeoutMs) {
            log.info("Recompute lock timeout raised to the pass timeout: {}ms", lockConfig.timeoutMs());
        }
        return new LocalRecomputeLock(lockConfig);
    }

    @Produces
    @ApplicationScoped
    public RestrictionService restrictionService(RestrictionRuleRepository repository, MetricsService metrics) {
        RuleCacheConfig cacheConfig = ruleCacheEnabled
                ? new RuleCacheConfig(ruleCacheMaxSize, ruleCacheTtlSeconds, true)
                : RuleCacheConfig.disabled();
        return new RestrictionService(repository, userDirectory(), cacheConfig, metrics);
    }

    @Produces
    @ApplicationScoped
    public ExclusionComputer exclusionComputer(RestrictionRuleRepository rules, HiddenEntityRepository hidden,
                                               ExclusionStore store, MetricsService metrics) {
        RecomputeConfig config = recomputeConfig();
        return new ExclusionComputer(catalog(), userDirectory(), rules, hidden, store, metrics, config.passTimeout());
    }

    @Produces
    @ApplicationScoped
    public RecomputeCoordinator recomputeCoordinator(ExclusionComputer computer, RecomputeLock lock,
                                                     MetricsService metrics) {
        return new RecomputeCoordinator(computer, userDirectory(), lock, metrics, recomputeConfig());
    }

    public void closeCoordinator(@Disposes RecomputeCoordinator coordinator) {
        log.info("Closing RecomputeCoordinator");
        coordinator.close();
    }

    @Produces
    @ApplicationScoped
    public HiddenEntityService hiddenEntityService(HiddenEntityRepository repository, RestrictionRuleRepository rules,
                                                   ExclusionStore store, MetricsService metrics,
                                                   RecomputeCoordinator coordinator) {
        HiddenEntityService service = new HiddenEntityService(repository, userDirectory(), rules, store,
                catalog(), metrics);
        service.addListener(coordinator);
        return service;
    }

    @Produces
    @ApplicationScoped
    public ExclusionQueryService exclusionQueryService(ExclusionStore store) {
        return new ExclusionQueryService(store);
    }

    @Produces
    @ApplicationScoped
    public StatsAggregator statsAggregator(ExclusionStore store) {
        return new StatsAggregator(store, userDirectory());
    }

    @Produces
    @ApplicationScoped
    public SecurityConfig securityConfig() {
        SecurityConfig.Builder builder = SecurityConfig.builder()
                .enabled(securityEnabled)
                .apiKeyHeader(apiKeyHeader);

        adminKeys.ifPresent(keys -> builder.addKeys(keys, SecurityRole.ADMIN));
        userKeys.ifPresent(keys -> builder.addKeys(keys, SecurityRole.USER));

        SecurityConfig config = builder.build();
        log.info("Security config: enabled={} keyCount={}", config.isEnabled(), config.keyCount());
        return config;
    }

    @Produces
    @ApplicationScoped
    public ApiKeyAuthFilter apiKeyAuthFilter(SecurityConfig config) {
        return new ApiKeyAuthFilter(config);
    }

    @Produces
    @ApplicationScoped
    public RoleAuthorizationFilter roleAuthorizationFilter(SecurityConfig config) {
        return new RoleAuthorizationFilter(config);
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    RecomputeConfig recomputeConfig() {
        return new RecomputeConfig(maxParallelUsers, passTimeoutMs, recomputeOnUnhide);
    }

    private EntityCatalog catalog() {
        if (catalogs.isResolvable()) {
            return catalogs.get();
        }
        log.warn("No EntityCatalog bean available; recomputes will fail until one is provided");
        return null;
    }

    private synchronized UserDirectory userDirectory() {
        if (userDirectories.isResolvable()) {
            return userDirectories.get();
        }
        if (fallbackDirectory == null) {
            log.warn("No UserDirectory bean available; using an empty in-memory directory");
            fallbackDirectory = new InMemoryUserDirectory();
        }
        return fallbackDirectory;
    }
}
