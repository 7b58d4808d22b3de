package com.content.visibility.exclusion;

import com.content.visibility.catalog.CatalogNotReadyException;
import com.content.visibility.catalog.CatalogUnavailableException;
import com.content.visibility.catalog.EntityCatalog;
import com.content.visibility.core.model.EntityKey;
import com.content.visibility.core.model.EntityStats;
import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.ExcludedEntity;
import com.content.visibility.core.model.ExclusionReason;
import com.content.visibility.core.model.InstanceScope;
import com.content.visibility.core.model.Relation;
import com.content.visibility.core.model.RestrictionRule;
import com.content.visibility.core.model.RuleSet;
import com.content.visibility.error.NotFoundException;
import com.content.visibility.hidden.HiddenEntityRepository;
import com.content.visibility.metrics.MetricsService;
import com.content.visibility.metrics.NoOpMetricsService;
import com.content.visibility.rules.RestrictionRuleRepository;
import com.content.visibility.user.UserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computes and commits the complete exclusion set of one user.
 *
 * <p>A pass reads the user's rules straight from the repository, enumerates every
 * type within the user's instance scope, applies the rules and hidden entities,
 * runs the cascade to a fixed point and finally replaces the user's rows in the
 * store in one step. Anything that fails before the commit leaves the previous
 * snapshot untouched.</p>
 *
 * <p>This class does not serialize passes; callers go through
 * {@link com.content.visibility.recompute.RecomputeCoordinator}.</p>
 */
public class ExclusionComputer {
    private static final Logger log = LoggerFactory.getLogger(ExclusionComputer.class);

    private final EntityCatalog catalog;
    private final UserDirectory users;
    private final RestrictionRuleRepository rules;
    private final HiddenEntityRepository hidden;
    private final ExclusionStore store;
    private final MetricsService metrics;
    private final CascadeResolver resolver = new CascadeResolver();
    private final Duration passTimeout;
    private final Clock clock;

    public ExclusionComputer(EntityCatalog catalog, UserDirectory users, RestrictionRuleRepository rules,
                             HiddenEntityRepository hidden, ExclusionStore store,
                             MetricsService metrics, Duration passTimeout) {
        this(catalog, users, rules, hidden, store, metrics, passTimeout, Clock.systemUTC());
    }

    public ExclusionComputer(EntityCatalog catalog, UserDirectory users, RestrictionRuleRepository rules,
                             HiddenEntityRepository hidden, ExclusionStore store,
                             MetricsService metrics, Duration passTimeout, Clock clock) {
        // may be null until the mirror is wired; checked on every pass
        this.catalog = catalog;
        this.users = Objects.requireNonNull(users, "users");
        this.rules = Objects.requireNonNull(rules, "rules");
        this.hidden = Objects.requireNonNull(hidden, "hidden");
        this.store = Objects.requireNonNull(store, "store");
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.passTimeout = Objects.requireNonNull(passTimeout, "passTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Recomputes and commits the exclusions of one user.
     *
     * @throws CatalogNotReadyException    if no catalog is available yet
     * @throws CatalogUnavailableException if an enumeration or lookup fails
     * @throws NotFoundException           if the user does not exist
     * @throws RecomputeTimeoutException   if the pass overran its deadline
     */
    public ExclusionResult recompute(long userId) {
        Instant started = clock.instant();
        Instant deadline = started.plus(passTimeout);

        Pass pass = plan(userId, deadline);

        checkDeadline(userId, deadline, "commit");
        Instant computedAt = clock.instant();
        Map<EntityType, List<ExcludedEntity>> rows = pass.plan().toRows(computedAt);
        Map<EntityType, EntityStats> stats = new EnumMap<>(EntityType.class);
        Map<EntityType, Integer> excluded = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            int count = pass.plan().count(type);
            long visible = visibleCount(pass.plan(), type, pass.allIds().get(type));
            stats.put(type, new EntityStats(userId, type, visible, computedAt));
            excluded.put(type, count);
            rows.putIfAbsent(type, List.of());
        }
        store.commit(userId, rows, stats);

        Duration elapsed = Duration.between(started, clock.instant());
        excluded.forEach(metrics::recordExcludedCount);
        metrics.recordCascadeRounds(pass.cascade().rounds());
        log.info("recompute.committed userId={} excluded={} cascaded={} rounds={} ruleVersion={} elapsedMs={}",
                userId, pass.plan().totalCount(), pass.cascade().size(), pass.cascade().rounds(),
                pass.rules().version(), elapsed.toMillis());
        return new ExclusionResult(userId, excluded, countCascaded(pass.plan()),
                pass.cascade().rounds(), pass.rules().version(), elapsed);
    }

    /**
     * Computes the exclusion plan of a user without committing it.
     */
    public ExclusionPlan preview(long userId) {
        return plan(userId, clock.instant().plus(passTimeout)).plan();
    }

    private Pass plan(long userId, Instant deadline) {
        EntityCatalog source = requireCatalog();
        if (!users.exists(userId)) {
            throw NotFoundException.user(userId);
        }

        RuleSet ruleSet = rules.load(userId);
        Map<EntityType, Set<EntityKey>> hiddenKeys = hidden.keysByType(userId);
        InstanceScope scope = users.instanceScope(userId);

        Map<EntityType, Set<EntityKey>> allIds = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            allIds.put(type, enumerate(source, type, scope));
        }
        checkDeadline(userId, deadline, "enumerate");

        ExclusionPlan plan = new ExclusionPlan(userId);
        for (EntityType type : EntityType.values()) {
            applyRule(plan, ruleSet.effectiveRule(type), allIds.get(type));
        }
        hiddenKeys.forEach((type, keys) -> plan.addAll(type, keys, ExclusionReason.HIDDEN));

        List<CascadeRule> active = CascadeRules.active(ruleSet);
        RelationshipSnapshot relationships = loadRelationships(source, active, allIds);
        checkDeadline(userId, deadline, "relationships");

        CascadeResolver.Result cascade = resolver.resolve(allIds, relationships, plan, active);
        cascade.cascaded().forEach((type, keys) -> plan.addAll(type, keys, ExclusionReason.CASCADE));

        log.debug("recompute.planned userId={} activeCascadeRules={} excluded={}",
                userId, active.size(), plan.totalCount());
        return new Pass(ruleSet, allIds, plan, cascade);
    }

    /**
     * INCLUDE excludes everything not listed, EXCLUDE excludes exactly what is listed.
     */
    static void applyRule(ExclusionPlan plan, RestrictionRule rule, Set<EntityKey> allIds) {
        if (rule.isAllowList()) {
            Set<String> allowed = rule.entityIds();
            for (EntityKey key : allIds) {
                if (!allowed.contains(key.entityId())) {
                    plan.add(rule.entityType(), key, ExclusionReason.RESTRICTED);
                }
            }
        } else {
            for (String entityId : rule.entityIds()) {
                plan.add(rule.entityType(), EntityKey.of(entityId), ExclusionReason.RESTRICTED);
            }
        }
    }

    private RelationshipSnapshot loadRelationships(EntityCatalog source, List<CascadeRule> active,
                                                   Map<EntityType, Set<EntityKey>> allIds) {
        RelationshipSnapshot.Builder builder = RelationshipSnapshot.builder();
        for (Relation relation : CascadeRules.relations(active)) {
            Set<EntityKey> keys = allIds.get(relation.source());
            if (keys.isEmpty()) {
                builder.put(relation, Map.of());
                continue;
            }
            try {
                builder.put(relation, source.relatedIds(relation.source(), keys, relation));
            } catch (CatalogUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new CatalogUnavailableException("Relationship lookup failed for " + relation, e);
            }
        }
        return builder.build();
    }

    private Set<EntityKey> enumerate(EntityCatalog source, EntityType type, InstanceScope scope) {
        try {
            Set<EntityKey> keys = source.allIds(type, scope);
            if (keys == null) {
                throw new CatalogUnavailableException("Catalog returned no result for type " + type);
            }
            return keys;
        } catch (CatalogUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CatalogUnavailableException("Catalog enumeration failed for type " + type, e);
        }
    }

    private EntityCatalog requireCatalog() {
        if (catalog == null) {
            throw new CatalogNotReadyException("No entity catalog has been provided");
        }
        if (!catalog.isReady()) {
            throw new CatalogNotReadyException("Entity catalog is not ready");
        }
        return catalog;
    }

    private void checkDeadline(long userId, Instant deadline, String phase) {
        if (clock.instant().isAfter(deadline)) {
            throw new RecomputeTimeoutException("Recompute for user " + userId + " exceeded "
                    + passTimeout.toMillis() + "ms before " + phase);
        }
    }

    /**
     * Counts the enumerated entities no row designates. A global row hides its id
     * in every instance, and a row for an id the catalog does not hold hides nothing.
     */
    static long visibleCount(ExclusionPlan plan, EntityType type, Set<EntityKey> allIds) {
        long visible = 0;
        for (EntityKey key : allIds) {
            if (!plan.isExcluded(type, key)) {
                visible++;
            }
        }
        return visible;
    }

    private static int countCascaded(ExclusionPlan plan) {
        int cascaded = 0;
        for (EntityType type : EntityType.values()) {
            cascaded += plan.count(type, ExclusionReason.CASCADE);
        }
        return cascaded;
    }

    private record Pass(RuleSet rules, Map<EntityType, Set<EntityKey>> allIds,
                        ExclusionPlan plan, CascadeResolver.Result cascade) {}
}
