package com.content.visibility.rules;

import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.RestrictionMode;
import com.content.visibility.core.model.RestrictionRule;
import com.content.visibility.core.model.RuleSet;
import com.content.visibility.error.NotFoundException;
import com.content.visibility.error.ValidationException;
import com.content.visibility.metrics.MetricsService;
import com.content.visibility.metrics.NoOpMetricsService;
import com.content.visibility.user.UserDirectory;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Administrator-facing store of per-user restriction rules.
 *
 * <p>Reads go through a Caffeine cache keyed by user id. Every write invalidates
 * the user's entry, and each cached {@link RuleSet} carries the version it was
 * read at. Writes never trigger a recompute; callers ask the
 * {@link com.content.visibility.recompute.RecomputeCoordinator} for one.</p>
 */
public class RestrictionService {
    private static final Logger log = LoggerFactory.getLogger(RestrictionService.class);

    private final RestrictionRuleRepository repository;
    private final UserDirectory users;
    private final Cache<Long, RuleSet> cache;
    private final MetricsService metrics;

    public RestrictionService(RestrictionRuleRepository repository, UserDirectory users) {
        this(repository, users, RuleCacheConfig.defaults(), new NoOpMetricsService());
    }

    public RestrictionService(RestrictionRuleRepository repository, UserDirectory users,
                              RuleCacheConfig config, MetricsService metrics) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.users = Objects.requireNonNull(users, "users");
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.cache = config.enabled()
                ? Caffeine.newBuilder()
                        .maximumSize(config.maxSize())
                        .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                        .build()
                : null;
        log.info("RestrictionService initialized: cacheEnabled={} maxSize={} ttl={}s",
                config.enabled(), config.maxSize(), config.ttlSeconds());
    }

    /**
     * Returns the rules of a user, possibly from cache.
     *
     * @throws NotFoundException if the user does not exist
     */
    public RuleSet getRules(long userId) {
        requireUser(userId);
        if (cache == null) {
            return repository.load(userId);
        }
        RuleSet cached = cache.getIfPresent(userId);
        if (cached != null) {
            metrics.recordRuleCacheHit();
            return cached;
        }
        metrics.recordRuleCacheMiss();
        return cache.get(userId, repository::load);
    }

    /**
     * Validates and stores the complete rule set of a user, replacing whatever was
     * there. Nothing is written when any input is invalid.
     *
     * @throws ValidationException if the list is missing or any rule is malformed
     * @throws NotFoundException   if the user does not exist
     */
    public RuleSet setRules(long userId, List<RestrictionRuleInput> inputs) {
        requireUser(userId);
        List<RestrictionRule> rules = validate(userId, inputs);
        RuleSet stored = repository.replaceAll(userId, rules);
        invalidate(userId);
        log.info("restrictions.updated userId={} ruleCount={} version={}",
                userId, rules.size(), stored.version());
        return stored;
    }

    /**
     * Removes every rule of the user.
     *
     * @return the number of rules removed
     * @throws NotFoundException if the user does not exist
     */
    public int deleteRules(long userId) {
        requireUser(userId);
        int removed = repository.deleteAll(userId);
        invalidate(userId);
        log.info("restrictions.deleted userId={} removed={}", userId, removed);
        return removed;
    }

    public void invalidate(long userId) {
        if (cache != null) {
            cache.invalidate(userId);
        }
    }

    public void invalidateAll() {
        if (cache != null) {
            cache.invalidateAll();
        }
    }

    /**
     * Converts raw inputs to rules, failing on the first malformed one.
     */
    static List<RestrictionRule> validate(long userId, List<RestrictionRuleInput> inputs) {
        if (inputs == null) {
            throw new ValidationException("Restrictions must be an array");
        }
        List<RestrictionRule> rules = new ArrayList<>(inputs.size());
        Set<EntityType> seen = EnumSet.noneOf(EntityType.class);
        for (RestrictionRuleInput input : inputs) {
            if (input == null) {
                throw new ValidationException("Restriction must not be null");
            }
            EntityType type = EntityType.fromWire(input.entityType())
                    .orElseThrow(() -> new ValidationException("Invalid entity type: " + input.entityType()));
            RestrictionMode mode = RestrictionMode.parse(input.mode())
                    .orElseThrow(() -> new ValidationException("Invalid mode: " + input.mode()));
            if (input.entityIds() == null) {
                throw new ValidationException("entityIds must be an array");
            }
            Set<String> ids = new LinkedHashSet<>();
            for (String id : input.entityIds()) {
                if (id == null || id.isBlank()) {
                    throw new ValidationException("entityIds must not contain blank values");
                }
                ids.add(id.trim());
            }
            if (!seen.add(type)) {
                throw new ValidationException("Duplicate restriction for entity type: " + type);
            }
            rules.add(new RestrictionRule(userId, type, mode, ids, Boolean.TRUE.equals(input.restrictEmpty())));
        }
        return rules;
    }

    private void requireUser(long userId) {
        if (!users.exists(userId)) {
            throw NotFoundException.user(userId);
        }
    }
}
