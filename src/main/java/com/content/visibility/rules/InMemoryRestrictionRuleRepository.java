package com.content.visibility.rules;

import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.RestrictionRule;
import com.content.visibility.core.model.RuleSet;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of RestrictionRuleRepository.
 * Each user's rules are held as one immutable {@link RuleSet} swapped atomically,
 * so a reader never observes half of a replace.
 */
public class InMemoryRestrictionRuleRepository implements RestrictionRuleRepository {

    private final ConcurrentMap<Long, RuleSet> ruleSets = new ConcurrentHashMap<>();

    @Override
    public RuleSet load(long userId) {
        return ruleSets.getOrDefault(userId, RuleSet.empty(userId));
    }

    @Override
    public RuleSet replaceAll(long userId, Collection<RestrictionRule> rules) {
        Map<EntityType, RestrictionRule> byType = new EnumMap<>(EntityType.class);
        for (RestrictionRule rule : rules) {
            if (rule.userId() != userId) {
                throw new IllegalArgumentException("Rule for user " + rule.userId() + " stored under user " + userId);
            }
            if (byType.put(rule.entityType(), rule) != null) {
                throw new IllegalArgumentException("Duplicate rule for entity type " + rule.entityType());
            }
        }
        return ruleSets.compute(userId, (id, current) ->
                new RuleSet(id, byType, nextVersion(current), Instant.now()));
    }

    @Override
    public int deleteAll(long userId) {
        int[] removed = new int[1];
        ruleSets.compute(userId, (id, current) -> {
            removed[0] = current != null ? current.rules().size() : 0;
            return new RuleSet(id, Map.of(), nextVersion(current), Instant.now());
        });
        return removed[0];
    }

    private static long nextVersion(RuleSet current) {
        return current != null ? current.version() + 1 : 1L;
    }
}
