package com.content.visibility.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All restriction rules of one user, stamped with a version that increases on
 * every write.
 *
 * @param userId    the owning user
 * @param rules     at most one rule per entity type
 * @param version   write stamp, 0 for a user that never had rules written
 * @param updatedAt time of the last write, null if never written
 */
public record RuleSet(long userId, Map<EntityType, RestrictionRule> rules, long version, Instant updatedAt) {

    public RuleSet {
        EnumMap<EntityType, RestrictionRule> copy = new EnumMap<>(EntityType.class);
        if (rules != null) {
            copy.putAll(rules);
        }
        rules = Collections.unmodifiableMap(copy);
    }

    public static RuleSet empty(long userId) {
        return new RuleSet(userId, Map.of(), 0L, null);
    }

    public Optional<RestrictionRule> ruleFor(EntityType type) {
        return Optional.ofNullable(rules.get(type));
    }

    /**
     * Returns the stored rule for the type, or the unrestricted default.
     */
    public RestrictionRule effectiveRule(EntityType type) {
        RestrictionRule rule = rules.get(type);
        return rule != null ? rule : RestrictionRule.unrestricted(userId, type);
    }

    public boolean restrictEmpty(EntityType type) {
        RestrictionRule rule = rules.get(type);
        return rule != null && rule.restrictEmpty();
    }

    public List<RestrictionRule> asList() {
        return new ArrayList<>(rules.values());
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }
}
