package com.content.visibility.core.model;

import java.util.Set;

/**
 * Administrator-authored allow/deny policy for one entity type, scoped to one user.
 *
 * <p>Entity ids are instance-agnostic: an id in the list matches that id in every
 * upstream instance.</p>
 *
 * @param userId        the user the rule applies to
 * @param entityType    the governed type
 * @param mode          INCLUDE (allow-list) or EXCLUDE (deny-list)
 * @param entityIds     the listed entity ids
 * @param restrictEmpty whether entities that become empty through exclusion cascade
 */
public record RestrictionRule(
        long userId,
        EntityType entityType,
        RestrictionMode mode,
        Set<String> entityIds,
        boolean restrictEmpty
) {
    public RestrictionRule {
        if (entityType == null) {
            throw new IllegalArgumentException("entityType must not be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode must not be null");
        }
        entityIds = entityIds != null ? Set.copyOf(entityIds) : Set.of();
    }

    /**
     * The effective rule for a type the user has no rule for: nothing excluded,
     * no cascading.
     */
    public static RestrictionRule unrestricted(long userId, EntityType entityType) {
        return new RestrictionRule(userId, entityType, RestrictionMode.EXCLUDE, Set.of(), false);
    }

    public boolean isAllowList() {
        return mode == RestrictionMode.INCLUDE;
    }
}
