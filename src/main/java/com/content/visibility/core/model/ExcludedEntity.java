package com.content.visibility.core.model;

import java.time.Instant;

/**
 * One materialized exclusion row. Unique per (userId, entityType, key).
 */
public record ExcludedEntity(
        long userId,
        EntityType entityType,
        EntityKey key,
        ExclusionReason reason,
        Instant computedAt
) {
    public ExcludedEntity {
        if (entityType == null) {
            throw new IllegalArgumentException("entityType must not be null");
        }
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason must not be null");
        }
        if (computedAt == null) {
            computedAt = Instant.now();
        }
    }
}
