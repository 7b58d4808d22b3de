package com.content.visibility.core.model;

import java.time.Instant;

/**
 * Number of entities of one type a user can see after the last successful recompute.
 */
public record EntityStats(long userId, EntityType entityType, long visibleCount, Instant updatedAt) {
}
