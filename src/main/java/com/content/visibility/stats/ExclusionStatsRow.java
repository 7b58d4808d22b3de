package com.content.visibility.stats;

import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.ExclusionReason;

/**
 * Number of excluded rows for one (user, type, reason) group.
 */
public record ExclusionStatsRow(long userId, EntityType entityType, ExclusionReason reason, long count) {
}
