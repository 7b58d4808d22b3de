package com.content.visibility.stats;

import com.content.visibility.core.model.EntityStats;
import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.ExcludedEntity;
import com.content.visibility.core.model.ExclusionReason;
import com.content.visibility.error.NotFoundException;
import com.content.visibility.exclusion.ExclusionStore;
import com.content.visibility.user.UserDirectory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Summaries over the exclusion store. Reflects the last committed recompute of
 * each user only.
 */
public class StatsAggregator {

    private final ExclusionStore store;
    private final UserDirectory users;

    public StatsAggregator(ExclusionStore store, UserDirectory users) {
        this.store = Objects.requireNonNull(store, "store");
        this.users = Objects.requireNonNull(users, "users");
    }

    /**
     * Groups every stored row by user, type and reason. Ordered by user, then type,
     * then reason.
     */
    public List<ExclusionStatsRow> getStats() {
        List<ExclusionStatsRow> result = new ArrayList<>();
        for (long userId : store.userIds()) {
            result.addAll(getStats(userId));
        }
        return result;
    }

    public List<ExclusionStatsRow> getStats(long userId) {
        Map<EntityType, Map<ExclusionReason, Long>> grouped = new EnumMap<>(EntityType.class);
        for (ExcludedEntity row : store.rows(userId)) {
            grouped.computeIfAbsent(row.entityType(), t -> new EnumMap<>(ExclusionReason.class))
                    .merge(row.reason(), 1L, Long::sum);
        }
        List<ExclusionStatsRow> result = new ArrayList<>();
        grouped.forEach((type, byReason) -> byReason.forEach((reason, count) ->
                result.add(new ExclusionStatsRow(userId, type, reason, count))));
        return result;
    }

    /**
     * Returns the visible counts of one user, one entry per type that has been
     * computed.
     *
     * @throws NotFoundException if the user does not exist
     */
    public List<EntityStats> visibleCounts(long userId) {
        if (!users.exists(userId)) {
            throw NotFoundException.user(userId);
        }
        List<EntityStats> stats = new ArrayList<>(store.stats(userId));
        stats.sort(Comparator.comparing(EntityStats::entityType));
        return stats;
    }
}
