package com.content.visibility.stats;

import com.content.visibility.core.model.EntityKey;
import com.content.visibility.core.model.EntityStats;
import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.ExcludedEntity;
import com.content.visibility.core.model.ExclusionReason;
import com.content.visibility.error.NotFoundException;
import com.content.visibility.exclusion.InMemoryExclusionStore;
import com.content.visibility.user.InMemoryUserDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StatsAggregator")
class StatsAggregatorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final InMemoryExclusionStore store = new InMemoryExclusionStore();
    private final InMemoryUserDirectory users = new InMemoryUserDirectory().addUser(1).addUser(2);
    private final StatsAggregator aggregator = new StatsAggregator(store, users);

    private static ExcludedEntity row(long userId, EntityType type, String id, ExclusionReason reason) {
        return new ExcludedEntity(userId, type, EntityKey.of("lib", id), reason, NOW);
    }

    @BeforeEach
    void setUp() {
        store.commit(2L, Map.of(EntityType.TAG, List.of(
                row(2L, EntityType.TAG, "T1", ExclusionReason.RESTRICTED))), Map.of());
        store.commit(1L, Map.of(
                EntityType.TAG, List.of(
                        row(1L, EntityType.TAG, "T1", ExclusionReason.RESTRICTED),
                        row(1L, EntityType.TAG, "T2", ExclusionReason.RESTRICTED),
                        row(1L, EntityType.TAG, "T3", ExclusionReason.HIDDEN)),
                EntityType.MEDIA_ITEM, List.of(
                        row(1L, EntityType.MEDIA_ITEM, "S1", ExclusionReason.CASCADE))),
                Map.of(EntityType.TAG, new EntityStats(1L, EntityType.TAG, 2, NOW),
                        EntityType.MEDIA_ITEM, new EntityStats(1L, EntityType.MEDIA_ITEM, 7, NOW)));
    }

    @Test
    @DisplayName("groups rows by user, type and reason in order")
    void groups() {
        List<ExclusionStatsRow> stats = aggregator.getStats();

        assertEquals(List.of(
                new ExclusionStatsRow(1L, EntityType.MEDIA_ITEM, ExclusionReason.CASCADE, 1),
                new ExclusionStatsRow(1L, EntityType.TAG, ExclusionReason.RESTRICTED, 2),
                new ExclusionStatsRow(1L, EntityType.TAG, ExclusionReason.HIDDEN, 1),
                new ExclusionStatsRow(2L, EntityType.TAG, ExclusionReason.RESTRICTED, 1)), stats);
    }

    @Test
    @DisplayName("users without rows have no stats")
    void emptyUser() {
        assertTrue(aggregator.getStats(3L).isEmpty());
    }

    @Test
    @DisplayName("visible counts are ordered by type")
    void visibleCounts() {
        List<EntityStats> counts = aggregator.visibleCounts(1L);

        assertEquals(2, counts.size());
        assertEquals(EntityType.MEDIA_ITEM, counts.get(0).entityType());
        assertEquals(7, counts.get(0).visibleCount());
        assertEquals(2, counts.get(1).visibleCount());
    }

    @Test
    @DisplayName("visible counts of an unknown user are not found")
    void unknownUser() {
        assertThrows(NotFoundException.class, () -> aggregator.visibleCounts(99L));
    }
}
