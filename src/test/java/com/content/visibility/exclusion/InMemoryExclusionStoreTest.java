package com.content.visibility.exclusion;

import com.content.visibility.core.model.EntityKey;
import com.content.visibility.core.model.EntityStats;
import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.ExcludedEntity;
import com.content.visibility.core.model.ExclusionReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Exclusion store")
class InMemoryExclusionStoreTest {

    private static final long USER = 1L;
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final InMemoryExclusionStore store = new InMemoryExclusionStore();

    private static ExcludedEntity row(EntityType type, EntityKey key, ExclusionReason reason) {
        return new ExcludedEntity(USER, type, key, reason, NOW);
    }

    @Nested
    @DisplayName("commit")
    class Commit {

        @Test
        @DisplayName("replaces every row of the user")
        void replaces() {
            store.commit(USER, Map.of(EntityType.TAG, List.of(
                    row(EntityType.TAG, EntityKey.of("a", "T1"), ExclusionReason.RESTRICTED))), Map.of());
            store.commit(USER, Map.of(EntityType.STUDIO, List.of(
                    row(EntityType.STUDIO, EntityKey.of("a", "S1"), ExclusionReason.HIDDEN))), Map.of());

            assertTrue(store.rows(USER, EntityType.TAG).isEmpty());
            assertEquals(1, store.rows(USER).size());
        }

        @Test
        @DisplayName("stores visible counts")
        void stats() {
            EntityStats stats = new EntityStats(USER, EntityType.TAG, 5, NOW);
            store.commit(USER, Map.of(), Map.of(EntityType.TAG, stats));

            assertEquals(stats, store.stats(USER, EntityType.TAG).orElseThrow());
            assertTrue(store.stats(USER, EntityType.STUDIO).isEmpty());
            assertEquals(1, store.stats(USER).size());
        }

        @Test
        @DisplayName("rejects rows of another user or type")
        void rejectsForeignRows() {
            ExcludedEntity foreign = new ExcludedEntity(2L, EntityType.TAG, EntityKey.of("T1"),
                    ExclusionReason.HIDDEN, NOW);
            assertThrows(IllegalArgumentException.class,
                    () -> store.commit(USER, Map.of(EntityType.TAG, List.of(foreign)), Map.of()));
            ExcludedEntity wrongType = row(EntityType.STUDIO, EntityKey.of("S1"), ExclusionReason.HIDDEN);
            assertThrows(IllegalArgumentException.class,
                    () -> store.commit(USER, Map.of(EntityType.TAG, List.of(wrongType)), Map.of()));
        }

        @Test
        @DisplayName("users are independent")
        void isolation() {
            store.commit(USER, Map.of(EntityType.TAG, List.of(
                    row(EntityType.TAG, EntityKey.of("T1"), ExclusionReason.RESTRICTED))), Map.of());
            store.commit(2L, Map.of(), Map.of());

            assertFalse(store.isExcluded(2L, EntityType.TAG, EntityKey.of("T1")));
            assertEquals(Set.of(1L, 2L), store.userIds());
        }
    }

    @Nested
    @DisplayName("lookups")
    class Lookups {

        @Test
        @DisplayName("global rows match every instance")
        void globalRow() {
            store.commit(USER, Map.of(EntityType.PERFORMER, List.of(
                    row(EntityType.PERFORMER, EntityKey.of("P1"), ExclusionReason.HIDDEN))), Map.of());

            assertTrue(store.isExcluded(USER, EntityType.PERFORMER, EntityKey.of("lib-a", "P1")));
            assertTrue(store.isExcluded(USER, EntityType.PERFORMER, EntityKey.of("P1")));
            assertFalse(store.isExcluded(USER, EntityType.PERFORMER, EntityKey.of("lib-a", "P2")));
        }

        @Test
        @DisplayName("scoped rows match only their instance")
        void scopedRow() {
            store.commit(USER, Map.of(EntityType.PERFORMER, List.of(
                    row(EntityType.PERFORMER, EntityKey.of("lib-a", "P1"), ExclusionReason.HIDDEN))), Map.of());

            assertTrue(store.isExcluded(USER, EntityType.PERFORMER, EntityKey.of("lib-a", "P1")));
            assertFalse(store.isExcluded(USER, EntityType.PERFORMER, EntityKey.of("lib-b", "P1")));
            assertTrue(store.isExcluded(USER, EntityType.PERFORMER, EntityKey.of("P1")));
        }

        @Test
        @DisplayName("unknown users have nothing excluded")
        void unknownUser() {
            assertTrue(store.rows(42L).isEmpty());
            assertTrue(store.excludedKeys(42L, EntityType.TAG).isEmpty());
            assertTrue(store.stats(42L).isEmpty());
        }
    }

    @Nested
    @DisplayName("insertIfAbsent")
    class InsertIfAbsent {

        @Test
        @DisplayName("inserts once and keeps existing rows")
        void insertsOnce() {
            assertTrue(store.insertIfAbsent(row(EntityType.TAG, EntityKey.of("a", "T1"), ExclusionReason.HIDDEN)));
            assertFalse(store.insertIfAbsent(row(EntityType.TAG, EntityKey.of("a", "T1"), ExclusionReason.CASCADE)));

            assertEquals(ExclusionReason.HIDDEN, store.rows(USER, EntityType.TAG).get(0).reason());
        }

        @Test
        @DisplayName("a key covered by a global row is not inserted")
        void coveredByGlobal() {
            store.insertIfAbsent(row(EntityType.TAG, EntityKey.of("T1"), ExclusionReason.HIDDEN));
            assertFalse(store.insertIfAbsent(row(EntityType.TAG, EntityKey.of("a", "T1"), ExclusionReason.CASCADE)));
        }

        @Test
        @DisplayName("does not touch the stats of the last commit")
        void keepsStats() {
            EntityStats stats = new EntityStats(USER, EntityType.TAG, 3, NOW);
            store.commit(USER, Map.of(), Map.of(EntityType.TAG, stats));

            store.insertIfAbsent(row(EntityType.TAG, EntityKey.of("a", "T9"), ExclusionReason.HIDDEN));

            assertEquals(3, store.stats(USER, EntityType.TAG).orElseThrow().visibleCount());
        }
    }
}
