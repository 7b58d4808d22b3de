package com.content.visibility.exclusion;

import com.content.visibility.core.model.EntityKey;
import com.content.visibility.core.model.EntityStats;
import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.ExcludedEntity;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Materialized per-user exclusion rows and visible counts.
 *
 * <p>Implementations must let readers run without blocking: a reader sees either
 * the snapshot before a {@link #commit} or the one after it, never a mix.</p>
 */
public interface ExclusionStore {

    /**
     * Atomically replaces every row and stats entry of the user. Types absent from
     * {@code rows} end up with no rows.
     */
    void commit(long userId, Map<EntityType, List<ExcludedEntity>> rows, Map<EntityType, EntityStats> stats);

    /**
     * Inserts a row unless the key is already excluded for the user and type.
     *
     * @return true if the row was inserted
     */
    boolean insertIfAbsent(ExcludedEntity row);

    List<ExcludedEntity> rows(long userId, EntityType type);

    List<ExcludedEntity> rows(long userId);

    /**
     * Returns true if a row designates the key. A global row matches the id in
     * every instance; a global key matches any row with the same id.
     */
    boolean isExcluded(long userId, EntityType type, EntityKey key);

    Set<EntityKey> excludedKeys(long userId, EntityType type);

    Optional<EntityStats> stats(long userId, EntityType type);

    List<EntityStats> stats(long userId);

    /**
     * Returns the ids of users that have a committed or partially written snapshot.
     */
    Set<Long> userIds();
}
