package com.content.visibility.hidden;

import com.content.visibility.core.model.EntityKey;
import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.HiddenEntity;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Repository interface for hidden entity persistence.
 * Unique per (userId, entityType, key).
 */
public interface HiddenEntityRepository {

    /**
     * Inserts the entity unless the same (user, type, key) is already hidden.
     *
     * @return true if a new row was written
     */
    boolean save(HiddenEntity entity);

    /**
     * Removes one hidden entity, matching the key exactly.
     *
     * @return true if a row was removed
     */
    boolean delete(long userId, EntityType type, EntityKey key);

    /**
     * Removes every hidden entity of the user, optionally restricted to one type.
     *
     * @param type the type to clear, or null for all types
     * @return the number of rows removed
     */
    int deleteAll(long userId, EntityType type);

    /**
     * Lists hidden entities newest first.
     *
     * @param type the type to list, or null for all types
     */
    List<HiddenEntity> findByUser(long userId, EntityType type);

    /**
     * Returns the hidden keys of the user grouped by type. Types with nothing
     * hidden are absent.
     */
    Map<EntityType, Set<EntityKey>> keysByType(long userId);
}
