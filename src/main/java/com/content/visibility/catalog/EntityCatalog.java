package com.content.visibility.catalog;

import com.content.visibility.core.model.EntityKey;
import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.InstanceScope;
import com.content.visibility.core.model.Relation;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Read access to the mirrored library, provided by the sync/ingestion layer.
 *
 * <p>Implementations are instance-aware: every key returned carries the instance
 * the entity was mirrored from. Failures to enumerate or look up are reported as
 * {@link CatalogUnavailableException}, never as empty results.</p>
 */
public interface EntityCatalog {

    /**
     * Enumerates all live entity keys of a type within the given instance scope.
     *
     * @throws CatalogUnavailableException if the type cannot be enumerated
     */
    Set<EntityKey> allIds(EntityType type, InstanceScope scope);

    /**
     * Enumerates all live entity keys of a type across every instance.
     */
    default Set<EntityKey> allIds(EntityType type) {
        return allIds(type, InstanceScope.all());
    }

    /**
     * Returns the keys related to one entity through the given relation. The result
     * is restricted to the same instance as the entity.
     *
     * @param type     the type of the entity, must equal {@code relation.source()}
     * @param key      the entity
     * @param relation the relation to follow
     * @throws CatalogUnavailableException if the lookup fails
     */
    Set<EntityKey> relatedIds(EntityType type, EntityKey key, Relation relation);

    /**
     * Batched form of {@link #relatedIds(EntityType, EntityKey, Relation)}. Entities
     * without related entities may be absent from the result.
     */
    default Map<EntityKey, Set<EntityKey>> relatedIds(EntityType type, Collection<EntityKey> keys,
                                                       Relation relation) {
        Map<EntityKey, Set<EntityKey>> result = new HashMap<>();
        for (EntityKey key : keys) {
            Set<EntityKey> related = relatedIds(type, key, relation);
            if (!related.isEmpty()) {
                result.put(key, related);
            }
        }
        return result;
    }

    /**
     * Returns false while the catalog has not finished initializing.
     */
    default boolean isReady() {
        return true;
    }
}
