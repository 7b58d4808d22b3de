package com.content.visibility.catalog;

import com.content.visibility.core.model.EntityKey;
import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.InstanceScope;
import com.content.visibility.core.model.Relation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable in-memory {@link EntityCatalog}, built once through {@link Builder}.
 * Used in tests and when the library is embedded next to a mirror that already
 * holds its data in memory.
 *
 * <p>Links are recorded in both directions, so a lookup through a relation and
 * through its inverse always agree.</p>
 */
public class InMemoryEntityCatalog implements EntityCatalog {

    private final Map<EntityType, Set<EntityKey>> entities;
    private final Map<Relation, Map<EntityKey, Set<EntityKey>>> links;
    private volatile boolean ready;

    private InMemoryEntityCatalog(Builder builder) {
        Map<EntityType, Set<EntityKey>> entityCopy = new EnumMap<>(EntityType.class);
        builder.entities.forEach((type, keys) -> entityCopy.put(type, Set.copyOf(keys)));
        this.entities = Collections.unmodifiableMap(entityCopy);

        Map<Relation, Map<EntityKey, Set<EntityKey>>> linkCopy = new EnumMap<>(Relation.class);
        builder.links.forEach((relation, byKey) -> {
            Map<EntityKey, Set<EntityKey>> copy = new HashMap<>();
            byKey.forEach((key, related) -> copy.put(key, Set.copyOf(related)));
            linkCopy.put(relation, Collections.unmodifiableMap(copy));
        });
        this.links = Collections.unmodifiableMap(linkCopy);
        this.ready = builder.ready;
    }

    @Override
    public Set<EntityKey> allIds(EntityType type, InstanceScope scope) {
        Set<EntityKey> keys = entities.getOrDefault(type, Set.of());
        if (scope == null || scope.isUnrestricted()) {
            return keys;
        }
        return keys.stream()
                .filter(key -> scope.includes(key.instanceId()))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public Set<EntityKey> relatedIds(EntityType type, EntityKey key, Relation relation) {
        if (relation.source() != type) {
            throw new IllegalArgumentException("Relation " + relation + " does not start at " + type);
        }
        return links.getOrDefault(relation, Map.of()).getOrDefault(key, Set.of());
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    /**
     * Flips the readiness flag, for simulating a mirror that is still initializing.
     */
    public void setReady(boolean ready) {
        this.ready = ready;
    }

    public int size(EntityType type) {
        return entities.getOrDefault(type, Set.of()).size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<EntityType, Set<EntityKey>> entities = new EnumMap<>(EntityType.class);
        private final Map<Relation, Map<EntityKey, Set<EntityKey>>> links = new EnumMap<>(Relation.class);
        private boolean ready = true;

        /**
         * Adds entities of one type, all belonging to the given instance.
         */
        public Builder add(EntityType type, String instanceId, String... entityIds) {
            for (String entityId : entityIds) {
                add(type, EntityKey.of(instanceId, entityId));
            }
            return this;
        }

        public Builder add(EntityType type, EntityKey key) {
            if (key.isGlobal()) {
                throw new IllegalArgumentException("Catalog entities must carry an instance id: " + key);
            }
            entities.computeIfAbsent(type, t -> new LinkedHashSet<>()).add(key);
            return this;
        }

        /**
         * Links two entities of the same instance and registers both if they are
         * not present yet.
         *
         * @throws IllegalArgumentException if the types are not related or the
         *                                  instances differ
         */
        public Builder link(EntityType sourceType, EntityKey source, EntityType targetType, EntityKey target) {
            if (!source.instanceId().equals(target.instanceId())) {
                throw new IllegalArgumentException("Cannot link across instances: " + source + " -> " + target);
            }
            Relation relation = Relation.between(sourceType, targetType);
            add(sourceType, source);
            add(targetType, target);
            links.computeIfAbsent(relation, r -> new HashMap<>())
                    .computeIfAbsent(source, k -> new LinkedHashSet<>()).add(target);
            links.computeIfAbsent(relation.inverse(), r -> new HashMap<>())
                    .computeIfAbsent(target, k -> new LinkedHashSet<>()).add(source);
            return this;
        }

        /**
         * Shorthand for {@link #link(EntityType, EntityKey, EntityType, EntityKey)}
         * within one instance.
         */
        public Builder link(String instanceId, EntityType sourceType, String sourceId,
                            EntityType targetType, String targetId) {
            return link(sourceType, EntityKey.of(instanceId, sourceId),
                    targetType, EntityKey.of(instanceId, targetId));
        }

        public Builder ready(boolean ready) {
            this.ready = ready;
            return this;
        }

        public InMemoryEntityCatalog build() {
            return new InMemoryEntityCatalog(this);
        }
    }
}
