package com.content.visibility.exclusion;

import com.content.visibility.core.model.EntityKey;
import com.content.visibility.core.model.Relation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Relationship lookups loaded once per recompute pass, with a reverse index so the
 * cascade worklist can find the dependents of a newly excluded entity.
 */
public final class RelationshipSnapshot {

    private final Map<Relation, Map<EntityKey, Set<EntityKey>>> forward;
    private final Map<Relation, Map<EntityKey, Set<EntityKey>>> reverse;

    private RelationshipSnapshot(Map<Relation, Map<EntityKey, Set<EntityKey>>> forward) {
        this.forward = forward;
        this.reverse = new EnumMap<>(Relation.class);
        forward.forEach((relation, byKey) -> {
            Map<EntityKey, Set<EntityKey>> index = new HashMap<>();
            byKey.forEach((source, targets) -> {
                for (EntityKey target : targets) {
                    index.computeIfAbsent(target, k -> new HashSet<>()).add(source);
                }
            });
            reverse.put(relation, index);
        });
    }

    public static RelationshipSnapshot empty() {
        return new RelationshipSnapshot(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Entities reached from {@code source} through the relation.
     */
    public Set<EntityKey> related(Relation relation, EntityKey source) {
        return forward.getOrDefault(relation, Map.of()).getOrDefault(source, Set.of());
    }

    /**
     * Entities that reach {@code target} through the relation.
     */
    public Set<EntityKey> dependents(Relation relation, EntityKey target) {
        return reverse.getOrDefault(relation, Map.of()).getOrDefault(target, Set.of());
    }

    public boolean isLoaded(Relation relation) {
        return forward.containsKey(relation);
    }

    public static class Builder {
        private final Map<Relation, Map<EntityKey, Set<EntityKey>>> forward = new EnumMap<>(Relation.class);

        public Builder put(Relation relation, Map<EntityKey, Set<EntityKey>> bySource) {
            Map<EntityKey, Set<EntityKey>> copy = new HashMap<>();
            bySource.forEach((k, v) -> copy.put(k, Set.copyOf(v)));
            forward.put(relation, Collections.unmodifiableMap(copy));
            return this;
        }

        public Builder link(Relation relation, EntityKey source, EntityKey... targets) {
            Map<EntityKey, Set<EntityKey>> bySource = forward.computeIfAbsent(relation, r -> new HashMap<>());
            Set<EntityKey> merged = new HashSet<>(bySource.getOrDefault(source, Set.of()));
            merged.addAll(Set.of(targets));
            Map<EntityKey, Set<EntityKey>> next = new HashMap<>(bySource);
            next.put(source, Set.copyOf(merged));
            forward.put(relation, next);
            return this;
        }

        public RelationshipSnapshot build() {
            return new RelationshipSnapshot(new EnumMap<>(forward));
        }
    }
}
