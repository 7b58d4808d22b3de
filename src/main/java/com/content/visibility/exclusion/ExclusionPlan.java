package com.content.visibility.exclusion;

import com.content.visibility.core.model.EntityKey;
import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.ExcludedEntity;
import com.content.visibility.core.model.ExclusionReason;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Accumulates the exclusions of one user during a recompute pass.
 *
 * <p>At most one entry exists per entity: a global key absorbs concrete keys with
 * the same id, and a concrete key already covered by a global one only raises the
 * stored reason. The stored reason is always the strongest one seen.</p>
 *
 * <p>Not thread-safe; a plan belongs to a single pass.</p>
 */
public class ExclusionPlan {

    private final long userId;
    private final Map<EntityType, Map<EntityKey, ExclusionReason>> entries = new EnumMap<>(EntityType.class);
    private final Map<EntityType, Map<String, Set<EntityKey>>> idIndex = new EnumMap<>(EntityType.class);

    public ExclusionPlan(long userId) {
        this.userId = userId;
    }

    public long userId() {
        return userId;
    }

    /**
     * Records an exclusion.
     *
     * @return true if the entity was not excluded before
     */
    public boolean add(EntityType type, EntityKey key, ExclusionReason reason) {
        Map<EntityKey, ExclusionReason> typeEntries = entries.computeIfAbsent(type, t -> new LinkedHashMap<>());
        Map<String, Set<EntityKey>> ids = idIndex.computeIfAbsent(type, t -> new HashMap<>());

        if (key.isGlobal()) {
            Set<EntityKey> existing = ids.getOrDefault(key.entityId(), Set.of());
            boolean fresh = existing.isEmpty();
            ExclusionReason merged = reason;
            for (EntityKey covered : existing) {
                merged = merged.strongest(typeEntries.remove(covered));
            }
            typeEntries.put(key, merged);
            ids.put(key.entityId(), new HashSet<>(Set.of(key)));
            return fresh;
        }

        EntityKey global = key.toGlobal();
        ExclusionReason globalReason = typeEntries.get(global);
        if (globalReason != null) {
            typeEntries.put(global, globalReason.strongest(reason));
            return false;
        }
        ExclusionReason current = typeEntries.get(key);
        if (current != null) {
            typeEntries.put(key, current.strongest(reason));
            return false;
        }
        typeEntries.put(key, reason);
        ids.computeIfAbsent(key.entityId(), id -> new HashSet<>()).add(key);
        return true;
    }

    public void addAll(EntityType type, Iterable<EntityKey> keys, ExclusionReason reason) {
        for (EntityKey key : keys) {
            add(type, key, reason);
        }
    }

    /**
     * Returns true if an entry designates the concrete key.
     */
    public boolean isExcluded(EntityType type, EntityKey key) {
        Map<EntityKey, ExclusionReason> typeEntries = entries.get(type);
        if (typeEntries == null) {
            return false;
        }
        if (key.isGlobal()) {
            return idIndex.get(type).containsKey(key.entityId());
        }
        return typeEntries.containsKey(key) || typeEntries.containsKey(key.toGlobal());
    }

    public ExclusionReason reasonFor(EntityType type, EntityKey key) {
        Map<EntityKey, ExclusionReason> typeEntries = entries.getOrDefault(type, Map.of());
        ExclusionReason reason = typeEntries.get(key);
        return reason != null ? reason : typeEntries.get(key.toGlobal());
    }

    public Set<EntityKey> keys(EntityType type) {
        return Collections.unmodifiableSet(entries.getOrDefault(type, Map.of()).keySet());
    }

    public int count(EntityType type) {
        return entries.getOrDefault(type, Map.of()).size();
    }

    public int count(EntityType type, ExclusionReason reason) {
        int count = 0;
        for (ExclusionReason r : entries.getOrDefault(type, Map.of()).values()) {
            if (r == reason) {
                count++;
            }
        }
        return count;
    }

    public int totalCount() {
        int total = 0;
        for (Map<EntityKey, ExclusionReason> typeEntries : entries.values()) {
            total += typeEntries.size();
        }
        return total;
    }

    /**
     * Materializes the plan into store rows, one list per type that has entries.
     */
    public Map<EntityType, List<ExcludedEntity>> toRows(Instant computedAt) {
        Map<EntityType, List<ExcludedEntity>> rows = new EnumMap<>(EntityType.class);
        entries.forEach((type, typeEntries) -> {
            List<ExcludedEntity> list = new ArrayList<>(typeEntries.size());
            typeEntries.forEach((key, reason) ->
                    list.add(new ExcludedEntity(userId, type, key, reason, computedAt)));
            rows.put(type, list);
        });
        return rows;
    }
}
