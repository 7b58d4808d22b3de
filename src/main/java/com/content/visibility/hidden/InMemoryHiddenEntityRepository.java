package com.content.visibility.hidden;

import com.content.visibility.core.model.EntityKey;
import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.HiddenEntity;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of HiddenEntityRepository.
 * Thread-safe via ConcurrentHashMap.
 */
public class InMemoryHiddenEntityRepository implements HiddenEntityRepository {

    private final ConcurrentMap<Long, ConcurrentMap<Key, HiddenEntity>> byUser = new ConcurrentHashMap<>();

    @Override
    public boolean save(HiddenEntity entity) {
        ConcurrentMap<Key, HiddenEntity> entries = byUser.computeIfAbsent(entity.userId(), id -> new ConcurrentHashMap<>());
        return entries.putIfAbsent(new Key(entity.entityType(), entity.key()), entity) == null;
    }

    @Override
    public boolean delete(long userId, EntityType type, EntityKey key) {
        ConcurrentMap<Key, HiddenEntity> entries = byUser.get(userId);
        return entries != null && entries.remove(new Key(type, key)) != null;
    }

    @Override
    public int deleteAll(long userId, EntityType type) {
        ConcurrentMap<Key, HiddenEntity> entries = byUser.get(userId);
        if (entries == null) {
            return 0;
        }
        int removed = 0;
        for (Key key : List.copyOf(entries.keySet())) {
            if ((type == null || key.type() == type) && entries.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public List<HiddenEntity> findByUser(long userId, EntityType type) {
        ConcurrentMap<Key, HiddenEntity> entries = byUser.get(userId);
        if (entries == null) {
            return List.of();
        }
        return entries.values().stream()
                .filter(e -> type == null || e.entityType() == type)
                .sorted(Comparator.comparing(HiddenEntity::hiddenAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public Map<EntityType, Set<EntityKey>> keysByType(long userId) {
        Map<EntityType, Set<EntityKey>> result = new EnumMap<>(EntityType.class);
        ConcurrentMap<Key, HiddenEntity> entries = byUser.get(userId);
        if (entries != null) {
            entries.keySet().forEach(key ->
                    result.computeIfAbsent(key.type(), t -> new LinkedHashSet<>()).add(key.entityKey()));
        }
        return result;
    }

    private record Key(EntityType type, EntityKey entityKey) {}
}
