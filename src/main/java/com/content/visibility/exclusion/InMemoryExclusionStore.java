package com.content.visibility.exclusion;

import com.content.visibility.core.model.EntityKey;
import com.content.visibility.core.model.EntityStats;
import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.ExcludedEntity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of ExclusionStore.
 *
 * <p>Each user maps to an immutable {@link UserSnapshot}. Writers build a new
 * snapshot and swap it in with a single map operation, so readers never block
 * and never see a partially applied commit.</p>
 */
public class InMemoryExclusionStore implements ExclusionStore {

    private final ConcurrentMap<Long, UserSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public void commit(long userId, Map<EntityType, List<ExcludedEntity>> rows, Map<EntityType, EntityStats> stats) {
        Map<EntityType, TypeSnapshot> types = new EnumMap<>(EntityType.class);
        rows.forEach((type, typeRows) -> {
            Map<EntityKey, ExcludedEntity> byKey = new LinkedHashMap<>();
            for (ExcludedEntity row : typeRows) {
                if (row.userId() != userId || row.entityType() != type) {
                    throw new IllegalArgumentException("Row " + row + " does not belong to user " + userId + "/" + type);
                }
                byKey.put(row.key(), row);
            }
            types.put(type, new TypeSnapshot(byKey));
        });
        snapshots.put(userId, new UserSnapshot(types, stats));
    }

    @Override
    public boolean insertIfAbsent(ExcludedEntity row) {
        boolean[] inserted = new boolean[1];
        snapshots.compute(row.userId(), (id, current) -> {
            UserSnapshot snapshot = current != null ? current : UserSnapshot.EMPTY;
            TypeSnapshot type = snapshot.type(row.entityType());
            if (type.matches(row.key())) {
                return snapshot;
            }
            inserted[0] = true;
            return snapshot.with(row.entityType(), type.with(row));
        });
        return inserted[0];
    }

    @Override
    public List<ExcludedEntity> rows(long userId, EntityType type) {
        return List.copyOf(snapshot(userId).type(type).rows().values());
    }

    @Override
    public List<ExcludedEntity> rows(long userId) {
        List<ExcludedEntity> all = new ArrayList<>();
        snapshot(userId).types().values().forEach(t -> all.addAll(t.rows().values()));
        return Collections.unmodifiableList(all);
    }

    @Override
    public boolean isExcluded(long userId, EntityType type, EntityKey key) {
        return snapshot(userId).type(type).matches(key);
    }

    @Override
    public Set<EntityKey> excludedKeys(long userId, EntityType type) {
        return snapshot(userId).type(type).rows().keySet();
    }

    @Override
    public Optional<EntityStats> stats(long userId, EntityType type) {
        return Optional.ofNullable(snapshot(userId).stats().get(type));
    }

    @Override
    public List<EntityStats> stats(long userId) {
        return List.copyOf(snapshot(userId).stats().values());
    }

    @Override
    public Set<Long> userIds() {
        return Collections.unmodifiableSet(new TreeSet<>(snapshots.keySet()));
    }

    private UserSnapshot snapshot(long userId) {
        return snapshots.getOrDefault(userId, UserSnapshot.EMPTY);
    }

    record UserSnapshot(Map<EntityType, TypeSnapshot> types, Map<EntityType, EntityStats> stats) {
        static final UserSnapshot EMPTY = new UserSnapshot(Map.of(), Map.of());

        UserSnapshot {
            Map<EntityType, TypeSnapshot> typeCopy = new EnumMap<>(EntityType.class);
            typeCopy.putAll(types);
            types = Collections.unmodifiableMap(typeCopy);
            Map<EntityType, EntityStats> statsCopy = new EnumMap<>(EntityType.class);
            if (stats != null) {
                statsCopy.putAll(stats);
            }
            stats = Collections.unmodifiableMap(statsCopy);
        }

        TypeSnapshot type(EntityType type) {
            return types.getOrDefault(type, TypeSnapshot.EMPTY);
        }

        UserSnapshot with(EntityType type, TypeSnapshot snapshot) {
            Map<EntityType, TypeSnapshot> next = new EnumMap<>(EntityType.class);
            next.putAll(types);
            next.put(type, snapshot);
            return new UserSnapshot(next, stats);
        }
    }

    record TypeSnapshot(Map<EntityKey, ExcludedEntity> rows, Set<String> entityIds) {
        static final TypeSnapshot EMPTY = new TypeSnapshot(Map.of());

        TypeSnapshot(Map<EntityKey, ExcludedEntity> rows) {
            this(Collections.unmodifiableMap(new LinkedHashMap<>(rows)), idsOf(rows));
        }

        boolean matches(EntityKey key) {
            if (key.isGlobal()) {
                return entityIds.contains(key.entityId());
            }
            return rows.containsKey(key) || rows.containsKey(key.toGlobal());
        }

        TypeSnapshot with(ExcludedEntity row) {
            Map<EntityKey, ExcludedEntity> next = new LinkedHashMap<>(rows);
            next.put(row.key(), row);
            return new TypeSnapshot(next);
        }

        private static Set<String> idsOf(Map<EntityKey, ExcludedEntity> rows) {
            Set<String> ids = new HashSet<>();
            rows.keySet().forEach(k -> ids.add(k.entityId()));
            return Collections.unmodifiableSet(ids);
        }
    }
}
