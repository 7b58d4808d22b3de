package com.content.visibility.exclusion;

import com.content.visibility.core.model.EntityKey;
import com.content.visibility.core.model.EntityType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Read-side facade used by the list/filter layer to drop excluded entities.
 * Reads the last committed snapshot and never blocks on a running recompute.
 */
public class ExclusionQueryService {

    private final ExclusionStore store;

    public ExclusionQueryService(ExclusionStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Returns the excluded keys of a type as stored. Global keys stand for the id
     * in every instance.
     */
    public Set<EntityKey> excludedIds(long userId, EntityType type) {
        return store.excludedKeys(userId, type);
    }

    public boolean isVisible(long userId, EntityType type, EntityKey key) {
        return !store.isExcluded(userId, type, key);
    }

    public List<EntityKey> filterVisible(long userId, EntityType type, Collection<EntityKey> keys) {
        return filterVisible(userId, type, keys, Function.identity());
    }

    /**
     * Keeps the items whose key is visible to the user, preserving order.
     */
    public <T> List<T> filterVisible(long userId, EntityType type, Collection<T> items,
                                     Function<? super T, EntityKey> keyOf) {
        List<T> visible = new ArrayList<>(items.size());
        for (T item : items) {
            if (!store.isExcluded(userId, type, keyOf.apply(item))) {
                visible.add(item);
            }
        }
        return visible;
    }
}
