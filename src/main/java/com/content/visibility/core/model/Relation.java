package com.content.visibility.core.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Directed relationship between two entity types in the mirrored library graph.
 * Every relation has exactly one inverse; there is at most one relation per
 * ordered pair of types.
 */
public enum Relation {
    MEDIA_ITEM_PERFORMERS(EntityType.MEDIA_ITEM, EntityType.PERFORMER),
    MEDIA_ITEM_STUDIO(EntityType.MEDIA_ITEM, EntityType.STUDIO),
    MEDIA_ITEM_TAGS(EntityType.MEDIA_ITEM, EntityType.TAG),
    MEDIA_ITEM_SCENE_COLLECTIONS(EntityType.MEDIA_ITEM, EntityType.SCENE_COLLECTION),
    MEDIA_ITEM_IMAGE_COLLECTIONS(EntityType.MEDIA_ITEM, EntityType.IMAGE_COLLECTION),
    IMAGE_ITEM_IMAGE_COLLECTIONS(EntityType.IMAGE_ITEM, EntityType.IMAGE_COLLECTION),
    IMAGE_ITEM_PERFORMERS(EntityType.IMAGE_ITEM, EntityType.PERFORMER),
    IMAGE_ITEM_STUDIO(EntityType.IMAGE_ITEM, EntityType.STUDIO),
    PERFORMER_TAGS(EntityType.PERFORMER, EntityType.TAG),
    STUDIO_TAGS(EntityType.STUDIO, EntityType.TAG),
    SCENE_COLLECTION_TAGS(EntityType.SCENE_COLLECTION, EntityType.TAG),

    PERFORMER_MEDIA_ITEMS(EntityType.PERFORMER, EntityType.MEDIA_ITEM),
    STUDIO_MEDIA_ITEMS(EntityType.STUDIO, EntityType.MEDIA_ITEM),
    TAG_MEDIA_ITEMS(EntityType.TAG, EntityType.MEDIA_ITEM),
    SCENE_COLLECTION_MEDIA_ITEMS(EntityType.SCENE_COLLECTION, EntityType.MEDIA_ITEM),
    IMAGE_COLLECTION_MEDIA_ITEMS(EntityType.IMAGE_COLLECTION, EntityType.MEDIA_ITEM),
    IMAGE_COLLECTION_IMAGE_ITEMS(EntityType.IMAGE_COLLECTION, EntityType.IMAGE_ITEM),
    PERFORMER_IMAGE_ITEMS(EntityType.PERFORMER, EntityType.IMAGE_ITEM),
    STUDIO_IMAGE_ITEMS(EntityType.STUDIO, EntityType.IMAGE_ITEM),
    TAG_PERFORMERS(EntityType.TAG, EntityType.PERFORMER),
    TAG_STUDIOS(EntityType.TAG, EntityType.STUDIO),
    TAG_SCENE_COLLECTIONS(EntityType.TAG, EntityType.SCENE_COLLECTION);

    private static final Map<EntityType, Map<EntityType, Relation>> BY_TYPES = new EnumMap<>(EntityType.class);

    static {
        for (Relation relation : values()) {
            Relation previous = BY_TYPES
                    .computeIfAbsent(relation.source, t -> new EnumMap<>(EntityType.class))
                    .put(relation.target, relation);
            if (previous != null) {
                throw new IllegalStateException("Duplicate relation " + relation.source + " -> " + relation.target);
            }
        }
        for (Relation relation : values()) {
            if (relation.inverse() == null) {
                throw new IllegalStateException("Relation without inverse: " + relation);
            }
        }
    }

    private final EntityType source;
    private final EntityType target;

    Relation(EntityType source, EntityType target) {
        this.source = source;
        this.target = target;
    }

    public EntityType source() {
        return source;
    }

    public EntityType target() {
        return target;
    }

    public Relation inverse() {
        Map<EntityType, Relation> fromTarget = BY_TYPES.get(target);
        return fromTarget != null ? fromTarget.get(source) : null;
    }

    /**
     * Looks up the relation from one type to another.
     *
     * @throws IllegalArgumentException if the types are not related
     */
    public static Relation between(EntityType source, EntityType target) {
        Map<EntityType, Relation> fromSource = BY_TYPES.get(source);
        Relation relation = fromSource != null ? fromSource.get(target) : null;
        if (relation == null) {
            throw new IllegalArgumentException("No relation from " + source + " to " + target);
        }
        return relation;
    }
}
