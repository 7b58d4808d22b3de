package com.content.visibility.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Relation")
class RelationTest {

    @Test
    @DisplayName("every relation has an inverse pointing back")
    void inversesAreSymmetric() {
        for (Relation relation : Relation.values()) {
            Relation inverse = relation.inverse();
            assertNotNull(inverse, relation.name());
            assertEquals(relation.source(), inverse.target());
            assertEquals(relation.target(), inverse.source());
            assertEquals(relation, inverse.inverse());
        }
    }

    @Test
    @DisplayName("between finds the relation for a pair of types")
    void between() {
        assertEquals(Relation.MEDIA_ITEM_PERFORMERS, Relation.between(EntityType.MEDIA_ITEM, EntityType.PERFORMER));
        assertEquals(Relation.PERFORMER_MEDIA_ITEMS, Relation.between(EntityType.PERFORMER, EntityType.MEDIA_ITEM));
        assertEquals(Relation.TAG_SCENE_COLLECTIONS, Relation.between(EntityType.TAG, EntityType.SCENE_COLLECTION));
    }

    @Test
    @DisplayName("between rejects unrelated types")
    void betweenRejectsUnrelated() {
        assertThrows(IllegalArgumentException.class,
                () -> Relation.between(EntityType.IMAGE_ITEM, EntityType.TAG));
        assertThrows(IllegalArgumentException.class,
                () -> Relation.between(EntityType.PERFORMER, EntityType.STUDIO));
    }
}
