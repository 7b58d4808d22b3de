package com.content.visibility.exclusion;

import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.Relation;
import com.content.visibility.core.model.RuleSet;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The fixed table of structural cascades.
 */
public final class CascadeRules {

    public static final List<CascadeRule> ALL = List.of(
            CascadeRule.of(EntityType.MEDIA_ITEM, Relation.MEDIA_ITEM_PERFORMERS),
            CascadeRule.of(EntityType.MEDIA_ITEM, Relation.MEDIA_ITEM_STUDIO),
            CascadeRule.of(EntityType.MEDIA_ITEM, Relation.MEDIA_ITEM_TAGS),
            CascadeRule.of(EntityType.MEDIA_ITEM, Relation.MEDIA_ITEM_SCENE_COLLECTIONS),
            CascadeRule.of(EntityType.MEDIA_ITEM, Relation.MEDIA_ITEM_IMAGE_COLLECTIONS),
            CascadeRule.of(EntityType.IMAGE_ITEM, Relation.IMAGE_ITEM_IMAGE_COLLECTIONS),
            CascadeRule.of(EntityType.PERFORMER, Relation.PERFORMER_TAGS),
            CascadeRule.of(EntityType.PERFORMER, Relation.PERFORMER_MEDIA_ITEMS, Relation.PERFORMER_IMAGE_ITEMS),
            CascadeRule.of(EntityType.STUDIO, Relation.STUDIO_TAGS),
            CascadeRule.of(EntityType.STUDIO, Relation.STUDIO_MEDIA_ITEMS, Relation.STUDIO_IMAGE_ITEMS),
            CascadeRule.of(EntityType.SCENE_COLLECTION, Relation.SCENE_COLLECTION_TAGS),
            CascadeRule.of(EntityType.SCENE_COLLECTION, Relation.SCENE_COLLECTION_MEDIA_ITEMS),
            CascadeRule.of(EntityType.IMAGE_COLLECTION, Relation.IMAGE_COLLECTION_IMAGE_ITEMS),
            CascadeRule.of(EntityType.TAG, Relation.TAG_MEDIA_ITEMS, Relation.TAG_PERFORMERS,
                    Relation.TAG_STUDIOS, Relation.TAG_SCENE_COLLECTIONS)
    );

    private CascadeRules() {
    }

    /**
     * Returns the rules the user's restrictEmpty flags switch on.
     */
    public static List<CascadeRule> active(RuleSet rules) {
        List<CascadeRule> active = new ArrayList<>();
        for (CascadeRule rule : ALL) {
            if (rule.isActive(rules)) {
                active.add(rule);
            }
        }
        return active;
    }

    /**
     * Returns every relation the given rules need loaded.
     */
    public static Set<Relation> relations(List<CascadeRule> rules) {
        Set<Relation> relations = EnumSet.noneOf(Relation.class);
        rules.forEach(rule -> relations.addAll(rule.relations()));
        return relations;
    }
}
