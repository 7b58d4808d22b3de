package com.content.visibility.exclusion;

import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.Relation;
import com.content.visibility.core.model.RuleSet;

import java.util.EnumSet;
import java.util.Set;

/**
 * One structural emptiness rule: an entity of the dependent type is excluded once
 * every entity it reaches through the listed relations is excluded.
 *
 * @param dependent the type that may become empty
 * @param relations relations starting at {@code dependent} whose union justifies it
 */
public record CascadeRule(EntityType dependent, Set<Relation> relations) {

    public CascadeRule {
        if (dependent == null) {
            throw new IllegalArgumentException("dependent must not be null");
        }
        if (relations == null || relations.isEmpty()) {
            throw new IllegalArgumentException("relations must not be empty");
        }
        for (Relation relation : relations) {
            if (relation.source() != dependent) {
                throw new IllegalArgumentException("Relation " + relation + " does not start at " + dependent);
            }
        }
        relations = Set.copyOf(relations);
    }

    public static CascadeRule of(EntityType dependent, Relation... relations) {
        return new CascadeRule(dependent, Set.of(relations));
    }

    /**
     * A rule applies when the user asked for empty entities to be restricted,
     * either on the dependent type or on a type it depends on.
     */
    public boolean isActive(RuleSet rules) {
        if (rules.restrictEmpty(dependent)) {
            return true;
        }
        for (Relation relation : relations) {
            if (rules.restrictEmpty(relation.target())) {
                return true;
            }
        }
        return false;
    }

    public Set<EntityType> targets() {
        Set<EntityType> targets = EnumSet.noneOf(EntityType.class);
        relations.forEach(r -> targets.add(r.target()));
        return targets;
    }

    public boolean dependsOn(EntityType type) {
        for (Relation relation : relations) {
            if (relation.target() == type) {
                return true;
            }
        }
        return false;
    }
}
