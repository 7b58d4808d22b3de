package com.content.visibility.exclusion;

import com.content.visibility.core.model.EntityKey;
import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.Relation;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the entities that become empty once the direct exclusions are applied.
 *
 * <p>Pure: reads the catalog ids, the relationship snapshot and the plan, and
 * returns the additional keys without touching the plan. The worklist only
 * re-examines dependents of entities excluded in the previous round, and the
 * result grows monotonically within a bounded key space, so it terminates.</p>
 */
public class CascadeResolver {

    /**
     * Outcome of a resolution.
     *
     * @param cascaded newly excluded keys per type
     * @param rounds   number of worklist rounds that excluded something
     */
    public record Result(Map<EntityType, Set<EntityKey>> cascaded, int rounds) {

        public int size() {
            int size = 0;
            for (Set<EntityKey> keys : cascaded.values()) {
                size += keys.size();
            }
            return size;
        }

        public Set<EntityKey> cascaded(EntityType type) {
            return cascaded.getOrDefault(type, Set.of());
        }
    }

    public Result resolve(Map<EntityType, Set<EntityKey>> allIds,
                          RelationshipSnapshot relationships,
                          ExclusionPlan plan,
                          List<CascadeRule> rules) {
        Map<EntityType, Set<EntityKey>> cascaded = new EnumMap<>(EntityType.class);
        if (rules.isEmpty()) {
            return new Result(cascaded, 0);
        }
        State state = new State(plan, cascaded);

        Deque<Candidate> round = new ArrayDeque<>();
        for (CascadeRule rule : rules) {
            for (EntityKey key : allIds.getOrDefault(rule.dependent(), Set.of())) {
                round.add(new Candidate(rule.dependent(), key));
            }
        }

        int rounds = 0;
        while (!round.isEmpty()) {
            Set<Candidate> newlyExcluded = new LinkedHashSet<>();
            while (!round.isEmpty()) {
                Candidate candidate = round.poll();
                if (state.isExcluded(candidate.type(), candidate.key())) {
                    continue;
                }
                if (isEmptied(candidate, rules, relationships, state)) {
                    state.exclude(candidate.type(), candidate.key());
                    newlyExcluded.add(candidate);
                }
            }
            if (newlyExcluded.isEmpty()) {
                break;
            }
            rounds++;
            for (Candidate excluded : newlyExcluded) {
                enqueueDependents(excluded, rules, relationships, allIds, round);
            }
        }

        Map<EntityType, Set<EntityKey>> result = new EnumMap<>(EntityType.class);
        cascaded.forEach((type, keys) -> result.put(type, Collections.unmodifiableSet(keys)));
        return new Result(Collections.unmodifiableMap(result), rounds);
    }

    private boolean isEmptied(Candidate candidate, List<CascadeRule> rules,
                              RelationshipSnapshot relationships, State state) {
        for (CascadeRule rule : rules) {
            if (rule.dependent() != candidate.type()) {
                continue;
            }
            boolean anyRelated = false;
            boolean allExcluded = true;
            for (Relation relation : rule.relations()) {
                for (EntityKey related : relationships.related(relation, candidate.key())) {
                    anyRelated = true;
                    if (!state.isExcluded(relation.target(), related)) {
                        allExcluded = false;
                        break;
                    }
                }
                if (!allExcluded) {
                    break;
                }
            }
            if (anyRelated && allExcluded) {
                return true;
            }
        }
        return false;
    }

    private void enqueueDependents(Candidate excluded, List<CascadeRule> rules,
                                   RelationshipSnapshot relationships,
                                   Map<EntityType, Set<EntityKey>> allIds,
                                   Deque<Candidate> round) {
        for (CascadeRule rule : rules) {
            for (Relation relation : rule.relations()) {
                if (relation.target() != excluded.type()) {
                    continue;
                }
                Set<EntityKey> scope = allIds.getOrDefault(rule.dependent(), Set.of());
                for (EntityKey dependent : relationships.dependents(relation, excluded.key())) {
                    if (scope.contains(dependent)) {
                        round.add(new Candidate(rule.dependent(), dependent));
                    }
                }
            }
        }
    }

    private record Candidate(EntityType type, EntityKey key) {}

    private static final class State {
        private final ExclusionPlan plan;
        private final Map<EntityType, Set<EntityKey>> cascaded;

        State(ExclusionPlan plan, Map<EntityType, Set<EntityKey>> cascaded) {
            this.plan = plan;
            this.cascaded = cascaded;
        }

        boolean isExcluded(EntityType type, EntityKey key) {
            return plan.isExcluded(type, key) || cascaded.getOrDefault(type, Set.of()).contains(key);
        }

        void exclude(EntityType type, EntityKey key) {
            cascaded.computeIfAbsent(type, t -> new LinkedHashSet<>()).add(key);
        }
    }
}
