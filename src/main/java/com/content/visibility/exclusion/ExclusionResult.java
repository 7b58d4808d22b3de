package com.content.visibility.exclusion;

import com.content.visibility.core.model.EntityType;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Summary of one committed recompute pass.
 *
 * @param userId        the recomputed user
 * @param excluded      number of stored rows per type
 * @param cascaded      number of rows with reason cascade
 * @param cascadeRounds worklist rounds the cascade needed
 * @param ruleVersion   version of the rule set the pass used
 * @param elapsed       wall time of the pass
 */
public record ExclusionResult(
        long userId,
        Map<EntityType, Integer> excluded,
        int cascaded,
        int cascadeRounds,
        long ruleVersion,
        Duration elapsed
) {
    public ExclusionResult {
        Map<EntityType, Integer> copy = new EnumMap<>(EntityType.class);
        if (excluded != null) {
            copy.putAll(excluded);
        }
        excluded = Collections.unmodifiableMap(copy);
    }

    public int totalExcluded() {
        int total = 0;
        for (int count : excluded.values()) {
            total += count;
        }
        return total;
    }
}
