package com.content.visibility.rest.dto;

import com.content.visibility.core.model.RuleSet;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Response DTO for the restriction rules of a user.
 */
public record RestrictionsResponse(
        long userId,
        long version,
        Instant updatedAt,
        List<RestrictionRuleResponse> restrictions
) {
    public static RestrictionsResponse from(RuleSet ruleSet) {
        List<RestrictionRuleResponse> rules = ruleSet.asList().stream()
                .sorted(Comparator.comparing(r -> r.entityType().ordinal()))
                .map(RestrictionRuleResponse::from)
                .toList();
        return new RestrictionsResponse(ruleSet.userId(), ruleSet.version(), ruleSet.updatedAt(), rules);
    }
}
