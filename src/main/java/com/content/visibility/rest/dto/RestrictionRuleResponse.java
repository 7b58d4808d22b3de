package com.content.visibility.rest.dto;

import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.RestrictionMode;
import com.content.visibility.core.model.RestrictionRule;

import java.util.List;

/**
 * Response DTO for one restriction rule.
 */
public record RestrictionRuleResponse(
        EntityType entityType,
        RestrictionMode mode,
        List<String> entityIds,
        boolean restrictEmpty
) {
    public static RestrictionRuleResponse from(RestrictionRule rule) {
        return new RestrictionRuleResponse(rule.entityType(), rule.mode(),
                rule.entityIds().stream().sorted().toList(), rule.restrictEmpty());
    }
}
