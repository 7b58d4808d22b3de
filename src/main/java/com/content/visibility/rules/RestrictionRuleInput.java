package com.content.visibility.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Unvalidated rule as it arrives from the administrative API. Converted to a
 * {@link com.content.visibility.core.model.RestrictionRule} by
 * {@link RestrictionService#setRules(long, List)}.
 *
 * @param entityType    wire name or plural alias of the entity type
 * @param mode          INCLUDE or EXCLUDE, case-insensitive
 * @param entityIds     listed ids; must be present, may be empty
 * @param restrictEmpty cascade flag, absent means false
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RestrictionRuleInput(
        String entityType,
        String mode,
        List<String> entityIds,
        Boolean restrictEmpty
) {
}
