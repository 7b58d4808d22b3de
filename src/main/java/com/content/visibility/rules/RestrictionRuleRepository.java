package com.content.visibility.rules;

import com.content.visibility.core.model.RestrictionRule;
import com.content.visibility.core.model.RuleSet;

import java.util.Collection;

/**
 * Repository interface for restriction rule persistence.
 * Implementations provide different storage backends (in-memory, relational, etc.).
 */
public interface RestrictionRuleRepository {

    /**
     * Loads the current rules of a user. Never null: a user without rules gets
     * {@link RuleSet#empty(long)} or the empty set stamped with its last version.
     */
    RuleSet load(long userId);

    /**
     * Replaces every rule of the user in one atomic step and bumps the version.
     *
     * @return the stored rule set
     */
    RuleSet replaceAll(long userId, Collection<RestrictionRule> rules);

    /**
     * Removes every rule of the user and bumps the version.
     *
     * @return the number of rules removed
     */
    int deleteAll(long userId);
}
