package com.content.visibility.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why an entity is excluded for a user. Informational only: membership in the
 * exclusion set is what hides an entity.
 *
 * <p>Declaration order is precedence order. When an entity qualifies several
 * ways within one pass, the earliest constant is stored.</p>
 */
public enum ExclusionReason {
    RESTRICTED("restricted"),
    HIDDEN("hidden"),
    CASCADE("cascade");

    private final String wireName;

    ExclusionReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Returns the reason that wins between this and the other.
     */
    public ExclusionReason strongest(ExclusionReason other) {
        if (other == null) {
            return this;
        }
        return ordinal() <= other.ordinal() ? this : other;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
