package com.content.visibility.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * How the entity ids of a {@link RestrictionRule} are interpreted.
 */
public enum RestrictionMode {

    /** Only the listed entities are visible; every other entity of the type is excluded. */
    INCLUDE,

    /** The listed entities are excluded; every other entity of the type stays visible. */
    EXCLUDE;

    /**
     * Parses a mode case-insensitively.
     *
     * @return the mode, or empty if the value is null, blank or unknown
     */
    public static Optional<RestrictionMode> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
