package com.content.visibility.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of mirrored entity types whose visibility is governed per user.
 *
 * <p>The wire name is the singular lowercase form used in the REST API and in the
 * materialized exclusion rows. The plural form is accepted on input because the
 * restriction API historically used it ("tags", "galleries", ...).</p>
 */
public enum EntityType {
    MEDIA_ITEM("scene", "scenes"),
    PERFORMER("performer", "performers"),
    STUDIO("studio", "studios"),
    TAG("tag", "tags"),
    IMAGE_COLLECTION("gallery", "galleries"),
    IMAGE_ITEM("image", "images"),
    SCENE_COLLECTION("group", "groups");

    private final String wireName;
    private final String pluralName;

    EntityType(String wireName, String pluralName) {
        this.wireName = wireName;
        this.pluralName = pluralName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getPluralName() {
        return pluralName;
    }

    /**
     * Returns true for types that other entities reference as a grouping
     * (performer, studio, tag, image collection, scene collection).
     */
    public boolean isContainer() {
        return this != MEDIA_ITEM && this != IMAGE_ITEM;
    }

    /**
     * Parses a wire name, plural alias or enum constant name, case-insensitively.
     *
     * @param value the raw value, may be null
     * @return the matching type, or empty if the value is null, blank or unknown
     */
    public static Optional<EntityType> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (type.wireName.equals(normalized)
                    || type.pluralName.equals(normalized)
                    || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
