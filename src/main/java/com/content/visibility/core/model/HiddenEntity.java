package com.content.visibility.core.model;

import java.time.Instant;

/**
 * A user-initiated per-entity opt-out. The reference is opaque: it does not have
 * to exist in the catalog, so users can hide items the mirror has not ingested yet.
 */
public record HiddenEntity(long userId, EntityType entityType, EntityKey key, Instant hiddenAt) {

    public HiddenEntity {
        if (entityType == null) {
            throw new IllegalArgumentException("entityType must not be null");
        }
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        if (hiddenAt == null) {
            hiddenAt = Instant.now();
        }
    }
}
