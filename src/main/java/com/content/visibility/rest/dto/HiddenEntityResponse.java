package com.content.visibility.rest.dto;

import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.HiddenEntity;

import java.time.Instant;

/**
 * Response DTO for a hidden entity.
 */
public record HiddenEntityResponse(
        EntityType entityType,
        String entityId,
        String instanceId,
        Instant hiddenAt
) {
    public static HiddenEntityResponse from(HiddenEntity entity) {
        return new HiddenEntityResponse(entity.entityType(), entity.key().entityId(),
                entity.key().instanceId(), entity.hiddenAt());
    }
}
