package com.content.visibility.rest.dto;

import com.content.visibility.hidden.HideRequestItem;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Request DTO for hiding a single entity.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HideEntityRequest(String entityType, String entityId, String instanceId) {

    public HideRequestItem toItem() {
        return new HideRequestItem(entityType, entityId, instanceId);
    }
}
