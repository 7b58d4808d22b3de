package com.content.visibility.hidden;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One unvalidated entry of a hide or bulk hide request.
 *
 * @param entityType wire name of the type
 * @param entityId   id within the instance
 * @param instanceId upstream instance, absent for a global hide
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HideRequestItem(String entityType, String entityId, String instanceId) {

    public HideRequestItem(String entityType, String entityId) {
        this(entityType, entityId, null);
    }
}
