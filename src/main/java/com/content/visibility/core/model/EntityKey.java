package com.content.visibility.core.model;

/**
 * Instance-aware reference to a mirrored entity.
 *
 * <p>Entity ids are only unique within one upstream library instance, so every
 * reference carries the instance it belongs to. An empty {@code instanceId} is a
 * global reference: it stands for the same entity id in every instance.</p>
 *
 * @param instanceId upstream instance id, empty for a global reference
 * @param entityId   entity id within the instance
 */
public record EntityKey(String instanceId, String entityId) {

    public static final String GLOBAL_INSTANCE = "";

    public EntityKey {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId must not be null or blank");
        }
        instanceId = instanceId == null ? GLOBAL_INSTANCE : instanceId.trim();
    }

    /**
     * Creates a global reference matching the id in every instance.
     */
    public static EntityKey of(String entityId) {
        return new EntityKey(GLOBAL_INSTANCE, entityId);
    }

    public static EntityKey of(String instanceId, String entityId) {
        return new EntityKey(instanceId, entityId);
    }

    public boolean isGlobal() {
        return instanceId.isEmpty();
    }

    /**
     * Returns the global form of this reference.
     */
    public EntityKey toGlobal() {
        return isGlobal() ? this : of(entityId);
    }

    /**
     * Returns true if this reference designates the given concrete key, either
     * exactly or as a global reference to the same id.
     */
    public boolean matches(EntityKey other) {
        if (!entityId.equals(other.entityId)) {
            return false;
        }
        return isGlobal() || instanceId.equals(other.instanceId);
    }

    @Override
    public String toString() {
        return isGlobal() ? entityId : instanceId + ":" + entityId;
    }
}
