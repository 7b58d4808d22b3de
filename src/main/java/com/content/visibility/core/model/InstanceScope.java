package com.content.visibility.core.model;

import java.util.Set;

/**
 * The upstream instances a catalog enumeration is restricted to. An empty set of
 * instance ids means every instance.
 */
public record InstanceScope(Set<String> instanceIds) {

    private static final InstanceScope ALL = new InstanceScope(Set.of());

    public InstanceScope {
        instanceIds = instanceIds != null ? Set.copyOf(instanceIds) : Set.of();
    }

    public static InstanceScope all() {
        return ALL;
    }

    public static InstanceScope of(String... instanceIds) {
        return new InstanceScope(Set.of(instanceIds));
    }

    public boolean isUnrestricted() {
        return instanceIds.isEmpty();
    }

    public boolean includes(String instanceId) {
        return isUnrestricted() || instanceIds.contains(instanceId);
    }
}
