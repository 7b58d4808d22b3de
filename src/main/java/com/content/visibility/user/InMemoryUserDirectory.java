package com.content.visibility.user;

import com.content.visibility.core.model.InstanceScope;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of UserDirectory.
 * Thread-safe via ConcurrentHashMap.
 */
public class InMemoryUserDirectory implements UserDirectory {

    private final ConcurrentMap<Long, InstanceScope> users = new ConcurrentHashMap<>();

    public InMemoryUserDirectory addUser(long userId) {
        users.putIfAbsent(userId, InstanceScope.all());
        return this;
    }

    public InMemoryUserDirectory addUser(long userId, InstanceScope scope) {
        users.put(userId, scope != null ? scope : InstanceScope.all());
        return this;
    }

    public void removeUser(long userId) {
        users.remove(userId);
    }

    @Override
    public boolean exists(long userId) {
        return users.containsKey(userId);
    }

    @Override
    public Set<Long> allUserIds() {
        return Collections.unmodifiableSet(new TreeSet<>(users.keySet()));
    }

    @Override
    public InstanceScope instanceScope(long userId) {
        return users.getOrDefault(userId, InstanceScope.all());
    }
}
