package com.content.visibility.user;

import com.content.visibility.core.model.InstanceScope;

import java.util.Set;

/**
 * Knows which users exist and which upstream instances each user may see.
 * Provided by the authentication/session layer.
 */
public interface UserDirectory {

    boolean exists(long userId);

    /**
     * Returns the ids of every user, in ascending order of iteration where the
     * implementation can offer it.
     */
    Set<Long> allUserIds();

    /**
     * Returns the instances the user's catalog enumerations are restricted to.
     * Unknown users get {@link InstanceScope#all()}.
     */
    default InstanceScope instanceScope(long userId) {
        return InstanceScope.all();
    }
}
