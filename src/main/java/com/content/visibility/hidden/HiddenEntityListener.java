package com.content.visibility.hidden;

import com.content.visibility.core.model.EntityType;

/**
 * Callback invoked after hidden entities were removed, since unhiding can make
 * cascaded entities visible again and only a recompute can tell which.
 */
@FunctionalInterface
public interface HiddenEntityListener {

    /**
     * @param userId the user whose hidden entities changed
     * @param type   the type that was unhidden, or null when several types were
     */
    void onUnhide(long userId, EntityType type);
}
