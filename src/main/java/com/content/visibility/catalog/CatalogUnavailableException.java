package com.content.visibility.catalog;

import com.content.visibility.error.VisibilityException;

/**
 * Thrown when the entity catalog cannot enumerate a type or answer a relationship
 * lookup. Aborts the affected user's recompute pass before anything is written.
 */
public class CatalogUnavailableException extends VisibilityException {

    public CatalogUnavailableException(String message) {
        super(message);
    }

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
