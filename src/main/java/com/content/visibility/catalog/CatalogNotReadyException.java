package com.content.visibility.catalog;

/**
 * Thrown when a recompute is attempted before the entity catalog was provided or
 * while it reports that it is not ready. Never degrades into an empty result.
 */
public class CatalogNotReadyException extends CatalogUnavailableException {

    public CatalogNotReadyException(String message) {
        super(message);
    }
}
