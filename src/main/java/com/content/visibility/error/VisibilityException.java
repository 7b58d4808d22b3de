package com.content.visibility.error;

/**
 * Base class for the unchecked exceptions raised by the visibility engine.
 */
public class VisibilityException extends RuntimeException {

    public VisibilityException(String message) {
        super(message);
    }

    public VisibilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
