package com.content.visibility.error;

/**
 * Thrown when input crossing the API boundary is malformed: an unknown entity type
 * or restriction mode, a missing field, a non-numeric id.
 */
public class ValidationException extends VisibilityException {

    public ValidationException(String message) {
        super(message);
    }
}
