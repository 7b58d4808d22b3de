package com.content.visibility.error;

/**
 * Thrown when the user or target of an operation does not exist.
 */
public class NotFoundException extends VisibilityException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException user(long userId) {
        return new NotFoundException("User not found: " + userId);
    }
}
