package com.content.visibility.lock;

import com.content.visibility.error.VisibilityException;

/**
 * Runtime exception thrown when a user's recompute lock cannot be acquired
 * within the configured timeout.
 */
public class LockAcquisitionException extends VisibilityException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
