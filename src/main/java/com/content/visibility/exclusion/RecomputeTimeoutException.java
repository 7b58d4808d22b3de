package com.content.visibility.exclusion;

import com.content.visibility.error.VisibilityException;

/**
 * Thrown when a recompute pass overruns its deadline. The pass is abandoned
 * before anything is written.
 */
public class RecomputeTimeoutException extends VisibilityException {

    public RecomputeTimeoutException(String message) {
        super(message);
    }
}
