package com.content.visibility.recompute;

import java.util.List;

/**
 * Outcome of a recompute over all users.
 *
 * @param success number of users recomputed and committed
 * @param failed  number of users whose pass failed
 * @param errors  one entry per failed user
 */
public record RecomputeAllResult(int success, int failed, List<UserFailure> errors) {

    public RecomputeAllResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public record UserFailure(long userId, String error) {}
}
