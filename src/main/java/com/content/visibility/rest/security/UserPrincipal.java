package com.content.visibility.rest.security;

import java.security.Principal;

/**
 * Principal installed by {@link ApiKeyAuthFilter}. Carries the user the API key
 * belongs to, which scopes every hidden-entity operation.
 *
 * @param userId    the authenticated user
 * @param role      the role bound to the key
 * @param maskedKey the API key with its middle replaced, for logs
 */
public record UserPrincipal(long userId, SecurityRole role, String maskedKey) implements Principal {

    @Override
    public String getName() {
        return "user-" + userId;
    }
}
