package com.content.visibility.rest.security;

import com.content.visibility.rest.dto.ErrorResponse;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.Principal;

/**
 * Jakarta RS filter that authenticates requests using API keys.
 *
 * <p>Reads the API key from the configured header (default: {@code X-API-Key}),
 * resolves it through {@link SecurityConfig} and installs a {@link SecurityContext}
 * whose principal is a {@link UserPrincipal}.</p>
 *
 * <p>Returns {@code 401 Unauthorized} for missing or invalid keys when security is enabled.</p>
 */
@Provider
@Priority(Priorities.AUTHENTICATION)
public class ApiKeyAuthFilter implements ContainerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyAuthFilter.class);

    /** Context property key for the authenticated API key's role. */
    public static final String ROLE_PROPERTY = "content-visibility.security.role";

    /** Context property key for the authenticated user id. */
    public static final String USER_PROPERTY = "content-visibility.security.user";

    private final SecurityConfig securityConfig;

    public ApiKeyAuthFilter(SecurityConfig securityConfig) {
        this.securityConfig = securityConfig;
    }

    @Override
    public void filter(ContainerRequestContext requestContext) {
        if (!securityConfig.isEnabled()) {
            return;
        }

        String apiKey = requestContext.getHeaderString(securityConfig.getApiKeyHeader());
        String path = requestContext.getUriInfo().getPath();

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("auth.rejected reason=missing_api_key path={}", path);
            requestContext.abortWith(Response.status(Response.Status.UNAUTHORIZED)
                    .entity(ErrorResponse.unauthorized(
                            "Missing API key. Provide a valid key in the '"
                                    + securityConfig.getApiKeyHeader() + "' header.", path))
                    .build());
            return;
        }

        SecurityConfig.KeyBinding binding = securityConfig.getBindingForKey(apiKey);

        if (binding == null) {
            log.warn("auth.rejected reason=invalid_api_key path={}", path);
            requestContext.abortWith(Response.status(Response.Status.UNAUTHORIZED)
                    .entity(ErrorResponse.unauthorized("Invalid API key.", path))
                    .build());
            return;
        }

        SecurityRole role = binding.role();
        requestContext.setProperty(ROLE_PROPERTY, role);
        requestContext.setProperty(USER_PROPERTY, binding.userId());

        final UserPrincipal principal = new UserPrincipal(binding.userId(), role, maskKey(apiKey));
        final boolean secure = requestContext.getSecurityContext() != null
                && requestContext.getSecurityContext().isSecure();
        requestContext.setSecurityContext(new SecurityContext() {
            @Override
            public Principal getUserPrincipal() {
                return principal;
            }

            @Override
            public boolean isUserInRole(String roleName) {
                try {
                    SecurityRole required = SecurityRole.fromString(roleName);
                    return role.hasPermission(required);
                } catch (IllegalArgumentException e) {
                    return false;
                }
            }

            @Override
            public boolean isSecure() {
                return secure;
            }

            @Override
            public String getAuthenticationScheme() {
                return "API-KEY";
            }
        });

        log.debug("auth.success userId={} role={} path={}", binding.userId(), role, path);
    }

    static String maskKey(String key) {
        if (key.length() <= 8) {
            return "****";
        }
        return key.substring(0, 4) + "****" + key.substring(key.length() - 4);
    }
}
