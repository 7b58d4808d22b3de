package com.content.visibility.rest.security;

import com.content.visibility.rest.dto.ErrorResponse;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.Optional;

/**
 * Jakarta RS filter that keeps users out of the administrative surface.
 *
 * <p>The required role comes from {@link RequiresRole} on the matched method or its
 * resource class. Requests that match no annotated resource fall back to the route:
 * {@value #ADMIN_ROUTE} needs {@link SecurityRole#ADMIN}, {@value #USER_ROUTE} needs
 * {@link SecurityRole#USER}. The caller is the {@link UserPrincipal} installed by
 * {@link ApiKeyAuthFilter}.</p>
 *
 * <p>Returns {@code 403 Forbidden} when the caller's role is insufficient.</p>
 */
@Provider
@Priority(Priorities.AUTHORIZATION)
public class RoleAuthorizationFilter implements ContainerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RoleAuthorizationFilter.class);

    static final String ADMIN_ROUTE = "api/v1/admin";
    static final String USER_ROUTE = "api/v1/hidden-entities";

    private final SecurityConfig securityConfig;

    @Context
    private ResourceInfo resourceInfo;

    public RoleAuthorizationFilter(SecurityConfig securityConfig) {
        this.securityConfig = securityConfig;
    }

    public RoleAuthorizationFilter(SecurityConfig securityConfig, ResourceInfo resourceInfo) {
        this.securityConfig = securityConfig;
        this.resourceInfo = resourceInfo;
    }

    @Override
    public void filter(ContainerRequestContext requestContext) {
        if (!securityConfig.isEnabled()) {
            return;
        }

        String path = requestContext.getUriInfo().getPath();
        Optional<SecurityRole> required = requiredRole(path);
        if (required.isEmpty()) {
            return;
        }

        Optional<UserPrincipal> caller = caller(requestContext);
        if (caller.isEmpty()) {
            log.warn("authz.rejected reason=unauthenticated path={}", path);
            deny(requestContext, "Access denied.", path);
            return;
        }

        UserPrincipal user = caller.get();
        if (!user.role().hasPermission(required.get())) {
            log.warn("authz.rejected userId={} role={} required={} path={}",
                    user.userId(), user.role(), required.get(), path);
            deny(requestContext, "Insufficient permissions. Required role: " + required.get(), path);
            return;
        }

        log.debug("authz.granted userId={} role={} required={} path={}",
                user.userId(), user.role(), required.get(), path);
    }

    /**
     * Method annotation, then class annotation, then the route the request targets.
     */
    Optional<SecurityRole> requiredRole(String path) {
        if (resourceInfo != null) {
            Method method = resourceInfo.getResourceMethod();
            if (method != null && method.isAnnotationPresent(RequiresRole.class)) {
                return Optional.of(method.getAnnotation(RequiresRole.class).value());
            }
            Class<?> resourceClass = resourceInfo.getResourceClass();
            if (resourceClass != null && resourceClass.isAnnotationPresent(RequiresRole.class)) {
                return Optional.of(resourceClass.getAnnotation(RequiresRole.class).value());
            }
        }
        return routeRole(path);
    }

    static Optional<SecurityRole> routeRole(String path) {
        if (path == null) {
            return Optional.empty();
        }
        String route = path.startsWith("/") ? path.substring(1) : path;
        if (route.startsWith(ADMIN_ROUTE)) {
            return Optional.of(SecurityRole.ADMIN);
        }
        if (route.startsWith(USER_ROUTE)) {
            return Optional.of(SecurityRole.USER);
        }
        return Optional.empty();
    }

    private static Optional<UserPrincipal> caller(ContainerRequestContext requestContext) {
        SecurityContext securityContext = requestContext.getSecurityContext();
        if (securityContext != null && securityContext.getUserPrincipal() instanceof UserPrincipal user) {
            return Optional.of(user);
        }
        Object role = requestContext.getProperty(ApiKeyAuthFilter.ROLE_PROPERTY);
        Object userId = requestContext.getProperty(ApiKeyAuthFilter.USER_PROPERTY);
        if (role instanceof SecurityRole securityRole && userId instanceof Long id) {
            return Optional.of(new UserPrincipal(id, securityRole, "****"));
        }
        return Optional.empty();
    }

    private static void deny(ContainerRequestContext requestContext, String message, String path) {
        requestContext.abortWith(Response.status(Response.Status.FORBIDDEN)
                .entity(ErrorResponse.forbidden(message, path))
                .build());
    }
}
