package com.content.visibility.rest.security;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a REST endpoint or resource class with the minimum security role required.
 * Method-level annotations override the class-level one.
 *
 * <pre>
 * &#64;RequiresRole(SecurityRole.ADMIN)
 * &#64;POST
 * &#64;Path("/recompute-all")
 * public Response recomputeAll() { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface RequiresRole {

    SecurityRole value();
}
