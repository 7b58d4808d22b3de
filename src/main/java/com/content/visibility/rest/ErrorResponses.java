package com.content.visibility.rest;

import com.content.visibility.error.ValidationException;
import com.content.visibility.rest.dto.ErrorResponse;
import jakarta.ws.rs.core.Response;

/**
 * Helpers shared by the resources for turning failures into responses.
 */
final class ErrorResponses {

    private ErrorResponses() {
    }

    static Response of(RuntimeException e, String path) {
        ErrorResponse body = ErrorResponse.of(e, path);
        return Response.status(body.status()).entity(body).build();
    }

    static Response internalError(Exception e, String path) {
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(ErrorResponse.internalError(e.getMessage(), path))
                .build();
    }

    static Response unauthorized(String path) {
        return Response.status(Response.Status.UNAUTHORIZED)
                .entity(ErrorResponse.unauthorized("Unauthorized", path))
                .build();
    }

    /**
     * Parses a user id path segment.
     *
     * @throws ValidationException if the value is not a number
     */
    static long parseUserId(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new ValidationException("Invalid user id: " + value);
        }
    }
}
