package com.content.visibility.rest.dto;

import com.content.visibility.catalog.CatalogUnavailableException;
import com.content.visibility.error.NotFoundException;
import com.content.visibility.error.ValidationException;
import com.content.visibility.exclusion.RecomputeTimeoutException;
import com.content.visibility.lock.LockAcquisitionException;

import java.time.Instant;
import java.util.Map;

/**
 * Standardized error response DTO.
 */
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        Instant timestamp,
        Map<String, String> details
) {
    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now(), null);
    }

    public ErrorResponse(int status, String error, String message, String path,
                          Map<String, String> details) {
        this(status, error, message, path, Instant.now(), details);
    }

    public static ErrorResponse badRequest(String message, String path) {
        return new ErrorResponse(400, "Bad Request", message, path);
    }

    public static ErrorResponse unauthorized(String message, String path) {
        return new ErrorResponse(401, "Unauthorized", message, path);
    }

    public static ErrorResponse forbidden(String message, String path) {
        return new ErrorResponse(403, "Forbidden", message, path);
    }

    public static ErrorResponse notFound(String message, String path) {
        return new ErrorResponse(404, "Not Found", message, path);
    }

    public static ErrorResponse conflict(String message, String path) {
        return new ErrorResponse(409, "Conflict", message, path);
    }

    public static ErrorResponse serviceUnavailable(String message, String path) {
        return new ErrorResponse(503, "Service Unavailable", message, path);
    }

    public static ErrorResponse internalError(String message, String path) {
        return new ErrorResponse(500, "Internal Server Error", message, path);
    }

    /**
     * Maps an engine exception to the response its HTTP status stands for.
     */
    public static ErrorResponse of(RuntimeException e, String path) {
        if (e instanceof ValidationException) {
            return badRequest(e.getMessage(), path);
        }
        if (e instanceof NotFoundException) {
            return notFound(e.getMessage(), path);
        }
        if (e instanceof LockAcquisitionException) {
            return conflict(e.getMessage(), path);
        }
        if (e instanceof CatalogUnavailableException || e instanceof RecomputeTimeoutException) {
            return serviceUnavailable(e.getMessage(), path);
        }
        return internalError(e.getMessage(), path);
    }
}
