package com.example.k8sproxy.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Error body returned for every request the proxy blocks.
 *
 * <pre>{@code
 * {
 *   "error": "access_denied",
 *   "code": "RESOURCE_ACCESS_DENIED",
 *   "message": "user 'alice' is not allowed to 'delete' apps/v1/deployments/dep1 in namespace 'ns1'",
 *   "correlationId": "550e8400-e29b-41d4-a716-446655440000",
 *   "timestamp": "2024-12-19T10:30:00.000Z",
 *   "path": "/apis/apps/v1/namespaces/ns1/deployments/dep1"
 * }
 * }</pre>
 *
 * @param error         Stable error category for client error handling
 * @param code          Specific error code for debugging/logging
 * @param message       Human-readable message
 * @param correlationId Request correlation ID for tracing
 * @param timestamp     ISO-8601 timestamp when error occurred
 * @param path          Request path that triggered the error
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        String code,
        String message,
        String correlationId,
        Instant timestamp,
        String path
) {
    public static ErrorResponse of(
            String error,
            String code,
            String message,
            String correlationId,
            String path
    ) {
        return new ErrorResponse(error, code, message, correlationId, Instant.now(), path);
    }

    /**
     * Common error categories.
     */
    public static final class Categories {
        public static final String ACCESS_DENIED = "access_denied";
        public static final String AUTHENTICATION_REQUIRED = "authentication_required";
        public static final String INVALID_REQUEST = "invalid_request";
        public static final String NOT_FOUND = "not_found";
        public static final String UPSTREAM_ERROR = "upstream_error";
        public static final String INTERNAL_ERROR = "internal_error";

        private Categories() {
        }
    }

    public static final class Codes {
        public static final String MALFORMED_RESOURCE_PATH = "MALFORMED_RESOURCE_PATH";
        public static final String UNSUPPORTED_METHOD = "UNSUPPORTED_METHOD";
        public static final String IMPERSONATED_USER_REQUIRED = "IMPERSONATED_USER_REQUIRED";
        public static final String RESOURCE_ACCESS_DENIED = "RESOURCE_ACCESS_DENIED";
        public static final String RESOURCE_NOT_FOUND = "RESOURCE_NOT_FOUND";
        public static final String ACCESS_REVIEW_FAILED = "ACCESS_REVIEW_FAILED";
        public static final String API_SERVER_UNAVAILABLE = "API_SERVER_UNAVAILABLE";
        public static final String REQUEST_ERROR = "REQUEST_ERROR";
        public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

        private Codes() {
        }
    }
}
