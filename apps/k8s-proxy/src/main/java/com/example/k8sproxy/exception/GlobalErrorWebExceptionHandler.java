package com.example.k8sproxy.exception;

import com.example.k8sproxy.authz.exception.MalformedPathException;
import com.example.k8sproxy.authz.exception.ResourceAccessDeniedException;
import com.example.k8sproxy.authz.exception.UnsupportedMethodException;
import com.example.k8sproxy.common.util.StringSanitizer;
import com.example.k8sproxy.observability.filter.CorrelationIdFilter;
import com.example.k8sproxy.security.exception.AuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Renders every failure of a proxied request as an {@link ErrorResponse}.
 *
 * <p>The status comes from the {@link ErrorStatusPolicy}. Denial messages are returned to the
 * caller as-is under 403; when the policy hides denials behind 404, a generic not-found message
 * is used instead. Upstream and internal failure details only go to the log.
 */
@Slf4j
@Component
@Order(-2)  // Higher priority than DefaultErrorWebExceptionHandler
public class GlobalErrorWebExceptionHandler extends AbstractErrorWebExceptionHandler {

    private final ErrorStatusPolicy statusPolicy;

    public GlobalErrorWebExceptionHandler(
            ErrorAttributes errorAttributes,
            WebProperties webProperties,
            ApplicationContext applicationContext,
            ServerCodecConfigurer serverCodecConfigurer,
            ErrorStatusPolicy statusPolicy) {
        super(errorAttributes, webProperties.getResources(), applicationContext);
        this.setMessageWriters(serverCodecConfigurer.getWriters());
        this.statusPolicy = statusPolicy;
    }

    @Override
    protected RouterFunction<ServerResponse> getRoutingFunction(ErrorAttributes errorAttributes) {
        return RouterFunctions.route(RequestPredicates.all(), this::renderErrorResponse);
    }

    private Mono<ServerResponse> renderErrorResponse(ServerRequest request) {
        Throwable error = getError(request);
        String path = request.path();
        String correlationId = request.exchange().getResponse().getHeaders()
                .getFirst(CorrelationIdFilter.CORRELATION_ID_HEADER);
        HttpStatus status = statusPolicy.statusFor(error);

        if (error instanceof ResourceAccessDeniedException denied) {
            // Logged by AuthorizationGate
            if (status == HttpStatus.FORBIDDEN) {
                return createErrorResponse(status, ErrorResponse.Categories.ACCESS_DENIED,
                        ErrorResponse.Codes.RESOURCE_ACCESS_DENIED, denied.getMessage(), correlationId, path);
            }
            return createErrorResponse(status, ErrorResponse.Categories.NOT_FOUND,
                    ErrorResponse.Codes.RESOURCE_NOT_FOUND, "The requested resource could not be found",
                    correlationId, path);
        }

        if (error instanceof MalformedPathException) {
            log.warn("Malformed resource path: path={}", StringSanitizer.forLog(path));
            return createErrorResponse(status, ErrorResponse.Categories.INVALID_REQUEST,
                    ErrorResponse.Codes.MALFORMED_RESOURCE_PATH, error.getMessage(), correlationId, path);
        }

        if (error instanceof UnsupportedMethodException unsupported) {
            log.warn("Unsupported method: method={}, path={}",
                    StringSanitizer.forLog(unsupported.getMethod()), StringSanitizer.forLog(path));
            return createErrorResponse(status, ErrorResponse.Categories.INVALID_REQUEST,
                    ErrorResponse.Codes.UNSUPPORTED_METHOD, error.getMessage(), correlationId, path);
        }

        if (error instanceof AuthenticationException) {
            log.warn("Impersonated user missing: path={}, error={}", StringSanitizer.forLog(path), error.getMessage());
            return createErrorResponse(status, ErrorResponse.Categories.AUTHENTICATION_REQUIRED,
                    ErrorResponse.Codes.IMPERSONATED_USER_REQUIRED, error.getMessage(), correlationId, path);
        }

        if (error instanceof AccessReviewException reviewError) {
            // Logged by AuthorizationGate
            log.debug("Access review failure rendered: status={}", reviewError.getStatusCode());
            return createErrorResponse(status, ErrorResponse.Categories.UPSTREAM_ERROR,
                    ErrorResponse.Codes.ACCESS_REVIEW_FAILED, "Authorization service unavailable",
                    correlationId, path);
        }

        if (error instanceof WebClientException) {
            log.error("Kubernetes API server call failed: path={}, error={}",
                    StringSanitizer.forLog(path), error.getMessage());
            return createErrorResponse(status, ErrorResponse.Categories.UPSTREAM_ERROR,
                    ErrorResponse.Codes.API_SERVER_UNAVAILABLE, "Kubernetes API server unavailable",
                    correlationId, path);
        }

        if (error instanceof ResponseStatusException statusException) {
            log.warn("Response status exception: path={}, status={}, reason={}",
                    StringSanitizer.forLog(path), status, statusException.getReason());
            return createErrorResponse(status, ErrorResponse.Categories.INVALID_REQUEST,
                    ErrorResponse.Codes.REQUEST_ERROR,
                    statusException.getReason() != null ? statusException.getReason() : status.getReasonPhrase(),
                    correlationId, path);
        }

        if (status == HttpStatus.BAD_GATEWAY) {
            log.error("Upstream call failed: path={}, error={}", StringSanitizer.forLog(path), error.getMessage());
            return createErrorResponse(status, ErrorResponse.Categories.UPSTREAM_ERROR,
                    ErrorResponse.Codes.API_SERVER_UNAVAILABLE, "Upstream service unavailable",
                    correlationId, path);
        }

        log.error("Unhandled error: path={}, status={}, error={}",
                StringSanitizer.forLog(path), status, error.getMessage(), error);
        return createErrorResponse(status, ErrorResponse.Categories.INTERNAL_ERROR,
                ErrorResponse.Codes.INTERNAL_ERROR, "An unexpected error occurred", correlationId, path);
    }

    private Mono<ServerResponse> createErrorResponse(
            HttpStatus status, String error, String code, String message, String correlationId, String path) {
        ErrorResponse body = ErrorResponse.of(error, code, message, correlationId, path);

        return ServerResponse.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromValue(body));
    }
}
