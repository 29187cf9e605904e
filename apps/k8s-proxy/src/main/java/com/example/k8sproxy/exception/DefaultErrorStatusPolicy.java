package com.example.k8sproxy.exception;

import com.example.k8sproxy.authz.exception.MalformedPathException;
import com.example.k8sproxy.authz.exception.ResourceAccessDeniedException;
import com.example.k8sproxy.authz.exception.UnsupportedMethodException;
import com.example.k8sproxy.security.exception.AuthenticationException;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.server.ResponseStatusException;

import java.util.concurrent.TimeoutException;

/**
 * Status mapping used unless another {@link ErrorStatusPolicy} bean is declared.
 *
 * <ul>
 *   <li>malformed path: 400</li>
 *   <li>unsupported method: 405</li>
 *   <li>missing identity: 401</li>
 *   <li>denied by SubjectAccessReview: configured, 403 by default</li>
 *   <li>SubjectAccessReview or API server unreachable: 502</li>
 *   <li>anything else: 500</li>
 * </ul>
 */
public class DefaultErrorStatusPolicy implements ErrorStatusPolicy {

    private final HttpStatus accessDeniedStatus;

    public DefaultErrorStatusPolicy(@NonNull HttpStatus accessDeniedStatus) {
        if (!accessDeniedStatus.is4xxClientError()) {
            throw new IllegalArgumentException("Access denied status must be a 4xx status, got " + accessDeniedStatus);
        }
        this.accessDeniedStatus = accessDeniedStatus;
    }

    @Override
    @NonNull
    public HttpStatus statusFor(@NonNull Throwable error) {
        if (error instanceof ResourceAccessDeniedException) {
            return accessDeniedStatus;
        }
        if (error instanceof MalformedPathException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (error instanceof UnsupportedMethodException) {
            return HttpStatus.METHOD_NOT_ALLOWED;
        }
        if (error instanceof AuthenticationException) {
            return HttpStatus.UNAUTHORIZED;
        }
        if (error instanceof AccessReviewException
                || error instanceof WebClientException
                || error instanceof TimeoutException) {
            return HttpStatus.BAD_GATEWAY;
        }
        if (error instanceof ResponseStatusException statusException) {
            HttpStatus status = HttpStatus.resolve(statusException.getStatusCode().value());
            return status != null ? status : HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
