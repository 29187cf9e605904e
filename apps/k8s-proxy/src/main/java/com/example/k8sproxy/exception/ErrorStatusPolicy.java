package com.example.k8sproxy.exception;

import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;

/**
 * Decides which HTTP status a failure surfaces as at the proxy boundary.
 *
 * <p>Declare a bean of this type to replace {@link DefaultErrorStatusPolicy}, e.g. to hide denied
 * resources behind 404 for some paths only.
 */
@FunctionalInterface
public interface ErrorStatusPolicy {

    @NonNull
    HttpStatus statusFor(@NonNull Throwable error);
}
