package com.example.k8sproxy.exception;

import lombok.Getter;
import org.springframework.http.HttpStatusCode;
import org.springframework.lang.Nullable;

/**
 * The API server could not answer a SubjectAccessReview.
 *
 * <p>Either it rejected the review itself (status and body of that response are kept), or its
 * answer could not be read. Never a denial: a denial is an answer.
 */
@Getter
public class AccessReviewException extends RuntimeException {

    @Nullable
    private final HttpStatusCode statusCode;

    @Nullable
    private final String responseBody;

    public AccessReviewException(HttpStatusCode statusCode, String responseBody) {
        super("SubjectAccessReview request failed with status " + statusCode.value());
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public AccessReviewException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
        this.responseBody = null;
    }
}
