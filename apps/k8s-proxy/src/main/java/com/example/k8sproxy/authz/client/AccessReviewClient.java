package com.example.k8sproxy.authz.client;

import com.example.k8sproxy.authz.model.AuthorizationQuery;
import reactor.core.publisher.Mono;

/**
 * Remote authorization oracle.
 *
 * <p>Implementations must be safe for concurrent use. A failed call is signalled as an error,
 * never as {@code false}: only the oracle's answer may produce a denial.
 */
public interface AccessReviewClient {

    /**
     * @return {@code true} when the oracle allows the query, {@code false} when it does not
     */
    Mono<Boolean> checkAccess(AuthorizationQuery query);
}
