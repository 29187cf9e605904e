package com.example.k8sproxy.authz.service;

import com.example.k8sproxy.authz.audit.AuthzAuditService;
import com.example.k8sproxy.authz.client.AccessReviewClient;
import com.example.k8sproxy.authz.exception.ResourceAccessDeniedException;
import com.example.k8sproxy.authz.model.AccessDecision;
import com.example.k8sproxy.authz.model.AuthorizationQuery;
import com.example.k8sproxy.authz.model.ResourceDescriptor;
import com.example.k8sproxy.authz.model.Verb;
import com.example.k8sproxy.common.util.StringSanitizer;
import com.example.k8sproxy.observability.filter.CorrelationIdFilter;
import com.example.k8sproxy.observability.metrics.AuthzMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Deny-by-default authorization check for a single impersonated request.
 *
 * <p>Performs exactly one oracle call per {@link #authorize} subscription. Only an explicit
 * "allowed" answer completes the returned {@code Mono}; a "not allowed" or empty answer fails it
 * with {@link ResourceAccessDeniedException}, and an oracle failure is propagated as-is.
 */
@Slf4j
@Service
public class AuthorizationGate {

    private final AccessReviewClient accessReviewClient;

    @Nullable
    private final AuthzAuditService auditService;

    private final AuthzMetrics metrics;

    public AuthorizationGate(
            AccessReviewClient accessReviewClient,
            @Nullable AuthzAuditService auditService,
            AuthzMetrics metrics) {
        this.accessReviewClient = accessReviewClient;
        this.auditService = auditService;
        this.metrics = metrics;
    }

    @NonNull
    public Mono<Void> authorize(@NonNull String identity, @NonNull ResourceDescriptor resource, @NonNull Verb verb) {
        return Mono.deferContextual(ctx -> {
            AuthorizationQuery query = new AuthorizationQuery(identity, verb, resource);
            String correlationId = ctx.getOrDefault(CorrelationIdFilter.CORRELATION_ID_KEY, null);
            long startNanos = System.nanoTime();

            return accessReviewClient.checkAccess(query)
                    .defaultIfEmpty(Boolean.FALSE)
                    .doOnError(e -> onReviewFailure(query, e, correlationId))
                    .doFinally(signal -> metrics.recordReviewDuration(Duration.ofNanos(System.nanoTime() - startNanos)))
                    .flatMap(allowed -> decide(query, AccessDecision.of(allowed, resource), correlationId));
        });
    }

    private Mono<Void> decide(AuthorizationQuery query, AccessDecision decision, @Nullable String correlationId) {
        if (decision.allowed()) {
            log.debug("Access ALLOWED - user={}, verb={}, resource={}",
                    StringSanitizer.forLog(query.identity()), query.verb(), decision.resourceLabel());
            metrics.recordAllowed();
            if (auditService != null) {
                auditService.logAllowed(query, correlationId);
            }
            return Mono.empty();
        }

        ResourceAccessDeniedException denied = new ResourceAccessDeniedException(
                query.identity(),
                query.verb(),
                decision.resourceLabel(),
                query.resource().namespace());

        log.info("Access DENIED - {}", StringSanitizer.forLog(denied.getMessage(), 512));
        metrics.recordDenied();
        if (auditService != null) {
            auditService.logDenied(query, denied.getMessage(), correlationId);
        }
        return Mono.error(denied);
    }

    private void onReviewFailure(AuthorizationQuery query, Throwable error, @Nullable String correlationId) {
        log.error("SubjectAccessReview failed for user={}, verb={}: {}",
                StringSanitizer.forLog(query.identity()), query.verb(), StringSanitizer.forLog(error.getMessage(), 256));
        metrics.recordError();
        if (auditService != null) {
            auditService.logError(query, error, correlationId);
        }
    }
}
