package com.example.k8sproxy.authz.audit;

import com.example.k8sproxy.authz.model.AuthorizationQuery;
import com.example.k8sproxy.authz.model.ResourceDescriptor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Structured audit event for one SubjectAccessReview outcome.
 */
public record AuthzAuditEvent(
        // Event metadata
        String eventId,
        Instant timestamp,
        String correlationId,

        // Decision
        Outcome outcome,
        String reason,

        // Subject and action
        String user,
        String verb,

        // Resource
        String namespace,
        String group,
        String version,
        String resource,
        String name,
        String subresource
) {
    public enum Outcome {
        ALLOW, DENY, ERROR
    }

    public static AuthzAuditEvent of(
            AuthorizationQuery query,
            Outcome outcome,
            String reason,
            String correlationId) {

        ResourceDescriptor resource = query.resource();
        return new AuthzAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                correlationId,
                outcome,
                reason,
                query.identity(),
                query.verb().value(),
                resource.namespace(),
                resource.group(),
                resource.version(),
                resource.resourceType(),
                resource.resourceName(),
                resource.subresource()
        );
    }

    /**
     * Converts event to structured map for JSON logging.
     */
    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", "authz_decision"),
                Map.entry("event_id", eventId),
                Map.entry("timestamp", timestamp.toString()),
                Map.entry("correlation_id", correlationId != null ? correlationId : ""),
                Map.entry("outcome", outcome.name()),
                Map.entry("reason", reason != null ? reason : ""),
                Map.entry("user", user != null ? user : ""),
                Map.entry("verb", verb != null ? verb : ""),
                Map.entry("namespace", namespace),
                Map.entry("group", group),
                Map.entry("version", version),
                Map.entry("resource", resource),
                Map.entry("name", name),
                Map.entry("subresource", subresource)
        );
    }
}
