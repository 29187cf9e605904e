package com.example.k8sproxy.authz.audit;

import com.example.k8sproxy.authz.model.AuthorizationQuery;
import com.example.k8sproxy.common.util.StringSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Publishes authorization audit events as JSON on the {@code AUTHZ_AUDIT} logger.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.proxy.audit.enabled", havingValue = "true", matchIfMissing = true)
public class AuthzAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("AUTHZ_AUDIT");

    private final ObjectMapper objectMapper;

    public void logAllowed(@NonNull AuthorizationQuery query, @Nullable String correlationId) {
        logEvent(AuthzAuditEvent.of(query, AuthzAuditEvent.Outcome.ALLOW, null, correlationId));
    }

    public void logDenied(@NonNull AuthorizationQuery query, @NonNull String reason, @Nullable String correlationId) {
        logEvent(AuthzAuditEvent.of(query, AuthzAuditEvent.Outcome.DENY, reason, correlationId));
    }

    public void logError(@NonNull AuthorizationQuery query, @NonNull Throwable error, @Nullable String correlationId) {
        String reason = error.getClass().getSimpleName() + ": " + error.getMessage();
        logEvent(AuthzAuditEvent.of(query, AuthzAuditEvent.Outcome.ERROR, reason, correlationId));
    }

    private void logEvent(@NonNull AuthzAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            logByOutcome(event.outcome(), json);
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(event);
        }
    }

    private void logByOutcome(@NonNull AuthzAuditEvent.Outcome outcome, String json) {
        switch (outcome) {
            case ALLOW -> AUDIT_LOG.info(json);
            case DENY -> AUDIT_LOG.warn(json);
            case ERROR -> AUDIT_LOG.error(json);
        }
    }

    private void logFallback(@NonNull AuthzAuditEvent event) {
        AUDIT_LOG.warn("AuthZ {} - user={}, verb={}, namespace={}, resource={}/{}/{}, reason={}",
                event.outcome(),
                StringSanitizer.forLog(event.user()),
                event.verb(),
                StringSanitizer.forLog(event.namespace()),
                StringSanitizer.forLog(event.resource()),
                StringSanitizer.forLog(event.name()),
                StringSanitizer.forLog(event.subresource()),
                StringSanitizer.forLog(event.reason()));
    }
}
