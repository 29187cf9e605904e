package com.example.k8sproxy.observability.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Authorization decision metrics. Tags are bounded to the decision outcome.
 */
@Component
public class AuthzMetrics {

    private static final String DECISION_METRIC = "authz.decision";

    private final Counter decisionAllowed;
    private final Counter decisionDenied;
    private final Counter decisionError;
    private final Timer reviewTimer;

    public AuthzMetrics(@NonNull MeterRegistry registry) {
        this.decisionAllowed = Counter.builder(DECISION_METRIC)
                .tag("outcome", "allowed")
                .description("Requests allowed by SubjectAccessReview")
                .register(registry);

        this.decisionDenied = Counter.builder(DECISION_METRIC)
                .tag("outcome", "denied")
                .description("Requests denied by SubjectAccessReview")
                .register(registry);

        this.decisionError = Counter.builder(DECISION_METRIC)
                .tag("outcome", "error")
                .description("Requests blocked because the SubjectAccessReview failed")
                .register(registry);

        this.reviewTimer = Timer.builder("authz.review.duration")
                .description("SubjectAccessReview round trip")
                .register(registry);
    }

    public void recordAllowed() {
        decisionAllowed.increment();
    }

    public void recordDenied() {
        decisionDenied.increment();
    }

    public void recordError() {
        decisionError.increment();
    }

    public void recordReviewDuration(@NonNull Duration duration) {
        reviewTimer.record(duration);
    }
}
