package com.example.k8sproxy.authz.client;

import com.example.k8sproxy.authz.client.dto.SubjectAccessReview;
import com.example.k8sproxy.authz.model.AuthorizationQuery;
import com.example.k8sproxy.common.util.StringSanitizer;
import com.example.k8sproxy.config.ApiServerWebClientConfig;
import com.example.k8sproxy.exception.AccessReviewException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Asks the Kubernetes API server whether a user may perform an action by creating a SubjectAccessReview.
 *
 * <p>One POST per query, no retries, no caching. Transport failures propagate untouched; non-2xx
 * responses become {@link AccessReviewException}.
 */
@Slf4j
@Component
public class SubjectAccessReviewClient implements AccessReviewClient {

    static final String REVIEW_PATH = "/apis/authorization.k8s.io/v1/subjectaccessreviews";

    private final WebClient webClient;

    public SubjectAccessReviewClient(
            @Qualifier(ApiServerWebClientConfig.ACCESS_REVIEW_WEBCLIENT) WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public Mono<Boolean> checkAccess(AuthorizationQuery query) {
        SubjectAccessReview review = SubjectAccessReview.forQuery(query);

        return Mono.defer(() -> {
            log.debug("SubjectAccessReview - user={}, verb={}, namespace={}, resource={}",
                    StringSanitizer.forLog(query.identity()),
                    query.verb(),
                    StringSanitizer.forLog(query.resource().namespace()),
                    StringSanitizer.forLog(query.resource().label(), 256));

            return webClient.post()
                    .uri(REVIEW_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(review)
                    .retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(),
                            response -> response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .map(body -> new AccessReviewException(response.statusCode(), body)))
                    .bodyToMono(SubjectAccessReview.class)
                    .onErrorMap(DecodingException.class, e -> new AccessReviewException(
                            "Unreadable SubjectAccessReview response", e))
                    .map(SubjectAccessReviewClient::isAllowed)
                    .doOnNext(allowed -> log.debug("SubjectAccessReview answered allowed={} for user={}",
                            allowed, StringSanitizer.forLog(query.identity())));
        });
    }

    private static boolean isAllowed(SubjectAccessReview response) {
        SubjectAccessReview.Status status = response.status();
        return status != null && status.allowed() && !status.denied();
    }
}
