package com.example.k8sproxy;

import com.example.k8sproxy.authz.client.AccessReviewClient;
import com.example.k8sproxy.exception.AccessReviewException;
import com.example.k8sproxy.exception.ErrorStatusPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class K8sProxyApplicationTests {

    private static final String IDENTITY_HEADER = "X-Forwarded-User";

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private ErrorStatusPolicy errorStatusPolicy;

    @MockBean
    private AccessReviewClient accessReviewClient;

    @Test
    void contextLoads() {
        assertThat(errorStatusPolicy).isNotNull();
    }

    @Test
    @DisplayName("should return 401 without identity header")
    void shouldRequireIdentity() {
        webTestClient.get().uri("/api/v1/namespaces/ns1/pods")
                .header("X-Correlation-Id", "corr-42")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.code").isEqualTo("IMPERSONATED_USER_REQUIRED")
                .jsonPath("$.correlationId").isEqualTo("corr-42")
                .jsonPath("$.path").isEqualTo("/api/v1/namespaces/ns1/pods");

        verify(accessReviewClient, never()).checkAccess(any());
    }

    @Test
    @DisplayName("should return 400 for a malformed resource path")
    void shouldRejectMalformedPath() {
        webTestClient.get().uri("/api/v1/pods/")
                .header(IDENTITY_HEADER, "alice")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("MALFORMED_RESOURCE_PATH");

        verify(accessReviewClient, never()).checkAccess(any());
    }

    @Test
    @DisplayName("should return 405 for an unmapped method")
    void shouldRejectUnmappedMethod() {
        webTestClient.method(HttpMethod.OPTIONS).uri("/api/v1/namespaces/ns1/pods")
                .header(IDENTITY_HEADER, "alice")
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.METHOD_NOT_ALLOWED)
                .expectBody()
                .jsonPath("$.code").isEqualTo("UNSUPPORTED_METHOD");
    }

    @Test
    @DisplayName("should return 403 with the denial message")
    void shouldReturnDenial() {
        when(accessReviewClient.checkAccess(any())).thenReturn(Mono.just(false));

        webTestClient.delete().uri("/apis/apps/v1/namespaces/ns1/deployments/dep1")
                .header(IDENTITY_HEADER, "alice")
                .exchange()
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.error").isEqualTo("access_denied")
                .jsonPath("$.code").isEqualTo("RESOURCE_ACCESS_DENIED")
                .jsonPath("$.message").isEqualTo(
                        "user 'alice' is not allowed to 'delete' apps/v1/deployments/dep1 in namespace 'ns1'");
    }

    @Test
    @DisplayName("should return 502 without oracle details when the review fails")
    void shouldHideReviewFailure() {
        when(accessReviewClient.checkAccess(any())).thenReturn(Mono.error(new AccessReviewException(
                HttpStatus.INTERNAL_SERVER_ERROR, "etcd timeout")));

        webTestClient.get().uri("/api/v1/namespaces/ns1/secrets/db")
                .header(IDENTITY_HEADER, "alice")
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.BAD_GATEWAY)
                .expectBody()
                .jsonPath("$.code").isEqualTo("ACCESS_REVIEW_FAILED")
                .jsonPath("$.message").isEqualTo("Authorization service unavailable");
    }

    @Test
    @DisplayName("should forward allowed requests to the API server")
    void shouldForwardAllowedRequest() {
        when(accessReviewClient.checkAccess(any())).thenReturn(Mono.just(true));

        // The test API server address refuses connections
        webTestClient.get().uri("/api/v1/namespaces/ns1/pods")
                .header(IDENTITY_HEADER, "alice")
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.BAD_GATEWAY)
                .expectBody()
                .jsonPath("$.code").isEqualTo("API_SERVER_UNAVAILABLE");

        verify(accessReviewClient).checkAccess(any());
    }

    @Test
    @DisplayName("health endpoint should be public")
    void healthShouldBePublic() {
        webTestClient.get().uri("/actuator/health")
                .exchange()
                .expectStatus().isOk();
    }

    @Test
    @DisplayName("unmatched paths should be refused")
    void unmatchedPathsShouldBeRefused() {
        webTestClient.get().uri("/version")
                .exchange()
                .expectStatus().is4xxClientError();
    }
}
