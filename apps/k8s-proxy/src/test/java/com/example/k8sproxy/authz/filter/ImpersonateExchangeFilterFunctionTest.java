package com.example.k8sproxy.authz.filter;

import com.example.k8sproxy.authz.client.AccessReviewClient;
import com.example.k8sproxy.authz.exception.MalformedPathException;
import com.example.k8sproxy.authz.exception.ResourceAccessDeniedException;
import com.example.k8sproxy.authz.exception.UnsupportedMethodException;
import com.example.k8sproxy.authz.model.AuthorizationQuery;
import com.example.k8sproxy.authz.model.ResourceDescriptor;
import com.example.k8sproxy.authz.model.Verb;
import com.example.k8sproxy.authz.resolver.ResourcePathParser;
import com.example.k8sproxy.authz.resolver.VerbMapper;
import com.example.k8sproxy.authz.service.AuthorizationGate;
import com.example.k8sproxy.exception.AccessReviewException;
import com.example.k8sproxy.observability.metrics.AuthzMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ImpersonateExchangeFilterFunction")
class ImpersonateExchangeFilterFunctionTest {

    private static final String API_SERVER = "https://kubernetes.test";

    @Mock
    private AccessReviewClient accessReviewClient;

    private ImpersonateExchangeFilterFunction filter;

    private final AtomicReference<ClientRequest> forwarded = new AtomicReference<>();
    private final ExchangeFunction next = request -> {
        forwarded.set(request);
        return Mono.just(ClientResponse.create(HttpStatus.OK).build());
    };

    @BeforeEach
    void setUp() {
        AuthorizationGate gate = new AuthorizationGate(
                accessReviewClient, null, new AuthzMetrics(new SimpleMeterRegistry()));
        filter = new ImpersonateExchangeFilterFunction("alice", new ResourcePathParser(), new VerbMapper(), gate);
    }

    private static ClientRequest request(HttpMethod method, String pathAndQuery) {
        return ClientRequest.create(method, URI.create(API_SERVER + pathAndQuery)).build();
    }

    @Nested
    @DisplayName("when access is allowed")
    class Allowed {

        @Test
        @DisplayName("should forward the unchanged request")
        void shouldForwardUnchangedRequest() {
            when(accessReviewClient.checkAccess(any())).thenReturn(Mono.just(true));
            ClientRequest request = request(HttpMethod.GET, "/api/v1/namespaces/ns1/pods?labelSelector=app%3Dweb");

            StepVerifier.create(filter.filter(request, next))
                    .assertNext(response -> assertThat(response.statusCode()).isEqualTo(HttpStatus.OK))
                    .verifyComplete();

            assertThat(forwarded.get()).isSameAs(request);
        }

        @Test
        @DisplayName("should review the user, verb and resource derived from the request")
        void shouldReviewDerivedQuery() {
            when(accessReviewClient.checkAccess(any())).thenReturn(Mono.just(true));

            StepVerifier.create(filter.filter(
                            request(HttpMethod.PATCH, "/apis/apps/v1/namespaces/ns1/deployments/dep1/scale"), next))
                    .expectNextCount(1)
                    .verifyComplete();

            ArgumentCaptor<AuthorizationQuery> captor = ArgumentCaptor.forClass(AuthorizationQuery.class);
            verify(accessReviewClient).checkAccess(captor.capture());
            assertThat(captor.getValue()).isEqualTo(new AuthorizationQuery("alice", Verb.PATCH,
                    new ResourceDescriptor("ns1", "apps", "v1", "deployments", "dep1", "scale")));
        }
    }

    @Nested
    @DisplayName("when the request is blocked")
    class Blocked {

        @Test
        @DisplayName("should not forward a denied request")
        void shouldNotForwardDeniedRequest() {
            when(accessReviewClient.checkAccess(any())).thenReturn(Mono.just(false));

            StepVerifier.create(filter.filter(
                            request(HttpMethod.DELETE, "/apis/apps/v1/namespaces/ns1/deployments/dep1"), next))
                    .expectErrorMessage(
                            "user 'alice' is not allowed to 'delete' apps/v1/deployments/dep1 in namespace 'ns1'")
                    .verify();

            assertThat(forwarded.get()).isNull();
        }

        @Test
        @DisplayName("should not forward or review a malformed path")
        void shouldRejectMalformedPath() {
            StepVerifier.create(filter.filter(request(HttpMethod.GET, "/api/v1/pods/"), next))
                    .expectError(MalformedPathException.class)
                    .verify();

            assertThat(forwarded.get()).isNull();
            verifyNoInteractions(accessReviewClient);
        }

        @Test
        @DisplayName("should not forward or review an unsupported method")
        void shouldRejectUnsupportedMethod() {
            StepVerifier.create(filter.filter(request(HttpMethod.OPTIONS, "/api/v1/namespaces/ns1/pods"), next))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(UnsupportedMethodException.class);
                        assertThat(((UnsupportedMethodException) error).getRequestTarget())
                                .isEqualTo(API_SERVER + "/api/v1/namespaces/ns1/pods");
                    })
                    .verify();

            assertThat(forwarded.get()).isNull();
            verifyNoInteractions(accessReviewClient);
        }

        @Test
        @DisplayName("should not forward when the review fails")
        void shouldNotForwardWhenReviewFails() {
            AccessReviewException failure = new AccessReviewException(
                    HttpStatus.SERVICE_UNAVAILABLE, "");
            when(accessReviewClient.checkAccess(any())).thenReturn(Mono.error(failure));

            StepVerifier.create(filter.filter(request(HttpMethod.GET, "/api/v1/namespaces/ns1/pods/p1"), next))
                    .expectErrorSatisfies(error -> assertThat(error).isSameAs(failure))
                    .verify();

            assertThat(forwarded.get()).isNull();
        }

        @Test
        @DisplayName("should treat empty review answer as denial")
        void shouldTreatEmptyAnswerAsDenial() {
            when(accessReviewClient.checkAccess(any())).thenReturn(Mono.empty());

            StepVerifier.create(filter.filter(request(HttpMethod.GET, "/api/v1/nodes"), next))
                    .expectError(ResourceAccessDeniedException.class)
                    .verify();

            assertThat(forwarded.get()).isNull();
        }
    }
}
