package com.example.k8sproxy.security.filter;

import com.example.k8sproxy.security.context.ImpersonationContextHolder;
import com.example.k8sproxy.security.exception.AuthenticationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ImpersonatedUserFilter")
class ImpersonatedUserFilterTest {

    private static final String HEADER = "X-Forwarded-User";

    private final ImpersonatedUserFilter filter = new ImpersonatedUserFilter(HEADER);

    @Nested
    @DisplayName("when the identity header is valid")
    class ValidHeader {

        @Test
        @DisplayName("should publish the trimmed user in the reactive context")
        void shouldPublishUser() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.get("/api/v1/pods").header(HEADER, "  alice@example.com ").build());

            AtomicReference<String> seenUser = new AtomicReference<>();
            WebFilterChain chain = ex -> ImpersonationContextHolder.getImpersonatedUser()
                    .doOnNext(seenUser::set)
                    .then();

            StepVerifier.create(filter.filter(exchange, chain))
                    .verifyComplete();

            assertThat(seenUser.get()).isEqualTo("alice@example.com");
        }
    }

    @Nested
    @DisplayName("when the identity header is unusable")
    class InvalidHeader {

        @Test
        @DisplayName("should reject a missing header without calling the chain")
        void shouldRejectMissingHeader() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.get("/api/v1/pods").build());

            AtomicBoolean chainCalled = new AtomicBoolean(false);
            WebFilterChain chain = ex -> {
                chainCalled.set(true);
                return Mono.empty();
            };

            StepVerifier.create(filter.filter(exchange, chain))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(AuthenticationException.class)
                            .hasMessage("Missing required header: " + HEADER))
                    .verify();

            assertThat(chainCalled.get()).isFalse();
        }

        @Test
        @DisplayName("should reject a blank header")
        void shouldRejectBlankHeader() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.get("/api/v1/pods").header(HEADER, "   ").build());

            StepVerifier.create(filter.filter(exchange, ex -> Mono.empty()))
                    .expectError(AuthenticationException.class)
                    .verify();
        }

        @Test
        @DisplayName("should reject an overlong header")
        void shouldRejectOverlongHeader() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.get("/api/v1/pods").header(HEADER, "a".repeat(254)).build());

            StepVerifier.create(filter.filter(exchange, ex -> Mono.empty()))
                    .expectErrorMessage("Invalid value for header: " + HEADER)
                    .verify();
        }

        @Test
        @DisplayName("should reject control characters")
        void shouldRejectControlCharacters() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.get("/api/v1/pods").header(HEADER, "alice\u0000admin").build());

            StepVerifier.create(filter.filter(exchange, ex -> Mono.empty()))
                    .expectErrorMessage("Invalid value for header: " + HEADER)
                    .verify();
        }
    }

    @Test
    @DisplayName("context holder should fail without an impersonated user")
    void contextHolderShouldFailWithoutUser() {
        StepVerifier.create(ImpersonationContextHolder.getImpersonatedUser())
                .expectError(AuthenticationException.class)
                .verify();
    }
}
