package com.example.k8sproxy.client;

import com.example.k8sproxy.config.properties.ProxyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Bearer token the proxy presents to the API server.
 *
 * <p>A configured static token wins. Otherwise the token file is read on every call, so that
 * projected service account tokens rotated by the kubelet are picked up. A missing file means
 * no token (e.g. a local API server without authentication).
 */
@Slf4j
@Component
public class ServiceAccountTokenProvider {

    private final String staticToken;
    private final Path tokenFile;

    public ServiceAccountTokenProvider(ProxyProperties properties) {
        this.staticToken = properties.apiServer().token();
        this.tokenFile = Path.of(properties.apiServer().tokenFile());
    }

    public Optional<String> currentToken() {
        if (staticToken != null && !staticToken.isBlank()) {
            return Optional.of(staticToken.trim());
        }
        if (!Files.isRegularFile(tokenFile)) {
            log.debug("No service account token at {}", tokenFile);
            return Optional.empty();
        }
        try {
            String token = Files.readString(tokenFile).trim();
            return token.isEmpty() ? Optional.empty() : Optional.of(token);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read service account token from " + tokenFile, e);
        }
    }

    /**
     * Sets {@code Authorization: Bearer <token>} on outgoing requests, replacing any inbound value.
     */
    public ExchangeFilterFunction bearerTokenFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(request -> Mono.fromCallable(this::currentToken)
                .subscribeOn(Schedulers.boundedElastic())
                .map(token -> token
                        .map(value -> ClientRequest.from(request)
                                .headers(headers -> headers.setBearerAuth(value))
                                .build())
                        .orElse(request)));
    }
}
