package com.example.k8sproxy.observability.filter;

import com.example.k8sproxy.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.List;
import java.util.UUID;

/**
 * Assigns every request a correlation ID.
 *
 * <p>An inbound X-Correlation-Id or X-Request-Id is reused when it is a short printable token,
 * otherwise a random UUID is generated. The ID is echoed on the response, kept in the MDC and
 * published in the Reactor context, from where authorization auditing and the forwarded API
 * server call ({@code Audit-ID}) pick it up.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_KEY = "correlationId";

    private static final List<String> INBOUND_HEADERS = List.of(CORRELATION_ID_HEADER, "X-Request-Id");
    private static final int MAX_ID_LENGTH = 128;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String correlationId = resolveCorrelationId(request.getHeaders());
        String method = request.getMethod().name();
        String path = StringSanitizer.forLog(request.getPath().value(), 256);

        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        return chain.filter(exchange)
                .contextWrite(Context.of(CORRELATION_ID_KEY, correlationId))
                .doFirst(() -> {
                    MDC.put(CORRELATION_ID_KEY, correlationId);
                    log.debug("{} {} started", method, path);
                })
                .doFinally(signal -> {
                    log.debug("{} {} finished: status={}, signal={}",
                            method, path, exchange.getResponse().getStatusCode(), signal);
                    MDC.remove(CORRELATION_ID_KEY);
                });
    }

    static String resolveCorrelationId(HttpHeaders headers) {
        return INBOUND_HEADERS.stream()
                .map(headers::getFirst)
                .filter(CorrelationIdFilter::isUsable)
                .map(String::trim)
                .findFirst()
                .orElseGet(() -> UUID.randomUUID().toString());
    }

    private static boolean isUsable(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        String trimmed = value.trim();
        return trimmed.length() <= MAX_ID_LENGTH && !StringSanitizer.containsControlCharacters(trimmed);
    }
}
