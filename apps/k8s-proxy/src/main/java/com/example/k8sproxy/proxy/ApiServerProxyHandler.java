package com.example.k8sproxy.proxy;

import com.example.k8sproxy.authz.exception.MalformedPathException;
import com.example.k8sproxy.client.ApiServerClientFactory;
import com.example.k8sproxy.common.util.StringSanitizer;
import com.example.k8sproxy.config.properties.ProxyProperties;
import com.example.k8sproxy.observability.filter.CorrelationIdFilter;
import com.example.k8sproxy.security.context.ImpersonationContextHolder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Locale;
import java.util.Set;

/**
 * Forwards Kubernetes API requests to the API server as the impersonated user.
 *
 * <p>Every call goes through {@link ApiServerClientFactory#forUser(String)}, so nothing reaches
 * the API server before a SubjectAccessReview allowed it. Status, headers and body of the API
 * server's answer are relayed as received, error statuses included.
 */
@Slf4j
@Component
public class ApiServerProxyHandler {

    static final String IMPERSONATE_USER_HEADER = "Impersonate-User";
    static final String AUDIT_ID_HEADER = "Audit-ID";
    private static final String IMPERSONATE_HEADER_PREFIX = "impersonate-";

    // RFC 7230 hop-by-hop headers, plus headers the outbound connection sets itself
    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "proxy-connection",
            "te",
            "trailer",
            "transfer-encoding",
            "upgrade",
            "host",
            "content-length"
    );

    private final ApiServerClientFactory clientFactory;
    private final String apiServerUrl;
    private final String identityHeader;
    private final boolean forwardImpersonateHeader;

    public ApiServerProxyHandler(ApiServerClientFactory clientFactory, ProxyProperties properties) {
        this.clientFactory = clientFactory;
        this.apiServerUrl = stripTrailingSlash(properties.apiServer().url());
        this.identityHeader = properties.impersonation().identityHeader().toLowerCase(Locale.ROOT);
        this.forwardImpersonateHeader = properties.impersonation().forwardImpersonateHeader();
    }

    @NonNull
    public Mono<ServerResponse> forward(@NonNull ServerRequest request) {
        return Mono.deferContextual(ctx -> {
                    String correlationId = ctx.getOrDefault(CorrelationIdFilter.CORRELATION_ID_KEY, null);
                    return ImpersonationContextHolder.getImpersonatedUser()
                            .flatMap(username -> exchange(username, correlationId, request));
                })
                .flatMap(this::toServerResponse);
    }

    private Mono<ResponseEntity<byte[]>> exchange(
            String username, @Nullable String correlationId, ServerRequest request) {
        rejectDotSegments(request.uri());
        URI target = targetUri(request.uri());
        log.debug("Forwarding {} {} for user={}",
                request.method(), StringSanitizer.forLog(target.getRawPath(), 256), StringSanitizer.forLog(username));

        WebClient client = clientFactory.forUser(username);
        WebClient.RequestBodySpec spec = client.method(request.method())
                .uri(target)
                .headers(headers -> {
                    copyRequestHeaders(request.headers().asHttpHeaders(), headers);
                    if (forwardImpersonateHeader) {
                        headers.set(IMPERSONATE_USER_HEADER, username);
                    }
                    // API server audit events carry the same ID as the proxy's logs
                    if (correlationId != null) {
                        headers.set(AUDIT_ID_HEADER, correlationId);
                    }
                });

        WebClient.RequestHeadersSpec<?> ready = hasBody(request)
                ? spec.body(BodyInserters.fromDataBuffers(request.bodyToFlux(DataBuffer.class)))
                : spec;

        return ready.exchangeToMono(response -> response.toEntity(byte[].class));
    }

    private Mono<ServerResponse> toServerResponse(ResponseEntity<byte[]> upstream) {
        ServerResponse.BodyBuilder builder = ServerResponse.status(upstream.getStatusCode())
                .headers(headers -> upstream.getHeaders().forEach((name, values) -> {
                    if (!HOP_BY_HOP_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                        headers.addAll(name, values);
                    }
                }));

        byte[] body = upstream.getBody();
        return body != null && body.length > 0 ? builder.bodyValue(body) : builder.build();
    }

    // The authorized path must be the path the API server resolves
    static void rejectDotSegments(URI inbound) {
        if (!inbound.normalize().equals(inbound) || hasDotSegment(inbound.getPath())) {
            throw new MalformedPathException(inbound.getRawPath());
        }
    }

    private static boolean hasDotSegment(@Nullable String path) {
        if (path == null) {
            return false;
        }
        for (String segment : path.split("/")) {
            if (".".equals(segment) || "..".equals(segment)) {
                return true;
            }
        }
        return false;
    }

    URI targetUri(URI inbound) {
        StringBuilder target = new StringBuilder(apiServerUrl).append(inbound.getRawPath());
        if (inbound.getRawQuery() != null) {
            target.append('?').append(inbound.getRawQuery());
        }
        return URI.create(target.toString());
    }

    void copyRequestHeaders(HttpHeaders inbound, HttpHeaders outbound) {
        inbound.forEach((name, values) -> {
            if (isForwardable(name)) {
                outbound.addAll(name, values);
            }
        });
    }

    private boolean isForwardable(String headerName) {
        String name = headerName.toLowerCase(Locale.ROOT);
        return !HOP_BY_HOP_HEADERS.contains(name)
                && !HttpHeaders.AUTHORIZATION.equalsIgnoreCase(name)
                && !identityHeader.equals(name)
                && !name.startsWith(IMPERSONATE_HEADER_PREFIX);
    }

    private static boolean hasBody(ServerRequest request) {
        HttpHeaders headers = request.headers().asHttpHeaders();
        return headers.getContentLength() > 0 || headers.containsKey(HttpHeaders.TRANSFER_ENCODING);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
