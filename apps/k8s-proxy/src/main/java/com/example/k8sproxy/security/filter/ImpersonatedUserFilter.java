package com.example.k8sproxy.security.filter;

import com.example.k8sproxy.common.util.StringSanitizer;
import com.example.k8sproxy.security.context.ImpersonationContextHolder;
import com.example.k8sproxy.security.exception.AuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Reads the impersonated username from a header set by the upstream authenticator
 * (e.g. an OAuth2 proxy) and publishes it through {@link ImpersonationContextHolder}.
 *
 * <p>Registered inside the proxy security chain only, not as a global WebFilter.
 */
@Slf4j
public class ImpersonatedUserFilter implements WebFilter {

    // DNS subdomain length
    private static final int MAX_USERNAME_LENGTH = 253;

    private final String identityHeader;

    public ImpersonatedUserFilter(@NonNull String identityHeader) {
        this.identityHeader = identityHeader;
    }

    @Override
    @NonNull
    public Mono<Void> filter(@NonNull ServerWebExchange exchange, @NonNull WebFilterChain chain) {
        String username = exchange.getRequest().getHeaders().getFirst(identityHeader);

        if (username == null || username.isBlank()) {
            return Mono.error(new AuthenticationException("Missing required header: " + identityHeader));
        }

        String trimmed = username.trim();
        if (trimmed.length() > MAX_USERNAME_LENGTH || StringSanitizer.containsControlCharacters(trimmed)) {
            log.warn("Rejected malformed impersonated user header: {}", StringSanitizer.forLog(trimmed));
            return Mono.error(new AuthenticationException("Invalid value for header: " + identityHeader));
        }

        log.debug("Impersonating user={}", StringSanitizer.forLog(trimmed));
        return chain.filter(exchange)
                .contextWrite(ImpersonationContextHolder.withImpersonatedUser(trimmed));
    }
}
