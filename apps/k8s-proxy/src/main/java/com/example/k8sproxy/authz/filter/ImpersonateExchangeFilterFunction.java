package com.example.k8sproxy.authz.filter;

import com.example.k8sproxy.authz.model.ResourceDescriptor;
import com.example.k8sproxy.authz.model.Verb;
import com.example.k8sproxy.authz.resolver.ResourcePathParser;
import com.example.k8sproxy.authz.resolver.VerbMapper;
import com.example.k8sproxy.authz.service.AuthorizationGate;
import com.example.k8sproxy.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Objects;

/**
 * WebClient filter that performs a SubjectAccessReview for every Kubernetes API call made on
 * behalf of {@code username}.
 *
 * <p>The request is passed to the next exchange function unchanged, and only after the
 * {@link AuthorizationGate} allowed it. Unparseable paths, unmapped methods, denials and oracle
 * failures are emitted as errors and nothing is sent to the API server.
 */
@Slf4j
public class ImpersonateExchangeFilterFunction implements ExchangeFilterFunction {

    private final String username;
    private final ResourcePathParser pathParser;
    private final VerbMapper verbMapper;
    private final AuthorizationGate authorizationGate;

    public ImpersonateExchangeFilterFunction(
            @NonNull String username,
            @NonNull ResourcePathParser pathParser,
            @NonNull VerbMapper verbMapper,
            @NonNull AuthorizationGate authorizationGate) {
        this.username = Objects.requireNonNull(username, "username");
        this.pathParser = pathParser;
        this.verbMapper = verbMapper;
        this.authorizationGate = authorizationGate;
    }

    @Override
    @NonNull
    public Mono<ClientResponse> filter(@NonNull ClientRequest request, @NonNull ExchangeFunction next) {
        return Mono.defer(() -> {
            URI url = request.url();
            String path = Objects.requireNonNullElse(url.getPath(), "");
            log.debug("ImpersonateExchangeFilter - method={}, path={}, query={}",
                    request.method(),
                    StringSanitizer.forLog(path, 256),
                    StringSanitizer.forLog(url.getRawQuery(), 256));

            ResourceDescriptor resource = pathParser.parse(path);
            Verb verb = verbMapper.map(request.method().name(), url.toString());

            return authorizationGate.authorize(username, resource, verb)
                    .then(Mono.defer(() -> next.exchange(request)));
        });
    }
}
