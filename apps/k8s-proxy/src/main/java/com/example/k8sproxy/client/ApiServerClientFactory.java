package com.example.k8sproxy.client;

import com.example.k8sproxy.authz.filter.ImpersonateExchangeFilterFunction;
import com.example.k8sproxy.authz.resolver.ResourcePathParser;
import com.example.k8sproxy.authz.resolver.VerbMapper;
import com.example.k8sproxy.authz.service.AuthorizationGate;
import com.example.k8sproxy.config.properties.ProxyProperties;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Builds API server clients whose every request is authorized for an impersonated user.
 */
@Component
public class ApiServerClientFactory {

    private final WebClient.Builder apiServerWebClientBuilder;
    private final ResourcePathParser pathParser;
    private final VerbMapper verbMapper;
    private final AuthorizationGate authorizationGate;

    public ApiServerClientFactory(
            WebClient.Builder webClientBuilder,
            HttpClient apiServerHttpClient,
            ServiceAccountTokenProvider tokenProvider,
            ProxyProperties properties,
            ResourcePathParser pathParser,
            VerbMapper verbMapper,
            AuthorizationGate authorizationGate) {
        this.pathParser = pathParser;
        this.verbMapper = verbMapper;
        this.authorizationGate = authorizationGate;

        // Response bodies are relayed whole; list responses can be large
        this.apiServerWebClientBuilder = webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(apiServerHttpClient))
                .baseUrl(properties.apiServer().url())
                .filter(tokenProvider.bearerTokenFilter())
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024));
    }

    /**
     * @param username impersonated user every request of the returned client is authorized for
     */
    @NonNull
    public WebClient forUser(@NonNull String username) {
        return apiServerWebClientBuilder.clone()
                .filter(new ImpersonateExchangeFilterFunction(username, pathParser, verbMapper, authorizationGate))
                .build();
    }
}
