package com.example.k8sproxy.config;

import com.example.k8sproxy.client.ServiceAccountTokenProvider;
import com.example.k8sproxy.config.properties.ProxyProperties;
import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import javax.net.ssl.SSLException;
import java.io.File;
import java.time.Duration;

/**
 * WebClient configuration for the Kubernetes API server.
 *
 * <p>One pooled {@link HttpClient} is shared by the SubjectAccessReview client and by every
 * per-user forwarding client built by {@link com.example.k8sproxy.client.ApiServerClientFactory}.
 */
@Slf4j
@Configuration
public class ApiServerWebClientConfig {

    /**
     * Bean qualifier for the WebClient used for SubjectAccessReviews.
     */
    public static final String ACCESS_REVIEW_WEBCLIENT = "accessReviewWebClient";

    @Bean(destroyMethod = "dispose")
    public ConnectionProvider apiServerConnectionProvider() {
        return ConnectionProvider.builder("api-server-pool")
                .maxConnections(200)
                .pendingAcquireMaxCount(1000)
                .pendingAcquireTimeout(Duration.ofSeconds(10))
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public HttpClient apiServerHttpClient(
            ConnectionProvider apiServerConnectionProvider,
            ProxyProperties properties) {

        ProxyProperties.ApiServerProperties apiServer = properties.apiServer();

        HttpClient httpClient = HttpClient.create(apiServerConnectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) apiServer.connectTimeout().toMillis())
                .responseTimeout(apiServer.timeout())
                .keepAlive(true);

        if (apiServer.caCertFile() != null && !apiServer.caCertFile().isBlank()) {
            SslContext sslContext = buildSslContext(apiServer.caCertFile());
            httpClient = httpClient.secure(spec -> spec.sslContext(sslContext));
        }

        log.info("API server client configured for {}", apiServer.url());
        return httpClient;
    }

    @Bean(ACCESS_REVIEW_WEBCLIENT)
    public WebClient accessReviewWebClient(
            WebClient.Builder webClientBuilder,
            HttpClient apiServerHttpClient,
            ServiceAccountTokenProvider tokenProvider,
            ProxyProperties properties) {
        return webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(apiServerHttpClient))
                .baseUrl(properties.apiServer().url())
                .filter(tokenProvider.bearerTokenFilter())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    private static SslContext buildSslContext(String caCertFile) {
        try {
            return SslContextBuilder.forClient()
                    .trustManager(new File(caCertFile))
                    .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Failed to load API server CA bundle from " + caCertFile, e);
        }
    }
}
