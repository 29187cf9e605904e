package com.example.k8sproxy.proxy;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.ServerResponse;

import static org.springframework.web.reactive.function.server.RequestPredicates.path;
import static org.springframework.web.reactive.function.server.RouterFunctions.route;

@Configuration
public class ProxyRouterConfig {

    @Bean
    public RouterFunction<ServerResponse> apiServerProxyRoutes(ApiServerProxyHandler handler) {
        return route(path("/api/**").or(path("/apis/**")), handler::forward);
    }
}
