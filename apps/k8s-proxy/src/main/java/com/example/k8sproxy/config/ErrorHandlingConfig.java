package com.example.k8sproxy.config;

import com.example.k8sproxy.config.properties.ProxyProperties;
import com.example.k8sproxy.exception.DefaultErrorStatusPolicy;
import com.example.k8sproxy.exception.ErrorStatusPolicy;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ErrorHandlingConfig {

    @Bean
    @ConditionalOnMissingBean(ErrorStatusPolicy.class)
    public ErrorStatusPolicy errorStatusPolicy(ProxyProperties properties) {
        return new DefaultErrorStatusPolicy(properties.impersonation().accessDeniedStatus());
    }
}
