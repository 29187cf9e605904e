package com.example.k8sproxy;

import com.example.k8sproxy.config.properties.ProxyProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ProxyProperties.class)
public class K8sProxyApplication {

    public static void main(String[] args) {
        SpringApplication.run(K8sProxyApplication.class, args);
    }

}
