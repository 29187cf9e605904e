package com.example.k8sproxy.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.proxy")
public record ProxyProperties(
        @Valid ApiServerProperties apiServer,
        ImpersonationProperties impersonation,
        AuditProperties audit
) {
    public static final String DEFAULT_TOKEN_FILE = "/var/run/secrets/kubernetes.io/serviceaccount/token";
    public static final String DEFAULT_IDENTITY_HEADER = "X-Forwarded-User";

    public ProxyProperties {
        if (apiServer == null) {
            apiServer = new ApiServerProperties(null, null, null, null, null, null);
        }
        if (impersonation == null) {
            impersonation = new ImpersonationProperties(null, null, false);
        }
        if (audit == null) {
            audit = new AuditProperties(true);
        }
    }

    /**
     * Connection to the Kubernetes API server, used both for forwarding and for SubjectAccessReviews.
     *
     * @param url            base URL, e.g. {@code https://kubernetes.default.svc}; required
     * @param token          static bearer token; takes precedence over {@code tokenFile}
     * @param tokenFile      file holding the proxy's own service account token, re-read per request
     * @param caCertFile     PEM bundle trusted for the API server's certificate, JDK trust store when unset
     * @param connectTimeout TCP connect timeout
     * @param timeout        response timeout for every call to the API server
     */
    public record ApiServerProperties(
            @NotBlank String url,
            String token,
            String tokenFile,
            String caCertFile,
            Duration connectTimeout,
            Duration timeout
    ) {
        public ApiServerProperties {
            if (tokenFile == null || tokenFile.isBlank()) {
                tokenFile = DEFAULT_TOKEN_FILE;
            }
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(5);
            }
            if (timeout == null) {
                timeout = Duration.ofSeconds(10);
            }
        }
    }

    /**
     * @param identityHeader         inbound header carrying the impersonated username, set by the upstream authenticator
     * @param accessDeniedStatus     status returned when a SubjectAccessReview denies the request (FORBIDDEN or NOT_FOUND)
     * @param forwardImpersonateHeader add {@code Impersonate-User} to forwarded requests
     */
    public record ImpersonationProperties(
            String identityHeader,
            HttpStatus accessDeniedStatus,
            boolean forwardImpersonateHeader
    ) {
        public ImpersonationProperties {
            if (identityHeader == null || identityHeader.isBlank()) {
                identityHeader = DEFAULT_IDENTITY_HEADER;
            }
            if (accessDeniedStatus == null) {
                accessDeniedStatus = HttpStatus.FORBIDDEN;
            }
        }
    }

    public record AuditProperties(
            boolean enabled
    ) {}
}
