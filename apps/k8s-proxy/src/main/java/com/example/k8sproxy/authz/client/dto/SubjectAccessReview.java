package com.example.k8sproxy.authz.client.dto;

import com.example.k8sproxy.authz.model.AuthorizationQuery;
import com.example.k8sproxy.authz.model.ResourceDescriptor;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * {@code authorization.k8s.io/v1} SubjectAccessReview, reduced to the fields this proxy sends and reads.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubjectAccessReview(
        String apiVersion,
        String kind,
        Spec spec,
        Status status
) {
    public static final String API_VERSION = "authorization.k8s.io/v1";
    public static final String KIND = "SubjectAccessReview";

    public static SubjectAccessReview forQuery(AuthorizationQuery query) {
        ResourceDescriptor resource = query.resource();
        ResourceAttributes attributes = new ResourceAttributes(
                resource.namespace(),
                query.verb().value(),
                resource.group(),
                resource.version(),
                resource.resourceType(),
                resource.resourceName(),
                resource.subresource()
        );
        return new SubjectAccessReview(API_VERSION, KIND, new Spec(query.identity(), attributes), null);
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Spec(
            String user,
            ResourceAttributes resourceAttributes
    ) {}

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResourceAttributes(
            String namespace,
            String verb,
            String group,
            String version,
            String resource,
            String name,
            String subresource
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Status(
            boolean allowed,
            boolean denied,
            String reason,
            String evaluationError
    ) {}
}
