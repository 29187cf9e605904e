package com.example.k8sproxy.authz.model;

/**
 * Question put to the authorization oracle: may {@code identity} perform {@code verb} on {@code resource}?
 */
public record AuthorizationQuery(
        String identity,
        Verb verb,
        ResourceDescriptor resource
) {
}
