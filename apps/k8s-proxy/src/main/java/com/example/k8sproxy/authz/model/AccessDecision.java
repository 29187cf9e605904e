package com.example.k8sproxy.authz.model;

/**
 * Oracle answer for a single query, with the resource label used in denial messages.
 */
public record AccessDecision(
        boolean allowed,
        String resourceLabel
) {
    public static AccessDecision of(boolean allowed, ResourceDescriptor resource) {
        return new AccessDecision(allowed, resource.label());
    }
}
