package com.example.k8sproxy.authz.exception;

import com.example.k8sproxy.authz.model.Verb;
import lombok.Getter;

/**
 * The authorization oracle explicitly refused the request.
 */
@Getter
public class ResourceAccessDeniedException extends ImpersonationException {

    private final String identity;
    private final Verb verb;
    private final String resourceLabel;
    private final String namespace;

    public ResourceAccessDeniedException(String identity, Verb verb, String resourceLabel, String namespace) {
        super(String.format("user '%s' is not allowed to '%s' %s in namespace '%s'",
                identity, verb.value(), resourceLabel, namespace));
        this.identity = identity;
        this.verb = verb;
        this.resourceLabel = resourceLabel;
        this.namespace = namespace;
    }
}
