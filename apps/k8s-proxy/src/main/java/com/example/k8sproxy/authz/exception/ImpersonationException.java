package com.example.k8sproxy.authz.exception;

// Base for request-derived failures raised before or by the authorization check. Never retried.
public abstract class ImpersonationException extends RuntimeException {

    protected ImpersonationException(String message) {
        super(message);
    }
}
