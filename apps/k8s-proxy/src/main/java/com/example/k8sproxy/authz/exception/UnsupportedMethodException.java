package com.example.k8sproxy.authz.exception;

import lombok.Getter;

@Getter
public class UnsupportedMethodException extends ImpersonationException {

    private final String method;
    private final String requestTarget;

    public UnsupportedMethodException(String method, String requestTarget) {
        super(String.format("Could not calculate kubernetes resource verb for %s on %s", method, requestTarget));
        this.method = method;
        this.requestTarget = requestTarget;
    }
}
