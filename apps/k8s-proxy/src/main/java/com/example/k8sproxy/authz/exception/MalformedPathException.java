package com.example.k8sproxy.authz.exception;

import lombok.Getter;

@Getter
public class MalformedPathException extends ImpersonationException {

    private final String path;

    public MalformedPathException(String path) {
        super("Invalid Kubernetes Resource URI path: " + path);
        this.path = path;
    }
}
