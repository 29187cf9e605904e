package com.example.k8sproxy.security.exception;

// No usable impersonated identity on the inbound request.
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }
}
