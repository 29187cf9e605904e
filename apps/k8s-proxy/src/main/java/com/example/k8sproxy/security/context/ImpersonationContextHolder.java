package com.example.k8sproxy.security.context;

import com.example.k8sproxy.security.exception.AuthenticationException;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.function.Function;

/**
 * Carries the impersonated username in the Reactor context of an inbound request.
 */
public final class ImpersonationContextHolder {

    private static final String IMPERSONATED_USER_KEY = ImpersonationContextHolder.class.getName() + ".user";

    private ImpersonationContextHolder() {
        // Utility class
    }

    public static Mono<String> getImpersonatedUser() {
        return Mono.deferContextual(ctx -> {
            if (ctx.hasKey(IMPERSONATED_USER_KEY)) {
                return Mono.just(ctx.get(IMPERSONATED_USER_KEY));
            }
            return Mono.error(new AuthenticationException(
                    "No impersonated user found in reactive context"));
        });
    }

    public static Function<Context, Context> withImpersonatedUser(String username) {
        return context -> context.put(IMPERSONATED_USER_KEY, username);
    }
}
