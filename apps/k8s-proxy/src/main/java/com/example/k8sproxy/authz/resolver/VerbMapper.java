package com.example.k8sproxy.authz.resolver;

import com.example.k8sproxy.authz.exception.UnsupportedMethodException;
import com.example.k8sproxy.authz.model.Verb;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Maps an HTTP method to the Kubernetes verb checked for it.
 *
 * <p>GET and DELETE always map to the singular verbs. Collection reads ({@code list}),
 * {@code ?watch=1} streams and collection deletes ({@code deletecollection}) are not
 * distinguished, so those requests are checked against {@code get} / {@code delete}.
 */
@Component
public class VerbMapper {

    /**
     * @param method        HTTP method, an empty or {@code null} method is treated as GET
     * @param requestTarget full request target, reported when the method is not mapped
     */
    @NonNull
    public Verb map(@Nullable String method, @Nullable String requestTarget) {
        if (method == null) {
            return Verb.GET;
        }
        return switch (method) {
            case "", "GET" -> Verb.GET;
            case "POST" -> Verb.CREATE;
            case "PUT" -> Verb.UPDATE;
            case "PATCH" -> Verb.PATCH;
            case "DELETE" -> Verb.DELETE;
            default -> throw new UnsupportedMethodException(method, requestTarget);
        };
    }
}
