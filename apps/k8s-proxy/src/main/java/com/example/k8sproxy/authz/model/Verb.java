package com.example.k8sproxy.authz.model;

/**
 * Kubernetes authorization verbs derivable from an HTTP method.
 *
 * <p>{@code list}, {@code watch} and {@code deletecollection} are not represented:
 * requests against collections are checked with the singular verb.
 */
public enum Verb {
    GET("get"),
    CREATE("create"),
    UPDATE("update"),
    PATCH("patch"),
    DELETE("delete");

    private final String value;

    Verb(String value) {
        this.value = value;
    }

    /**
     * Wire value sent in SubjectAccessReview resource attributes.
     */
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
