package com.example.k8sproxy.authz.model;

import org.springframework.lang.NonNull;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Kubernetes resource addressed by an API server URL path.
 *
 * <p>Absent parts are empty strings, never {@code null}. {@code version} and
 * {@code resourceType} are always present on descriptors produced by
 * {@link com.example.k8sproxy.authz.resolver.ResourcePathParser}.
 *
 * @param namespace    namespace, empty for cluster-scoped resources
 * @param group        API group, empty for the core ("/api") group
 * @param version      API version, e.g. {@code v1}
 * @param resourceType plural resource type, e.g. {@code pods}
 * @param resourceName name of a single resource, empty for collections
 * @param subresource  subresource, e.g. {@code status}
 */
public record ResourceDescriptor(
        String namespace,
        String group,
        String version,
        String resourceType,
        String resourceName,
        String subresource
) {
    public ResourceDescriptor {
        namespace = Objects.requireNonNullElse(namespace, "");
        group = Objects.requireNonNullElse(group, "");
        version = Objects.requireNonNullElse(version, "");
        resourceType = Objects.requireNonNullElse(resourceType, "");
        resourceName = Objects.requireNonNullElse(resourceName, "");
        subresource = Objects.requireNonNullElse(subresource, "");
    }

    public boolean isNamespaced() {
        return !namespace.isEmpty();
    }

    /**
     * Human-readable rendering used in denial messages:
     * {@code group/version/resourceType/resourceName/subresource}, empty parts skipped.
     */
    @NonNull
    public String label() {
        StringJoiner joiner = new StringJoiner("/");
        for (String part : new String[]{group, version, resourceType, resourceName, subresource}) {
            if (!part.isEmpty()) {
                joiner.add(part);
            }
        }
        return joiner.toString();
    }
}
