package com.example.k8sproxy.authz.resolver;

import com.example.k8sproxy.authz.exception.MalformedPathException;
import com.example.k8sproxy.authz.model.ResourceDescriptor;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Derives a {@link ResourceDescriptor} from a Kubernetes API server URL path.
 *
 * <p>Accepted forms:
 * <pre>
 * /api/{version}[/namespaces/{namespace}]/{resourceType}[/{resourceName}][/{subresource}]
 * /apis/{group}/{version}[/namespaces/{namespace}]/{resourceType}[/{resourceName}][/{subresource}]
 * </pre>
 *
 * <p>The path is consumed segment by segment. After the version, a {@code namespaces/{ns}}
 * pair is treated as a namespace scope only when at least one segment follows it and no more
 * than three do; otherwise {@code namespaces} is the resource type itself
 * (e.g. {@code /api/v1/namespaces/ns1} addresses the namespace object {@code ns1}).
 *
 * <p>Stateless and safe for concurrent use.
 */
@Component
public class ResourcePathParser {

    private static final String CORE_PREFIX = "api";
    private static final String GROUPED_PREFIX = "apis";
    private static final String NAMESPACES = "namespaces";
    private static final int MAX_RESOURCE_SEGMENTS = 3;

    private enum State {
        PREFIX,
        GROUP,
        VERSION,
        SCOPE,
        RESOURCE,
        DONE
    }

    @NonNull
    public ResourceDescriptor parse(@Nullable String path) {
        if (path == null || !path.startsWith("/")) {
            throw new MalformedPathException(String.valueOf(path));
        }

        String[] segments = path.substring(1).split("/", -1);
        for (String segment : segments) {
            if (segment.isEmpty() || segment.indexOf('\n') >= 0) {
                throw new MalformedPathException(path);
            }
        }

        String group = "";
        String version = "";
        String namespace = "";
        String[] resource = new String[MAX_RESOURCE_SEGMENTS];

        int pos = 0;
        State state = State.PREFIX;
        while (state != State.DONE) {
            switch (state) {
                case PREFIX -> {
                    String prefix = segments[pos++];
                    if (CORE_PREFIX.equals(prefix)) {
                        state = State.VERSION;
                    } else if (GROUPED_PREFIX.equals(prefix)) {
                        state = State.GROUP;
                    } else {
                        throw new MalformedPathException(path);
                    }
                }
                case GROUP -> {
                    requireSegment(segments, pos, path);
                    group = segments[pos++];
                    state = State.VERSION;
                }
                case VERSION -> {
                    requireSegment(segments, pos, path);
                    version = segments[pos++];
                    state = State.SCOPE;
                }
                case SCOPE -> {
                    int remaining = segments.length - pos;
                    if (remaining >= 3
                            && remaining - 2 <= MAX_RESOURCE_SEGMENTS
                            && NAMESPACES.equals(segments[pos])) {
                        namespace = segments[pos + 1];
                        pos += 2;
                    }
                    state = State.RESOURCE;
                }
                case RESOURCE -> {
                    int remaining = segments.length - pos;
                    if (remaining < 1 || remaining > MAX_RESOURCE_SEGMENTS) {
                        throw new MalformedPathException(path);
                    }
                    for (int i = 0; i < remaining; i++) {
                        resource[i] = segments[pos + i];
                    }
                    state = State.DONE;
                }
                default -> throw new IllegalStateException("Unexpected parser state: " + state);
            }
        }

        return new ResourceDescriptor(namespace, group, version, resource[0], resource[1], resource[2]);
    }

    private static void requireSegment(String[] segments, int pos, String path) {
        if (pos >= segments.length) {
            throw new MalformedPathException(path);
        }
    }
}
