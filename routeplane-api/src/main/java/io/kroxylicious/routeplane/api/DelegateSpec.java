/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A delegation edge: instead of naming backends, a route entry names another resource that
 * supplies the routes for its path prefix. The edge is owned by the referencing route.
 *
 * @param name name of the target resource
 * @param namespace namespace of the target resource, {@code null} for the namespace of the referrer
 */
public record DelegateSpec(String name, @Nullable String namespace) {

    public DelegateSpec {
        Objects.requireNonNull(name, "name cannot be null");
    }

    public ResourceId resolve(String referrerNamespace) {
        return new ResourceId(namespace == null || namespace.isEmpty() ? referrerNamespace : namespace, name);
    }
}
