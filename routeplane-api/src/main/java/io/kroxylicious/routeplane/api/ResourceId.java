/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.Comparator;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Identifies a namespaced resource. Identity is stable across build passes, so it is the only
 * thing that links a resource in one pass to the same resource in the next.
 *
 * @param namespace namespace of the resource
 * @param name name of the resource
 */
public record ResourceId(@NonNull String namespace, @NonNull String name) implements Comparable<ResourceId> {

    private static final Comparator<ResourceId> COMPARATOR = Comparator.comparing(ResourceId::namespace)
            .thenComparing(ResourceId::name);

    public ResourceId {
        Objects.requireNonNull(namespace, "namespace cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
    }

    public static ResourceId of(String namespace, String name) {
        return new ResourceId(namespace, name);
    }

    /**
     * Parses a reference of the form {@code namespace/name}. A reference without a {@code /}
     * is resolved against the given default namespace.
     *
     * @param reference the reference
     * @param defaultNamespace namespace to use when the reference does not carry one
     * @return the resource id
     */
    public static ResourceId parse(String reference, String defaultNamespace) {
        Objects.requireNonNull(reference, "reference cannot be null");
        int slash = reference.indexOf('/');
        if (slash < 0) {
            return new ResourceId(defaultNamespace, reference);
        }
        return new ResourceId(reference.substring(0, slash), reference.substring(slash + 1));
    }

    @Override
    public int compareTo(ResourceId o) {
        return COMPARATOR.compare(this, o);
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
