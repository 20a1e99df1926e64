/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

import io.kroxylicious.routeplane.api.HashPolicySpec;
import io.kroxylicious.routeplane.api.TracingSpec;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A route of a virtual host: requests matching the prefix and header conditions are sent to the clusters.
 */
public record Route(String prefix,
                    List<HeaderCondition> headerConditions,
                    List<Cluster> clusters,
                    boolean websocket,
                    boolean httpsUpgrade,
                    @Nullable String prefixRewrite,
                    @Nullable TimeoutPolicy timeoutPolicy,
                    @Nullable Duration idleTimeout,
                    @Nullable Duration timeout,
                    @Nullable RetryPolicy retryPolicy,
                    List<HashPolicySpec> hashPolicies,
                    @Nullable TracingSpec tracing,
                    @Nullable HeadersPolicy requestHeadersPolicy,
                    @Nullable HeadersPolicy responseHeadersPolicy)
        implements Vertex {

    /**
     * The conditions a route matches on. Within a virtual host, a route replaces any earlier route
     * with equal conditions.
     */
    public record Conditions(String prefix, List<HeaderCondition> headerConditions) {}

    public Route {
        Objects.requireNonNull(prefix, "prefix cannot be null");
        headerConditions = List.copyOf(headerConditions);
        clusters = List.copyOf(clusters);
        hashPolicies = List.copyOf(hashPolicies);
    }

    public Conditions conditions() {
        return new Conditions(prefix, headerConditions);
    }

    @Override
    public VertexKind kind() {
        return VertexKind.ROUTE;
    }

    @Override
    public void visitChildren(Consumer<Vertex> consumer) {
        clusters.forEach(consumer);
    }
}
