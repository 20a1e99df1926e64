/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A weighted upstream of a route or TCP proxy.
 *
 * @param upstream the backend service port
 * @param weight relative weight, {@code 0} when unspecified
 * @param loadBalancerPolicy load balancing strategy, {@code null} for round robin
 * @param healthCheckPolicy active health checking, {@code null} for none
 * @param upstreamValidation verification of the backend's certificate, only set for TLS backends
 * @param protocol upstream protocol, as {@link Service#protocol()}
 * @param idleTimeout upstream connection idle timeout, {@code null} for the default
 */
public record Cluster(Service upstream,
                      int weight,
                      @Nullable String loadBalancerPolicy,
                      @Nullable HealthCheckPolicy healthCheckPolicy,
                      @Nullable PeerValidationContext upstreamValidation,
                      String protocol,
                      @Nullable Duration idleTimeout)
        implements Vertex {

    public Cluster {
        Objects.requireNonNull(upstream, "upstream cannot be null");
        Objects.requireNonNull(protocol, "protocol cannot be null");
    }

    @Override
    public VertexKind kind() {
        return VertexKind.CLUSTER;
    }

    @Override
    public void visitChildren(Consumer<Vertex> consumer) {
        consumer.accept(upstream);
        if (upstreamValidation != null) {
            consumer.accept(upstreamValidation.caCertificate());
        }
    }
}
