/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.time.Duration;
import java.util.Objects;

import io.kroxylicious.routeplane.dag.Service;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A cluster whose members are discovered through the endpoint discovery service.
 *
 * @param name cluster name
 * @param altStatName name used for the cluster's statistics
 * @param edsServiceName the load assignment to fetch
 * @param connectTimeout upstream connect timeout
 * @param loadBalancerPolicy how requests are spread across members
 * @param healthCheck active health check, {@code null} for none
 * @param tlsContext TLS origination, {@code null} for plain text
 * @param http2 whether the upstream speaks HTTP/2
 * @param circuitBreakers thresholds, {@link Service.CircuitBreakers#NONE} for the proxy defaults
 * @param idleTimeout upstream connection idle timeout, {@code null} for the proxy default
 */
public record UpstreamCluster(String name,
                              String altStatName,
                              String edsServiceName,
                              Duration connectTimeout,
                              LoadBalancerPolicy loadBalancerPolicy,
                              @Nullable HealthCheck healthCheck,
                              @Nullable UpstreamTlsContext tlsContext,
                              boolean http2,
                              Service.CircuitBreakers circuitBreakers,
                              @Nullable Duration idleTimeout) {

    public UpstreamCluster {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(altStatName, "altStatName cannot be null");
        Objects.requireNonNull(edsServiceName, "edsServiceName cannot be null");
        Objects.requireNonNull(connectTimeout, "connectTimeout cannot be null");
        Objects.requireNonNull(loadBalancerPolicy, "loadBalancerPolicy cannot be null");
        Objects.requireNonNull(circuitBreakers, "circuitBreakers cannot be null");
    }
}
