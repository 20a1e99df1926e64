/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.util.Objects;
import java.util.function.Consumer;

import io.kroxylicious.routeplane.api.ResourceId;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A port of a backend service.
 *
 * @param id the backend service
 * @param port port number
 * @param portName port name, {@code null} if the port is unnamed
 * @param protocol upstream protocol: empty for HTTP/1.1, or one of {@code h2}, {@code h2c}, {@code tls}
 * @param circuitBreakers circuit breaker thresholds
 */
public record Service(ResourceId id,
                      int port,
                      @Nullable String portName,
                      String protocol,
                      CircuitBreakers circuitBreakers)
        implements Vertex {

    public Service {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(protocol, "protocol cannot be null");
        Objects.requireNonNull(circuitBreakers, "circuitBreakers cannot be null");
    }

    /**
     * @return {@code namespace/name/portName}, or {@code namespace/name} for an unnamed port
     */
    public String serviceName() {
        return portName == null || portName.isEmpty() ? id.toString() : id + "/" + portName;
    }

    @Override
    public VertexKind kind() {
        return VertexKind.SERVICE;
    }

    @Override
    public void visitChildren(Consumer<Vertex> consumer) {
        // leaf
    }

    /**
     * Circuit breaker thresholds, {@code 0} meaning the proxy default.
     */
    public record CircuitBreakers(int maxConnections, int maxPendingRequests, int maxRequests, int maxRetries) {

        public static final CircuitBreakers NONE = new CircuitBreakers(0, 0, 0, 0);

        public boolean isDefault() {
            return equals(NONE);
        }
    }
}
