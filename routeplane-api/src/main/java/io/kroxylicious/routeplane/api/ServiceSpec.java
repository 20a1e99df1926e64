/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.time.Duration;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A backend reference of a route.
 *
 * @param name name of the backend service, in the namespace of the referring resource
 * @param port service port number
 * @param weight relative weight, {@code 0} when unspecified
 * @param strategy load-balancing strategy, {@code null} for the default
 * @param healthCheck active HTTP health checking, {@code null} to disable
 * @param upstreamValidation validation of the backend's certificate, {@code null} to disable
 * @param idleTimeout upstream connection idle timeout, {@code null} for the default
 */
public record ServiceSpec(String name,
                          int port,
                          int weight,
                          @Nullable String strategy,
                          @Nullable HealthCheckSpec healthCheck,
                          @Nullable UpstreamValidationSpec upstreamValidation,
                          @Nullable Duration idleTimeout) {

    public ServiceSpec {
        Objects.requireNonNull(name, "name cannot be null");
    }

    public static ServiceSpec of(String name, int port) {
        return new ServiceSpec(name, port, 0, null, null, null, null);
    }

    public static ServiceSpec weighted(String name, int port, int weight) {
        return new ServiceSpec(name, port, weight, null, null, null, null);
    }
}
