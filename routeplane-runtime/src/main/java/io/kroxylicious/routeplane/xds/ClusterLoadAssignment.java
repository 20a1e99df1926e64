/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.List;
import java.util.Objects;

/**
 * The members of a service port.
 *
 * @param clusterName the EDS service name, {@code namespace/name[/portName]}
 * @param endpoints the members, sorted by address then port
 */
public record ClusterLoadAssignment(String clusterName, List<LbEndpoint> endpoints) {

    public ClusterLoadAssignment {
        Objects.requireNonNull(clusterName, "clusterName cannot be null");
        endpoints = List.copyOf(endpoints);
    }

    public static ClusterLoadAssignment empty(String clusterName) {
        return new ClusterLoadAssignment(clusterName, List.of());
    }
}
