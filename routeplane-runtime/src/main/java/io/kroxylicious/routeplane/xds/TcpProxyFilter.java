/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Forwards raw TCP to a single cluster or to weighted clusters.
 */
public record TcpProxyFilter(String statPrefix,
                             @Nullable String cluster,
                             @Nullable WeightedClusters weightedClusters,
                             List<AccessLog> accessLogs,
                             Duration idleTimeout)
        implements NetworkFilter {

    public static final String NAME = "envoy.tcp_proxy";

    public TcpProxyFilter {
        Objects.requireNonNull(statPrefix, "statPrefix cannot be null");
        if ((cluster == null) == (weightedClusters == null)) {
            throw new IllegalArgumentException("exactly one of cluster and weightedClusters must be set");
        }
        accessLogs = List.copyOf(accessLogs);
    }

    @Override
    public String name() {
        return NAME;
    }
}
