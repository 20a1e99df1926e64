/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.cache;

import java.util.List;
import java.util.Objects;

/**
 * The caches of every configuration type served to proxies.
 */
public record ConfigurationCaches(ListenerCache listeners,
                                  RouteCache routes,
                                  ClusterCache clusters,
                                  EndpointsCache endpoints,
                                  SecretCache secrets) {

    public ConfigurationCaches {
        Objects.requireNonNull(listeners, "listeners cannot be null");
        Objects.requireNonNull(routes, "routes cannot be null");
        Objects.requireNonNull(clusters, "clusters cannot be null");
        Objects.requireNonNull(endpoints, "endpoints cannot be null");
        Objects.requireNonNull(secrets, "secrets cannot be null");
    }

    public static ConfigurationCaches create() {
        return new ConfigurationCaches(new ListenerCache(), new RouteCache(), new ClusterCache(), new EndpointsCache(), new SecretCache());
    }

    public List<SnapshotCache<?>> all() {
        return List.of(listeners, routes, clusters, endpoints, secrets);
    }
}
