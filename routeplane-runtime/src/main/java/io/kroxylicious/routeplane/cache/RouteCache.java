/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.cache;

import java.util.Map;

import io.kroxylicious.routeplane.xds.RouteConfiguration;
import io.kroxylicious.routeplane.xds.TypeUrls;

/**
 * The current route configurations.
 */
public final class RouteCache extends SnapshotCache<RouteConfiguration> {

    public RouteCache() {
        this(Map.of());
    }

    public RouteCache(Map<String, RouteConfiguration> staticValues) {
        super(TypeUrls.ROUTE, staticValues);
    }
}
