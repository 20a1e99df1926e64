/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.cache;

import java.util.Map;

import io.kroxylicious.routeplane.xds.ClusterLoadAssignment;
import io.kroxylicious.routeplane.xds.TypeUrls;

/**
 * The current cluster load assignments.
 */
public final class EndpointsCache extends SnapshotCache<ClusterLoadAssignment> {

    public EndpointsCache() {
        this(Map.of());
    }

    public EndpointsCache(Map<String, ClusterLoadAssignment> staticValues) {
        super(TypeUrls.ENDPOINT, staticValues);
    }
}
