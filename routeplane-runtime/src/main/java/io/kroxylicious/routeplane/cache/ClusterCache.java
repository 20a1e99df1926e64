/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.cache;

import java.util.Map;

import io.kroxylicious.routeplane.xds.UpstreamCluster;
import io.kroxylicious.routeplane.xds.TypeUrls;

/**
 * The current clusters.
 */
public final class ClusterCache extends SnapshotCache<UpstreamCluster> {

    public ClusterCache() {
        this(Map.of());
    }

    public ClusterCache(Map<String, UpstreamCluster> staticValues) {
        super(TypeUrls.CLUSTER, staticValues);
    }
}
