/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.Comparator;
import java.util.List;

/**
 * Traffic split across clusters.
 *
 * @param clusters the clusters, sorted by name then weight
 * @param totalWeight the sum of the weights
 */
public record WeightedClusters(List<ClusterWeight> clusters, int totalWeight) {

    public static final Comparator<ClusterWeight> BY_NAME_THEN_WEIGHT = Comparator.comparing(ClusterWeight::name)
            .thenComparingInt(ClusterWeight::weight);

    public WeightedClusters {
        clusters = clusters.stream().sorted(BY_NAME_THEN_WEIGHT).toList();
    }
}
