/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import edu.umd.cs.findbugs.annotations.Nullable;

public enum LoadBalancerPolicy {
    ROUND_ROBIN,
    LEAST_REQUEST,
    RANDOM,
    RING_HASH;

    /**
     * Maps a requested strategy to a policy. Unknown or absent strategies get round robin.
     */
    public static LoadBalancerPolicy of(@Nullable String strategy) {
        if (strategy == null) {
            return ROUND_ROBIN;
        }
        return switch (strategy) {
            case "WeightedLeastRequest" -> LEAST_REQUEST;
            case "Random" -> RANDOM;
            case "Cookie", "RequestHash" -> RING_HASH;
            default -> ROUND_ROBIN;
        };
    }
}
