/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.time.Duration;
import java.util.List;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Forwards to a single cluster or to weighted clusters.
 *
 * @param cluster the single cluster, {@code null} when weighted
 * @param weightedClusters the split, {@code null} for a single cluster
 * @param timeout response timeout, {@link Duration#ZERO} to disable, {@code null} for the proxy default
 * @param idleTimeout stream idle timeout, {@code null} for the proxy default
 * @param retryPolicy retries, {@code null} for none
 * @param prefixRewrite replacement for the matched prefix
 * @param hashPolicies consistent hashing inputs
 * @param upgradeConfigs enabled upgrades, such as {@code websocket}
 */
public record ForwardAction(@Nullable String cluster,
                            @Nullable WeightedClusters weightedClusters,
                            @Nullable Duration timeout,
                            @Nullable Duration idleTimeout,
                            @Nullable RetryPolicyEntry retryPolicy,
                            @Nullable String prefixRewrite,
                            List<HashPolicy> hashPolicies,
                            List<String> upgradeConfigs)
        implements Action {

    public ForwardAction {
        if ((cluster == null) == (weightedClusters == null)) {
            throw new IllegalArgumentException("exactly one of cluster and weightedClusters must be set");
        }
        hashPolicies = List.copyOf(hashPolicies);
        upgradeConfigs = List.copyOf(upgradeConfigs);
    }
}
