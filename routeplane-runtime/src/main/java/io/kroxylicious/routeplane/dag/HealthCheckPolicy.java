/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.time.Duration;

import io.kroxylicious.routeplane.api.HealthCheckSpec;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Active HTTP health checking of a cluster. Zero durations and thresholds mean the proxy default.
 */
public record HealthCheckPolicy(String path,
                                @Nullable String host,
                                Duration interval,
                                Duration timeout,
                                int unhealthyThreshold,
                                int healthyThreshold) {

    @Nullable
    static HealthCheckPolicy of(@Nullable HealthCheckSpec spec) {
        if (spec == null) {
            return null;
        }
        return new HealthCheckPolicy(spec.path(),
                spec.host(),
                Duration.ofSeconds(spec.intervalSeconds()),
                Duration.ofSeconds(spec.timeoutSeconds()),
                spec.unhealthyThresholdCount(),
                spec.healthyThresholdCount());
    }
}
