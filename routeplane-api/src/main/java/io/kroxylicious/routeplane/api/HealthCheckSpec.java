/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Active HTTP health checking of a backend.
 *
 * @param path request path
 * @param host request host, {@code null} for the default
 * @param intervalSeconds interval between checks, {@code 0} for the default
 * @param timeoutSeconds timeout of a check, {@code 0} for the default
 * @param unhealthyThresholdCount failures before a host is considered unhealthy, {@code 0} for the default
 * @param healthyThresholdCount successes before a host is considered healthy, {@code 0} for the default
 */
public record HealthCheckSpec(String path,
                              @Nullable String host,
                              long intervalSeconds,
                              long timeoutSeconds,
                              int unhealthyThresholdCount,
                              int healthyThresholdCount) {

    public HealthCheckSpec {
        Objects.requireNonNull(path, "path cannot be null");
    }
}
