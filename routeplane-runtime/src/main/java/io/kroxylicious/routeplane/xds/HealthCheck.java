/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.time.Duration;
import java.util.Objects;

/**
 * An active HTTP health check.
 */
public record HealthCheck(Duration timeout,
                          Duration interval,
                          int unhealthyThreshold,
                          int healthyThreshold,
                          String host,
                          String path) {

    public HealthCheck {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        Objects.requireNonNull(interval, "interval cannot be null");
        Objects.requireNonNull(host, "host cannot be null");
        Objects.requireNonNull(path, "path cannot be null");
    }
}
