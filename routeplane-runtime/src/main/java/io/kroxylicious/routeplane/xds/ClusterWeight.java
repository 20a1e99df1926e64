/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.List;
import java.util.Objects;

public record ClusterWeight(String name, int weight, List<HeaderValueOption> requestHeadersToAdd) {

    public ClusterWeight {
        Objects.requireNonNull(name, "name cannot be null");
        requestHeadersToAdd = List.copyOf(requestHeadersToAdd);
    }
}
