/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.List;
import java.util.Objects;

/**
 * The live endpoints of a {@link BackendService}, sharing its id.
 */
public record ServiceEndpoints(ResourceId id, List<EndpointSubset> subsets) {

    public ServiceEndpoints {
        Objects.requireNonNull(id, "id cannot be null");
        subsets = subsets == null ? List.of() : List.copyOf(subsets);
    }
}
