/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.kroxylicious.routeplane.api.ResourceId;
import io.kroxylicious.routeplane.api.ResourceStatus;

/**
 * The output of one build pass.
 *
 * @param dag the graph
 * @param statuses one status per resource of the input, ordered by resource id
 */
public record BuildResult(Dag dag, List<ResourceStatus> statuses) {

    public BuildResult {
        Objects.requireNonNull(dag, "dag cannot be null");
        statuses = List.copyOf(statuses);
    }

    public Optional<ResourceStatus> status(ResourceId id) {
        return statuses.stream().filter(s -> s.id().equals(id)).findFirst();
    }

    public long count(ResourceStatus.State state) {
        return statuses.stream().filter(s -> s.state() == state).count();
    }
}
