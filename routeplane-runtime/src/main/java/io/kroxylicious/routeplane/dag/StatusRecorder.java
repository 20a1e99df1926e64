/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import javax.annotation.concurrent.NotThreadSafe;

import io.kroxylicious.routeplane.api.ResourceId;
import io.kroxylicious.routeplane.api.ResourceStatus;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Collects the status of each resource during one build pass. A resource reached more than once
 * keeps its strongest status: invalid beats valid, and valid beats orphaned. Among invalid
 * statuses the first reason recorded is kept.
 */
@NotThreadSafe
final class StatusRecorder {

    private static final Comparator<ResourceStatus.State> PRECEDENCE = Comparator.comparingInt(state -> switch (state) {
        case ORPHANED -> 0;
        case VALID -> 1;
        case INVALID -> 2;
    });

    private final Map<ResourceId, ResourceStatus> statuses = new TreeMap<>();

    void valid(ResourceId id, @Nullable String vhost) {
        record(ResourceStatus.valid(id, vhost));
    }

    void invalid(ResourceId id, String reason, @Nullable String vhost) {
        record(ResourceStatus.invalid(id, reason, vhost));
    }

    void orphaned(ResourceId id) {
        record(ResourceStatus.orphaned(id));
    }

    void record(ResourceStatus status) {
        statuses.merge(status.id(), status, StatusRecorder::strongest);
    }

    @Nullable
    ResourceStatus get(ResourceId id) {
        return statuses.get(id);
    }

    /**
     * @return the recorded statuses, ordered by resource id
     */
    List<ResourceStatus> statuses() {
        return List.copyOf(statuses.values());
    }

    private static ResourceStatus strongest(ResourceStatus existing, ResourceStatus candidate) {
        return PRECEDENCE.compare(candidate.state(), existing.state()) > 0 ? candidate : existing;
    }
}
