/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

/**
 * Source of the resources the control plane compiles. Implementations are fed by whatever watches
 * the outside world; the builder only ever sees the snapshots they hand out.
 */
@FunctionalInterface
public interface EntityStore {

    /**
     * Takes a snapshot of the current resources. Changes made to the store afterwards
     * must not be visible through the returned snapshot.
     *
     * @return the snapshot
     */
    EntitySnapshot snapshot();
}
