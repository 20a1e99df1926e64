/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.cache;

import java.util.Map;

import io.kroxylicious.routeplane.xds.Listener;
import io.kroxylicious.routeplane.xds.TypeUrls;

/**
 * The current listeners.
 */
public final class ListenerCache extends SnapshotCache<Listener> {

    public ListenerCache() {
        this(Map.of());
    }

    public ListenerCache(Map<String, Listener> staticValues) {
        super(TypeUrls.LISTENER, staticValues);
    }
}
