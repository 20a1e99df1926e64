/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.cache;

import java.util.Map;

import io.kroxylicious.routeplane.xds.SecretResource;
import io.kroxylicious.routeplane.xds.TypeUrls;

/**
 * The current secrets.
 */
public final class SecretCache extends SnapshotCache<SecretResource> {

    public SecretCache() {
        this(Map.of());
    }

    public SecretCache(Map<String, SecretResource> staticValues) {
        super(TypeUrls.SECRET, staticValues);
    }
}
