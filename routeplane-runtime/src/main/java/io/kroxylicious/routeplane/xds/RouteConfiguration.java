/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.List;
import java.util.Objects;

/**
 * A named route table, fetched by the HTTP connection managers that reference its name.
 */
public record RouteConfiguration(String name, List<VirtualHostEntry> virtualHosts) {

    public RouteConfiguration {
        Objects.requireNonNull(name, "name cannot be null");
        virtualHosts = List.copyOf(virtualHosts);
    }
}
