/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.List;
import java.util.Objects;

public record VirtualHostEntry(String name, List<String> domains, List<RouteEntry> routes) {

    public VirtualHostEntry {
        Objects.requireNonNull(name, "name cannot be null");
        domains = List.copyOf(domains);
        routes = List.copyOf(routes);
    }
}
