/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.List;
import java.util.Objects;

public record Listener(String name, SocketAddress address, List<ListenerFilter> listenerFilters, List<FilterChain> filterChains) {

    public Listener {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(address, "address cannot be null");
        listenerFilters = List.copyOf(listenerFilters);
        filterChains = List.copyOf(filterChains);
    }
}
