/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.List;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A routing resource. A resource that declares a {@link VirtualHostSpec} is a <em>root</em> and owns
 * the fully qualified domain name it declares. A resource without one is a <em>delegate</em>: it only
 * contributes routes when another resource delegates to it.
 *
 * @param id identity of the resource
 * @param virtualHost the virtual host declaration, {@code null} for a delegate
 * @param routes route entries, in declaration order
 * @param tcpProxy raw TCP proxying, {@code null} if none
 */
public record IngressRoute(ResourceId id,
                           @Nullable VirtualHostSpec virtualHost,
                           List<RouteSpec> routes,
                           @Nullable TcpProxySpec tcpProxy) {

    public IngressRoute {
        Objects.requireNonNull(id, "id cannot be null");
        routes = routes == null ? List.of() : List.copyOf(routes);
    }

    public boolean isRoot() {
        return virtualHost != null;
    }
}
