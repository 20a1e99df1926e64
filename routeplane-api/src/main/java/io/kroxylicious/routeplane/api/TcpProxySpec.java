/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.List;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Raw TCP proxying of a TLS virtual host, either to backends or via delegation.
 *
 * @param services backends
 * @param delegate delegation edge, {@code null} if none
 */
public record TcpProxySpec(List<ServiceSpec> services, @Nullable DelegateSpec delegate) {

    public TcpProxySpec {
        services = services == null ? List.of() : List.copyOf(services);
    }
}
