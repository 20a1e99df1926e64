/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

/**
 * The closed set of vertex kinds. Visitors dispatch on the kind rather than on the runtime class.
 */
public enum VertexKind {
    VIRTUAL_HOST(VirtualHost.class),
    SECURE_VIRTUAL_HOST(SecureVirtualHost.class),
    ROUTE(Route.class),
    CLUSTER(Cluster.class),
    TCP_PROXY(TcpProxy.class),
    SERVICE(Service.class),
    SECRET(Secret.class);

    private final Class<? extends Vertex> vertexType;

    VertexKind(Class<? extends Vertex> vertexType) {
        this.vertexType = vertexType;
    }

    public Class<? extends Vertex> vertexType() {
        return vertexType;
    }
}
