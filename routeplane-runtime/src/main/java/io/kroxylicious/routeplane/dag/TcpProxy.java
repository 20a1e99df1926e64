/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.util.List;
import java.util.function.Consumer;

/**
 * Raw TCP forwarding of the connections of a TLS virtual host.
 */
public record TcpProxy(List<Cluster> clusters) implements Vertex {

    public TcpProxy {
        clusters = List.copyOf(clusters);
    }

    @Override
    public VertexKind kind() {
        return VertexKind.TCP_PROXY;
    }

    @Override
    public void visitChildren(Consumer<Vertex> consumer) {
        clusters.forEach(consumer);
    }
}
