/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.util.function.Consumer;

/**
 * A node of the routing graph.
 */
public interface Vertex {

    VertexKind kind();

    /**
     * Passes each direct child of this vertex to the given consumer.
     *
     * @param consumer receives the children
     */
    void visitChildren(Consumer<Vertex> consumer);
}
