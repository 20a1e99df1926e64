/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Walks the graph, dispatching each vertex to the handler registered for its {@link VertexKind}.
 * Vertices of a kind with no handler are descended into; a handler that wants to continue below
 * its vertex calls {@link #visitChildren(Vertex)} itself.
 */
public final class VertexVisitor {

    private final Map<VertexKind, Consumer<Vertex>> handlers;

    private VertexVisitor(Map<VertexKind, Consumer<Vertex>> handlers) {
        this.handlers = handlers;
    }

    public static Builder builder() {
        return new Builder();
    }

    public void visit(Vertex vertex) {
        Consumer<Vertex> handler = handlers.get(vertex.kind());
        if (handler == null) {
            visitChildren(vertex);
        }
        else {
            handler.accept(vertex);
        }
    }

    public void visitChildren(Vertex vertex) {
        vertex.visitChildren(this::visit);
    }

    public static final class Builder {
        private final Map<VertexKind, Consumer<Vertex>> handlers = new EnumMap<>(VertexKind.class);

        private Builder() {
        }

        /**
         * Registers the handler for a kind.
         *
         * @param kind the kind
         * @param type the vertex class of that kind
         * @param handler the handler
         * @return this builder
         * @param <T> the vertex class
         */
        public <T extends Vertex> Builder on(VertexKind kind, Class<T> type, Consumer<? super T> handler) {
            Objects.requireNonNull(handler, "handler cannot be null");
            if (kind.vertexType() != type) {
                throw new IllegalArgumentException(kind + " vertices are " + kind.vertexType().getSimpleName() + ", not " + type.getSimpleName());
            }
            if (handlers.putIfAbsent(kind, vertex -> handler.accept(type.cast(vertex))) != null) {
                throw new IllegalStateException("a handler for " + kind + " is already registered");
            }
            return this;
        }

        public VertexVisitor build() {
            return new VertexVisitor(new EnumMap<>(handlers));
        }
    }
}
