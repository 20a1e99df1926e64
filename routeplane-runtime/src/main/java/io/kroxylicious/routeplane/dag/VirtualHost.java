/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * The plain HTTP routing table of a fully qualified domain name.
 */
@NotThreadSafe
public final class VirtualHost implements Vertex {

    private final String name;
    private final Map<Route.Conditions, Route> routes = new LinkedHashMap<>();

    public VirtualHost(String name) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
    }

    /**
     * @return the fully qualified domain name
     */
    public String name() {
        return name;
    }

    /**
     * Adds a route. A route with the same conditions as an existing one replaces it in place.
     */
    public void addRoute(Route route) {
        routes.put(route.conditions(), route);
    }

    /**
     * @return the routes in insertion order
     */
    public Collection<Route> routes() {
        return Collections.unmodifiableCollection(routes.values());
    }

    public boolean isValid() {
        return !routes.isEmpty();
    }

    @Override
    public VertexKind kind() {
        return VertexKind.VIRTUAL_HOST;
    }

    @Override
    public void visitChildren(Consumer<Vertex> consumer) {
        routes.values().forEach(consumer);
    }

    @Override
    public String toString() {
        return "VirtualHost[" + name + ", routes=" + routes.size() + "]";
    }
}
