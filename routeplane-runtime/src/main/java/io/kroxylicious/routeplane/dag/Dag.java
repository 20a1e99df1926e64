/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The routing graph produced by one build pass. Only valid virtual hosts are present, each list
 * sorted by name. A graph is never modified once built.
 */
public final class Dag {

    private static final Dag EMPTY = new Dag(List.of(), List.of());

    private final List<VirtualHost> virtualHosts;
    private final List<SecureVirtualHost> secureVirtualHosts;

    Dag(List<VirtualHost> virtualHosts, List<SecureVirtualHost> secureVirtualHosts) {
        this.virtualHosts = virtualHosts.stream()
                .filter(VirtualHost::isValid)
                .sorted(Comparator.comparing(VirtualHost::name))
                .toList();
        this.secureVirtualHosts = secureVirtualHosts.stream()
                .filter(SecureVirtualHost::isValid)
                .sorted(Comparator.comparing(SecureVirtualHost::name))
                .toList();
    }

    public static Dag empty() {
        return EMPTY;
    }

    public List<VirtualHost> virtualHosts() {
        return virtualHosts;
    }

    public List<SecureVirtualHost> secureVirtualHosts() {
        return secureVirtualHosts;
    }

    public Optional<VirtualHost> virtualHost(String name) {
        return virtualHosts.stream().filter(vh -> vh.name().equals(name)).findFirst();
    }

    public Optional<SecureVirtualHost> secureVirtualHost(String name) {
        return secureVirtualHosts.stream().filter(vh -> vh.name().equals(name)).findFirst();
    }

    /**
     * @return the roots of the graph: virtual hosts then secure virtual hosts
     */
    public List<Vertex> roots() {
        List<Vertex> roots = new ArrayList<>(virtualHosts);
        roots.addAll(secureVirtualHosts);
        return roots;
    }

    public void accept(VertexVisitor visitor) {
        roots().forEach(visitor::visit);
    }
}
