/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.projection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import io.kroxylicious.routeplane.api.EndpointPort;
import io.kroxylicious.routeplane.api.EndpointSubset;
import io.kroxylicious.routeplane.api.EntitySnapshot;
import io.kroxylicious.routeplane.api.ServiceEndpoints;
import io.kroxylicious.routeplane.dag.Cluster;
import io.kroxylicious.routeplane.dag.Dag;
import io.kroxylicious.routeplane.dag.Service;
import io.kroxylicious.routeplane.dag.VertexKind;
import io.kroxylicious.routeplane.dag.VertexVisitor;
import io.kroxylicious.routeplane.xds.ClusterLoadAssignment;
import io.kroxylicious.routeplane.xds.LbEndpoint;

/**
 * Produces one load assignment per service port a cluster uses. A service with no endpoints gets an
 * empty assignment, so proxies stop sending it traffic rather than keep stale members.
 */
public final class EndpointVisitor {

    private static final Comparator<LbEndpoint> ENDPOINT_ORDER = Comparator.comparing(LbEndpoint::address)
            .thenComparingInt(LbEndpoint::port);

    private EndpointVisitor() {
    }

    public static Map<String, ClusterLoadAssignment> visit(Dag dag, EntitySnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        Map<String, ClusterLoadAssignment> assignments = new TreeMap<>();
        dag.accept(VertexVisitor.builder()
                .on(VertexKind.CLUSTER, Cluster.class, cluster -> {
                    Service service = cluster.upstream();
                    assignments.computeIfAbsent(service.serviceName(), name -> loadAssignment(name, service, snapshot));
                })
                .build());
        return assignments;
    }

    static ClusterLoadAssignment loadAssignment(String name, Service service, EntitySnapshot snapshot) {
        ServiceEndpoints endpoints = snapshot.endpoints(service.id()).orElse(null);
        if (endpoints == null) {
            return ClusterLoadAssignment.empty(name);
        }
        String portName = service.portName() == null ? "" : service.portName();
        List<LbEndpoint> members = new ArrayList<>();
        for (EndpointSubset subset : endpoints.subsets()) {
            for (EndpointPort port : subset.ports()) {
                String endpointPortName = port.name() == null ? "" : port.name();
                if (!portName.equals(endpointPortName)) {
                    continue;
                }
                for (String address : subset.addresses()) {
                    members.add(new LbEndpoint(address, port.port()));
                }
            }
        }
        members.sort(ENDPOINT_ORDER);
        return new ClusterLoadAssignment(name, members);
    }
}
