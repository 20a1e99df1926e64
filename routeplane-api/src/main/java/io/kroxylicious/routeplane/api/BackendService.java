/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A backend service that routes send traffic to.
 *
 * @param id identity of the service
 * @param ports exposed ports
 * @param annotations metadata annotations, which carry the upstream protocol and circuit breaker settings
 */
public record BackendService(ResourceId id, List<ServicePort> ports, Map<String, String> annotations) {

    public BackendService {
        Objects.requireNonNull(id, "id cannot be null");
        ports = ports == null ? List.of() : List.copyOf(ports);
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
    }

    public Optional<ServicePort> port(int number) {
        return ports.stream().filter(p -> p.port() == number).findFirst();
    }
}
