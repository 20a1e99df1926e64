/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.List;

/**
 * A set of addresses that all expose the same ports.
 *
 * @param addresses IP addresses of ready endpoints
 * @param ports ports exposed by every address
 */
public record EndpointSubset(List<String> addresses, List<EndpointPort> ports) {

    public EndpointSubset {
        addresses = addresses == null ? List.of() : List.copyOf(addresses);
        ports = ports == null ? List.of() : List.copyOf(ports);
    }
}
