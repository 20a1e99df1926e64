/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.Objects;

public record LbEndpoint(String address, int port) {

    public LbEndpoint {
        Objects.requireNonNull(address, "address cannot be null");
    }
}
