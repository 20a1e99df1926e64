/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param name port name, {@code null} for an unnamed port
 * @param port port number
 * @param protocol transport protocol, usually {@code TCP}
 */
public record ServicePort(@Nullable String name, int port, @Nullable String protocol) {

    public static ServicePort of(String name, int port) {
        return new ServicePort(name, port, "TCP");
    }
}
