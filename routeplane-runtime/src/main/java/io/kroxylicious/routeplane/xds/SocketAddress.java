/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.Objects;

/**
 * @param address IP address
 * @param port port number
 * @param ipv4Compat whether an IPv6 wildcard address also accepts IPv4 connections
 */
public record SocketAddress(String address, int port, boolean ipv4Compat) {

    public SocketAddress {
        Objects.requireNonNull(address, "address cannot be null");
    }

    public static SocketAddress of(String address, int port) {
        return new SocketAddress(address, port, "::".equals(address));
    }

    @Override
    public String toString() {
        return address + ":" + port;
    }
}
