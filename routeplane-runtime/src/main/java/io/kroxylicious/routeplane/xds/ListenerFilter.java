/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A filter that runs on a connection before a filter chain is chosen.
 */
public record ListenerFilter(String name, @Nullable TypedConfig typedConfig) {

    public static final String TLS_INSPECTOR = "envoy.listener.tls_inspector";
    public static final String PROXY_PROTOCOL = "envoy.listener.proxy_protocol";
    public static final String IP_ALLOW_DENY = "envoy.listener.ip_allow_deny";

    public ListenerFilter {
        Objects.requireNonNull(name, "name cannot be null");
    }

    public static ListenerFilter tlsInspector() {
        return new ListenerFilter(TLS_INSPECTOR, null);
    }

    public static ListenerFilter proxyProtocol() {
        return new ListenerFilter(PROXY_PROTOCOL, null);
    }
}
