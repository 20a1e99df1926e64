/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Bind address, port and access log destination of one of the proxy's listeners.
 * Unset fields take the defaults supplied by {@link #httpDefaults()} or {@link #httpsDefaults()}.
 *
 * @param address bind address
 * @param port bind port
 * @param accessLog path of the access log
 */
public record ListenerConfig(@JsonProperty("address") @Nullable String address,
                             @JsonProperty("port") @Nullable Integer port,
                             @JsonProperty("accessLog") @Nullable String accessLog) {

    public static final String DEFAULT_ADDRESS = "0.0.0.0";
    public static final int DEFAULT_HTTP_PORT = 8080;
    public static final int DEFAULT_HTTPS_PORT = 8443;
    public static final String DEFAULT_ACCESS_LOG = "/dev/stdout";

    public ListenerConfig {
        if (port != null && (port < 1 || port > 65535)) {
            throw new IllegalConfigurationException("listener port must be in the range 1-65535, was " + port);
        }
    }

    public static ListenerConfig httpDefaults() {
        return new ListenerConfig(DEFAULT_ADDRESS, DEFAULT_HTTP_PORT, DEFAULT_ACCESS_LOG);
    }

    public static ListenerConfig httpsDefaults() {
        return new ListenerConfig(DEFAULT_ADDRESS, DEFAULT_HTTPS_PORT, DEFAULT_ACCESS_LOG);
    }

    /**
     * @param defaults supplies values for the fields left unset here
     * @return a config with every field set
     */
    public ListenerConfig withDefaults(ListenerConfig defaults) {
        return new ListenerConfig(isEmpty(address) ? defaults.address() : address,
                port == null ? defaults.port() : port,
                isEmpty(accessLog) ? defaults.accessLog() : accessLog);
    }

    private static boolean isEmpty(@Nullable String s) {
        return s == null || s.isEmpty();
    }
}
