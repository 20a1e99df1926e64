/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.projection;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.kroxylicious.routeplane.xds.AccessLog;
import io.kroxylicious.routeplane.xds.HttpConnectionManager;
import io.kroxylicious.routeplane.xds.HttpFilter;
import io.kroxylicious.routeplane.xds.TypedConfig;

/**
 * The settings that vary between the HTTP connection managers of the listeners.
 *
 * @param routeConfigName route configuration to fetch
 * @param statPrefix statistics prefix
 * @param accessLogs access logs
 * @param requestTimeout request timeout, {@link Duration#ZERO} when disabled
 * @param defaultFilters whether to install the standard filters ahead of the router
 * @param healthCheckPath path answered by the health check filter
 */
public record HttpConnectionManagerConfig(String routeConfigName,
                                          String statPrefix,
                                          List<AccessLog> accessLogs,
                                          Duration requestTimeout,
                                          boolean defaultFilters,
                                          String healthCheckPath) {

    public static final String SERVER_NAME = "routeplane";

    static final String IP_ALLOW_DENY_FILTER = "envoy.filters.http.ip_allow_deny";
    static final String HEALTH_CHECK_FILTER = "envoy.filters.http.health_check_simple";
    static final String HEADER_SIZE_FILTER = "envoy.filters.http.header_size";
    static final String ROUTER_FILTER = "envoy.router";
    static final int MAX_HEADER_BYTES = 64 * 1024;

    public HttpConnectionManagerConfig {
        Objects.requireNonNull(routeConfigName, "routeConfigName cannot be null");
        Objects.requireNonNull(statPrefix, "statPrefix cannot be null");
        accessLogs = List.copyOf(accessLogs);
        Objects.requireNonNull(requestTimeout, "requestTimeout cannot be null");
        Objects.requireNonNull(healthCheckPath, "healthCheckPath cannot be null");
    }

    public HttpConnectionManager build() {
        List<HttpFilter> filters = new ArrayList<>();
        if (defaultFilters) {
            filters.add(new HttpFilter(IP_ALLOW_DENY_FILTER, null));
            filters.add(new HttpFilter(HEALTH_CHECK_FILTER,
                    new TypedConfig("envoy.config.filter.http.health_check_simple.v2.HealthCheckSimple", Map.of("path", healthCheckPath))));
            filters.add(new HttpFilter(HEADER_SIZE_FILTER,
                    new TypedConfig("envoy.config.filter.http.header_size.v2.HeaderSize", Map.of("max_bytes", MAX_HEADER_BYTES))));
            filters.add(new HttpFilter(ROUTER_FILTER,
                    new TypedConfig("type.googleapis.com/envoy.config.filter.http.router.v2.Router", Map.of("suppress_envoy_headers", true))));
        }
        return new HttpConnectionManager(statPrefix, routeConfigName, filters, accessLogs, requestTimeout, SERVER_NAME);
    }
}
