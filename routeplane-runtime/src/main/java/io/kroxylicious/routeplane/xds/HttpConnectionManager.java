/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Terminates HTTP and routes requests using the route configuration it names.
 *
 * @param statPrefix prefix of the statistics it emits
 * @param routeConfigName the route configuration to fetch
 * @param httpFilters HTTP filters, ending with the router
 * @param accessLogs access logs
 * @param requestTimeout timeout for a whole request, {@link Duration#ZERO} when disabled
 * @param serverName value of the {@code server} response header
 */
public record HttpConnectionManager(String statPrefix,
                                    String routeConfigName,
                                    List<HttpFilter> httpFilters,
                                    List<AccessLog> accessLogs,
                                    Duration requestTimeout,
                                    String serverName)
        implements NetworkFilter {

    public static final String NAME = "envoy.http_connection_manager";
    public static final int MAX_REQUEST_HEADERS_KB = 64;

    public HttpConnectionManager {
        Objects.requireNonNull(statPrefix, "statPrefix cannot be null");
        Objects.requireNonNull(routeConfigName, "routeConfigName cannot be null");
        httpFilters = List.copyOf(httpFilters);
        accessLogs = List.copyOf(accessLogs);
        Objects.requireNonNull(requestTimeout, "requestTimeout cannot be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    public boolean generateRequestId() {
        return false;
    }

    public boolean acceptHttp10() {
        return true;
    }

    public boolean useRemoteAddress() {
        return true;
    }

    public boolean normalizePath() {
        return true;
    }

    public boolean mergeSlashes() {
        return true;
    }
}
