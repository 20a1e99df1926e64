/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param name chain name, only set for the fallback certificate chain
 * @param match what connections the chain is chosen for
 * @param tlsContext TLS termination, {@code null} when TLS is passed through or absent
 * @param filters the filters
 */
public record FilterChain(@Nullable String name,
                          FilterChainMatch match,
                          @Nullable DownstreamTlsContext tlsContext,
                          List<NetworkFilter> filters) {

    public FilterChain {
        Objects.requireNonNull(match, "match cannot be null");
        filters = List.copyOf(filters);
    }

    public boolean isTcpProxy() {
        return filters.stream().anyMatch(TcpProxyFilter.class::isInstance);
    }

    /**
     * @return a copy of this chain that also matches {@code serverName}, its server names sorted
     */
    public FilterChain withServerName(String serverName) {
        List<String> names = new ArrayList<>(match.serverNames());
        names.add(serverName);
        names.sort(null);
        return new FilterChain(name, new FilterChainMatch(names, match.transportProtocol()), tlsContext, filters);
    }

    public String firstServerName() {
        return match.serverNames().isEmpty() ? "" : match.serverNames().get(0);
    }
}
