/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.List;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param serverNames SNI names the chain is chosen for, empty to match any
 * @param transportProtocol transport protocol the chain is chosen for, {@code null} for any
 */
public record FilterChainMatch(List<String> serverNames, @Nullable String transportProtocol) {

    public FilterChainMatch {
        serverNames = List.copyOf(serverNames);
    }
}
