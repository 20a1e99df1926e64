/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.List;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * One route of a virtual host.
 *
 * @param match what the route matches
 * @param action what it does with matched requests
 * @param requestHeadersToAdd headers added to requests
 * @param requestHeadersToRemove headers removed from requests
 * @param responseHeadersToAdd headers added to responses
 * @param responseHeadersToRemove headers removed from responses
 * @param hostRewrite replacement for the {@code Host} header
 * @param clientSampling percentage of client-forced traces kept, {@code null} for the default
 * @param randomSampling percentage of requests traced, {@code null} for the default
 */
public record RouteEntry(RouteMatch match,
                         Action action,
                         List<HeaderValueOption> requestHeadersToAdd,
                         List<String> requestHeadersToRemove,
                         List<HeaderValueOption> responseHeadersToAdd,
                         List<String> responseHeadersToRemove,
                         @Nullable String hostRewrite,
                         @Nullable Double clientSampling,
                         @Nullable Double randomSampling) {

    public RouteEntry {
        Objects.requireNonNull(match, "match cannot be null");
        Objects.requireNonNull(action, "action cannot be null");
        requestHeadersToAdd = List.copyOf(requestHeadersToAdd);
        requestHeadersToRemove = List.copyOf(requestHeadersToRemove);
        responseHeadersToAdd = List.copyOf(responseHeadersToAdd);
        responseHeadersToRemove = List.copyOf(responseHeadersToRemove);
    }

    public static RouteEntry of(RouteMatch match, Action action) {
        return new RouteEntry(match, action, List.of(), List.of(), List.of(), List.of(), null, null, null);
    }
}
