/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A route entry. An entry either lists backend {@link #services()} (a terminal route) or names a
 * {@link #delegate()}; specifying both is invalid.
 *
 * @param match path prefix
 * @param services backends
 * @param delegate delegation edge
 * @param enableWebsockets allow websocket upgrades
 * @param permitInsecure serve this route over plain HTTP even when the virtual host has TLS
 * @param prefixRewrite replacement for the matched prefix
 * @param timeoutPolicy response timeout
 * @param retryPolicy retries
 * @param hashPolicy hash policies for consistent load balancing
 * @param idleTimeout stream idle timeout; must be positive, clamped to one hour
 * @param timeout route timeout; must not be negative
 * @param tracing tracing sample rates
 * @param headerMatch header conditions
 * @param requestHeadersPolicy request header manipulation
 * @param responseHeadersPolicy response header manipulation
 */
public record RouteSpec(String match,
                        List<ServiceSpec> services,
                        @Nullable DelegateSpec delegate,
                        boolean enableWebsockets,
                        boolean permitInsecure,
                        @Nullable String prefixRewrite,
                        @Nullable TimeoutPolicySpec timeoutPolicy,
                        @Nullable RetryPolicySpec retryPolicy,
                        List<HashPolicySpec> hashPolicy,
                        @Nullable Duration idleTimeout,
                        @Nullable Duration timeout,
                        @Nullable TracingSpec tracing,
                        List<HeaderMatchSpec> headerMatch,
                        @Nullable HeadersPolicySpec requestHeadersPolicy,
                        @Nullable HeadersPolicySpec responseHeadersPolicy) {

    public RouteSpec {
        Objects.requireNonNull(match, "match cannot be null");
        services = services == null ? List.of() : List.copyOf(services);
        hashPolicy = hashPolicy == null ? List.of() : List.copyOf(hashPolicy);
        headerMatch = headerMatch == null ? List.of() : List.copyOf(headerMatch);
    }

    public static RouteSpec toServices(String match, ServiceSpec... services) {
        return new RouteSpec(match, List.of(services), null, false, false, null, null, null, null, null, null, null, null, null, null);
    }

    public static RouteSpec toDelegate(String match, DelegateSpec delegate) {
        return new RouteSpec(match, null, delegate, false, false, null, null, null, null, null, null, null, null, null, null);
    }

    public boolean delegates() {
        return delegate != null;
    }

    public boolean hasServices() {
        return !services.isEmpty();
    }
}
