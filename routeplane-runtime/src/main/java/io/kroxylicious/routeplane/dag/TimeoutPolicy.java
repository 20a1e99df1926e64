/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.time.Duration;

import io.kroxylicious.routeplane.api.TimeoutPolicySpec;
import io.kroxylicious.routeplane.config.DurationSerde;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param responseTimeout how long to wait for the response to a request; {@link Duration#ZERO} disables the
 *                        timeout and {@code null} leaves the proxy default in place
 */
public record TimeoutPolicy(@Nullable Duration responseTimeout) {

    private static final String INFINITY = "infinity";

    /**
     * The field is called {@code request} on the resource, but it bounds the response to a request.
     * {@code infinity}, or any value that does not parse, disables the timeout.
     */
    @Nullable
    static TimeoutPolicy of(@Nullable TimeoutPolicySpec spec) {
        if (spec == null) {
            return null;
        }
        String request = spec.request();
        if (request == null || request.isEmpty()) {
            return new TimeoutPolicy(null);
        }
        if (INFINITY.equals(request)) {
            return new TimeoutPolicy(Duration.ZERO);
        }
        try {
            Duration parsed = DurationSerde.parse(request);
            return new TimeoutPolicy(parsed.isNegative() ? Duration.ZERO : parsed);
        }
        catch (IllegalArgumentException e) {
            return new TimeoutPolicy(Duration.ZERO);
        }
    }
}
