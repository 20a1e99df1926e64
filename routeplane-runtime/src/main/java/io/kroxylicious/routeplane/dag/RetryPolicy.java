/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.time.Duration;

import io.kroxylicious.routeplane.api.RetryPolicySpec;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param retryOn conditions that trigger a retry
 * @param numRetries maximum number of retries
 * @param perTryTimeout timeout of each attempt, {@code null} for none
 */
public record RetryPolicy(String retryOn, int numRetries, @Nullable Duration perTryTimeout) {

    static final String RETRY_ON_5XX = "5xx";

    @Nullable
    static RetryPolicy of(@Nullable RetryPolicySpec spec) {
        if (spec == null) {
            return null;
        }
        Duration perTry = spec.perTryTimeout();
        return new RetryPolicy(RETRY_ON_5XX,
                Math.max(1, spec.count()),
                perTry == null || perTry.isZero() || perTry.isNegative() ? null : perTry);
    }
}
