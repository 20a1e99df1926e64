/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.time.Duration;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

public record RetryPolicyEntry(String retryOn, int numRetries, @Nullable Duration perTryTimeout) {

    public RetryPolicyEntry {
        Objects.requireNonNull(retryOn, "retryOn cannot be null");
    }
}
