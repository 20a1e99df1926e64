/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.time.Duration;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param count maximum number of retries, {@code 0} for the default of one
 * @param perTryTimeout timeout of each attempt, {@code null} for none
 */
public record RetryPolicySpec(int count, @Nullable Duration perTryTimeout) {}
