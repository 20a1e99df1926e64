/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param request timeout for the response to a request, as a duration string such as {@code 30s};
 *                {@code infinity} (or any value that cannot be parsed) disables the timeout
 */
public record TimeoutPolicySpec(@Nullable String request) {}
