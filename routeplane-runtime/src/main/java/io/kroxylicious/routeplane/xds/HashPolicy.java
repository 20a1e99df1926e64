/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.time.Duration;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * One input to the consistent hash of a request. Exactly one of header, cookie or source IP applies.
 */
public record HashPolicy(@Nullable String headerName,
                         @Nullable String cookieName,
                         @Nullable String cookiePath,
                         @Nullable Duration cookieTtl,
                         boolean sourceIp,
                         boolean terminal) {
}
