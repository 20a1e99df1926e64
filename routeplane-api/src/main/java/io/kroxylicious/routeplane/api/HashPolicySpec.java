/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.time.Duration;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A hash policy. One of {@link #headerName()}, {@link #cookieName()} or {@link #sourceIp()} is expected.
 *
 * @param headerName hash on this request header
 * @param cookieName hash on this cookie
 * @param cookiePath path of the generated cookie
 * @param cookieTtl lifetime of the generated cookie
 * @param sourceIp hash on the client address
 * @param terminal stop evaluating further hash policies when this one produces a hash
 */
public record HashPolicySpec(@Nullable String headerName,
                             @Nullable String cookieName,
                             @Nullable String cookiePath,
                             @Nullable Duration cookieTtl,
                             boolean sourceIp,
                             boolean terminal) {}
