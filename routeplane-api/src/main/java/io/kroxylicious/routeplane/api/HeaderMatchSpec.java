/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A header condition. Exactly one of the match fields is expected to be set.
 *
 * @param name header name
 * @param present match when the header is present
 * @param contains match when the header value contains this string
 * @param notContains match when the header value does not contain this string
 * @param exact match when the header value equals this string
 * @param notExact match when the header value does not equal this string
 */
public record HeaderMatchSpec(String name,
                              boolean present,
                              @Nullable String contains,
                              @Nullable String notContains,
                              @Nullable String exact,
                              @Nullable String notExact) {

    public HeaderMatchSpec {
        Objects.requireNonNull(name, "name cannot be null");
    }

    public static HeaderMatchSpec exact(String name, String value) {
        return new HeaderMatchSpec(name, false, null, null, value, null);
    }

    public static HeaderMatchSpec contains(String name, String value) {
        return new HeaderMatchSpec(name, false, value, null, null, null);
    }

    public static HeaderMatchSpec present(String name) {
        return new HeaderMatchSpec(name, true, null, null, null, null);
    }
}
