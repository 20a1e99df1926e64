/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Matches a request header. Exactly one of {@code exactMatch}, {@code safeRegexMatch} or
 * {@code presentMatch} is set.
 */
public record HeaderMatcher(String name,
                            @Nullable String exactMatch,
                            @Nullable String safeRegexMatch,
                            boolean presentMatch,
                            boolean invertMatch) {

    public HeaderMatcher {
        Objects.requireNonNull(name, "name cannot be null");
        int set = (exactMatch != null ? 1 : 0) + (safeRegexMatch != null ? 1 : 0) + (presentMatch ? 1 : 0);
        if (set != 1) {
            throw new IllegalArgumentException("exactly one match must be set for header " + name);
        }
    }

    public static HeaderMatcher exact(String name, String value, boolean invert) {
        return new HeaderMatcher(name, value, null, false, invert);
    }

    public static HeaderMatcher safeRegex(String name, String regex, boolean invert) {
        return new HeaderMatcher(name, null, regex, false, invert);
    }

    public static HeaderMatcher present(String name, boolean invert) {
        return new HeaderMatcher(name, null, null, true, invert);
    }
}
