/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.List;
import java.util.Objects;

public record RouteMatch(String prefix, List<HeaderMatcher> headers) {

    public RouteMatch {
        Objects.requireNonNull(prefix, "prefix cannot be null");
        headers = List.copyOf(headers);
    }
}
