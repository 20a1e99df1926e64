/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

public record HttpFilter(String name, @Nullable TypedConfig typedConfig) {

    public HttpFilter {
        Objects.requireNonNull(name, "name cannot be null");
    }
}
