/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.Objects;

/**
 * A header to add to a request or response.
 *
 * @param key header name
 * @param value header value, may contain proxy command operators
 * @param append whether to append to an existing value rather than overwrite it
 */
public record HeaderValueOption(String key, String value, boolean append) {

    public HeaderValueOption {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
    }
}
