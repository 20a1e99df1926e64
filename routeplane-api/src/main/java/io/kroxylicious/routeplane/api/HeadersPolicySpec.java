/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.List;

/**
 * @param set headers to set, replacing existing values
 * @param remove names of headers to remove
 */
public record HeadersPolicySpec(List<HeaderValue> set, List<String> remove) {

    public HeadersPolicySpec {
        set = set == null ? List.of() : List.copyOf(set);
        remove = remove == null ? List.of() : List.copyOf(remove);
    }
}
