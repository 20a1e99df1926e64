/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Opaque filter configuration: a type URL and a structure of strings, numbers, booleans, lists and maps.
 */
public record TypedConfig(String typeUrl, Map<String, Object> value) {

    public TypedConfig {
        Objects.requireNonNull(typeUrl, "typeUrl cannot be null");
        value = Collections.unmodifiableMap(new LinkedHashMap<>(value));
    }
}
