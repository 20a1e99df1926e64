/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.config;

import java.util.Arrays;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Format of the proxy's access logs.
 */
public enum AccessLogFormat {
    /** The proxy's built in text format. */
    ENVOY,
    /** One JSON object per request, made of the configured {@link AccessLogFields}. */
    JSON;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AccessLogFormat fromValue(String value) {
        return Arrays.stream(values())
                .filter(f -> f.value().equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalConfigurationException("unknown access log format '" + value + "', expected one of envoy, json"));
    }
}
