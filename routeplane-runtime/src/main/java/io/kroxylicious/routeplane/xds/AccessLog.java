/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.Map;
import java.util.Objects;

/**
 * A file access log.
 *
 * @param path the file
 * @param jsonFields field name to command operator for JSON logs, empty for the proxy's text format
 */
public record AccessLog(String path, Map<String, String> jsonFields) {

    public AccessLog {
        Objects.requireNonNull(path, "path cannot be null");
        jsonFields = Map.copyOf(jsonFields);
    }

    public boolean isJson() {
        return !jsonFields.isEmpty();
    }
}
