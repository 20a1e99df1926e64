/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.Objects;

/**
 * @param caSecret secret holding the CA bundle used to verify client certificates
 */
public record ClientValidationSpec(String caSecret) {

    public ClientValidationSpec {
        Objects.requireNonNull(caSecret, "caSecret cannot be null");
    }
}
