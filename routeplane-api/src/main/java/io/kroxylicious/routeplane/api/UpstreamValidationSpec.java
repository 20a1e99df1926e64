/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.Objects;

/**
 * Validation of a TLS backend's certificate.
 *
 * @param caSecret secret holding the CA bundle
 * @param subjectName subject alternative name the backend certificate must carry
 */
public record UpstreamValidationSpec(String caSecret, String subjectName) {

    public UpstreamValidationSpec {
        Objects.requireNonNull(caSecret, "caSecret cannot be null");
        Objects.requireNonNull(subjectName, "subjectName cannot be null");
    }
}
