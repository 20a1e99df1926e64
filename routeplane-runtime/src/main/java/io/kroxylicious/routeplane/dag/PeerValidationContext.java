/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * How the certificate presented by the peer of a TLS connection is verified.
 *
 * @param caCertificate CA bundle the peer certificate must chain to
 * @param subjectName subject alternative name the peer certificate must carry, {@code null} for any
 */
public record PeerValidationContext(Secret caCertificate, @Nullable String subjectName) {

    public PeerValidationContext {
        Objects.requireNonNull(caCertificate, "caCertificate cannot be null");
    }
}
