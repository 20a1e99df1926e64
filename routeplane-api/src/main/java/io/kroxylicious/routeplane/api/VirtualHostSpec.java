/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param fqdn the fully qualified domain name, wildcards are permitted
 * @param tls TLS settings, {@code null} for a plain HTTP virtual host
 */
public record VirtualHostSpec(String fqdn, @Nullable TlsSpec tls) {

    public VirtualHostSpec {
        Objects.requireNonNull(fqdn, "fqdn cannot be null");
    }
}
