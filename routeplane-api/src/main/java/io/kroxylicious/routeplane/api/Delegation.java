/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.List;
import java.util.Objects;

/**
 * @param secretName name of a secret in the namespace of the enclosing {@link CertificateDelegation}
 * @param targetNamespaces namespaces permitted to use the secret, {@value #ALL_NAMESPACES} for any
 */
public record Delegation(String secretName, List<String> targetNamespaces) {

    public static final String ALL_NAMESPACES = "*";

    public Delegation {
        Objects.requireNonNull(secretName, "secretName cannot be null");
        targetNamespaces = targetNamespaces == null ? List.of() : List.copyOf(targetNamespaces);
    }

    public boolean permits(String namespace) {
        return targetNamespaces.contains(ALL_NAMESPACES) || targetNamespaces.contains(namespace);
    }
}
