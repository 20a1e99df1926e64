/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.List;
import java.util.Objects;

/**
 * Grants resources in other namespaces the use of secrets in this resource's namespace.
 */
public record CertificateDelegation(ResourceId id, List<Delegation> delegations) {

    public CertificateDelegation {
        Objects.requireNonNull(id, "id cannot be null");
        delegations = delegations == null ? List.of() : List.copyOf(delegations);
    }

    /**
     * @param secret the secret to be used
     * @param namespace the namespace of the resource that wants to use it
     * @return true if this resource grants the use of {@code secret} to {@code namespace}
     */
    public boolean permits(ResourceId secret, String namespace) {
        if (!id.namespace().equals(secret.namespace())) {
            return false;
        }
        return delegations.stream()
                .anyMatch(d -> d.secretName().equals(secret.name()) && d.permits(namespace));
    }
}
