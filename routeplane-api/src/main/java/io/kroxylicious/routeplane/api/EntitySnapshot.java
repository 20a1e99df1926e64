/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.Collection;
import java.util.Optional;

/**
 * An immutable, consistent view of every resource the builder reads during one pass.
 */
public interface EntitySnapshot {

    /**
     * @return all routing resources, in no particular order
     */
    Collection<IngressRoute> ingressRoutes();

    Optional<IngressRoute> ingressRoute(ResourceId id);

    Optional<BackendService> service(ResourceId id);

    Optional<ServiceEndpoints> endpoints(ResourceId id);

    Optional<TlsSecret> secret(ResourceId id);

    Collection<CertificateDelegation> certificateDelegations();
}
