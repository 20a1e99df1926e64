/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.projection;

import java.util.Map;
import java.util.TreeMap;

import io.kroxylicious.routeplane.api.ResourceId;
import io.kroxylicious.routeplane.dag.Dag;
import io.kroxylicious.routeplane.dag.Secret;
import io.kroxylicious.routeplane.dag.VertexKind;
import io.kroxylicious.routeplane.dag.VertexVisitor;
import io.kroxylicious.routeplane.xds.HashNames;
import io.kroxylicious.routeplane.xds.SecretResource;

/**
 * Produces one secret per certificate or CA bundle the graph references.
 */
public final class SecretVisitor {

    private SecretVisitor() {
    }

    public static Map<String, SecretResource> visit(Dag dag) {
        Map<String, SecretResource> secrets = new TreeMap<>();
        for (Secret secret : secrets(dag).values()) {
            SecretResource resource = toResource(secret);
            secrets.put(resource.name(), resource);
        }
        return secrets;
    }

    /**
     * @return every secret referenced by the graph, by id
     */
    static Map<ResourceId, Secret> secrets(Dag dag) {
        Map<ResourceId, Secret> secrets = new TreeMap<>();
        dag.accept(VertexVisitor.builder()
                .on(VertexKind.SECRET, Secret.class, secret -> secrets.put(secret.id(), secret))
                .build());
        return secrets;
    }

    static SecretResource toResource(Secret secret) {
        String name = HashNames.secretName(secret);
        String certificateChain = secret.certificateChain();
        if (certificateChain != null && !certificateChain.isEmpty()) {
            return new SecretResource(name, certificateChain, secret.privateKey(), null);
        }
        return new SecretResource(name, null, null, secret.caBundle());
    }
}
