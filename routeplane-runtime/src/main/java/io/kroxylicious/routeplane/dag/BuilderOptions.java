/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.util.List;
import java.util.Objects;

import io.kroxylicious.routeplane.api.ResourceId;
import io.kroxylicious.routeplane.config.ControlPlaneConfiguration;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Settings that shape how resources become a graph.
 *
 * @param minimumTlsVersion lowest TLS version any secure virtual host may negotiate
 * @param fallbackCertificate certificate for clients without SNI, {@code null} if not configured
 * @param rootNamespaces namespaces allowed to hold root resources, empty for all
 * @param disablePermitInsecure ignore {@code permitInsecure} on routes
 */
public record BuilderOptions(TlsVersion minimumTlsVersion,
                             @Nullable ResourceId fallbackCertificate,
                             List<String> rootNamespaces,
                             boolean disablePermitInsecure) {

    public BuilderOptions {
        Objects.requireNonNull(minimumTlsVersion, "minimumTlsVersion cannot be null");
        rootNamespaces = List.copyOf(rootNamespaces);
    }

    public static BuilderOptions defaults() {
        return new BuilderOptions(TlsVersion.TLS_1_1, null, List.of(), false);
    }

    public static BuilderOptions from(ControlPlaneConfiguration configuration) {
        return new BuilderOptions(configuration.tls().minimumVersion(),
                configuration.tls().fallbackCertificateId(),
                configuration.rootNamespaces(),
                configuration.disablePermitInsecure());
    }

    boolean rootAllowed(String namespace) {
        return rootNamespaces.isEmpty() || rootNamespaces.contains(namespace);
    }
}
