/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.List;
import java.util.Objects;

import io.kroxylicious.routeplane.dag.TlsVersion;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * TLS termination settings of a filter chain. Two chains with equal contexts can share one chain.
 *
 * @param certificateSecret name of the serving certificate secret
 * @param minimumProtocolVersion lowest TLS version accepted
 * @param maximumProtocolVersion highest TLS version accepted
 * @param validationSecret name of the CA secret client certificates are verified against, {@code null} to not request them
 * @param alpnProtocols protocols offered through ALPN
 */
public record DownstreamTlsContext(String certificateSecret,
                                   TlsVersion minimumProtocolVersion,
                                   TlsVersion maximumProtocolVersion,
                                   @Nullable String validationSecret,
                                   List<String> alpnProtocols) {

    public DownstreamTlsContext {
        Objects.requireNonNull(certificateSecret, "certificateSecret cannot be null");
        Objects.requireNonNull(minimumProtocolVersion, "minimumProtocolVersion cannot be null");
        Objects.requireNonNull(maximumProtocolVersion, "maximumProtocolVersion cannot be null");
        alpnProtocols = List.copyOf(alpnProtocols);
    }

    public boolean requireClientCertificate() {
        return validationSecret != null;
    }
}
