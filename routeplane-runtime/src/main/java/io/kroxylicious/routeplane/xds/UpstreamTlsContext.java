/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.util.List;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * TLS origination towards an upstream.
 *
 * @param sni server name sent upstream, {@code null} for none
 * @param validationSecret CA secret the upstream certificate is verified against, {@code null} to not verify
 * @param subjectAltName name the upstream certificate must carry, {@code null} for any
 * @param alpnProtocols protocols offered through ALPN
 */
public record UpstreamTlsContext(@Nullable String sni,
                                 @Nullable String validationSecret,
                                 @Nullable String subjectAltName,
                                 List<String> alpnProtocols) {

    public UpstreamTlsContext {
        alpnProtocols = List.copyOf(alpnProtocols);
    }
}
