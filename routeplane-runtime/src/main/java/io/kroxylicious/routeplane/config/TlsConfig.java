/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.kroxylicious.routeplane.api.ResourceId;
import io.kroxylicious.routeplane.dag.TlsVersion;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Proxy wide TLS settings.
 *
 * @param minimumProtocolVersion the lowest TLS version any virtual host may negotiate, one of {@code 1.1}, {@code 1.2}, {@code 1.3}
 * @param fallbackCertificate {@code namespace/name} of the certificate served to clients that do not send SNI
 */
public record TlsConfig(@JsonProperty("minimumProtocolVersion") @Nullable String minimumProtocolVersion,
                        @JsonProperty("fallbackCertificate") @Nullable String fallbackCertificate) {

    public TlsConfig {
        if (minimumProtocolVersion != null && TlsVersion.fromConfigValue(minimumProtocolVersion).isEmpty()) {
            throw new IllegalConfigurationException("invalid TLS minimum protocol version '" + minimumProtocolVersion + "', expected one of 1.1, 1.2, 1.3");
        }
        if (fallbackCertificate != null && !fallbackCertificate.contains("/")) {
            throw new IllegalConfigurationException("fallbackCertificate must be of the form namespace/name, was '" + fallbackCertificate + "'");
        }
    }

    public TlsVersion minimumVersion() {
        return minimumProtocolVersion == null ? TlsVersion.TLS_1_1 : TlsVersion.fromConfigValue(minimumProtocolVersion).orElseThrow();
    }

    @Nullable
    public ResourceId fallbackCertificateId() {
        return fallbackCertificate == null ? null : ResourceId.parse(fallbackCertificate, "");
    }
}
