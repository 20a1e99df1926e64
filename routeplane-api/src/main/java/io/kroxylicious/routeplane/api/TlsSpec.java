/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * TLS settings of a virtual host.
 *
 * @param secretName serving certificate, either {@code name} or {@code namespace/name}
 * @param minimumProtocolVersion requested minimum TLS version ({@code 1.1}, {@code 1.2}, {@code 1.3}), may be {@code null}
 * @param maximumProtocolVersion requested maximum TLS version, may be {@code null}
 * @param passthrough pass the TLS session through to the backend untouched (only honoured without a secret)
 * @param enableFallbackCertificate serve the fallback certificate to clients that do not send SNI
 * @param clientValidation validation of client certificates, {@code null} to disable
 */
public record TlsSpec(@Nullable String secretName,
                      @Nullable String minimumProtocolVersion,
                      @Nullable String maximumProtocolVersion,
                      boolean passthrough,
                      boolean enableFallbackCertificate,
                      @Nullable ClientValidationSpec clientValidation) {

    public static TlsSpec withSecret(String secretName) {
        return new TlsSpec(secretName, null, null, false, false, null);
    }

    public static TlsSpec passthroughOnly() {
        return new TlsSpec(null, null, null, true, false, null);
    }

    public boolean hasSecretName() {
        return secretName != null && !secretName.isEmpty();
    }
}
