/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.api;

import java.util.Map;
import java.util.Objects;

/**
 * Certificate material. A serving certificate carries {@value #CERTIFICATE_KEY} and
 * {@value #PRIVATE_KEY_KEY}; a CA bundle carries {@value #CA_KEY}.
 *
 * @param id identity of the secret
 * @param data the entries of the secret
 */
public record TlsSecret(ResourceId id, Map<String, String> data) {

    public static final String CERTIFICATE_KEY = "tls.crt";
    public static final String PRIVATE_KEY_KEY = "tls.key";
    public static final String CA_KEY = "ca.crt";

    public TlsSecret {
        Objects.requireNonNull(id, "id cannot be null");
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static TlsSecret serving(ResourceId id, String certificate, String privateKey) {
        return new TlsSecret(id, Map.of(CERTIFICATE_KEY, certificate, PRIVATE_KEY_KEY, privateKey));
    }

    public static TlsSecret caBundle(ResourceId id, String ca) {
        return new TlsSecret(id, Map.of(CA_KEY, ca));
    }

    public boolean isServingCertificate() {
        return notEmpty(CERTIFICATE_KEY) && notEmpty(PRIVATE_KEY_KEY);
    }

    public boolean isCaBundle() {
        return notEmpty(CA_KEY);
    }

    private boolean notEmpty(String key) {
        String value = data.get(key);
        return value != null && !value.isEmpty();
    }
}
