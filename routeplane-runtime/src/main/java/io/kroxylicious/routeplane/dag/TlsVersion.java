/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.dag;

import java.util.Optional;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * TLS protocol versions, in ascending order. {@link #TLS_AUTO} lets the proxy choose.
 */
public enum TlsVersion {
    TLS_AUTO("TLS_AUTO"),
    TLS_1_0("TLSv1_0"),
    TLS_1_1("TLSv1_1"),
    TLS_1_2("TLSv1_2"),
    TLS_1_3("TLSv1_3");

    private final String protocolName;

    TlsVersion(String protocolName) {
        this.protocolName = protocolName;
    }

    /**
     * @return the name the proxy uses for this version, e.g. {@code TLSv1_2}
     */
    public String protocolName() {
        return protocolName;
    }

    /**
     * Strict parse of a version in static configuration.
     *
     * @param value one of {@code 1.1}, {@code 1.2}, {@code 1.3}
     * @return the version, empty if the value is not recognised
     */
    public static Optional<TlsVersion> fromConfigValue(String value) {
        return switch (value) {
            case "1.1" -> Optional.of(TLS_1_1);
            case "1.2" -> Optional.of(TLS_1_2);
            case "1.3" -> Optional.of(TLS_1_3);
            default -> Optional.empty();
        };
    }

    /**
     * Lenient parse of a minimum version requested by a routing resource. Anything other than
     * {@code 1.2} or {@code 1.3} means TLS 1.1.
     */
    public static TlsVersion minimumOf(@Nullable String value) {
        if ("1.3".equals(value)) {
            return TLS_1_3;
        }
        if ("1.2".equals(value)) {
            return TLS_1_2;
        }
        return TLS_1_1;
    }

    /**
     * Lenient parse of a maximum version requested by a routing resource. Anything other than
     * {@code 1.2} or {@code 1.3} leaves the choice to the proxy.
     */
    public static TlsVersion maximumOf(@Nullable String value) {
        if ("1.3".equals(value)) {
            return TLS_1_3;
        }
        if ("1.2".equals(value)) {
            return TLS_1_2;
        }
        return TLS_AUTO;
    }

    public static TlsVersion max(TlsVersion a, TlsVersion b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * @return this version as an upper bound, {@link #TLS_AUTO} meaning the highest supported
     */
    public TlsVersion asMaximum() {
        return this == TLS_AUTO ? TLS_1_3 : this;
    }
}
