/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.xds;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;

import io.kroxylicious.routeplane.dag.Cluster;
import io.kroxylicious.routeplane.dag.HealthCheckPolicy;
import io.kroxylicious.routeplane.dag.PeerValidationContext;
import io.kroxylicious.routeplane.dag.Secret;
import io.kroxylicious.routeplane.dag.Service;

/**
 * Names for generated resources. Names are derived only from the content they name, so the same
 * graph always produces the same names.
 */
public final class HashNames {

    private static final int MAX_NAME_LENGTH = 60;
    private static final int SHORT_HASH_LENGTH = 6;

    private HashNames() {
    }

    /**
     * Joins the parts with {@code /}. If the result is not shorter than {@code limit}, the parts are
     * truncated from last to first, each to an equal share of the limit with a short hash of the
     * whole name as suffix, until the result fits. If truncating every part is not enough, the hash
     * itself is returned.
     *
     * @param limit the length the result must stay below
     * @param parts the components of the name
     * @return the name
     */
    public static String hashname(int limit, String... parts) {
        String joined = String.join("/", parts);
        if (limit > joined.length()) {
            return joined;
        }
        String hash = sha256Hex(joined).substring(0, SHORT_HASH_LENGTH);
        String[] s = parts.clone();
        for (int n = s.length - 1; n >= 0; n--) {
            s[n] = truncate(limit / s.length, s[n], hash);
            joined = String.join("/", s);
            if (limit > joined.length()) {
                return joined;
            }
        }
        return hash.substring(0, Math.min(hash.length(), limit));
    }

    private static String truncate(int length, String s, String suffix) {
        if (length >= s.length()) {
            return s;
        }
        if (length > suffix.length()) {
            return s.substring(0, length - suffix.length()) + suffix;
        }
        return s.substring(0, length);
    }

    /**
     * A cluster is named for its service port and a hash of the settings that make clusters of the
     * same port differ: load balancing, health checking and upstream validation.
     */
    public static String clusterName(Cluster cluster) {
        Service service = cluster.upstream();
        StringBuilder buf = new StringBuilder();
        if (cluster.loadBalancerPolicy() != null) {
            buf.append(cluster.loadBalancerPolicy());
        }
        HealthCheckPolicy hc = cluster.healthCheckPolicy();
        if (hc != null) {
            if (hc.timeout().compareTo(Duration.ZERO) > 0) {
                buf.append(goDuration(hc.timeout().toSeconds()));
            }
            if (hc.interval().compareTo(Duration.ZERO) > 0) {
                buf.append(goDuration(hc.interval().toSeconds()));
            }
            if (hc.unhealthyThreshold() > 0) {
                buf.append(hc.unhealthyThreshold());
            }
            if (hc.healthyThreshold() > 0) {
                buf.append(hc.healthyThreshold());
            }
            buf.append(hc.path());
        }
        PeerValidationContext uv = cluster.upstreamValidation();
        if (uv != null) {
            buf.append(uv.caCertificate().id().name());
            if (uv.subjectName() != null) {
                buf.append(uv.subjectName());
            }
        }
        String hash = sha1Hex(buf.toString().getBytes(StandardCharsets.UTF_8)).substring(0, 10);
        return hashname(MAX_NAME_LENGTH, service.id().namespace(), service.id().name(), Integer.toString(service.port()), hash);
    }

    /**
     * @return the statistics name of a cluster: {@code namespace_name_port}
     */
    public static String altStatName(Service service) {
        return String.join("_", List.of(service.id().namespace(), service.id().name(), Integer.toString(service.port())));
    }

    /**
     * A secret is named for its id and a hash of its contents, so a changed certificate gets a new name.
     */
    public static String secretName(Secret secret) {
        String hash = sha1Hex(secret.contentBytes()).substring(0, 10);
        return hashname(MAX_NAME_LENGTH, secret.id().namespace(), secret.id().name(), hash);
    }

    public static String virtualHostName(String fqdn) {
        return hashname(MAX_NAME_LENGTH, fqdn);
    }

    // whole seconds rendered the way the hash inputs have always been rendered: 5s, 1m30s, 1h0m0s
    static String goDuration(long seconds) {
        long h = seconds / 3600;
        long m = (seconds % 3600) / 60;
        long s = seconds % 60;
        if (h > 0) {
            return h + "h" + m + "m" + s + "s";
        }
        if (m > 0) {
            return m + "m" + s + "s";
        }
        return s + "s";
    }

    private static String sha1Hex(byte[] bytes) {
        return HexFormat.of().formatHex(digest("SHA-1").digest(bytes));
    }

    private static String sha256Hex(String s) {
        return HexFormat.of().formatHex(digest("SHA-256").digest(s.getBytes(StandardCharsets.UTF_8)));
    }

    private static MessageDigest digest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        }
        catch (NoSuchAlgorithmException e) {
            // every JRE is required to provide SHA-1 and SHA-256
            throw new IllegalStateException(e);
        }
    }
}
