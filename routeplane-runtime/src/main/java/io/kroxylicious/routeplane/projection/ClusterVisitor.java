/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.projection;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import io.kroxylicious.routeplane.dag.Cluster;
import io.kroxylicious.routeplane.dag.Dag;
import io.kroxylicious.routeplane.dag.HealthCheckPolicy;
import io.kroxylicious.routeplane.dag.PeerValidationContext;
import io.kroxylicious.routeplane.dag.Service;
import io.kroxylicious.routeplane.dag.VertexKind;
import io.kroxylicious.routeplane.dag.VertexVisitor;
import io.kroxylicious.routeplane.xds.HashNames;
import io.kroxylicious.routeplane.xds.HealthCheck;
import io.kroxylicious.routeplane.xds.LoadBalancerPolicy;
import io.kroxylicious.routeplane.xds.UpstreamCluster;
import io.kroxylicious.routeplane.xds.UpstreamTlsContext;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Produces one cluster per distinct upstream configuration. Clusters of the graph that differ
 * only in weight or route collapse into one, because they share a name.
 */
public final class ClusterVisitor {

    static final Duration CONNECT_TIMEOUT = Duration.ofMillis(250);
    static final Duration HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(2);
    static final Duration HEALTH_CHECK_INTERVAL = Duration.ofSeconds(10);
    static final int UNHEALTHY_THRESHOLD = 3;
    static final int HEALTHY_THRESHOLD = 2;
    static final String HEALTH_CHECK_HOST = "contour-envoy-healthcheck";

    private ClusterVisitor() {
    }

    public static Map<String, UpstreamCluster> visit(Dag dag) {
        Map<String, UpstreamCluster> clusters = new TreeMap<>();
        dag.accept(VertexVisitor.builder()
                .on(VertexKind.CLUSTER, Cluster.class, cluster -> {
                    String name = HashNames.clusterName(cluster);
                    if (!clusters.containsKey(name)) {
                        clusters.put(name, toUpstreamCluster(name, cluster));
                    }
                })
                .build());
        return clusters;
    }

    static UpstreamCluster toUpstreamCluster(String name, Cluster cluster) {
        Service service = cluster.upstream();
        String protocol = cluster.protocol();
        UpstreamTlsContext tls = switch (protocol) {
            case "tls" -> upstreamTls(cluster.upstreamValidation(), List.of());
            case "h2" -> upstreamTls(null, List.of("h2"));
            default -> null;
        };
        boolean http2 = "h2".equals(protocol) || "h2c".equals(protocol);
        return new UpstreamCluster(name,
                HashNames.altStatName(service),
                service.serviceName(),
                CONNECT_TIMEOUT,
                LoadBalancerPolicy.of(cluster.loadBalancerPolicy()),
                healthCheck(cluster.healthCheckPolicy()),
                tls,
                http2,
                service.circuitBreakers(),
                cluster.idleTimeout());
    }

    private static UpstreamTlsContext upstreamTls(@Nullable PeerValidationContext validation, List<String> alpn) {
        if (validation == null) {
            return new UpstreamTlsContext(null, null, null, alpn);
        }
        return new UpstreamTlsContext(null, HashNames.secretName(validation.caCertificate()), validation.subjectName(), alpn);
    }

    @Nullable
    static HealthCheck healthCheck(@Nullable HealthCheckPolicy policy) {
        if (policy == null) {
            return null;
        }
        String host = policy.host() == null || policy.host().isEmpty() ? HEALTH_CHECK_HOST : policy.host();
        return new HealthCheck(policy.timeout().compareTo(Duration.ZERO) > 0 ? policy.timeout() : HEALTH_CHECK_TIMEOUT,
                policy.interval().compareTo(Duration.ZERO) > 0 ? policy.interval() : HEALTH_CHECK_INTERVAL,
                policy.unhealthyThreshold() > 0 ? policy.unhealthyThreshold() : UNHEALTHY_THRESHOLD,
                policy.healthyThreshold() > 0 ? policy.healthyThreshold() : HEALTHY_THRESHOLD,
                host,
                policy.path());
    }
}
