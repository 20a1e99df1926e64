/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.projection;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import io.kroxylicious.routeplane.dag.Cluster;
import io.kroxylicious.routeplane.dag.Dag;
import io.kroxylicious.routeplane.dag.PeerValidationContext;
import io.kroxylicious.routeplane.dag.Secret;
import io.kroxylicious.routeplane.dag.SecureVirtualHost;
import io.kroxylicious.routeplane.dag.TcpProxy;
import io.kroxylicious.routeplane.dag.TlsVersion;
import io.kroxylicious.routeplane.dag.VertexKind;
import io.kroxylicious.routeplane.dag.VertexVisitor;
import io.kroxylicious.routeplane.dag.VirtualHost;
import io.kroxylicious.routeplane.xds.ClusterWeight;
import io.kroxylicious.routeplane.xds.DownstreamTlsContext;
import io.kroxylicious.routeplane.xds.FilterChain;
import io.kroxylicious.routeplane.xds.FilterChainMatch;
import io.kroxylicious.routeplane.xds.HashNames;
import io.kroxylicious.routeplane.xds.Listener;
import io.kroxylicious.routeplane.xds.NetworkFilter;
import io.kroxylicious.routeplane.xds.SocketAddress;
import io.kroxylicious.routeplane.xds.TcpProxyFilter;
import io.kroxylicious.routeplane.xds.WeightedClusters;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Produces the plain text listener {@value #HTTP_LISTENER} and the TLS listener {@value #HTTPS_LISTENER}.
 * <p>
 * The plain text listener exists only if some virtual host is served without TLS. The TLS listener gets
 * one filter chain per secure virtual host, except that HTTP hosts sharing an identical TLS context share
 * one chain listing all of their server names. It exists only if it has at least one chain.
 * </p>
 */
public final class ListenerVisitor {

    public static final String HTTP_LISTENER = "ingress_http";
    public static final String HTTPS_LISTENER = "ingress_https";
    public static final String FALLBACK_ROUTE_CONFIG = "ingress_fallbackcert";
    public static final String FALLBACK_CHAIN_NAME = "fallback-certificate";

    static final Duration TCP_PROXY_IDLE_TIMEOUT = Duration.ofSeconds(9001);
    static final List<String> HTTP_ALPN_PROTOCOLS = List.of("h2", "http/1.1");

    // chains without server names last, the rest by their first server name
    private static final Comparator<FilterChain> CHAIN_ORDER = Comparator
            .comparing((FilterChain chain) -> chain.match().serverNames().isEmpty())
            .thenComparing(FilterChain::firstServerName);

    private final ListenerVisitorConfig config;

    public ListenerVisitor(ListenerVisitorConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public Map<String, Listener> visit(Dag dag) {
        Pass pass = new Pass();
        dag.accept(VertexVisitor.builder()
                .on(VertexKind.VIRTUAL_HOST, VirtualHost.class, vh -> pass.http = true)
                .on(VertexKind.SECURE_VIRTUAL_HOST, SecureVirtualHost.class, pass::secureVirtualHost)
                .build());

        Map<String, Listener> listeners = new TreeMap<>();
        if (pass.http) {
            NetworkFilter manager = new HttpConnectionManagerConfig(HTTP_LISTENER,
                    HTTP_LISTENER,
                    config.insecureAccessLogs(),
                    config.requestTimeout(),
                    true,
                    config.healthCheckPath()).build();
            listeners.put(HTTP_LISTENER, new Listener(HTTP_LISTENER,
                    SocketAddress.of(config.httpListener().address(), config.httpListener().port()),
                    config.insecureListenerFilters(),
                    List.of(new FilterChain(null, new FilterChainMatch(List.of(), null), null, List.of(manager)))));
        }

        if (config.defaultCertificate() != null) {
            Secret secret = SecretVisitor.secrets(dag).get(config.defaultCertificate());
            if (secret != null) {
                DownstreamTlsContext tls = new DownstreamTlsContext(HashNames.secretName(secret),
                        config.minimumTlsVersion(),
                        TlsVersion.TLS_1_3,
                        null,
                        HTTP_ALPN_PROTOCOLS);
                // an empty server name catches clients that send no SNI
                pass.chains.add(new FilterChain(null, new FilterChainMatch(List.of(""), null), tls, List.of(secureHttpConnectionManager(true))));
            }
        }

        if (!pass.chains.isEmpty()) {
            List<FilterChain> chains = new ArrayList<>(pass.chains);
            chains.sort(CHAIN_ORDER);
            listeners.put(HTTPS_LISTENER, new Listener(HTTPS_LISTENER,
                    SocketAddress.of(config.httpsListener().address(), config.httpsListener().port()),
                    config.secureListenerFilters(),
                    chains));
        }
        return listeners;
    }

    private NetworkFilter secureHttpConnectionManager(boolean defaultFilters) {
        return new HttpConnectionManagerConfig(defaultFilters ? HTTPS_LISTENER : FALLBACK_ROUTE_CONFIG,
                HTTPS_LISTENER,
                config.secureAccessLogs(),
                config.requestTimeout(),
                defaultFilters,
                config.healthCheckPath()).build();
    }

    private TcpProxyFilter tcpProxyFilter(TcpProxy proxy) {
        List<Cluster> clusters = proxy.clusters();
        if (clusters.size() == 1) {
            return new TcpProxyFilter(HTTPS_LISTENER, HashNames.clusterName(clusters.get(0)), null, config.secureAccessLogs(), TCP_PROXY_IDLE_TIMEOUT);
        }
        List<ClusterWeight> weights = new ArrayList<>();
        int total = 0;
        for (Cluster cluster : clusters) {
            int weight = cluster.weight() == 0 ? 1 : cluster.weight();
            weights.add(new ClusterWeight(HashNames.clusterName(cluster), weight, List.of()));
            total += weight;
        }
        return new TcpProxyFilter(HTTPS_LISTENER, null, new WeightedClusters(weights, total), config.secureAccessLogs(), TCP_PROXY_IDLE_TIMEOUT);
    }

    private final class Pass {
        private boolean http;
        private final List<FilterChain> chains = new ArrayList<>();
        private boolean fallbackAdded;

        private void secureVirtualHost(SecureVirtualHost vh) {
            List<NetworkFilter> filters;
            List<String> alpn;
            if (vh.tcpProxy() == null) {
                filters = List.of(secureHttpConnectionManager(true));
                alpn = HTTP_ALPN_PROTOCOLS;
            }
            else {
                filters = List.of(tcpProxyFilter(vh.tcpProxy()));
                // the backend negotiates protocols in its own ServerHello
                alpn = List.of();
            }

            DownstreamTlsContext tls = null;
            Secret secret = vh.secret();
            if (secret != null) {
                tls = new DownstreamTlsContext(HashNames.secretName(secret),
                        TlsVersion.max(config.minimumTlsVersion(), vh.minTlsVersion()),
                        vh.maxTlsVersion().asMaximum(),
                        validationSecretName(vh.downstreamValidation()),
                        alpn);
            }

            if (!(vh.tcpProxy() == null && tls != null && mergeIntoExistingChain(tls, vh.name()))) {
                chains.add(new FilterChain(null, new FilterChainMatch(List.of(vh.name()), null), tls, filters));
            }

            Secret fallback = vh.fallbackCertificate();
            if (fallback != null && !fallbackAdded) {
                DownstreamTlsContext fallbackTls = new DownstreamTlsContext(HashNames.secretName(fallback),
                        config.minimumTlsVersion(),
                        TlsVersion.TLS_1_3,
                        validationSecretName(vh.downstreamValidation()),
                        alpn);
                chains.add(new FilterChain(FALLBACK_CHAIN_NAME,
                        new FilterChainMatch(List.of(), "tls"),
                        fallbackTls,
                        List.of(secureHttpConnectionManager(false))));
                fallbackAdded = true;
            }
        }

        private boolean mergeIntoExistingChain(DownstreamTlsContext tls, String serverName) {
            for (int i = 0; i < chains.size(); i++) {
                FilterChain chain = chains.get(i);
                if (chain.tlsContext() == null || chain.isTcpProxy() || chain.name() != null) {
                    continue;
                }
                if (tls.equals(chain.tlsContext())) {
                    chains.set(i, chain.withServerName(serverName));
                    return true;
                }
            }
            return false;
        }
    }

    @Nullable
    private static String validationSecretName(@Nullable PeerValidationContext validation) {
        return validation == null ? null : HashNames.secretName(validation.caCertificate());
    }
}
