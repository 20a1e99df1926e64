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
import java.util.TreeMap;

import io.kroxylicious.routeplane.api.HashPolicySpec;
import io.kroxylicious.routeplane.api.TracingSpec;
import io.kroxylicious.routeplane.dag.Cluster;
import io.kroxylicious.routeplane.dag.Dag;
import io.kroxylicious.routeplane.dag.HeaderCondition;
import io.kroxylicious.routeplane.dag.HeadersPolicy;
import io.kroxylicious.routeplane.dag.Route;
import io.kroxylicious.routeplane.dag.SecureVirtualHost;
import io.kroxylicious.routeplane.dag.VirtualHost;
import io.kroxylicious.routeplane.tag.VisibleForTesting;
import io.kroxylicious.routeplane.xds.Action;
import io.kroxylicious.routeplane.xds.ClusterWeight;
import io.kroxylicious.routeplane.xds.ForwardAction;
import io.kroxylicious.routeplane.xds.HashNames;
import io.kroxylicious.routeplane.xds.HashPolicy;
import io.kroxylicious.routeplane.xds.HeaderMatcher;
import io.kroxylicious.routeplane.xds.HeaderValueOption;
import io.kroxylicious.routeplane.xds.RedirectAction;
import io.kroxylicious.routeplane.xds.RetryPolicyEntry;
import io.kroxylicious.routeplane.xds.RouteConfiguration;
import io.kroxylicious.routeplane.xds.RouteEntry;
import io.kroxylicious.routeplane.xds.RouteMatch;
import io.kroxylicious.routeplane.xds.VirtualHostEntry;
import io.kroxylicious.routeplane.xds.WeightedClusters;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Produces the route configurations named by the listeners' connection managers: {@code ingress_http},
 * {@code ingress_https}, and {@code ingress_fallbackcert} when some host enables the fallback certificate.
 */
public final class RouteVisitor {

    static final String WILDCARD = "*";
    static final String REQUEST_START_HEADER = "x-request-start";
    static final String REQUEST_START_VALUE = "t=%START_TIME(%s.%3f)%";
    static final String WEBSOCKET_UPGRADE = "websocket";

    /**
     * Orders the routes of a virtual host. The proxy uses the first route that matches, so this order
     * decides which route serves a request and must not change for unchanged input.
     * <ol>
     *     <li>prefixes in reverse lexical order, so {@code /foo/bar} comes before {@code /foo} and {@code /}</li>
     *     <li>for equal prefixes, more header conditions first</li>
     *     <li>for as many header conditions, the conditions compared pairwise by name, match type and value</li>
     * </ol>
     * Routes that still compare equal keep their insertion order.
     */
    @VisibleForTesting
    static final Comparator<Route> ROUTE_ORDER = Comparator.comparing(Route::prefix, Comparator.reverseOrder())
            .thenComparing(route -> route.headerConditions().size(), Comparator.reverseOrder())
            .thenComparing(Route::headerConditions, RouteVisitor::compareConditions);

    private final int httpPort;
    private final int httpsPort;

    /**
     * @param httpPort port of the plain text listener, used in the domains of its virtual hosts
     * @param httpsPort port of the TLS listener, used in the domains of its virtual hosts
     */
    public RouteVisitor(int httpPort, int httpsPort) {
        this.httpPort = httpPort;
        this.httpsPort = httpsPort;
    }

    public static RouteVisitor of(ListenerVisitorConfig config) {
        return new RouteVisitor(config.httpListener().port(), config.httpsListener().port());
    }

    public Map<String, RouteConfiguration> visit(Dag dag) {
        Map<String, VirtualHostEntry> insecure = new TreeMap<>();
        for (VirtualHost vh : dag.virtualHosts()) {
            List<RouteEntry> routes = sorted(vh.routes()).stream().map(this::insecureRoute).toList();
            if (!routes.isEmpty()) {
                insecure.put(vh.name(), virtualHost(vh.name(), httpPort, routes));
            }
        }

        Map<String, VirtualHostEntry> secure = new TreeMap<>();
        Map<String, VirtualHostEntry> fallback = new TreeMap<>();
        for (SecureVirtualHost svh : dag.secureVirtualHosts()) {
            List<RouteEntry> routes = sorted(svh.virtualHost().routes()).stream().map(RouteVisitor::secureRoute).toList();
            if (routes.isEmpty()) {
                continue;
            }
            VirtualHostEntry entry = virtualHost(svh.name(), httpsPort, routes);
            secure.put(svh.name(), entry);
            if (svh.fallbackCertificate() != null) {
                fallback.put(svh.name(), entry);
            }
        }

        Map<String, RouteConfiguration> configurations = new TreeMap<>();
        configurations.put(ListenerVisitor.HTTP_LISTENER, new RouteConfiguration(ListenerVisitor.HTTP_LISTENER, List.copyOf(insecure.values())));
        configurations.put(ListenerVisitor.HTTPS_LISTENER, new RouteConfiguration(ListenerVisitor.HTTPS_LISTENER, List.copyOf(secure.values())));
        if (!fallback.isEmpty()) {
            configurations.put(ListenerVisitor.FALLBACK_ROUTE_CONFIG,
                    new RouteConfiguration(ListenerVisitor.FALLBACK_ROUTE_CONFIG, List.copyOf(fallback.values())));
        }
        return configurations;
    }

    @VisibleForTesting
    static List<Route> sorted(Iterable<Route> routes) {
        List<Route> sorted = new ArrayList<>();
        routes.forEach(sorted::add);
        // List.sort is stable
        sorted.sort(ROUTE_ORDER);
        return sorted;
    }

    private static int compareConditions(List<HeaderCondition> a, List<HeaderCondition> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int cmp = a.get(i).compareTo(b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    static VirtualHostEntry virtualHost(String fqdn, int port, List<RouteEntry> routes) {
        List<String> domains = WILDCARD.equals(fqdn) ? List.of(fqdn) : List.of(fqdn, fqdn + ":" + port);
        return new VirtualHostEntry(HashNames.virtualHostName(fqdn), domains, routes);
    }

    private RouteEntry insecureRoute(Route route) {
        if (route.httpsUpgrade()) {
            return RouteEntry.of(match(route), RedirectAction.HTTPS);
        }
        return secureRoute(route);
    }

    @VisibleForTesting
    static RouteEntry secureRoute(Route route) {
        HeadersPolicy request = route.requestHeadersPolicy();
        HeadersPolicy response = route.responseHeadersPolicy();
        TracingSpec tracing = route.tracing();
        List<HeaderValueOption> requestHeaders = new ArrayList<>();
        if (route.clusters().size() == 1) {
            requestHeaders.add(requestStartHeader());
        }
        if (request != null) {
            requestHeaders.addAll(headerValues(request.set()));
        }
        return new RouteEntry(match(route),
                forward(route),
                requestHeaders,
                request == null ? List.of() : request.remove(),
                response == null ? List.of() : headerValues(response.set()),
                response == null ? List.of() : response.remove(),
                request == null ? null : request.hostRewrite(),
                tracing == null ? null : tracing.clientSampling(),
                tracing == null ? null : tracing.randomSampling());
    }

    static RouteMatch match(Route route) {
        return new RouteMatch(route.prefix(), route.headerConditions().stream().map(RouteVisitor::headerMatcher).toList());
    }

    static HeaderMatcher headerMatcher(HeaderCondition condition) {
        return switch (condition.matchType()) {
            case EXACT -> HeaderMatcher.exact(condition.name(), condition.value(), condition.invert());
            case CONTAINS -> HeaderMatcher.safeRegex(condition.name(), ".*" + quoteMeta(condition.value()) + ".*", condition.invert());
            case PRESENT -> HeaderMatcher.present(condition.name(), condition.invert());
        };
    }

    /**
     * Escapes every regular expression metacharacter in {@code s}.
     */
    @VisibleForTesting
    static String quoteMeta(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            if ("\\.+*?()|[]{}^$".indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static ForwardAction forward(Route route) {
        String cluster = null;
        WeightedClusters weighted = null;
        if (route.clusters().size() == 1) {
            cluster = HashNames.clusterName(route.clusters().get(0));
        }
        else {
            weighted = weightedClusters(route.clusters());
        }
        RetryPolicyEntry retry = route.retryPolicy() == null ? null
                : new RetryPolicyEntry(route.retryPolicy().retryOn(), route.retryPolicy().numRetries(), route.retryPolicy().perTryTimeout());
        return new ForwardAction(cluster,
                weighted,
                timeout(route),
                route.idleTimeout(),
                retry,
                route.prefixRewrite(),
                route.hashPolicies().stream().map(RouteVisitor::hashPolicy).toList(),
                route.websocket() ? List.of(WEBSOCKET_UPGRADE) : List.of());
    }

    @Nullable
    private static Duration timeout(Route route) {
        if (route.timeout() != null) {
            return route.timeout();
        }
        return route.timeoutPolicy() == null ? null : route.timeoutPolicy().responseTimeout();
    }

    /**
     * When no cluster has a weight, traffic is split evenly. Otherwise the weights are used as given,
     * so a cluster with weight zero receives no traffic.
     */
    @VisibleForTesting
    static WeightedClusters weightedClusters(List<Cluster> clusters) {
        List<HeaderValueOption> requestStart = List.of(requestStartHeader());
        int total = clusters.stream().mapToInt(Cluster::weight).sum();
        boolean even = total == 0;
        List<ClusterWeight> weights = clusters.stream()
                .map(c -> new ClusterWeight(HashNames.clusterName(c), even ? 1 : c.weight(), requestStart))
                .toList();
        return new WeightedClusters(weights, even ? clusters.size() : total);
    }

    private static HeaderValueOption requestStartHeader() {
        return new HeaderValueOption(REQUEST_START_HEADER, REQUEST_START_VALUE, true);
    }

    private static List<HeaderValueOption> headerValues(Map<String, String> headers) {
        return new TreeMap<>(headers).entrySet().stream()
                .map(e -> new HeaderValueOption(e.getKey(), e.getValue(), false))
                .toList();
    }

    private static HashPolicy hashPolicy(HashPolicySpec spec) {
        return new HashPolicy(spec.headerName(), spec.cookieName(), spec.cookiePath(), spec.cookieTtl(), spec.sourceIp(), spec.terminal());
    }
}
