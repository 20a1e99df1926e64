/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.projection;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.kroxylicious.routeplane.api.ResourceId;
import io.kroxylicious.routeplane.config.AccessLogFields;
import io.kroxylicious.routeplane.config.AccessLogFormat;
import io.kroxylicious.routeplane.config.Cidr;
import io.kroxylicious.routeplane.config.ControlPlaneConfiguration;
import io.kroxylicious.routeplane.config.IpAllowDeny;
import io.kroxylicious.routeplane.config.ListenerConfig;
import io.kroxylicious.routeplane.dag.TlsVersion;
import io.kroxylicious.routeplane.xds.AccessLog;
import io.kroxylicious.routeplane.xds.ListenerFilter;
import io.kroxylicious.routeplane.xds.TypedConfig;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Everything the listener projection needs, resolved up front. The IP allow/deny list is read from
 * disk once, by {@link #from(ControlPlaneConfiguration)}, and carried by value from then on.
 *
 * @param httpListener the plain text listener
 * @param httpsListener the TLS listener
 * @param accessLogFormat text or JSON access logs
 * @param accessLogFields JSON field name to command operator
 * @param minimumTlsVersion the lowest TLS version any host may negotiate
 * @param defaultCertificate certificate served to clients that send no SNI, if configured
 * @param requestTimeout request timeout of every connection manager, {@link Duration#ZERO} when disabled
 * @param useProxyProtocol whether connections start with a PROXY protocol preamble
 * @param healthCheckPath path answered by the health check filter
 * @param ipAllowDeny client address ranges to allow or deny, {@code null} when none are configured
 */
public record ListenerVisitorConfig(ListenerConfig httpListener,
                                    ListenerConfig httpsListener,
                                    AccessLogFormat accessLogFormat,
                                    Map<String, String> accessLogFields,
                                    TlsVersion minimumTlsVersion,
                                    @Nullable ResourceId defaultCertificate,
                                    Duration requestTimeout,
                                    boolean useProxyProtocol,
                                    String healthCheckPath,
                                    @Nullable IpAllowDeny ipAllowDeny) {

    static final String IP_ALLOW_DENY_TYPE_URL = "envoy.config.filter.network.ip_allow_deny.v2.IpAllowDeny";

    public ListenerVisitorConfig {
        Objects.requireNonNull(httpListener, "httpListener cannot be null");
        Objects.requireNonNull(httpsListener, "httpsListener cannot be null");
        Objects.requireNonNull(accessLogFormat, "accessLogFormat cannot be null");
        accessLogFields = new LinkedHashMap<>(accessLogFields);
        minimumTlsVersion = TlsVersion.max(Objects.requireNonNull(minimumTlsVersion, "minimumTlsVersion cannot be null"), TlsVersion.TLS_1_1);
        requestTimeout = requestTimeout == null || requestTimeout.isNegative() ? Duration.ZERO : requestTimeout;
        Objects.requireNonNull(healthCheckPath, "healthCheckPath cannot be null");
    }

    /**
     * @throws io.kroxylicious.routeplane.config.IllegalConfigurationException if the CIDR list cannot be loaded
     */
    public static ListenerVisitorConfig from(ControlPlaneConfiguration configuration) {
        return new ListenerVisitorConfig(configuration.httpListener(),
                configuration.httpsListener(),
                configuration.accessLogFormat(),
                AccessLogFields.resolve(configuration.accessLogFields()),
                configuration.tls().minimumVersion(),
                configuration.defaultCertificateId().orElse(null),
                configuration.effectiveRequestTimeout(),
                configuration.useProxyProtocol(),
                configuration.healthCheckPath(),
                IpAllowDeny.load(configuration.cidrListPath()).orElse(null));
    }

    public static ListenerVisitorConfig defaults() {
        return from(ControlPlaneConfiguration.defaults());
    }

    List<AccessLog> insecureAccessLogs() {
        return accessLogs(httpListener.accessLog());
    }

    List<AccessLog> secureAccessLogs() {
        return accessLogs(httpsListener.accessLog());
    }

    private List<AccessLog> accessLogs(String path) {
        return List.of(new AccessLog(path, accessLogFormat == AccessLogFormat.JSON ? accessLogFields : Map.of()));
    }

    List<ListenerFilter> insecureListenerFilters() {
        List<ListenerFilter> filters = new ArrayList<>();
        if (useProxyProtocol) {
            filters.add(ListenerFilter.proxyProtocol());
        }
        filters.addAll(customListenerFilters());
        return filters;
    }

    List<ListenerFilter> secureListenerFilters() {
        List<ListenerFilter> filters = new ArrayList<>();
        if (useProxyProtocol) {
            filters.add(ListenerFilter.proxyProtocol());
        }
        filters.add(ListenerFilter.tlsInspector());
        filters.addAll(customListenerFilters());
        return filters;
    }

    private List<ListenerFilter> customListenerFilters() {
        if (ipAllowDeny == null || ipAllowDeny.isEmpty()) {
            return List.of();
        }
        Map<String, Object> value = new LinkedHashMap<>();
        if (ipAllowDeny.allowCidrs() != null) {
            value.put("allow_cidrs", cidrs(ipAllowDeny.allowCidrs()));
        }
        if (ipAllowDeny.denyCidrs() != null) {
            value.put("deny_cidrs", cidrs(ipAllowDeny.denyCidrs()));
        }
        return List.of(new ListenerFilter(ListenerFilter.IP_ALLOW_DENY, new TypedConfig(IP_ALLOW_DENY_TYPE_URL, value)));
    }

    private static List<Map<String, Object>> cidrs(List<Cidr> cidrs) {
        return cidrs.stream()
                .map(cidr -> Map.<String, Object> of("address_prefix", cidr.addressPrefix(), "prefix_len", cidr.prefixLen()))
                .toList();
    }
}
