/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import io.kroxylicious.routeplane.api.ResourceId;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The static configuration of the control plane.
 *
 * @param httpListener the plain HTTP listener
 * @param httpsListener the TLS listener
 * @param accessLogFormat access log format
 * @param accessLogFields fields of JSON access logs
 * @param tls proxy wide TLS settings
 * @param defaultCertificate {@code namespace/name} of the certificate served by the catch-all TLS filter chain
 * @param requestTimeout timeout for a whole request, a negative value disables the timeout
 * @param useProxyProtocol expect a PROXY protocol preamble on every connection
 * @param disablePermitInsecure ignore {@code permitInsecure} on routes
 * @param rootNamespaces namespaces allowed to hold root resources, empty for all
 * @param cidrListPath JSON file listing the CIDR ranges allowed or denied on every listener
 * @param holdoffDelay quiet period before a rebuild starts
 * @param holdoffMaxDelay longest a pending rebuild can be deferred
 * @param healthCheckPath path answered by the proxy's own health check filter
 */
public record ControlPlaneConfiguration(@JsonProperty("httpListener") @Nullable ListenerConfig httpListener,
                                        @JsonProperty("httpsListener") @Nullable ListenerConfig httpsListener,
                                        @JsonProperty("accessLogFormat") @Nullable AccessLogFormat accessLogFormat,
                                        @JsonProperty("accessLogFields") @Nullable List<String> accessLogFields,
                                        @JsonProperty("tls") @Nullable TlsConfig tls,
                                        @JsonProperty("defaultCertificate") @Nullable String defaultCertificate,
                                        @JsonProperty("requestTimeout") @JsonDeserialize(using = DurationSerde.Deserializer.class) @JsonSerialize(using = DurationSerde.Serializer.class) @Nullable Duration requestTimeout,
                                        @JsonProperty("useProxyProtocol") boolean useProxyProtocol,
                                        @JsonProperty("disablePermitInsecure") boolean disablePermitInsecure,
                                        @JsonProperty("rootNamespaces") @Nullable List<String> rootNamespaces,
                                        @JsonProperty("cidrListPath") @Nullable String cidrListPath,
                                        @JsonProperty("holdoffDelay") @JsonDeserialize(using = DurationSerde.Deserializer.class) @JsonSerialize(using = DurationSerde.Serializer.class) @Nullable Duration holdoffDelay,
                                        @JsonProperty("holdoffMaxDelay") @JsonDeserialize(using = DurationSerde.Deserializer.class) @JsonSerialize(using = DurationSerde.Serializer.class) @Nullable Duration holdoffMaxDelay,
                                        @JsonProperty("healthCheckPath") @Nullable String healthCheckPath) {

    public static final Duration DEFAULT_HOLDOFF_DELAY = Duration.ofMillis(100);
    public static final Duration DEFAULT_HOLDOFF_MAX_DELAY = Duration.ofMillis(500);
    public static final String DEFAULT_HEALTH_CHECK_PATH = "/envoy_health_94eaa5a6ba44fc17d1da432d4a1e2d73";

    public ControlPlaneConfiguration {
        httpListener = httpListener == null ? ListenerConfig.httpDefaults() : httpListener.withDefaults(ListenerConfig.httpDefaults());
        httpsListener = httpsListener == null ? ListenerConfig.httpsDefaults() : httpsListener.withDefaults(ListenerConfig.httpsDefaults());
        accessLogFormat = accessLogFormat == null ? AccessLogFormat.ENVOY : accessLogFormat;
        accessLogFields = accessLogFields == null ? AccessLogFields.DEFAULT_FIELDS : List.copyOf(accessLogFields);
        AccessLogFields.resolve(accessLogFields);
        tls = tls == null ? new TlsConfig(null, null) : tls;
        if (defaultCertificate != null && !defaultCertificate.contains("/")) {
            throw new IllegalConfigurationException("defaultCertificate must be of the form namespace/name, was '" + defaultCertificate + "'");
        }
        if (requestTimeout != null && requestTimeout.isNegative()) {
            requestTimeout = Duration.ZERO;
        }
        rootNamespaces = rootNamespaces == null ? List.of() : List.copyOf(rootNamespaces);
        holdoffDelay = holdoffDelay == null ? DEFAULT_HOLDOFF_DELAY : holdoffDelay;
        holdoffMaxDelay = holdoffMaxDelay == null ? DEFAULT_HOLDOFF_MAX_DELAY : holdoffMaxDelay;
        if (holdoffDelay.isNegative() || holdoffMaxDelay.compareTo(holdoffDelay) < 0) {
            throw new IllegalConfigurationException("holdoffMaxDelay (" + DurationSerde.format(holdoffMaxDelay)
                    + ") must not be shorter than holdoffDelay (" + DurationSerde.format(holdoffDelay) + ")");
        }
        healthCheckPath = healthCheckPath == null ? DEFAULT_HEALTH_CHECK_PATH : healthCheckPath;
    }

    /**
     * @return a configuration with every setting at its default
     */
    public static ControlPlaneConfiguration defaults() {
        return new ControlPlaneConfiguration(null, null, null, null, null, null, null, false, false, null, null, null, null, null);
    }

    public Optional<ResourceId> defaultCertificateId() {
        return Optional.ofNullable(defaultCertificate).map(ref -> ResourceId.parse(ref, ""));
    }

    /**
     * @return the request timeout, {@link Duration#ZERO} when disabled
     */
    public Duration effectiveRequestTimeout() {
        return requestTimeout == null ? Duration.ZERO : requestTimeout;
    }
}
