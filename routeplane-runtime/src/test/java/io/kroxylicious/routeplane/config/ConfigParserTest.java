/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.config;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import io.kroxylicious.routeplane.api.ResourceId;
import io.kroxylicious.routeplane.dag.TlsVersion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.junit.jupiter.params.provider.Arguments.argumentSet;

class ConfigParserTest {

    private static final String FULL_CONFIG = """
            httpListener:
              address: "::"
              port: 80
              accessLog: /var/log/http.log
            httpsListener:
              port: 443
            accessLogFormat: json
            accessLogFields:
            - "@timestamp"
            - method
            - response_code
            tls:
              minimumProtocolVersion: "1.2"
              fallbackCertificate: certs/fallback
            defaultCertificate: certs/default
            requestTimeout: 30s
            useProxyProtocol: true
            disablePermitInsecure: true
            rootNamespaces:
            - roots
            - team-a
            holdoffDelay: 50ms
            holdoffMaxDelay: 1s
            healthCheckPath: /healthz
            """;

    private final ConfigParser configParser = new ConfigParser();

    @Test
    void shouldParseEveryProperty() {
        // given
        // when
        ControlPlaneConfiguration config = configParser.parseConfiguration(FULL_CONFIG);

        // then
        assertThat(config.httpListener()).isEqualTo(new ListenerConfig("::", 80, "/var/log/http.log"));
        assertThat(config.httpsListener()).isEqualTo(new ListenerConfig("0.0.0.0", 443, "/dev/stdout"));
        assertThat(config.accessLogFormat()).isEqualTo(AccessLogFormat.JSON);
        assertThat(config.accessLogFields()).containsExactly("@timestamp", "method", "response_code");
        assertThat(config.tls().minimumVersion()).isEqualTo(TlsVersion.TLS_1_2);
        assertThat(config.tls().fallbackCertificateId()).isEqualTo(new ResourceId("certs", "fallback"));
        assertThat(config.defaultCertificateId()).contains(new ResourceId("certs", "default"));
        assertThat(config.effectiveRequestTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.useProxyProtocol()).isTrue();
        assertThat(config.disablePermitInsecure()).isTrue();
        assertThat(config.rootNamespaces()).containsExactly("roots", "team-a");
        assertThat(config.holdoffDelay()).isEqualTo(Duration.ofMillis(50));
        assertThat(config.holdoffMaxDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.healthCheckPath()).isEqualTo("/healthz");
    }

    @Test
    void shouldParseFromStream() {
        // given
        var stream = new ByteArrayInputStream(FULL_CONFIG.getBytes(StandardCharsets.UTF_8));

        // when
        ControlPlaneConfiguration config = configParser.parseConfiguration(stream);

        // then
        assertThat(config).isEqualTo(configParser.parseConfiguration(FULL_CONFIG));
    }

    @Test
    void emptyConfigurationUsesDefaults() {
        // given
        // when
        ControlPlaneConfiguration config = configParser.parseConfiguration("{}");

        // then
        assertThat(config).isEqualTo(ControlPlaneConfiguration.defaults());
        assertThat(config.httpListener()).isEqualTo(ListenerConfig.httpDefaults());
        assertThat(config.httpsListener().port()).isEqualTo(8443);
        assertThat(config.accessLogFormat()).isEqualTo(AccessLogFormat.ENVOY);
        assertThat(config.accessLogFields()).isEqualTo(AccessLogFields.DEFAULT_FIELDS);
        assertThat(config.tls().minimumVersion()).isEqualTo(TlsVersion.TLS_1_1);
        assertThat(config.tls().fallbackCertificateId()).isNull();
        assertThat(config.defaultCertificateId()).isEmpty();
        assertThat(config.effectiveRequestTimeout()).isZero();
        assertThat(config.rootNamespaces()).isEmpty();
        assertThat(config.holdoffDelay()).isEqualTo(ControlPlaneConfiguration.DEFAULT_HOLDOFF_DELAY);
        assertThat(config.holdoffMaxDelay()).isEqualTo(ControlPlaneConfiguration.DEFAULT_HOLDOFF_MAX_DELAY);
        assertThat(config.healthCheckPath()).isEqualTo(ControlPlaneConfiguration.DEFAULT_HEALTH_CHECK_PATH);
    }

    @Test
    void negativeRequestTimeoutDisablesTimeout() {
        // given
        // when
        ControlPlaneConfiguration config = configParser.parseConfiguration("requestTimeout: -5s");

        // then
        assertThat(config.effectiveRequestTimeout()).isZero();
    }

    @Test
    void partialListenerTakesRemainingDefaults() {
        // given
        // when
        ControlPlaneConfiguration config = configParser.parseConfiguration("""
                httpListener:
                  accessLog: ""
                  port: 9080
                """);

        // then
        assertThat(config.httpListener()).isEqualTo(new ListenerConfig("0.0.0.0", 9080, "/dev/stdout"));
    }

    static Stream<Arguments> invalidConfigurations() {
        return Stream.of(
                argumentSet("unknown TLS version", """
                        tls:
                          minimumProtocolVersion: "1.0"
                        """, "invalid TLS minimum protocol version '1.0', expected one of 1.1, 1.2, 1.3"),
                argumentSet("unqualified fallback certificate", """
                        tls:
                          fallbackCertificate: fallback
                        """, "fallbackCertificate must be of the form namespace/name, was 'fallback'"),
                argumentSet("unknown access log field", """
                        accessLogFields:
                        - method
                        - bogus
                        """, "unknown access log fields [bogus]"),
                argumentSet("unknown access log format", "accessLogFormat: xml", "unknown access log format 'xml'"),
                argumentSet("unqualified default certificate", "defaultCertificate: wildcard",
                        "defaultCertificate must be of the form namespace/name, was 'wildcard'"),
                argumentSet("max holdoff shorter than holdoff", """
                        holdoffDelay: 1s
                        holdoffMaxDelay: 100ms
                        """, "holdoffMaxDelay (100ms) must not be shorter than holdoffDelay (1s)"),
                argumentSet("listener port out of range", """
                        httpsListener:
                          port: 70000
                        """, "listener port must be in the range 1-65535, was 70000"),
                argumentSet("unknown property", "debug: true", "Couldn't parse configuration"),
                argumentSet("duplicate key", """
                        healthCheckPath: /a
                        healthCheckPath: /b
                        """, "Duplicate field 'healthCheckPath'"),
                argumentSet("malformed duration", "requestTimeout: soon", "Invalid duration string: 'soon'"));
    }

    @ParameterizedTest
    @MethodSource("invalidConfigurations")
    void shouldRejectInvalidConfiguration(String yaml, String expectedMessage) {
        assertThatThrownBy(() -> configParser.parseConfiguration(yaml))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessageContaining(expectedMessage);
    }

    @Test
    void yamlFormParsesBackToEqualConfiguration() {
        // given
        ControlPlaneConfiguration config = configParser.parseConfiguration(FULL_CONFIG);

        // when
        String yaml = configParser.toYaml(config);

        // then
        assertThat(configParser.parseConfiguration(yaml)).isEqualTo(config);
    }

    @Test
    void yamlFormOmitsUnsetValues() {
        // given
        ControlPlaneConfiguration config = ControlPlaneConfiguration.defaults();

        // when
        String yaml = configParser.toYaml(config);

        // then
        assertThat(yaml)
                .doesNotContain("useProxyProtocol")
                .doesNotContain("defaultCertificate")
                .doesNotContain("rootNamespaces")
                .contains("holdoffDelay: \"100ms\"");
    }

    @Test
    void accessLogFieldsResolveInConfiguredOrder() {
        // given
        List<String> fields = List.of("response_code", "@timestamp", "ts");

        // when
        var resolved = AccessLogFields.resolve(fields);

        // then
        assertThat(resolved).containsExactly(
                entry("response_code", "%RESPONSE_CODE%"),
                entry("@timestamp", "%START_TIME%"),
                entry("ts", "%START_TIME%"));
    }
}
