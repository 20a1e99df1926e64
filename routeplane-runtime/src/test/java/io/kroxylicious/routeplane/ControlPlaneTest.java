/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import io.kroxylicious.routeplane.api.InMemoryEntitySnapshot;
import io.kroxylicious.routeplane.api.ResourceId;
import io.kroxylicious.routeplane.api.ResourceStatus;
import io.kroxylicious.routeplane.api.RouteSpec;
import io.kroxylicious.routeplane.api.ServiceSpec;
import io.kroxylicious.routeplane.api.StatusWriter;
import io.kroxylicious.routeplane.config.ConfigParser;
import io.kroxylicious.routeplane.config.ControlPlaneConfiguration;
import io.kroxylicious.routeplane.config.IllegalConfigurationException;
import io.kroxylicious.routeplane.xds.RouteConfiguration;
import io.kroxylicious.routeplane.xds.UpstreamCluster;

import static io.kroxylicious.routeplane.Fixtures.root;
import static io.kroxylicious.routeplane.Fixtures.service;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ControlPlaneTest {

    private static final ControlPlaneConfiguration CONFIG = new ConfigParser().parseConfiguration("""
            holdoffDelay: 10ms
            holdoffMaxDelay: 50ms
            """);

    @Mock
    StatusWriter statusWriter;

    private final AtomicReference<InMemoryEntitySnapshot> resources = new AtomicReference<>(InMemoryEntitySnapshot.empty());
    private ControlPlane controlPlane;

    @BeforeEach
    void setUp() {
        controlPlane = new ControlPlane(CONFIG, resources::get, statusWriter, new SimpleMeterRegistry());
    }

    @AfterEach
    void tearDown() {
        controlPlane.close();
    }

    @Test
    void startupPublishesFirstGeneration() {
        // given
        // when
        controlPlane.startup();

        // then
        assertThat(controlPlane.isRunning()).isTrue();
        await().atMost(Duration.ofSeconds(5)).until(() -> controlPlane.caches().routes().version() == 1L);
        assertThat(controlPlane.caches().routes().contents())
                .extracting(RouteConfiguration::name)
                .containsExactly("ingress_http", "ingress_https");
    }

    @Test
    void changeNotificationTriggersRebuild() {
        // given
        controlPlane.startup();
        await().atMost(Duration.ofSeconds(5)).until(() -> controlPlane.caches().clusters().version() == 1L);
        resources.set(InMemoryEntitySnapshot.builder()
                .addIngressRoutes(root("roots", "kuard", "kuard.example.com", RouteSpec.toServices("/", ServiceSpec.of("kuard", 8080))))
                .addServices(service("roots", "kuard", 8080))
                .build());

        // when
        controlPlane.onResourcesChanged();

        // then
        await().atMost(Duration.ofSeconds(5)).until(() -> controlPlane.caches().clusters().version() == 2L);
        assertThat(controlPlane.caches().clusters().contents())
                .extracting(UpstreamCluster::name)
                .containsExactly("roots/kuard/8080/da39a3ee5e");
        ResourceId kuard = ResourceId.of("roots", "kuard");
        verify(statusWriter, timeout(5000)).setStatus(ResourceStatus.valid(kuard, "kuard.example.com"));
    }

    @Test
    void startupTwiceIsRejected() {
        // given
        controlPlane.startup();

        // when
        // then
        assertThatThrownBy(controlPlane::startup)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("This control plane is already running");
    }

    @Test
    void changeNotificationBeforeStartupIsRejected() {
        assertThatThrownBy(controlPlane::onResourcesChanged)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("This control plane is not running");
    }

    @Test
    void shutdownKeepsLastGeneration() {
        // given
        controlPlane.startup();
        await().atMost(Duration.ofSeconds(5)).until(() -> controlPlane.caches().listeners().version() == 1L);

        // when
        controlPlane.shutdown();

        // then
        assertThat(controlPlane.isRunning()).isFalse();
        assertThat(controlPlane.caches().listeners().version()).isEqualTo(1L);
        assertThatThrownBy(controlPlane::shutdown)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("This control plane is not running");
    }

    @Test
    void unreadableCidrListFailsStartup() {
        // given
        ControlPlaneConfiguration config = new ConfigParser().parseConfiguration("cidrListPath: /does/not/exist.json");
        try (ControlPlane broken = new ControlPlane(config, InMemoryEntitySnapshot.empty(), statusWriter, new SimpleMeterRegistry())) {

            // when
            // then
            assertThatThrownBy(broken::startup)
                    .isInstanceOf(IllegalConfigurationException.class)
                    .hasMessageContaining("/does/not/exist.json");
            assertThat(broken.isRunning()).isFalse();
        }
    }
}
