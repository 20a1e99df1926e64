/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane;

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
import io.kroxylicious.routeplane.cache.ConfigurationCaches;
import io.kroxylicious.routeplane.dag.BuildResult;
import io.kroxylicious.routeplane.dag.BuilderOptions;
import io.kroxylicious.routeplane.dag.DagBuilder;
import io.kroxylicious.routeplane.projection.ListenerVisitor;
import io.kroxylicious.routeplane.projection.ListenerVisitorConfig;
import io.kroxylicious.routeplane.xds.Listener;
import io.kroxylicious.routeplane.xds.RouteConfiguration;
import io.kroxylicious.routeplane.xds.UpstreamCluster;

import static io.kroxylicious.routeplane.Fixtures.root;
import static io.kroxylicious.routeplane.Fixtures.service;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ConfigurationCompilerTest {

    private static final ResourceId KUARD_ROUTE = ResourceId.of("roots", "kuard");
    private static final ResourceId BLOG_ROUTE = ResourceId.of("roots", "blog");
    private static final InMemoryEntitySnapshot SNAPSHOT = InMemoryEntitySnapshot.builder()
            .addIngressRoutes(root("roots", "kuard", "kuard.example.com", RouteSpec.toServices("/", ServiceSpec.of("kuard", 8080))),
                    root("roots", "blog", "blog.example.com", RouteSpec.toServices("/", ServiceSpec.of("blog", 80))))
            .addServices(service("roots", "kuard", 8080), service("roots", "blog", 80))
            .build();

    @Mock
    StatusWriter statusWriter;

    private SimpleMeterRegistry registry;
    private ConfigurationCaches caches;
    private ConfigurationCompiler compiler;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        caches = ConfigurationCaches.create();
        compiler = new ConfigurationCompiler(new DagBuilder(BuilderOptions.defaults()), ListenerVisitorConfig.defaults(), caches, statusWriter, registry);
    }

    @Test
    void shouldPublishEveryCache() {
        // given
        // when
        compiler.compile(SNAPSHOT);

        // then
        assertThat(caches.clusters().contents())
                .extracting(UpstreamCluster::name)
                .containsExactly("roots/blog/80/da39a3ee5e", "roots/kuard/8080/da39a3ee5e");
        assertThat(caches.listeners().contents())
                .extracting(Listener::name)
                .containsExactly(ListenerVisitor.HTTP_LISTENER);
        assertThat(caches.routes().contents())
                .extracting(RouteConfiguration::name)
                .containsExactly("ingress_http", "ingress_https");
        assertThat(caches.secrets().contents()).isEmpty();
        assertThat(caches.all()).allSatisfy(cache -> assertThat(cache.version()).isEqualTo(1L));
    }

    @Test
    void shouldWriteStatusOfEveryResource() {
        // given
        // when
        BuildResult result = compiler.compile(SNAPSHOT);

        // then
        assertThat(result.count(ResourceStatus.State.VALID)).isEqualTo(2);
        verify(statusWriter).setStatus(ResourceStatus.valid(KUARD_ROUTE, "kuard.example.com"));
        verify(statusWriter).setStatus(ResourceStatus.valid(BLOG_ROUTE, "blog.example.com"));
    }

    @Test
    void statusWriteFailureDoesNotStopThePass() {
        // given
        doThrow(new IllegalStateException("conflict")).when(statusWriter).setStatus(any());

        // when
        compiler.compile(SNAPSHOT);

        // then
        verify(statusWriter, times(2)).setStatus(any());
        assertThat(caches.clusters().contents()).hasSize(2);
        assertThat(registry.get("routeplane_build_passes").counter().count()).isEqualTo(1.0);
    }

    @Test
    void laterPassReplacesEarlierGeneration() {
        // given
        compiler.compile(SNAPSHOT);
        InMemoryEntitySnapshot withoutBlog = SNAPSHOT.toBuilder().removeIngressRoute(BLOG_ROUTE).build();

        // when
        compiler.compile(withoutBlog);

        // then
        assertThat(caches.clusters().contents())
                .extracting(UpstreamCluster::name)
                .containsExactly("roots/kuard/8080/da39a3ee5e");
        assertThat(caches.clusters().version()).isEqualTo(2L);
    }

    @Test
    void shouldRecordMetrics() {
        // given
        InMemoryEntitySnapshot withOrphan = SNAPSHOT.toBuilder()
                .addIngressRoutes(Fixtures.delegate("roots", "orphan", RouteSpec.toServices("/", ServiceSpec.of("kuard", 8080))))
                .build();

        // when
        compiler.compile(withOrphan);
        compiler.compile(withOrphan);

        // then
        assertThat(registry.get("routeplane_build_passes").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("routeplane_build_duration").timer().count()).isEqualTo(2L);
        assertThat(registry.get("routeplane_resources").tag("state", "valid").gauge().value()).isEqualTo(2.0);
        assertThat(registry.get("routeplane_resources").tag("state", "orphaned").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("routeplane_resources").tag("state", "invalid").gauge().value()).isZero();
        assertThat(registry.get("routeplane_cache_version").tag("type", "route").gauge().value()).isEqualTo(2.0);
    }
}
