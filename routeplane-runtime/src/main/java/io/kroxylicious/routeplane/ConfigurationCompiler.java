/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import io.kroxylicious.routeplane.api.EntitySnapshot;
import io.kroxylicious.routeplane.api.ResourceStatus;
import io.kroxylicious.routeplane.api.StatusWriter;
import io.kroxylicious.routeplane.cache.ConfigurationCaches;
import io.kroxylicious.routeplane.dag.BuildResult;
import io.kroxylicious.routeplane.dag.Dag;
import io.kroxylicious.routeplane.dag.DagBuilder;
import io.kroxylicious.routeplane.internal.util.Metrics;
import io.kroxylicious.routeplane.projection.ClusterVisitor;
import io.kroxylicious.routeplane.projection.EndpointVisitor;
import io.kroxylicious.routeplane.projection.ListenerVisitor;
import io.kroxylicious.routeplane.projection.ListenerVisitorConfig;
import io.kroxylicious.routeplane.projection.RouteVisitor;
import io.kroxylicious.routeplane.projection.SecretVisitor;

/**
 * Runs one full build pass: resources to graph, graph to configuration objects, configuration
 * objects into the caches, and finally the status of every resource to the {@link StatusWriter}.
 * <p>
 * Caches are updated in the order proxies consume them, secrets and clusters ahead of the listeners
 * and routes that refer to them.
 * </p>
 */
public final class ConfigurationCompiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigurationCompiler.class);

    private final DagBuilder builder;
    private final ListenerVisitor listenerVisitor;
    private final RouteVisitor routeVisitor;
    private final ConfigurationCaches caches;
    private final StatusWriter statusWriter;
    private final Counter passes;
    private final Timer duration;
    private final Map<ResourceStatus.State, AtomicLong> resourceCounts = new EnumMap<>(ResourceStatus.State.class);

    public ConfigurationCompiler(DagBuilder builder,
                                 ListenerVisitorConfig listenerConfig,
                                 ConfigurationCaches caches,
                                 StatusWriter statusWriter,
                                 MeterRegistry registry) {
        this.builder = Objects.requireNonNull(builder, "builder cannot be null");
        Objects.requireNonNull(listenerConfig, "listenerConfig cannot be null");
        this.listenerVisitor = new ListenerVisitor(listenerConfig);
        this.routeVisitor = RouteVisitor.of(listenerConfig);
        this.caches = Objects.requireNonNull(caches, "caches cannot be null");
        this.statusWriter = Objects.requireNonNull(statusWriter, "statusWriter cannot be null");
        Objects.requireNonNull(registry, "registry cannot be null");
        this.passes = Metrics.buildPassCounter(registry);
        this.duration = Metrics.buildDurationTimer(registry);
        for (ResourceStatus.State state : ResourceStatus.State.values()) {
            resourceCounts.put(state, Metrics.resourceGauge(registry, state));
        }
        Metrics.cacheVersionGauge(registry, "listener", caches.listeners());
        Metrics.cacheVersionGauge(registry, "route", caches.routes());
        Metrics.cacheVersionGauge(registry, "cluster", caches.clusters());
        Metrics.cacheVersionGauge(registry, "endpoint", caches.endpoints());
        Metrics.cacheVersionGauge(registry, "secret", caches.secrets());
    }

    /**
     * Builds and publishes the configuration for a snapshot of the resources.
     *
     * @param snapshot the resources
     * @return the graph and the status of every resource
     */
    public BuildResult compile(EntitySnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        long start = System.nanoTime();

        BuildResult result = builder.build(snapshot);
        Dag dag = result.dag();

        caches.secrets().update(SecretVisitor.visit(dag));
        caches.clusters().update(ClusterVisitor.visit(dag));
        caches.endpoints().update(EndpointVisitor.visit(dag, snapshot));
        caches.listeners().update(listenerVisitor.visit(dag));
        caches.routes().update(routeVisitor.visit(dag));

        for (ResourceStatus status : result.statuses()) {
            writeStatus(status);
        }

        long elapsed = System.nanoTime() - start;
        duration.record(elapsed, TimeUnit.NANOSECONDS);
        passes.increment();
        resourceCounts.forEach((state, count) -> count.set(result.count(state)));

        LOGGER.atInfo()
                .setMessage("build pass complete")
                .addKeyValue("virtualHosts", dag.virtualHosts().size())
                .addKeyValue("secureVirtualHosts", dag.secureVirtualHosts().size())
                .addKeyValue("valid", result.count(ResourceStatus.State.VALID))
                .addKeyValue("invalid", result.count(ResourceStatus.State.INVALID))
                .addKeyValue("orphaned", result.count(ResourceStatus.State.ORPHANED))
                .addKeyValue("durationMs", TimeUnit.NANOSECONDS.toMillis(elapsed))
                .log();
        return result;
    }

    // one status that cannot be written does not stop the others
    private void writeStatus(ResourceStatus status) {
        try {
            statusWriter.setStatus(status);
        }
        catch (RuntimeException e) {
            LOGGER.atWarn()
                    .setMessage("failed to write status")
                    .addKeyValue("resource", status.id())
                    .addKeyValue("error", e.getMessage())
                    .setCause(LOGGER.isDebugEnabled() ? e : null)
                    .log();
        }
    }
}
