/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.MeterRegistry;

import io.kroxylicious.routeplane.api.EntityStore;
import io.kroxylicious.routeplane.api.StatusWriter;
import io.kroxylicious.routeplane.cache.ConfigurationCaches;
import io.kroxylicious.routeplane.config.ControlPlaneConfiguration;
import io.kroxylicious.routeplane.config.IllegalConfigurationException;
import io.kroxylicious.routeplane.dag.BuilderOptions;
import io.kroxylicious.routeplane.dag.DagBuilder;
import io.kroxylicious.routeplane.projection.ListenerVisitorConfig;

import edu.umd.cs.findbugs.annotations.Nullable;

import static io.micrometer.core.instrument.Metrics.globalRegistry;

/**
 * Wires the control plane together: the resources come from an {@link EntityStore}, every change
 * triggers a rebuild, and the results are served from {@link #caches()}.
 */
public final class ControlPlane implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ControlPlane.class);
    private static final Logger STARTUP_SHUTDOWN_LOGGER = LoggerFactory.getLogger("io.kroxylicious.routeplane.StartupShutdownLogger");

    private final ControlPlaneConfiguration config;
    private final EntityStore store;
    private final StatusWriter statusWriter;
    private final MeterRegistry registry;
    private final ConfigurationCaches caches = ConfigurationCaches.create();
    private final AtomicBoolean running = new AtomicBoolean();
    private volatile @Nullable RebuildScheduler scheduler;

    public ControlPlane(ControlPlaneConfiguration config, EntityStore store, StatusWriter statusWriter) {
        this(config, store, statusWriter, globalRegistry);
    }

    public ControlPlane(ControlPlaneConfiguration config, EntityStore store, StatusWriter statusWriter, MeterRegistry registry) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.statusWriter = Objects.requireNonNull(statusWriter, "statusWriter cannot be null");
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    }

    /**
     * Starts the control plane and requests the first build pass.
     *
     * @return this control plane
     * @throws IllegalConfigurationException if the configuration refers to files that cannot be loaded
     */
    public ControlPlane startup() {
        if (running.getAndSet(true)) {
            throw new IllegalStateException("This control plane is already running");
        }
        try {
            STARTUP_SHUTDOWN_LOGGER.info("Routeplane is starting");
            ListenerVisitorConfig listenerConfig = ListenerVisitorConfig.from(config);
            ConfigurationCompiler compiler = new ConfigurationCompiler(new DagBuilder(BuilderOptions.from(config)),
                    listenerConfig,
                    caches,
                    statusWriter,
                    registry);
            scheduler = new RebuildScheduler(store, compiler, config.holdoffDelay(), config.holdoffMaxDelay());
            scheduler.requestRebuild();
            STARTUP_SHUTDOWN_LOGGER.info("Routeplane is started");
            return this;
        }
        catch (RuntimeException e) {
            shutdown();
            throw e;
        }
    }

    /**
     * Notifies the control plane that the resources changed.
     */
    public void onResourcesChanged() {
        RebuildScheduler current = scheduler;
        if (!running.get() || current == null) {
            throw new IllegalStateException("This control plane is not running");
        }
        current.requestRebuild();
    }

    public ConfigurationCaches caches() {
        return caches;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stops rebuilding. The caches keep their last generation.
     */
    public void shutdown() {
        if (!running.getAndSet(false)) {
            throw new IllegalStateException("This control plane is not running");
        }
        try {
            STARTUP_SHUTDOWN_LOGGER.info("Shutting down");
            if (scheduler != null) {
                scheduler.close();
            }
        }
        finally {
            scheduler = null;
            LOGGER.info("Shut down completed.");
        }
    }

    @Override
    public void close() {
        if (running.get()) {
            shutdown();
        }
    }
}
