/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.internal.util;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import io.kroxylicious.routeplane.api.ResourceStatus;
import io.kroxylicious.routeplane.cache.SnapshotCache;

public class Metrics {

    // Common Labels
    public static final String STATE_LABEL = "state";
    public static final String TYPE_LABEL = "type";

    // Base Metric Names
    private static final String BUILD_PASSES_METER_NAME = "routeplane_build_passes";
    private static final String BUILD_DURATION_METER_NAME = "routeplane_build_duration";
    private static final String RESOURCES_METER_NAME = "routeplane_resources";
    private static final String CACHE_VERSION_METER_NAME = "routeplane_cache_version";

    private Metrics() {
        // unused
    }

    public static Counter buildPassCounter(MeterRegistry registry) {
        return Counter.builder(BUILD_PASSES_METER_NAME)
                .description("Count of the number of completed configuration build passes.")
                .register(registry);
    }

    public static Timer buildDurationTimer(MeterRegistry registry) {
        return Timer.builder(BUILD_DURATION_METER_NAME)
                .description("Time taken by a configuration build pass, from snapshot to published caches.")
                .register(registry);
    }

    /**
     * Registers the gauge of the number of resources in a state after the latest build pass.
     *
     * @return the value the gauge reports
     */
    public static AtomicLong resourceGauge(MeterRegistry registry, ResourceStatus.State state) {
        AtomicLong count = new AtomicLong();
        Gauge.builder(RESOURCES_METER_NAME, count, AtomicLong::get)
                .strongReference(true)
                .description("Number of routing resources in each state after the latest build pass.")
                .tag(STATE_LABEL, state.name().toLowerCase(Locale.ROOT))
                .register(registry);
        return count;
    }

    public static void cacheVersionGauge(MeterRegistry registry, String type, SnapshotCache<?> cache) {
        Gauge.builder(CACHE_VERSION_METER_NAME, cache, SnapshotCache::version)
                .strongReference(true)
                .description("Current version of a configuration cache.")
                .tag(TYPE_LABEL, type)
                .register(registry);
    }
}
