/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kroxylicious.routeplane.api.EntityStore;
import io.kroxylicious.routeplane.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Runs build passes on a single thread, coalescing bursts of change notifications.
 * <p>
 * A pass starts once no change has been requested for the hold-off delay, but never later than the
 * maximum hold-off delay after the first request it serves. A pass that fails is logged, and the caches
 * keep serving the previous generation.
 * </p>
 */
@ThreadSafe
public final class RebuildScheduler implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RebuildScheduler.class);

    private final EntityStore store;
    private final ConfigurationCompiler compiler;
    private final long holdoffNanos;
    private final long holdoffMaxNanos;
    private final LongSupplier nanoTime;
    private final ScheduledExecutorService executor;
    private final AtomicLong completedPasses = new AtomicLong();
    private final AtomicLong failedPasses = new AtomicLong();

    private @Nullable ScheduledFuture<?> pending;
    private long firstPendingRequest;
    private boolean closed;

    public RebuildScheduler(EntityStore store, ConfigurationCompiler compiler, Duration holdoffDelay, Duration holdoffMaxDelay) {
        this(store, compiler, holdoffDelay, holdoffMaxDelay, System::nanoTime);
    }

    @VisibleForTesting
    RebuildScheduler(EntityStore store, ConfigurationCompiler compiler, Duration holdoffDelay, Duration holdoffMaxDelay, LongSupplier nanoTime) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.compiler = Objects.requireNonNull(compiler, "compiler cannot be null");
        if (holdoffDelay.isNegative() || holdoffMaxDelay.compareTo(holdoffDelay) < 0) {
            throw new IllegalArgumentException("holdoffMaxDelay must not be shorter than holdoffDelay");
        }
        this.holdoffNanos = holdoffDelay.toNanos();
        this.holdoffMaxNanos = holdoffMaxDelay.toNanos();
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime cannot be null");
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "routeplane-rebuild");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Requests a build pass. Requests arriving while a pass is pending are served by that pass.
     *
     * @throws IllegalStateException if the scheduler is closed
     */
    public synchronized void requestRebuild() {
        if (closed) {
            throw new IllegalStateException("rebuild scheduler is closed");
        }
        long now = nanoTime.getAsLong();
        if (pending == null) {
            firstPendingRequest = now;
        }
        else {
            pending.cancel(false);
        }
        long waited = now - firstPendingRequest;
        long delay = Math.max(0L, Math.min(holdoffNanos, holdoffMaxNanos - waited));
        pending = executor.schedule(this::runPass, delay, TimeUnit.NANOSECONDS);
    }

    private void runPass() {
        synchronized (this) {
            pending = null;
        }
        try {
            compiler.compile(store.snapshot());
            completedPasses.incrementAndGet();
        }
        catch (RuntimeException e) {
            failedPasses.incrementAndGet();
            LOGGER.atError()
                    .setMessage("build pass failed, previous configuration is still served")
                    .addKeyValue("error", e.getMessage())
                    .setCause(e)
                    .log();
        }
    }

    public long completedPasses() {
        return completedPasses.get();
    }

    public long failedPasses() {
        return failedPasses.get();
    }

    /**
     * Stops scheduling passes, waiting for a running pass to finish.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                LOGGER.warn("rebuild thread did not stop within 10 seconds");
                executor.shutdownNow();
            }
        }
        catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
