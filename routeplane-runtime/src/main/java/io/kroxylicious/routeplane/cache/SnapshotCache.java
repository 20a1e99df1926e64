/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kroxylicious.routeplane.cache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the current generation of one type of configuration object, by name.
 * <p>
 * A single writer replaces the whole generation with {@link #update(Map)}; any number of readers
 * look up objects with {@link #query(Collection)} and {@link #contents()}, and wait for the next
 * generation with {@link #awaitNextVersion(long, Duration)} or {@link #nextVersion(long)}.
 * The version increases by one with every update, starting from {@code 0}.
 * </p>
 * <p>
 * Results are always ordered by name, so the same generation always reads back the same way.
 * </p>
 *
 * @param <T> the type of configuration object
 */
@ThreadSafe
public abstract class SnapshotCache<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotCache.class);

    private final String typeUrl;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition versionChanged = lock.newCondition();
    private final Map<String, T> staticValues;
    private final List<Waiter> waiters = new ArrayList<>();
    private Map<String, T> values = Map.of();
    private long version;

    /**
     * @param typeUrl type URL of the objects
     * @param staticValues objects served in addition to, and overridden by, those of each generation
     */
    protected SnapshotCache(String typeUrl, Map<String, T> staticValues) {
        this.typeUrl = Objects.requireNonNull(typeUrl, "typeUrl cannot be null");
        this.staticValues = Map.copyOf(staticValues);
    }

    /**
     * Replaces the current generation and wakes every waiter.
     *
     * @param values the new generation, by name
     */
    public void update(Map<String, T> values) {
        Map<String, T> copy = Map.copyOf(values);
        List<Waiter> woken = new ArrayList<>();
        long newVersion;
        lock.lock();
        try {
            this.values = copy;
            newVersion = ++version;
            versionChanged.signalAll();
            Iterator<Waiter> it = waiters.iterator();
            while (it.hasNext()) {
                Waiter waiter = it.next();
                if (newVersion > waiter.lastSeen()) {
                    it.remove();
                    woken.add(waiter);
                }
            }
        }
        finally {
            lock.unlock();
        }
        // complete outside the lock, dependent stages run on this thread
        woken.forEach(waiter -> waiter.future().complete(newVersion));
        LOGGER.atDebug()
                .setMessage("cache updated")
                .addKeyValue("typeUrl", typeUrl)
                .addKeyValue("version", newVersion)
                .addKeyValue("size", copy.size())
                .log();
    }

    /**
     * Looks up objects by name. Names that are not known are skipped.
     *
     * @param names the names
     * @return the objects found, ordered by name
     */
    public List<T> query(Collection<String> names) {
        Map<String, T> found = new TreeMap<>();
        lock.lock();
        try {
            for (String name : names) {
                T value = values.get(name);
                if (value == null) {
                    value = staticValues.get(name);
                }
                if (value != null) {
                    found.put(name, value);
                }
            }
        }
        finally {
            lock.unlock();
        }
        return List.copyOf(found.values());
    }

    /**
     * @return every object of the current generation and every static object, ordered by name
     */
    public List<T> contents() {
        Map<String, T> all = new TreeMap<>(staticValues);
        lock.lock();
        try {
            all.putAll(values);
        }
        finally {
            lock.unlock();
        }
        return List.copyOf(all.values());
    }

    /**
     * Waits until the version moves past {@code lastSeen}.
     *
     * @param lastSeen the last version the caller has seen
     * @param timeout how long to wait at most
     * @return the current version, or empty if it did not move past {@code lastSeen} in time
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public OptionalLong awaitNextVersion(long lastSeen, Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (version <= lastSeen) {
                if (remaining <= 0L) {
                    return OptionalLong.empty();
                }
                remaining = versionChanged.awaitNanos(remaining);
            }
            return OptionalLong.of(version);
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Waits until the version moves past {@code lastSeen}, without blocking the caller. Cancelling the
     * returned future stops the wait.
     *
     * @param lastSeen the last version the caller has seen
     * @return a future completed with the version once it moves past {@code lastSeen}
     */
    public CompletableFuture<Long> nextVersion(long lastSeen) {
        CompletableFuture<Long> future = new CompletableFuture<>();
        Waiter waiter = new Waiter(lastSeen, future);
        lock.lock();
        try {
            if (version > lastSeen) {
                future.complete(version);
                return future;
            }
            waiters.add(waiter);
        }
        finally {
            lock.unlock();
        }
        future.whenComplete((v, t) -> {
            if (future.isCancelled()) {
                deregister(waiter);
            }
        });
        return future;
    }

    private void deregister(Waiter waiter) {
        lock.lock();
        try {
            waiters.remove(waiter);
        }
        finally {
            lock.unlock();
        }
    }

    int waiterCount() {
        lock.lock();
        try {
            return waiters.size();
        }
        finally {
            lock.unlock();
        }
    }

    public long version() {
        lock.lock();
        try {
            return version;
        }
        finally {
            lock.unlock();
        }
    }

    public String typeUrl() {
        return typeUrl;
    }

    // identity equality, two waiters with the same lastSeen are distinct
    private static final class Waiter {
        private final long lastSeen;
        private final CompletableFuture<Long> future;

        private Waiter(long lastSeen, CompletableFuture<Long> future) {
            this.lastSeen = lastSeen;
            this.future = future;
        }

        long lastSeen() {
            return lastSeen;
        }

        CompletableFuture<Long> future() {
            return future;
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[typeUrl=" + typeUrl + ", version=" + version() + "]";
    }
}
