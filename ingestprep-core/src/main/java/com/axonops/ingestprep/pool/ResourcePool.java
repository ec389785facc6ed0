/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.ingestprep.pool;

import com.axonops.ingestprep.metrics.IngestMetricsRegistry;
import com.axonops.ingestprep.metrics.MetricNames;
import com.axonops.ingestprep.util.ResourceTracker;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe pool of reusable objects with bounded idle size.
 *
 * <p>Objects are handed out by {@link #acquire()} and handed back by {@link #release(Object)}.
 * Between the two calls the caller has the object to itself; the pool never hands the same object
 * to two callers. Released objects are passivated and queued for reuse until {@code maxIdle} are
 * waiting, after which further releases are dropped and left to the garbage collector.
 *
 * <p>Performance characteristics: lock-free acquire and release ({@link ConcurrentLinkedQueue}),
 * no background threads, allocation only when the idle queue is empty.
 *
 * <p>{@link #release(Object)} must be called exactly once per {@link #acquire()}. Prefer
 * {@link #withResource(Function)} or an {@link AutoCloseable} wrapper that releases on every exit
 * path.
 *
 * @param <T> pooled object type
 * @since 1.0.0
 */
public final class ResourcePool<T> {
  private static final Logger logger = LoggerFactory.getLogger(ResourcePool.class);

  private final String name;
  private final Function<ResourcePool<T>, T> factory;
  private final Consumer<T> onAcquire;
  private final Predicate<T> onRelease;
  private final int maxIdle;
  private final IngestMetricsRegistry metrics;
  private final ResourceTracker tracker;

  private final ConcurrentLinkedQueue<T> idle = new ConcurrentLinkedQueue<>();
  private final AtomicInteger idleCount = new AtomicInteger(0);

  private final Supplier<Number> activeGauge;
  private final Supplier<Number> idleGauge;

  /**
   * Creates a pool.
   *
   * @param name pool name, used in metric names and log lines (e.g., "extractors")
   * @param factory allocates a new object; receives this pool so objects can release themselves
   * @param onAcquire called on every object just before it is handed out
   * @param onRelease called on every released object; must clear all per-lease state and return
   *     true, or return false if the object is not currently leased (the release is then ignored)
   * @param maxIdle maximum number of idle objects kept for reuse (0 disables reuse)
   * @param metrics metrics registry for pool gauges and counters
   */
  public ResourcePool(
      String name,
      Function<ResourcePool<T>, T> factory,
      Consumer<T> onAcquire,
      Predicate<T> onRelease,
      int maxIdle,
      IngestMetricsRegistry metrics) {
    this.name = Objects.requireNonNull(name, "name cannot be null");
    this.factory = Objects.requireNonNull(factory, "factory cannot be null");
    this.onAcquire = Objects.requireNonNull(onAcquire, "onAcquire cannot be null");
    this.onRelease = Objects.requireNonNull(onRelease, "onRelease cannot be null");
    if (maxIdle < 0) {
      throw new IllegalArgumentException("maxIdle must be non-negative");
    }
    this.maxIdle = maxIdle;
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    this.tracker = new ResourceTracker(name);
    this.activeGauge = tracker::getActiveCount;
    this.idleGauge = idleCount::get;

    registerPoolMetrics();
    logger.debug("ingestprep: pool '{}' initialized - maxIdle: {}", name, maxIdle);
  }

  /**
   * Takes an idle object, or allocates a new one if none is waiting.
   *
   * @return an object owned exclusively by the caller until released
   */
  public T acquire() {
    T obj = idle.poll();
    boolean created = false;
    if (obj == null) {
      obj = factory.apply(this);
      created = true;
      metrics.incrementCounter(MetricNames.pool(name, MetricNames.POOL_CREATED));
    } else {
      idleCount.decrementAndGet();
    }
    onAcquire.accept(obj);
    tracker.trackAcquired(created);
    return obj;
  }

  /**
   * Passivates the object and queues it for reuse. The caller must not touch it afterwards.
   *
   * <p>Releasing an object that is not leased (e.g., a second release) is ignored, so it can never
   * sit in the idle queue twice.
   *
   * @param obj object previously returned by {@link #acquire()} on this pool
   */
  public void release(T obj) {
    Objects.requireNonNull(obj, "obj cannot be null");
    if (!onRelease.test(obj)) {
      logger.debug("ingestprep: pool '{}' ignoring release of an object that is not leased", name);
      return;
    }
    tracker.trackReleased();

    if (idleCount.incrementAndGet() <= maxIdle) {
      idle.offer(obj);
    } else {
      idleCount.decrementAndGet();
      tracker.trackDiscarded();
      logger.trace("ingestprep: pool '{}' full, dropping released object", name);
    }
  }

  /**
   * Runs {@code action} with a pooled object and releases it on every exit path.
   *
   * @param action work to do with the object; must not keep a reference to it
   * @param <R> result type
   * @return the action's result
   */
  public <R> R withResource(Function<? super T, ? extends R> action) {
    T obj = acquire();
    try {
      return action.apply(obj);
    } finally {
      release(obj);
    }
  }

  /** Drops every idle object. Leased objects are unaffected. */
  public void clear() {
    int dropped = 0;
    while (idle.poll() != null) {
      idleCount.decrementAndGet();
      dropped++;
    }
    logger.debug("ingestprep: pool '{}' cleared - dropped {} idle objects", name, dropped);
  }

  /** Clears the pool and unregisters the gauges it still owns. */
  public void close() {
    clear();
    metrics.removeGauge(MetricNames.pool(name, MetricNames.POOL_ACTIVE), activeGauge);
    metrics.removeGauge(MetricNames.pool(name, MetricNames.POOL_IDLE), idleGauge);
  }

  public String getName() {
    return name;
  }

  public int getMaxIdle() {
    return maxIdle;
  }

  public int getIdleCount() {
    return idleCount.get();
  }

  public ResourceTracker getResourceTracker() {
    return tracker;
  }

  /** @return a snapshot of pool state */
  public PoolStatistics getStatistics() {
    return new PoolStatistics(
        tracker.getActiveCount(),
        idleCount.get(),
        tracker.getTotalCreated(),
        tracker.getTotalAcquired(),
        tracker.getTotalReleased(),
        tracker.getTotalDiscarded());
  }

  private void registerPoolMetrics() {
    metrics.registerGauge(MetricNames.pool(name, MetricNames.POOL_ACTIVE), activeGauge);
    metrics.registerGauge(MetricNames.pool(name, MetricNames.POOL_IDLE), idleGauge);
  }
}
