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

package com.axonops.ingestprep.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Tracks lease accounting for one {@link com.axonops.ingestprep.pool.ResourcePool}.
 *
 * Tracks ACTIVE (currently leased) objects plus cumulative lifetime counters.
 * Instance-level (per-pool) so several pools never share counts.
 *
 * @since 1.0.0
 */
public final class ResourceTracker {
    private static final Logger logger = LoggerFactory.getLogger(ResourceTracker.class);

    private final String poolName;

    // ACTIVE count - AtomicInteger, read by the active gauge
    private final AtomicInteger activeCount = new AtomicInteger(0);

    // Cumulative counters (lifetime) - LongAdder for write-heavy hot path
    private final LongAdder totalCreated = new LongAdder();
    private final LongAdder totalAcquired = new LongAdder();
    private final LongAdder totalReleased = new LongAdder();
    private final LongAdder totalDiscarded = new LongAdder();

    public ResourceTracker(String poolName) {
        this.poolName = poolName;
    }

    /**
     * Tracks an object handed out by the pool.
     *
     * @param created true if the object was freshly allocated rather than reused
     */
    public void trackAcquired(boolean created) {
        int current = activeCount.incrementAndGet();
        totalAcquired.increment();
        if (created) {
            totalCreated.increment();
        }
        logger.trace("ingestprep: {} acquired - active: {}, created: {}", poolName, current, created);
    }

    /**
     * Tracks an object returned to the pool.
     */
    public void trackReleased() {
        int current = activeCount.decrementAndGet();
        totalReleased.increment();

        if (current < 0) {
            logger.error("ingestprep: {} active count went negative ({}) - an object was released "
                + "more often than it was acquired", poolName, current);
            activeCount.set(0);
        }
    }

    /**
     * Tracks a released object dropped because the idle queue was full.
     */
    public void trackDiscarded() {
        totalDiscarded.increment();
    }

    /** Objects currently leased out. */
    public int getActiveCount() {
        return activeCount.get();
    }

    public long getTotalCreated() {
        return totalCreated.sum();
    }

    public long getTotalAcquired() {
        return totalAcquired.sum();
    }

    public long getTotalReleased() {
        return totalReleased.sum();
    }

    public long getTotalDiscarded() {
        return totalDiscarded.sum();
    }

    /**
     * Resets all counters (for testing only).
     */
    public void reset() {
        activeCount.set(0);
        totalCreated.reset();
        totalAcquired.reset();
        totalReleased.reset();
        totalDiscarded.reset();
        logger.trace("ingestprep: {} tracker reset", poolName);
    }
}
