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

package com.axonops.ingestprep.metrics;

import java.util.function.Supplier;

/**
 * Abstract metrics registry interface for ingestprep.
 *
 * <p>Allows the library to work with or without the Dropwizard Metrics dependency.
 * Implementations can use Dropwizard Metrics, a custom metrics system, or no-op.
 *
 * <p><strong>Metric Types:</strong>
 * <ul>
 *   <li><strong>Counter:</strong> monotonically increasing count</li>
 *   <li><strong>Timer:</strong> duration in nanoseconds with histogram</li>
 *   <li><strong>Gauge:</strong> value computed on demand via supplier</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> All implementations must be thread-safe.
 *
 * @since 1.0.0
 */
public interface IngestMetricsRegistry {

    /**
     * Increment a counter by 1.
     *
     * @param name metric name (e.g., "extractor.parse.total.count")
     */
    void incrementCounter(String name);

    /**
     * Increment a counter by a specific delta.
     *
     * @param name metric name (e.g., "extractor.fields.total.count")
     * @param delta amount to increment (must be non-negative)
     */
    void incrementCounter(String name, long delta);

    /**
     * Record a timer measurement in nanoseconds.
     *
     * @param name metric name (e.g., "extractor.parse.latency")
     * @param durationNanos duration in nanoseconds
     */
    void recordTimer(String name, long durationNanos);

    /**
     * Register a gauge that computes its value on-demand.
     *
     * <p>The supplier is called each time the gauge is read (e.g., via JMX) and must
     * not block. An existing gauge with the same name is replaced.
     *
     * @param name metric name (e.g., "rows.ignored.too_many_labels.total.count")
     * @param valueSupplier function that returns the current value
     */
    void registerGauge(String name, Supplier<Number> valueSupplier);

    /**
     * Remove a gauge, but only while it is still backed by {@code valueSupplier}.
     *
     * <p>No-op if the gauge is absent or another owner has since re-registered the name.
     *
     * @param name metric name to remove
     * @param valueSupplier the supplier passed to {@link #registerGauge(String, Supplier)}
     */
    void removeGauge(String name, Supplier<Number> valueSupplier);
}
