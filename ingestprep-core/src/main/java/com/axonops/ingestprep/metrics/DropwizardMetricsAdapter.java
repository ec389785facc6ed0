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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Dropwizard Metrics adapter for ingestprep.
 *
 * <p>Wraps a Dropwizard {@link MetricRegistry} so the ignored-row gauges, extractor
 * counters and pool gauges show up next to the host application's own metrics.
 *
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * IngestConfig config = IngestConfig.builder()
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "vm.ingest"))
 *     .build();
 * }</pre>
 *
 * <p>MetricRegistry and all Dropwizard metric types are thread-safe, so is this adapter.
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements IngestMetricsRegistry {

    /** Prefix used when none is given. */
    public static final String DEFAULT_PREFIX = "com.axonops.ingestprep";

    private final MetricRegistry registry;
    private final String prefix;

    /**
     * Creates adapter with default metric prefix: {@code com.axonops.ingestprep}
     *
     * @param registry the Dropwizard MetricRegistry to register metrics with
     * @throws NullPointerException if registry is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Creates adapter with custom metric prefix.
     *
     * <p>With prefix {@code "vm.ingest"} the too-many-labels gauge appears as
     * {@code vm.ingest.rows.ignored.too_many_labels.total.count}.
     *
     * @param registry the Dropwizard MetricRegistry to register metrics with
     * @param prefix the metric name prefix
     * @throws NullPointerException if registry or prefix is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    @Override
    public void incrementCounter(String name) {
        registry.counter(metricName(name)).inc();
    }

    @Override
    public void incrementCounter(String name, long delta) {
        registry.counter(metricName(name)).inc(delta);
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
        registry.timer(metricName(name)).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void registerGauge(String name, Supplier<Number> valueSupplier) {
        String fullName = metricName(name);

        // A second validator or pool on the same registry takes over the name
        registry.remove(fullName);
        registry.register(fullName, new SupplierGauge(valueSupplier));
    }

    @Override
    public void removeGauge(String name, Supplier<Number> valueSupplier) {
        String fullName = metricName(name);
        registry.removeMatching((metricName, metric) -> metricName.equals(fullName)
            && metric instanceof SupplierGauge
            && ((SupplierGauge) metric).supplier == valueSupplier);
    }

    /** Full metric name, dot-separated via {@link MetricRegistry#name(String, String...)}. */
    String metricName(String name) {
        return MetricRegistry.name(prefix, name);
    }

    /** @return the configured metric prefix */
    public String getPrefix() {
        return prefix;
    }

    /** Gauge that remembers its supplier so only its owner can remove it. */
    private static final class SupplierGauge implements Gauge<Number> {
        private final Supplier<Number> supplier;

        SupplierGauge(Supplier<Number> supplier) {
            this.supplier = Objects.requireNonNull(supplier, "valueSupplier cannot be null");
        }

        @Override
        public Number getValue() {
            return supplier.get();
        }
    }
}
