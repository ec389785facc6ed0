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

package com.axonops.ingestprep.dropwizard;

import com.axonops.ingestprep.config.IngestConfig;
import com.axonops.ingestprep.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for IngestConfig with Dropwizard Metrics integration.
 *
 * <p>Sets up the Dropwizard adapter and, optionally, a JmxReporter so the ignored-rows gauges and
 * extractor metrics are visible over JMX.
 *
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * IngestConfig config = IngestMetricsConfig.withMetrics(registry, "myapp.ingest");
 * LabelLimitsValidator validator = new LabelLimitsValidator(config);
 * FieldExtractor.setGlobalPool(FieldExtractor.newPool(config));
 *
 * // Custom limits on top of the metrics wiring:
 * IngestConfig wide = IngestMetricsConfig.builderWithMetrics(registry, "myapp.ingest", false)
 *     .maxLabelsPerTimeseries(80)
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class IngestMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(IngestMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private IngestMetricsConfig() {
        // Utility class
    }

    /**
     * Creates IngestConfig with Dropwizard Metrics integration and automatic JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return default limits with metrics enabled
     */
    public static IngestConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates IngestConfig with Dropwizard Metrics integration.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to set up JMX exposure
     * @return default limits with metrics enabled
     */
    public static IngestConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return builderWithMetrics(registry, metricPrefix, enableJmx).build();
    }

    /**
     * Creates IngestConfig with Dropwizard Metrics using default prefix {@code com.axonops.ingestprep}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return default limits with metrics enabled
     */
    public static IngestConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Creates a config builder already wired to Dropwizard Metrics, for callers that also change
     * limits.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to set up JMX exposure
     * @return builder with the metrics registry set
     */
    public static IngestConfig.Builder builderWithMetrics(
            MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return IngestConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix));
    }

    /**
     * Ensures a JmxReporter is running. Only the first registry passed in gets one.
     *
     * @param registry the MetricRegistry to expose via JMX
     */
    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                jmxReporter = JmxReporter.forRegistry(registry).build();
                jmxReporter.start();
                logger.info("ingestprep: JmxReporter started - metrics available via JMX");
            } catch (RuntimeException e) {
                // Not fatal - registry may already have JMX exposure
                logger.warn("ingestprep: Failed to start JmxReporter (may already be configured)", e);
            }
        }
    }

    /** @return true if this factory has started a JmxReporter */
    public static boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    /**
     * Stops the JmxReporter started by this factory, if any.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("ingestprep: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
