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

package com.axonops.ingestprep.config;

import com.axonops.ingestprep.metrics.IngestMetricsRegistry;
import com.axonops.ingestprep.metrics.NoOpMetricsRegistry;
import java.util.Objects;

/**
 * Configuration for the ingestion preparation layer: label admission limits, diagnostic throttling,
 * extractor pooling and metrics.
 *
 * <p>Immutable configuration using Java 17 records. Built once at process start and handed to every
 * {@link com.axonops.ingestprep.limits.LabelLimitsValidator} and extractor pool that needs it, so
 * limits are never changed after the first sample has been checked.
 *
 * <h2>Label Limits</h2>
 *
 * <ul>
 *   <li><b>maxLabelsPerTimeseries</b> - samples with more labels are ignored (default 40)
 *   <li><b>maxLabelValueLen</b> - samples with a longer label value are ignored (default 4096)
 *   <li><b>{@link #MAX_LABEL_NAME_LEN}</b> - fixed, not configurable (256)
 * </ul>
 *
 * <p>Lengths are measured in UTF-8 bytes.
 *
 * <h2>Diagnostic Throttling</h2>
 *
 * <p>Every ignored sample increments an exact counter, but at most one warning per rejection reason
 * is logged per {@code logThrottleIntervalMillis} (default 5 seconds).
 *
 * <h2>Extractor Pool</h2>
 *
 * <p>{@code maxIdleExtractors} bounds how many released extractors are kept for reuse. Each one
 * retains its backing buffer capacity, so this is also a bound on retained buffer memory.
 *
 * <h2>Examples</h2>
 *
 * <pre>{@code
 * // Defaults (40 labels, 4KiB values, 5s throttle, metrics disabled)
 * LabelLimitsValidator validator = new LabelLimitsValidator(IngestConfig.DEFAULT);
 *
 * // Wider limits with Dropwizard metrics
 * IngestConfig config = IngestConfig.builder()
 *     .maxLabelsPerTimeseries(60)
 *     .maxLabelValueLen(16 * 1024)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.ingest"))
 *     .build();
 * }</pre>
 *
 * @param maxLabelsPerTimeseries maximum labels per sample (must be > 0)
 * @param maxLabelValueLen maximum label value length in bytes (must be > 0)
 * @param logThrottleIntervalMillis minimum gap between two warnings of the same kind (must be > 0)
 * @param maxIdleExtractors maximum released extractors kept for reuse (must be >= 0)
 * @param metricsRegistry metrics implementation (use {@link NoOpMetricsRegistry} for zero overhead)
 * @since 1.0.0
 */
public record IngestConfig(
    int maxLabelsPerTimeseries,
    int maxLabelValueLen,
    long logThrottleIntervalMillis,
    int maxIdleExtractors,
    IngestMetricsRegistry metricsRegistry) {

  /** Maximum length of a label name in bytes. Samples with longer names are ignored. */
  public static final int MAX_LABEL_NAME_LEN = 256;

  /** Default maximum number of labels per timeseries. */
  public static final int DEFAULT_MAX_LABELS_PER_TIMESERIES = 40;

  /** Default maximum label value length in bytes. */
  public static final int DEFAULT_MAX_LABEL_VALUE_LEN = 4 * 1024;

  /** Default gap between two warnings for the same rejection reason. */
  public static final long DEFAULT_LOG_THROTTLE_INTERVAL_MILLIS = 5_000;

  /** Default number of idle extractors kept by a pool. */
  public static final int DEFAULT_MAX_IDLE_EXTRACTORS = 1024;

  /** Default configuration: 40 labels, 4KiB values, 5s throttle, 1024 idle extractors, no metrics. */
  public static final IngestConfig DEFAULT =
      new IngestConfig(
          DEFAULT_MAX_LABELS_PER_TIMESERIES,
          DEFAULT_MAX_LABEL_VALUE_LEN,
          DEFAULT_LOG_THROTTLE_INTERVAL_MILLIS,
          DEFAULT_MAX_IDLE_EXTRACTORS,
          NoOpMetricsRegistry.INSTANCE);

  /** Compact constructor with validation. */
  public IngestConfig {
    if (maxLabelsPerTimeseries <= 0) {
      throw new IllegalArgumentException(
          "maxLabelsPerTimeseries must be positive, got " + maxLabelsPerTimeseries);
    }
    if (maxLabelValueLen <= 0) {
      throw new IllegalArgumentException(
          "maxLabelValueLen must be positive, got " + maxLabelValueLen);
    }
    if (logThrottleIntervalMillis <= 0) {
      throw new IllegalArgumentException(
          "logThrottleIntervalMillis must be positive, got " + logThrottleIntervalMillis);
    }
    if (maxIdleExtractors < 0) {
      throw new IllegalArgumentException(
          "maxIdleExtractors must be non-negative, got " + maxIdleExtractors);
    }
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
  }

  /**
   * Creates a builder starting from {@link #DEFAULT}.
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for custom configuration.
   *
   * <p>All fields start with the defaults from {@link #DEFAULT}.
   */
  public static class Builder {
    private int maxLabelsPerTimeseries = DEFAULT_MAX_LABELS_PER_TIMESERIES;
    private int maxLabelValueLen = DEFAULT_MAX_LABEL_VALUE_LEN;
    private long logThrottleIntervalMillis = DEFAULT_LOG_THROTTLE_INTERVAL_MILLIS;
    private int maxIdleExtractors = DEFAULT_MAX_IDLE_EXTRACTORS;
    private IngestMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Set the maximum number of labels per timeseries.
     *
     * <p><b>Default: 40</b>
     *
     * @param max maximum labels (must be > 0)
     * @return this builder
     */
    public Builder maxLabelsPerTimeseries(int max) {
      this.maxLabelsPerTimeseries = max;
      return this;
    }

    /**
     * Set the maximum label value length in bytes.
     *
     * <p><b>Default: 4096</b>
     *
     * @param max maximum value length (must be > 0)
     * @return this builder
     */
    public Builder maxLabelValueLen(int max) {
      this.maxLabelValueLen = max;
      return this;
    }

    /**
     * Set the minimum gap between two warnings of the same rejection reason.
     *
     * <p><b>Default: 5000ms</b>
     *
     * @param millis throttle interval in milliseconds (must be > 0)
     * @return this builder
     */
    public Builder logThrottleIntervalMillis(long millis) {
      this.logThrottleIntervalMillis = millis;
      return this;
    }

    /**
     * Set how many released extractors a pool keeps for reuse.
     *
     * <p><b>Default: 1024</b>. Zero disables reuse.
     *
     * @param max maximum idle extractors (must be >= 0)
     * @return this builder
     */
    public Builder maxIdleExtractors(int max) {
      this.maxIdleExtractors = max;
      return this;
    }

    /**
     * Set metrics registry for instrumentation.
     *
     * <p><b>Default: {@link NoOpMetricsRegistry}</b>
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(IngestMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated immutable configuration
     * @throws IllegalArgumentException if configuration is invalid
     */
    public IngestConfig build() {
      return new IngestConfig(
          maxLabelsPerTimeseries,
          maxLabelValueLen,
          logThrottleIntervalMillis,
          maxIdleExtractors,
          metricsRegistry);
    }
  }
}
