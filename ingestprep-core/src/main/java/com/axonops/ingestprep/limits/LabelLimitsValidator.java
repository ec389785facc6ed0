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

package com.axonops.ingestprep.limits;

import com.axonops.ingestprep.config.IngestConfig;
import com.axonops.ingestprep.metrics.IngestMetricsRegistry;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admission check for labeled samples before they reach storage.
 *
 * <p>A label set is refused when it has more than {@code maxLabelsPerTimeseries} labels, or when a
 * label name is longer than {@link IngestConfig#MAX_LABEL_NAME_LEN} bytes, or a label value longer
 * than {@code maxLabelValueLen} bytes. Checks run in that order and stop at the first hit; labels
 * are checked in the caller's order.
 *
 * <p>Every refusal increments an exact per-reason counter, exposed through the configured metrics
 * registry as {@code rows.ignored.<reason>.total.count}. A warning with the full label set is
 * logged for a refusal only if that reason has not been logged within the last
 * {@code logThrottleIntervalMillis}, so log volume stays bounded however many samples are dropped.
 *
 * <p>Thread-safe: limits are final, counters are {@link LongAdder}s and throttles are lock-free.
 * One validator is meant to be shared by every ingestion thread.
 *
 * @since 1.0.0
 */
public final class LabelLimitsValidator implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(LabelLimitsValidator.class);

  private final int maxLabelsPerTimeseries;
  private final int maxLabelValueLen;
  private final IngestMetricsRegistry metrics;

  private final Map<ViolationKind, LongAdder> ignored = new EnumMap<>(ViolationKind.class);
  private final Map<ViolationKind, IntervalThrottle> logThrottles =
      new EnumMap<>(ViolationKind.class);
  private final Map<ViolationKind, Supplier<Number>> gauges = new EnumMap<>(ViolationKind.class);

  /**
   * Creates a validator and registers its ignored-rows gauges.
   *
   * @param config limits, throttle interval and metrics registry
   */
  public LabelLimitsValidator(IngestConfig config) {
    this(config, System::nanoTime);
  }

  LabelLimitsValidator(IngestConfig config, LongSupplier nanoClock) {
    Objects.requireNonNull(config, "config cannot be null");
    this.maxLabelsPerTimeseries = config.maxLabelsPerTimeseries();
    this.maxLabelValueLen = config.maxLabelValueLen();
    this.metrics = config.metricsRegistry();

    Duration interval = Duration.ofMillis(config.logThrottleIntervalMillis());
    for (ViolationKind kind : ViolationKind.values()) {
      LongAdder counter = new LongAdder();
      ignored.put(kind, counter);
      logThrottles.put(kind, new IntervalThrottle(interval, nanoClock));
      Supplier<Number> gauge = counter::sum;
      gauges.put(kind, gauge);
      metrics.registerGauge(kind.metricName(), gauge);
    }

    logger.debug(
        "ingestprep: label limits initialized - maxLabelsPerTimeseries: {}, maxLabelNameLen: {}, "
            + "maxLabelValueLen: {}, log throttle: {}ms",
        maxLabelsPerTimeseries,
        IngestConfig.MAX_LABEL_NAME_LEN,
        maxLabelValueLen,
        config.logThrottleIntervalMillis());
  }

  /**
   * Checks whether the label set breaks a limit.
   *
   * <p>On a refusal the counter for that reason is incremented and a throttled warning may be
   * logged. An admitted set has no side effects.
   *
   * @param labels label set of one sample
   * @return true if the sample must be dropped
   */
  public boolean exceeds(List<Label> labels) {
    LimitViolation violation = check(labels);
    if (violation == null) {
      return false;
    }
    track(violation, labels);
    return true;
  }

  /**
   * Finds the first limit the label set breaks, without counting or logging it.
   *
   * @param labels label set of one sample
   * @return the violation, or empty if the set is admissible
   */
  public Optional<LimitViolation> firstViolation(List<Label> labels) {
    return Optional.ofNullable(check(labels));
  }

  /** @return a snapshot of ignored-sample counts */
  public RejectionStatistics getStatistics() {
    return new RejectionStatistics(
        ignored.get(ViolationKind.TOO_MANY_LABELS).sum(),
        ignored.get(ViolationKind.TOO_LONG_LABEL_NAME).sum(),
        ignored.get(ViolationKind.TOO_LONG_LABEL_VALUE).sum());
  }

  /** @return the exact number of samples ignored for {@code kind} */
  public long getIgnoredCount(ViolationKind kind) {
    return ignored.get(kind).sum();
  }

  public int getMaxLabelsPerTimeseries() {
    return maxLabelsPerTimeseries;
  }

  public int getMaxLabelValueLen() {
    return maxLabelValueLen;
  }

  /**
   * Unregisters the ignored-rows gauges this validator still owns. Counters stay readable through
   * {@link #getStatistics()}.
   */
  @Override
  public void close() {
    for (ViolationKind kind : ViolationKind.values()) {
      metrics.removeGauge(kind.metricName(), gauges.get(kind));
    }
  }

  private LimitViolation check(List<Label> labels) {
    if (labels.size() > maxLabelsPerTimeseries) {
      return new LimitViolation(
          ViolationKind.TOO_MANY_LABELS, null, labels.size(), maxLabelsPerTimeseries);
    }
    for (Label l : labels) {
      if (Labels.utf8LongerThan(l.name(), IngestConfig.MAX_LABEL_NAME_LEN)) {
        return new LimitViolation(
            ViolationKind.TOO_LONG_LABEL_NAME,
            l,
            Labels.utf8Length(l.name()),
            IngestConfig.MAX_LABEL_NAME_LEN);
      }
      if (Labels.utf8LongerThan(l.value(), maxLabelValueLen)) {
        return new LimitViolation(
            ViolationKind.TOO_LONG_LABEL_VALUE, l, Labels.utf8Length(l.value()), maxLabelValueLen);
      }
    }
    return null;
  }

  private void track(LimitViolation violation, List<Label> labels) {
    ViolationKind kind = violation.kind();
    ignored.get(kind).increment();

    // Render the label set only when the throttle lets a warning through
    if (!logThrottles.get(kind).tryAcquire()) {
      return;
    }
    switch (kind) {
      case TOO_MANY_LABELS:
        logger.warn(
            "ingestprep: ignoring series with {} labels for {}; either reduce the number of labels "
                + "for this metric or increase maxLabelsPerTimeseries={}",
            violation.actual(),
            Labels.toString(labels),
            violation.limit());
        break;
      case TOO_LONG_LABEL_NAME:
        logger.warn(
            "ingestprep: ignoring series with label {} for {}; label name length={} exceeds max "
                + "allowed {} - consider reducing label name length",
            Labels.quote(violation.label().name()),
            Labels.toString(labels),
            violation.actual(),
            violation.limit());
        break;
      case TOO_LONG_LABEL_VALUE:
        logger.warn(
            "ingestprep: ignoring series with {} label for {}; label value length={} exceeds "
                + "maxLabelValueLen={}; either reduce the label value length or increase "
                + "maxLabelValueLen",
            violation.label(),
            Labels.toString(labels),
            violation.actual(),
            violation.limit());
        break;
      default:
        throw new AssertionError("BUG: unexpected violation kind: " + kind);
    }
  }
}
