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

/**
 * Metric name constants for ingestprep instrumentation.
 *
 * <h2>Ignored Rows</h2>
 *
 * <p>Samples rejected by {@link com.axonops.ingestprep.limits.LabelLimitsValidator} are counted
 * exactly, one counter per rejection reason. The counters live inside the validator and are
 * exposed as gauges, so the registry only ever reads them. Warnings for the same rejections are
 * throttled; these gauges are the place to look for the real drop rate.
 *
 * <h2>Field Extraction</h2>
 *
 * <p>{@link com.axonops.ingestprep.api.FieldExtractor} counts every parse call and every failure
 * by kind, and records parse latency.
 *
 * <h2>Extractor Pool</h2>
 *
 * <p>Active and idle extractor counts. A steadily growing active count means extractors are
 * acquired and never released.
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 *   <li><b>Gauge</b> - Current value (suffix: {@code .current.count}), or an exact cumulative
 *       count read from the owning component (suffix: {@code .total.count})
 * </ul>
 *
 * @since 1.0.0
 * @see com.axonops.ingestprep.limits.LabelLimitsValidator
 * @see com.axonops.ingestprep.api.FieldExtractor
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Ignored Rows (3)
  // ========================================

  /**
   * Samples ignored because they carry more labels than {@code maxLabelsPerTimeseries}.
   *
   * <p><b>Type:</b> Gauge (cumulative count)
   */
  public static final String ROWS_IGNORED_TOO_MANY_LABELS =
      "rows.ignored.too_many_labels.total.count";

  /**
   * Samples ignored because a label name is longer than the fixed name limit.
   *
   * <p><b>Type:</b> Gauge (cumulative count)
   */
  public static final String ROWS_IGNORED_TOO_LONG_LABEL_NAME =
      "rows.ignored.too_long_label_name.total.count";

  /**
   * Samples ignored because a label value is longer than {@code maxLabelValueLen}.
   *
   * <p><b>Type:</b> Gauge (cumulative count)
   */
  public static final String ROWS_IGNORED_TOO_LONG_LABEL_VALUE =
      "rows.ignored.too_long_label_value.total.count";

  // ========================================
  // Field Extraction (5)
  // ========================================

  /**
   * Parse calls, successful or not.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String EXTRACTOR_PARSE_TOTAL = "extractor.parse.total.count";

  /**
   * Parse calls rejected because the input is not valid JSON.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String EXTRACTOR_PARSE_MALFORMED = "extractor.parse.malformed.total.count";

  /**
   * Parse calls rejected because the top-level value is not an object.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String EXTRACTOR_PARSE_UNEXPECTED_ROOT =
      "extractor.parse.unexpected_root.total.count";

  /**
   * Fields emitted by successful parse calls.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String EXTRACTOR_FIELDS = "extractor.fields.total.count";

  /**
   * Latency of successful parse calls (tokenizing plus flattening).
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String EXTRACTOR_PARSE_LATENCY = "extractor.parse.latency";

  // ========================================
  // Resource Pools (3 per pool)
  // ========================================

  /**
   * Objects currently leased out of a pool. Use with {@link #pool(String, String)}.
   *
   * <p><b>Type:</b> Gauge (count)
   */
  public static final String POOL_ACTIVE = "active.current.count";

  /**
   * Objects sitting idle in a pool. Use with {@link #pool(String, String)}.
   *
   * <p><b>Type:</b> Gauge (count)
   */
  public static final String POOL_IDLE = "idle.current.count";

  /**
   * Objects allocated because a pool was empty on acquire. Use with {@link #pool(String, String)}.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String POOL_CREATED = "created.total.count";

  /**
   * Builds a per-pool metric name, e.g. {@code pool.extractors.active.current.count}.
   *
   * @param poolName pool name (e.g., "extractors")
   * @param metric one of the {@code POOL_*} suffixes
   * @return full metric name relative to the registry prefix
   */
  public static String pool(String poolName, String metric) {
    return "pool." + poolName + "." + metric;
  }
}
