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

import com.axonops.ingestprep.metrics.MetricNames;

/**
 * Reasons a label set is refused by {@link LabelLimitsValidator}.
 *
 * @since 1.0.0
 */
public enum ViolationKind {
  TOO_MANY_LABELS("too_many_labels", MetricNames.ROWS_IGNORED_TOO_MANY_LABELS),
  TOO_LONG_LABEL_NAME("too_long_label_name", MetricNames.ROWS_IGNORED_TOO_LONG_LABEL_NAME),
  TOO_LONG_LABEL_VALUE("too_long_label_value", MetricNames.ROWS_IGNORED_TOO_LONG_LABEL_VALUE);

  private final String reason;
  private final String metricName;

  ViolationKind(String reason, String metricName) {
    this.reason = reason;
    this.metricName = metricName;
  }

  /** Short reason tag, e.g. {@code too_many_labels}. */
  public String reason() {
    return reason;
  }

  /** Name of the ignored-rows gauge for this reason. */
  public String metricName() {
    return metricName;
  }
}
