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

import java.util.Objects;

/**
 * One dimension of a timeseries identity.
 *
 * @param name label name; the metric name is carried as {@code __name__}
 * @param value label value
 * @since 1.0.0
 */
public record Label(String name, String value) {

  /** Label name holding the metric name. */
  public static final String METRIC_NAME = "__name__";

  public Label {
    Objects.requireNonNull(name, "name cannot be null");
    Objects.requireNonNull(value, "value cannot be null");
  }

  @Override
  public String toString() {
    return name + "=" + Labels.quote(value);
  }
}
