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

/**
 * Pool statistics for monitoring and metrics.
 *
 * <p>Immutable snapshot of pool state at a point in time.
 *
 * @since 1.0.0
 */
public record PoolStatistics(
    int active,
    int idle,
    long created,
    long acquired,
    long released,
    long discarded) {

  /**
   * Share of acquisitions served from the idle queue.
   *
   * @return reuse rate between 0.0 and 1.0, or 0.0 if nothing was acquired
   */
  public double reuseRate() {
    return acquired == 0 ? 0.0 : (double) (acquired - created) / acquired;
  }

  /** True if more objects were acquired than released and still count as active. */
  public boolean hasPotentialLeaks() {
    return acquired > released + active;
  }
}
